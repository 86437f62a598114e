package com.hinata.backend.global.security;

import jakarta.servlet.http.HttpServletRequest;

final class RequestPaths {

    private RequestPaths() {
    }

    /**
     * Request URI without the context path and without a trailing slash.
     */
    static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        String path = (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath))
                ? uri.substring(contextPath.length())
                : uri;
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.isEmpty() ? "/" : path;
    }
}

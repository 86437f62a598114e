package com.hinata.backend.global.security;

import java.util.List;

/**
 * Paths served without authentication or RBAC checks. {@code /auth/users/**} is carved out of
 * {@code /auth/**} and needs a bearer token.
 */
final class PublicPaths {

    static final String[] PATTERNS = {
            "/auth/**",
            "/v3/api-docs/**",
            "/swagger-ui/**",
            "/swagger-ui.html",
            "/actuator/health",
            "/actuator/health/**"
    };

    static final String[] AUTHENTICATED_PATTERNS = {
            "/auth/users/**"
    };

    private static final String AUTHENTICATED_PREFIX = "/auth/users/";

    private static final List<String> PREFIXES = List.of("/auth/", "/v3/api-docs", "/swagger-ui", "/actuator/health");

    private PublicPaths() {
    }

    static boolean matches(String path) {
        if (path.startsWith(AUTHENTICATED_PREFIX)) {
            return false;
        }
        for (String prefix : PREFIXES) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}

package com.hinata.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for protected paths reached without a usable principal. A request that sent a bearer token
 * gets {@code invalid_token}; one that sent none gets {@code unauthorized}. The detail never says why
 * a token was rejected.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String GENERIC_DETAIL = "Could not validate credentials";

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        boolean tokenSent = AccessTokenAuthenticationFilter.resolveBearerToken(request) != null;
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, tokenSent ? "Bearer error=\"invalid_token\"" : "Bearer");
        problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED,
                tokenSent ? "invalid_token" : "unauthorized", GENERIC_DETAIL);
    }
}

package com.hinata.backend.global.security;

import java.util.Optional;

import com.hinata.backend.global.error.UnauthorizedException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Reads the principal that {@link AccessTokenAuthenticationFilter} placed in the security context.
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<AuthenticatedUser> findCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return Optional.of(user);
        }
        return Optional.empty();
    }

    public static AuthenticatedUser getCurrentUser() {
        return findCurrentUser()
                .orElseThrow(() -> new UnauthorizedException("UNAUTHORIZED", "Authentication required"));
    }
}

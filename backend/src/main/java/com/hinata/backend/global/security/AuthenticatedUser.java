package com.hinata.backend.global.security;

import java.util.List;

import com.hinata.backend.modules.auth.application.token.TokenClaims;

/**
 * Principal placed in the security context once an access token has been verified.
 *
 * @param globalRoles names of roles granted outside any organization or team, e.g. {@code super_admin}
 */
public record AuthenticatedUser(Long userId, String email, List<String> globalRoles, TokenClaims claims) {

    public AuthenticatedUser {
        globalRoles = List.copyOf(globalRoles);
    }
}

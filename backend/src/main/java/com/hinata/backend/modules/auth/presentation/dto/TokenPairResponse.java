package com.hinata.backend.modules.auth.presentation.dto;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.hinata.backend.modules.auth.domain.TokenType;

/**
 * Lifetimes are in seconds. {@code signing} names the strategy the server is configured with.
 */
public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        TokenType signing,
        OffsetDateTime issuedAt
) {

    public static TokenPairResponse bearer(String accessToken, Duration accessTtl,
                                           String refreshToken, Duration refreshTtl,
                                           TokenType signing, OffsetDateTime issuedAt) {
        return new TokenPairResponse(accessToken, "Bearer", accessTtl.toSeconds(),
                refreshToken, refreshTtl.toSeconds(), signing, issuedAt);
    }
}

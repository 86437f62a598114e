package com.hinata.backend.modules.auth.application.token;

import java.util.Map;

import com.hinata.backend.modules.auth.domain.TokenType;

/**
 * Turns a claims map into a signed token and back. Implementations differ only in key material and algorithm;
 * the claims they produce and return have the same shape.
 */
public interface TokenSigner {

    TokenType tokenType();

    /**
     * Whether refresh tokens issued with this signer carry a random {@code nonce} claim.
     */
    boolean requiresNonce();

    String sign(Map<String, Object> claims);

    /**
     * @return claims with {@code exp} as an ISO-8601 string and {@code iat} as epoch seconds
     * @throws InvalidTokenException when the signature, format or library-level expiry check fails
     */
    Map<String, Object> verify(String token);
}

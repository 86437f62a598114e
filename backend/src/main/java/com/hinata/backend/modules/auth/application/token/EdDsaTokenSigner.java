package com.hinata.backend.modules.auth.application.token;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Date;
import java.util.Map;

import com.hinata.backend.modules.auth.domain.TokenType;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

/**
 * Ed25519 keypair signer. Verification only needs the public key, so other services can check tokens
 * without being able to mint them.
 */
public class EdDsaTokenSigner implements TokenSigner {

    private final PrivateKey privateKey;
    private final PublicKey publicKey;
    private final Clock clock;

    public EdDsaTokenSigner(PrivateKey privateKey, PublicKey publicKey, Clock clock) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
        this.clock = clock;
    }

    @Override
    public TokenType tokenType() {
        return TokenType.EDDSA;
    }

    @Override
    public boolean requiresNonce() {
        return true;
    }

    @Override
    public String sign(Map<String, Object> claims) {
        return JwtClaimsCodec.write(Jwts.builder(), claims)
                .signWith(privateKey, Jwts.SIG.EdDSA)
                .compact();
    }

    @Override
    public Map<String, Object> verify(String token) {
        try {
            // the library checks the signature and its own reading of exp; the raw payload is returned
            // so the ISO-8601 exp can be checked again by the caller
            Jwts.parser()
                    .verifyWith(publicKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }
        return JwtClaimsCodec.read(token);
    }
}

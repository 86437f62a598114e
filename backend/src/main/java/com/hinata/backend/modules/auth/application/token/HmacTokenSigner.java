package com.hinata.backend.modules.auth.application.token;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;
import java.util.Locale;
import java.util.Map;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.hinata.backend.modules.auth.domain.TokenType;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

public class HmacTokenSigner implements TokenSigner {

    private final SecretKey secretKey;
    private final MacAlgorithm algorithm;
    private final Clock clock;

    public HmacTokenSigner(String secret, String algorithmName, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("hinata.auth.secret must be set when hinata.auth.mode=hmac");
        }
        this.algorithm = resolveAlgorithm(algorithmName);
        this.secretKey = toSecretKey(secret, algorithm);
        this.clock = clock;
    }

    @Override
    public TokenType tokenType() {
        return TokenType.HMAC;
    }

    @Override
    public boolean requiresNonce() {
        return false;
    }

    @Override
    public String sign(Map<String, Object> claims) {
        return JwtClaimsCodec.write(Jwts.builder(), claims)
                .signWith(secretKey, algorithm)
                .compact();
    }

    @Override
    public Map<String, Object> verify(String token) {
        try {
            // the library checks the signature and its own reading of exp; the raw payload is returned
            // so the ISO-8601 exp can be checked again by the caller
            Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }
        return JwtClaimsCodec.read(token);
    }

    private static MacAlgorithm resolveAlgorithm(String name) {
        String normalized = name == null ? "HS256" : name.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "HS256" -> Jwts.SIG.HS256;
            case "HS384" -> Jwts.SIG.HS384;
            case "HS512" -> Jwts.SIG.HS512;
            default -> throw new IllegalStateException("Unsupported HMAC algorithm: " + name);
        };
    }

    private static SecretKey toSecretKey(String secret, MacAlgorithm algorithm) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        int requiredBits = algorithm.getKeyBitLength();
        if (keyBytes.length * 8 < requiredBits) {
            throw new IllegalStateException("hinata.auth.secret is too short for " + algorithm.getId()
                    + ": need at least " + requiredBits / 8 + " bytes");
        }
        String jcaName = "HmacSHA" + algorithm.getId().substring(2);
        return new SecretKeySpec(keyBytes, jcaName);
    }
}

package com.hinata.backend.modules.auth.application.token;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.hinata.backend.global.error.NotFoundException;
import com.hinata.backend.global.error.UnauthorizedException;
import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.auth.domain.RefreshToken;
import com.hinata.backend.modules.auth.domain.TokenType;
import com.hinata.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hinata.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.hinata.backend.modules.context.application.ContextPayloadAssembler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Mints and checks access and refresh tokens on top of the configured {@link TokenSigner}.
 *
 * <p>Expiry is written as an ISO-8601 {@code exp} claim. Verification runs the signing library's own
 * expiry check and then compares {@code exp} against this service's clock; both must pass.
 *
 * <p>Refresh tokens are also recorded server-side by SHA-256 hash so they can be revoked.
 */
@Service
public class TokenService {

    static final String INVALID_REFRESH_TOKEN = "INVALID_REFRESH_TOKEN";
    private static final String INVALID_REFRESH_DETAIL = "Invalid or expired refresh token";
    private static final int NONCE_BYTES = 32;

    private final TokenSigner tokenSigner;
    private final ContextPayloadAssembler payloadAssembler;
    private final RefreshTokenRepository refreshTokenRepository;
    private final AppUserRepository appUserRepository;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public TokenService(
            TokenSigner tokenSigner,
            ContextPayloadAssembler payloadAssembler,
            RefreshTokenRepository refreshTokenRepository,
            AppUserRepository appUserRepository,
            @Value("${hinata.auth.access-token-ttl-ms:900000}") long accessTokenTtlMillis,
            @Value("${hinata.auth.refresh-token-ttl-ms:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenSigner = tokenSigner;
        this.payloadAssembler = payloadAssembler;
        this.refreshTokenRepository = refreshTokenRepository;
        this.appUserRepository = appUserRepository;
        this.accessTokenTtl = Duration.ofMillis(accessTokenTtlMillis);
        this.refreshTokenTtl = Duration.ofMillis(refreshTokenTtlMillis);
        this.clock = clock;
    }

    public String createAccessToken(Map<String, Object> claims, Duration ttl) {
        return tokenSigner.sign(withTimestamps(claims, ttl));
    }

    /**
     * Access token carrying the user's profile, active organization/team and the permissions derived from them.
     * A context whose membership no longer exists is left out of the token.
     */
    public String createContextEnrichedToken(String email, Duration ttl, Long organizationId, Long teamId,
                                             Map<String, Object> customClaims) {
        Map<String, Object> payload = payloadAssembler.assemble(email, organizationId, teamId, customClaims);
        return createAccessToken(payload, ttl);
    }

    public String createContextEnrichedToken(String email, Long organizationId, Long teamId) {
        return createContextEnrichedToken(email, accessTokenTtl, organizationId, teamId, Map.of());
    }

    @Transactional(noRollbackFor = ResponseStatusException.class)
    public String createRefreshToken(Map<String, Object> claims, Duration ttl) {
        Object subject = claims.get(TokenClaims.SUBJECT);
        if (subject == null) {
            throw new IllegalArgumentException("Refresh token claims need a subject");
        }
        AppUser user = appUserRepository.findByEmailIgnoreCase(subject.toString())
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "No user for refresh token subject"));

        Map<String, Object> payload = new LinkedHashMap<>(claims);
        payload.put("jti", UUID.randomUUID().toString());
        payload.put(TokenClaims.TOKEN_USE, TokenClaims.REFRESH_TOKEN_USE);
        String nonce = null;
        if (tokenSigner.requiresNonce()) {
            nonce = newNonce();
            payload.put(TokenClaims.NONCE, nonce);
        }
        Instant now = clock.instant();
        payload = withTimestamps(payload, ttl);
        String token = tokenSigner.sign(payload);

        RefreshToken row = new RefreshToken();
        row.setUser(user);
        row.setTokenHash(hash(token));
        row.setTokenType(tokenSigner.tokenType());
        row.setNonce(nonce);
        row.setIssuedAt(OffsetDateTime.ofInstant(now, clock.getZone()));
        row.setExpiresAt(OffsetDateTime.ofInstant(now.plus(ttl), clock.getZone()));
        refreshTokenRepository.save(row);
        return token;
    }

    public String createRefreshToken(String email) {
        return createRefreshToken(Map.of(TokenClaims.SUBJECT, email), refreshTokenTtl);
    }

    public TokenClaims verifyToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        Map<String, Object> claims = tokenSigner.verify(token);
        Object subject = claims.get(TokenClaims.SUBJECT);
        if (subject == null || subject.toString().isBlank()) {
            throw new InvalidTokenException("Token has no subject");
        }
        Object expiresAt = claims.get(TokenClaims.EXPIRES_AT);
        if (expiresAt == null) {
            throw new InvalidTokenException("Token has no expiry");
        }
        Instant expiry;
        try {
            expiry = Instant.parse(expiresAt.toString());
        } catch (DateTimeParseException ex) {
            throw new InvalidTokenException("Token expiry is not ISO-8601", ex);
        }
        if (!clock.instant().isBefore(expiry)) {
            throw new InvalidTokenException("Token expired");
        }
        return new TokenClaims(claims);
    }

    /**
     * Signature and expiry checks plus the server-side record: unknown, revoked or expired rows are rejected.
     * Every failure gives the same error so callers cannot tell which check failed.
     */
    public TokenClaims verifyRefreshToken(String token) {
        TokenClaims claims;
        try {
            claims = verifyToken(token);
        } catch (InvalidTokenException ex) {
            throw invalidRefreshToken();
        }
        if (!claims.isRefreshToken()) {
            throw invalidRefreshToken();
        }
        RefreshToken row = refreshTokenRepository.findByTokenHash(hash(token))
                .orElseThrow(this::invalidRefreshToken);
        if (!row.isUsableAt(OffsetDateTime.now(clock))) {
            throw invalidRefreshToken();
        }
        if (row.getNonce() != null && !Objects.equals(row.getNonce(), claims.nonce().orElse(null))) {
            throw invalidRefreshToken();
        }
        return claims;
    }

    @Transactional(noRollbackFor = ResponseStatusException.class)
    public boolean revokeRefreshToken(String token, String reason) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return refreshTokenRepository.revokeByTokenHash(hash(token), OffsetDateTime.now(clock), reason) > 0;
    }

    @Transactional(noRollbackFor = ResponseStatusException.class)
    public int revokeExpiredRefreshTokens(Long userId, String reason) {
        return refreshTokenRepository.revokeExpiredTokens(userId, OffsetDateTime.now(clock), reason);
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    public TokenType getSigningType() {
        return tokenSigner.tokenType();
    }

    public static String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private Map<String, Object> withTimestamps(Map<String, Object> claims, Duration ttl) {
        Instant now = clock.instant();
        Map<String, Object> payload = new LinkedHashMap<>(claims);
        payload.putIfAbsent(TokenClaims.ISSUED_AT, now.getEpochSecond());
        payload.put(TokenClaims.EXPIRES_AT, now.plus(ttl).toString());
        return payload;
    }

    private String newNonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private UnauthorizedException invalidRefreshToken() {
        return new UnauthorizedException(INVALID_REFRESH_TOKEN, INVALID_REFRESH_DETAIL);
    }
}

package com.hinata.backend.modules.auth.application.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hinata.backend.global.error.UnauthorizedException;
import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.auth.domain.RefreshToken;
import com.hinata.backend.modules.auth.domain.TokenType;
import com.hinata.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hinata.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.hinata.backend.modules.context.application.ContextPayloadAssembler;
import com.hinata.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TokenServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-0123456789";
    private static final String EMAIL = "alice@example.com";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private ContextPayloadAssembler payloadAssembler;

    @Mock
    private RefreshTokenRepository refreshTokenRepository;

    @Mock
    private AppUserRepository appUserRepository;

    private Clock clock;
    private AppUser alice;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        alice = TestEntities.user(1L, EMAIL);
        lenient().when(appUserRepository.findByEmailIgnoreCase(EMAIL)).thenReturn(Optional.of(alice));
    }

    @Test
    void accessTokenRoundTripKeepsSubjectAndExpiry() {
        TokenService tokenService = hmacService(clock);

        String token = tokenService.createAccessToken(Map.of("sub", EMAIL, "email", EMAIL), Duration.ofMinutes(15));
        TokenClaims claims = tokenService.verifyToken(token);

        assertThat(claims.subject()).isEqualTo(EMAIL);
        assertThat(claims.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(claims.get("exp")).isEqualTo("2025-01-01T00:15:00Z");
        assertThat(claims.get("iat")).isEqualTo(NOW.getEpochSecond());
        assertThat(claims.isRefreshToken()).isFalse();
    }

    @Test
    void signedPayloadCarriesIsoExpiry() {
        String token = hmacService(clock).createAccessToken(Map.of("sub", "u@example.com"), Duration.ofMinutes(15));

        String payload = new String(Base64.getUrlDecoder().decode(token.split("\\.")[1]), StandardCharsets.UTF_8);

        assertThat(payload)
                .contains("\"exp\":\"2025-01-01T00:15:00Z\"")
                .contains("\"iat\":" + NOW.getEpochSecond());
    }

    @Test
    @DisplayName("the ISO expiry is checked against the service clock even when the signer accepts the token")
    void serviceClockRejectsTokenTheSignerStillAccepts() {
        HmacTokenSigner signer = new HmacTokenSigner(SECRET, "HS256", clock);
        String token = service(signer, clock).createAccessToken(Map.of("sub", EMAIL), Duration.ofMinutes(15));
        Clock later = Clock.fixed(NOW.plus(Duration.ofMinutes(20)), ZoneOffset.UTC);

        assertThat(signer.verify(token)).containsEntry("exp", "2025-01-01T00:15:00Z");
        assertThatThrownBy(() -> service(signer, later).verifyToken(token))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessage("Token expired");
    }

    @Test
    void tokenPastExpiryIsRejected() {
        String token = hmacService(clock).createAccessToken(Map.of("sub", EMAIL), Duration.ofMinutes(15));
        Clock later = Clock.fixed(NOW.plus(Duration.ofMinutes(16)), ZoneOffset.UTC);

        assertThatThrownBy(() -> hmacService(later).verifyToken(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenWithoutSubjectIsRejected() {
        TokenService tokenService = hmacService(clock);
        String token = tokenService.createAccessToken(Map.of("email", EMAIL), Duration.ofMinutes(5));

        assertThatThrownBy(() -> tokenService.verifyToken(token))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("subject");
    }

    @Test
    void tamperedTokenIsRejected() {
        TokenService tokenService = hmacService(clock);
        String token = tokenService.createAccessToken(Map.of("sub", EMAIL), Duration.ofMinutes(5));
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("A") ? "BB" : "AA");

        assertThatThrownBy(() -> tokenService.verifyToken(tampered))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithOtherSecretIsRejected() {
        String token = hmacService(clock).createAccessToken(Map.of("sub", EMAIL), Duration.ofMinutes(5));
        TokenService other = service(new HmacTokenSigner("another-secret-which-is-also-long-enough-42", "HS256", clock), clock);

        assertThatThrownBy(() -> other.verifyToken(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shortHmacSecretIsRefused() {
        assertThatThrownBy(() -> new HmacTokenSigner("too-short", "HS256", clock))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("HMAC and EdDSA tokens expose the same claim shape")
    void bothStrategiesProduceSameClaimShape() throws NoSuchAlgorithmException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sub", EMAIL);
        payload.put("email", EMAIL);
        payload.put("permissions", Map.of("/rbac/teams", List.of("GET")));

        TokenService hmac = hmacService(clock);
        TokenService eddsa = eddsaService(clock);

        TokenClaims fromHmac = hmac.verifyToken(hmac.createAccessToken(payload, Duration.ofMinutes(10)));
        TokenClaims fromEddsa = eddsa.verifyToken(eddsa.createAccessToken(payload, Duration.ofMinutes(10)));

        assertThat(fromEddsa.asMap().keySet()).containsExactlyInAnyOrderElementsOf(fromHmac.asMap().keySet());
        assertThat(fromEddsa.get("exp")).isEqualTo(fromHmac.get("exp"));
        assertThat(fromEddsa.get("iat")).isEqualTo(fromHmac.get("iat"));
        assertThat(fromEddsa.get("permissions")).isEqualTo(fromHmac.get("permissions"));
    }

    @Test
    void contextEnrichedTokenSignsAssembledPayload() {
        TokenService tokenService = hmacService(clock);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sub", EMAIL);
        payload.put("email", EMAIL);
        payload.put("active_organization", Map.of("id", 5, "name", "Acme"));
        when(payloadAssembler.assemble(eq(EMAIL), eq(5L), eq(null), anyMap())).thenReturn(payload);

        TokenClaims claims = tokenService.verifyToken(tokenService.createContextEnrichedToken(EMAIL, 5L, null));

        assertThat(claims.activeOrganizationId()).contains(5L);
        assertThat(claims.activeTeamId()).isEmpty();
    }

    @Test
    void refreshTokenIsPersistedByHashAndVerifies() {
        TokenService tokenService = hmacService(clock);

        String token = tokenService.createRefreshToken(EMAIL);

        ArgumentCaptor<RefreshToken> saved = ArgumentCaptor.forClass(RefreshToken.class);
        verify(refreshTokenRepository).save(saved.capture());
        RefreshToken row = saved.getValue();
        assertThat(row.getTokenHash()).isEqualTo(TokenService.hash(token)).hasSize(64);
        assertThat(row.getTokenType()).isEqualTo(TokenType.HMAC);
        assertThat(row.getNonce()).isNull();
        assertThat(row.getExpiresAt()).isEqualTo(OffsetDateTime.ofInstant(NOW.plus(Duration.ofDays(7)), ZoneOffset.UTC));

        when(refreshTokenRepository.findByTokenHash(row.getTokenHash())).thenReturn(Optional.of(row));
        TokenClaims claims = tokenService.verifyRefreshToken(token);
        assertThat(claims.isRefreshToken()).isTrue();
        assertThat(claims.get("jti")).isNotNull();
    }

    @Test
    void eddsaRefreshTokenCarriesStoredNonce() throws NoSuchAlgorithmException {
        TokenService tokenService = eddsaService(clock);

        String token = tokenService.createRefreshToken(EMAIL);

        ArgumentCaptor<RefreshToken> saved = ArgumentCaptor.forClass(RefreshToken.class);
        verify(refreshTokenRepository).save(saved.capture());
        RefreshToken row = saved.getValue();
        assertThat(row.getTokenType()).isEqualTo(TokenType.EDDSA);
        assertThat(row.getNonce()).hasSize(64);

        when(refreshTokenRepository.findByTokenHash(row.getTokenHash())).thenReturn(Optional.of(row));
        assertThat(tokenService.verifyRefreshToken(token).nonce()).contains(row.getNonce());
    }

    @Test
    void revokedRefreshTokenGetsGenericError() {
        TokenService tokenService = hmacService(clock);
        String token = tokenService.createRefreshToken(EMAIL);
        ArgumentCaptor<RefreshToken> saved = ArgumentCaptor.forClass(RefreshToken.class);
        verify(refreshTokenRepository).save(saved.capture());
        RefreshToken row = saved.getValue();
        row.revoke(OffsetDateTime.now(clock), "LOGOUT");
        when(refreshTokenRepository.findByTokenHash(row.getTokenHash())).thenReturn(Optional.of(row));

        assertThatThrownBy(() -> tokenService.verifyRefreshToken(token))
                .isInstanceOf(UnauthorizedException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_REFRESH_TOKEN")
                .hasFieldOrPropertyWithValue("detailMessage", "Invalid or expired refresh token");
    }

    @Test
    void unknownRefreshTokenGetsGenericError() {
        TokenService tokenService = hmacService(clock);
        String token = tokenService.createRefreshToken(EMAIL);
        when(refreshTokenRepository.findByTokenHash(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tokenService.verifyRefreshToken(token))
                .isInstanceOf(UnauthorizedException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_REFRESH_TOKEN");
    }

    @Test
    void accessTokenIsNotAcceptedAsRefreshToken() {
        TokenService tokenService = hmacService(clock);
        String accessToken = tokenService.createAccessToken(Map.of("sub", EMAIL), Duration.ofMinutes(5));

        assertThatThrownBy(() -> tokenService.verifyRefreshToken(accessToken))
                .isInstanceOf(UnauthorizedException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_REFRESH_TOKEN");
    }

    @Test
    void expiredRefreshTokenGetsGenericError() {
        String token = hmacService(clock).createRefreshToken(EMAIL);
        Clock later = Clock.fixed(NOW.plus(Duration.ofDays(8)), ZoneOffset.UTC);

        assertThatThrownBy(() -> hmacService(later).verifyRefreshToken(token))
                .isInstanceOf(UnauthorizedException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_REFRESH_TOKEN");
    }

    @Test
    void revokeReportsWhetherARowChanged() {
        TokenService tokenService = hmacService(clock);
        when(refreshTokenRepository.revokeByTokenHash(eq(TokenService.hash("abc")), any(), eq("LOGOUT"))).thenReturn(1);

        assertThat(tokenService.revokeRefreshToken("abc", "LOGOUT")).isTrue();
        assertThat(tokenService.revokeRefreshToken(" ", "LOGOUT")).isFalse();
    }

    private TokenService hmacService(Clock serviceClock) {
        return service(new HmacTokenSigner(SECRET, "HS256", serviceClock), serviceClock);
    }

    private TokenService eddsaService(Clock serviceClock) throws NoSuchAlgorithmException {
        KeyPair keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        String privatePem = PemKeys.toPem("PRIVATE KEY", keyPair.getPrivate().getEncoded());
        String publicPem = PemKeys.toPem("PUBLIC KEY", keyPair.getPublic().getEncoded());
        TokenSigner signer = new EdDsaTokenSigner(PemKeys.readPrivateKey(privatePem), PemKeys.readPublicKey(publicPem), serviceClock);
        return service(signer, serviceClock);
    }

    private TokenService service(TokenSigner signer, Clock serviceClock) {
        return new TokenService(signer, payloadAssembler, refreshTokenRepository, appUserRepository,
                900_000L, 604_800_000L, serviceClock);
    }
}

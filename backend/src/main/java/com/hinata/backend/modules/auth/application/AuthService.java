package com.hinata.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.hinata.backend.global.error.NotFoundException;
import com.hinata.backend.global.error.UnauthorizedException;
import com.hinata.backend.modules.auth.application.token.TokenClaims;
import com.hinata.backend.modules.auth.application.token.TokenService;
import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hinata.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.hinata.backend.modules.auth.presentation.dto.LoginRequest;
import com.hinata.backend.modules.auth.presentation.dto.LoginResponse;
import com.hinata.backend.modules.auth.presentation.dto.LogoutRequest;
import com.hinata.backend.modules.auth.presentation.dto.RefreshRequest;
import com.hinata.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.hinata.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.hinata.backend.modules.context.application.ContextSwitchService;
import com.hinata.backend.modules.context.application.ContextSwitchService.ActiveContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_ROTATED = "ROTATED";
    static final String REASON_LOGOUT = "LOGOUT";

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository appUserRepository;
    private final UserRoleRepository userRoleRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final ContextSwitchService contextSwitchService;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            UserRoleRepository userRoleRepository,
            PasswordEncoder passwordEncoder,
            TokenService tokenService,
            ContextSwitchService contextSwitchService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userRoleRepository = userRoleRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.contextSwitchService = contextSwitchService;
        this.clock = clock;
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(this::invalidCredentials);
        if (user.getPasswordHash() == null || !passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.warn("Login rejected: userId={}", user.getId());
            throw invalidCredentials();
        }

        tokenService.revokeExpiredRefreshTokens(user.getId(), REASON_EXPIRED);
        TokenPairResponse tokens = issueTokens(user, null, null);
        log.info("Login succeeded: userId={}", user.getId());
        return new LoginResponse(tokens, profile(user));
    }

    /**
     * Rotates the refresh token: the presented one is revoked and a new pair is issued.
     * A requested context goes through the same checks as a context switch, before anything is revoked.
     */
    public LoginResponse refresh(RefreshRequest request) {
        TokenClaims claims = tokenService.verifyRefreshToken(request.refreshToken());
        AppUser user = appUserRepository.findByEmailIgnoreCase(claims.subject())
                .orElseThrow(() -> new UnauthorizedException("INVALID_REFRESH_TOKEN", "Invalid or expired refresh token"));
        ActiveContext context = contextSwitchService.resolveContext(user.getId(), request.organizationId(), request.teamId());
        if (!tokenService.revokeRefreshToken(request.refreshToken(), REASON_ROTATED)) {
            throw new UnauthorizedException("INVALID_REFRESH_TOKEN", "Invalid or expired refresh token");
        }

        TokenPairResponse tokens = issueTokens(user, context.organizationId(), context.teamId());
        log.info("Refresh token rotated: userId={}", user.getId());
        return new LoginResponse(tokens, profile(user));
    }

    @Transactional(readOnly = true)
    public UserProfileResponse currentProfile(Long userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "User " + userId + " not found"));
        return profile(user);
    }

    public void logout(LogoutRequest request) {
        boolean revoked = tokenService.revokeRefreshToken(request.refreshToken(), REASON_LOGOUT);
        log.info("Logout: refreshTokenRevoked={}", revoked);
    }

    private TokenPairResponse issueTokens(AppUser user, Long organizationId, Long teamId) {
        String accessToken = tokenService.createContextEnrichedToken(user.getEmail(), organizationId, teamId);
        String refreshToken = tokenService.createRefreshToken(user.getEmail());
        return TokenPairResponse.bearer(
                accessToken, tokenService.getAccessTokenTtl(),
                refreshToken, tokenService.getRefreshTokenTtl(),
                tokenService.getSigningType(),
                OffsetDateTime.now(clock)
        );
    }

    private UserProfileResponse profile(AppUser user) {
        List<String> roles = userRoleRepository.findRoleNamesByUserId(user.getId());
        return UserProfileResponse.from(user, roles);
    }

    private UnauthorizedException invalidCredentials() {
        return new UnauthorizedException("INVALID_CREDENTIALS", "Invalid email or password");
    }
}

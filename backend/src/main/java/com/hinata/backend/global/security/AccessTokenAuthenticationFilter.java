package com.hinata.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

import com.hinata.backend.modules.auth.application.token.InvalidTokenException;
import com.hinata.backend.modules.auth.application.token.TokenClaims;
import com.hinata.backend.modules.auth.application.token.TokenService;
import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hinata.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the bearer access token and loads its subject as an {@link AuthenticatedUser}.
 * Requests without a bearer header pass through unauthenticated; a bad token ends the request with 401.
 */
@Component
public class AccessTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessTokenAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final AppUserRepository appUserRepository;
    private final UserRoleRepository userRoleRepository;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public AccessTokenAuthenticationFilter(
            TokenService tokenService,
            AppUserRepository appUserRepository,
            UserRoleRepository userRoleRepository,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.tokenService = tokenService;
        this.appUserRepository = appUserRepository;
        this.userRoleRepository = userRoleRepository;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = resolveBearerToken(request);
        if (token != null) {
            try {
                TokenClaims claims = tokenService.verifyToken(token);
                if (claims.isRefreshToken()) {
                    throw new InvalidTokenException("Refresh token used as access token");
                }
                AppUser user = appUserRepository.findByEmailIgnoreCase(claims.subject())
                        .orElseThrow(() -> new InvalidTokenException("Unknown subject"));
                List<String> globalRoles = userRoleRepository.findRoleNamesByUserId(user.getId());
                List<SimpleGrantedAuthority> authorities = globalRoles.stream()
                        .map(role -> new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT)))
                        .toList();

                AuthenticatedUser principal = new AuthenticatedUser(user.getId(), user.getEmail(), globalRoles, claims);
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (InvalidTokenException ex) {
                log.debug("Rejected access token: {}", ex.getMessage());
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response, new BadCredentialsException(ex.getMessage(), ex));
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    static String resolveBearerToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        return PublicPaths.matches(RequestPaths.pathWithinApplication(request));
    }
}

package com.hinata.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.hinata.backend.global.error.NotFoundException;
import com.hinata.backend.modules.organization.application.MembershipService;
import com.hinata.backend.modules.rbac.application.EffectivePermissionResolver;
import com.hinata.backend.modules.rbac.application.EffectivePermissions;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.Scope;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Route-level RBAC for {@code /rbac/**}: principal, scope, membership role, effective permissions, decision.
 *
 * <p>Missing principal is 401. Unknown scope, missing membership and missing permission are 403.
 * Anything else that goes wrong while deciding is 500 with a generic body.
 * {@code /rbac/context/**} only needs authentication and is skipped here.
 */
@Component
public class RbacAuthorizationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RbacAuthorizationFilter.class);

    // only need an authenticated principal, enforced by the security chain
    private static final List<String> AUTHENTICATED_ONLY_PREFIXES = List.of("/rbac/context/", "/rbac/roles/current-role/");

    private final ScopeClassifier scopeClassifier;
    private final MembershipService membershipService;
    private final EffectivePermissionResolver permissionResolver;
    private final ProblemResponseWriter problemResponseWriter;

    public RbacAuthorizationFilter(
            ScopeClassifier scopeClassifier,
            MembershipService membershipService,
            EffectivePermissionResolver permissionResolver,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.scopeClassifier = scopeClassifier;
        this.membershipService = membershipService;
        this.permissionResolver = permissionResolver;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        AuthenticatedUser user = SecurityUtils.findCurrentUser().orElse(null);
        if (user == null) {
            problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, "unauthorized", "Not authenticated");
            return;
        }

        String path = RequestPaths.pathWithinApplication(request);
        String method = request.getMethod();
        Decision decision;
        try {
            decision = decide(user, path, method);
        } catch (RuntimeException ex) {
            log.error("Authorization failed unexpectedly: path={}, method={}, userId={}", path, method, user.userId(), ex);
            problemResponseWriter.write(request, response, HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                    "An unexpected error occurred");
            return;
        }

        if (!decision.allowed()) {
            log.warn("Forbidden: path={}, method={}, userId={}, reason={}", path, method, user.userId(), decision.code());
            problemResponseWriter.write(request, response, HttpStatus.FORBIDDEN, decision.code(), decision.detail());
            return;
        }
        filterChain.doFilter(request, response);
    }

    Decision decide(AuthenticatedUser user, String path, String method) {
        RequestScope scope = scopeClassifier.classify(path).orElse(null);
        if (scope == null) {
            return Decision.deny("INSUFFICIENT_SCOPE", "Insufficient scope");
        }

        // global roles such as super_admin apply everywhere
        for (String globalRole : user.globalRoles()) {
            if (permissionResolver.resolve(globalRole, Scope.SUPER_ADMIN_KEY).allows(scope.route(), method)) {
                return Decision.allow();
            }
        }
        if (scope.isGlobal()) {
            return user.globalRoles().isEmpty()
                    ? Decision.deny("INSUFFICIENT_SCOPE", "Insufficient scope")
                    : Decision.deny("PERMISSION_DENIED", "Permission denied");
        }

        Role role;
        try {
            role = scope.scope() == Scope.ORGANIZATION
                    ? membershipService.getRoleOfUserInOrganization(user.userId(), scope.contextId())
                    : membershipService.getRoleOfUserInTeam(user.userId(), scope.contextId());
        } catch (NotFoundException ex) {
            return scope.scope() == Scope.ORGANIZATION
                    ? Decision.deny("NOT_ORGANIZATION_MEMBER", "You are not part of this organization")
                    : Decision.deny("NOT_TEAM_MEMBER", "You are not part of this team");
        }

        EffectivePermissions permissions = permissionResolver.resolve(role.getName(), scope.scopeKey());
        if (!permissions.allows(scope.route(), method)) {
            return Decision.deny("PERMISSION_DENIED", "Permission denied");
        }
        return Decision.allow();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = RequestPaths.pathWithinApplication(request);
        if (!path.startsWith("/rbac/") || PublicPaths.matches(path)) {
            return true;
        }
        return AUTHENTICATED_ONLY_PREFIXES.stream().anyMatch(path::startsWith);
    }

    record Decision(boolean allowed, String code, String detail) {

        static Decision allow() {
            return new Decision(true, null, null);
        }

        static Decision deny(String code, String detail) {
            return new Decision(false, code, detail);
        }
    }
}

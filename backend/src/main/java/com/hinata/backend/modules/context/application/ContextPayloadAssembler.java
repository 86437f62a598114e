package com.hinata.backend.modules.context.application;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.hinata.backend.global.error.NotFoundException;
import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hinata.backend.modules.organization.application.MembershipService;
import com.hinata.backend.modules.organization.domain.Organization;
import com.hinata.backend.modules.organization.domain.OrganizationUser;
import com.hinata.backend.modules.organization.domain.Team;
import com.hinata.backend.modules.organization.domain.TeamMember;
import com.hinata.backend.modules.rbac.application.EffectivePermissionResolver;
import com.hinata.backend.modules.rbac.application.EffectivePermissions;
import com.hinata.backend.modules.rbac.application.cache.PermissionCache;
import com.hinata.backend.modules.rbac.application.cache.PermissionSnapshot;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.Scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the claims of a context-enriched access token. Both signing strategies use this one payload shape.
 *
 * <p>Organization permissions are laid down first and team permissions overwrite them route by route.
 * A team owned by another organization than the active one is left out.
 * If any lookup fails the token falls back to {@code sub}, {@code email} and {@code iat} only.
 */
@Component
public class ContextPayloadAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextPayloadAssembler.class);

    private static final Set<String> RESERVED_CLAIMS = Set.of("sub", "exp", "iat");

    private final AppUserRepository appUserRepository;
    private final MembershipService membershipService;
    private final EffectivePermissionResolver permissionResolver;
    private final PermissionCache permissionCache;
    private final Clock clock;

    public ContextPayloadAssembler(
            AppUserRepository appUserRepository,
            MembershipService membershipService,
            EffectivePermissionResolver permissionResolver,
            PermissionCache permissionCache,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.membershipService = membershipService;
        this.permissionResolver = permissionResolver;
        this.permissionCache = permissionCache;
        this.clock = clock;
    }

    public Map<String, Object> assemble(String email, Long organizationId, Long teamId, Map<String, Object> customClaims) {
        long issuedAt = clock.instant().getEpochSecond();
        try {
            return fullPayload(email, organizationId, teamId, customClaims, issuedAt);
        } catch (RuntimeException ex) {
            log.warn("Context claims unavailable for {}, issuing minimal token: {}", email, ex.getMessage());
            Map<String, Object> minimal = new LinkedHashMap<>();
            minimal.put("sub", email);
            minimal.put("email", email);
            minimal.put("iat", issuedAt);
            return minimal;
        }
    }

    private Map<String, Object> fullPayload(String email, Long organizationId, Long teamId,
                                            Map<String, Object> customClaims, long issuedAt) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", "No user with email " + email));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sub", user.getEmail());
        payload.put("email", user.getEmail());
        payload.put("first_name", user.getFirstName());
        payload.put("last_name", user.getLastName());
        payload.put("phone_number", user.getPhoneNumber());
        payload.put("verified", user.isVerified());
        payload.put("auth_type", user.getAuthType().name());
        payload.put("iat", issuedAt);

        PermissionSnapshot snapshot = permissionCache.snapshot();
        EffectivePermissions permissions = EffectivePermissions.none();

        if (organizationId != null) {
            Optional<OrganizationUser> membership = membershipService.findOrganizationMembership(user.getId(), organizationId);
            if (membership.isPresent()) {
                Role role = membership.get().getRole();
                payload.put("active_organization", organizationClaim(membership.get().getOrganization(), role));
                permissions = permissionResolver.resolve(snapshot, role.getName(), Scope.ORGANIZATION.key());
            }
        }

        if (teamId != null) {
            Optional<TeamMember> membership = membershipService.findTeamMembership(user.getId(), teamId);
            Long activeOrganizationId = payload.containsKey("active_organization") ? organizationId : null;
            if (membership.isPresent() && activeOrganizationId != null
                    && !activeOrganizationId.equals(membership.get().getTeam().getOrganization().getId())) {
                log.warn("Team {} is outside active organization {}, leaving it out of the token for {}",
                        teamId, activeOrganizationId, email);
                membership = Optional.empty();
            }
            if (membership.isPresent()) {
                Role role = membership.get().getRole();
                payload.put("active_team", teamClaim(membership.get().getTeam(), role));
                EffectivePermissions teamPermissions = permissionResolver.resolve(snapshot, role.getName(), Scope.TEAM.key());
                permissions = permissions.overriddenBy(teamPermissions);
            }
        }

        payload.put("permissions", permissions.routes());
        payload.put("available_organizations", availableOrganizations(user.getId()));
        payload.put("available_teams", availableTeams(user.getId(), organizationId));

        if (customClaims != null) {
            customClaims.forEach((name, value) -> {
                if (!RESERVED_CLAIMS.contains(name)) {
                    payload.put(name, value);
                }
            });
        }
        return payload;
    }

    public List<Map<String, Object>> availableOrganizations(Long userId) {
        return membershipService.listOrganizationsOfUser(userId).stream()
                .map(OrganizationUser::getOrganization)
                .map(organization -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("id", organization.getId());
                    entry.put("name", organization.getName());
                    return entry;
                })
                .toList();
    }

    /**
     * Teams of the user, limited to one organization when {@code organizationId} is given.
     */
    public List<Map<String, Object>> availableTeams(Long userId, Long organizationId) {
        return membershipService.listTeamsOfUser(userId).stream()
                .map(TeamMember::getTeam)
                .filter(team -> organizationId == null || organizationId.equals(team.getOrganization().getId()))
                .map(team -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("id", team.getId());
                    entry.put("name", team.getName());
                    entry.put("organization_id", team.getOrganization().getId());
                    return entry;
                })
                .toList();
    }

    private Map<String, Object> organizationClaim(Organization organization, Role role) {
        Map<String, Object> claim = new LinkedHashMap<>();
        claim.put("id", organization.getId());
        claim.put("name", organization.getName());
        claim.put("creation_date", organization.getCreationDate() != null ? organization.getCreationDate().toString() : null);
        claim.put("user_role", roleClaim(role));
        return claim;
    }

    private Map<String, Object> teamClaim(Team team, Role role) {
        Map<String, Object> claim = new LinkedHashMap<>();
        claim.put("id", team.getId());
        claim.put("name", team.getName());
        claim.put("description", team.getDescription());
        claim.put("organization_id", team.getOrganization().getId());
        claim.put("user_role", roleClaim(role));
        return claim;
    }

    private Map<String, Object> roleClaim(Role role) {
        Map<String, Object> claim = new LinkedHashMap<>();
        claim.put("id", role.getId());
        claim.put("name", role.getName());
        claim.put("slug", role.getSlug());
        return claim;
    }
}

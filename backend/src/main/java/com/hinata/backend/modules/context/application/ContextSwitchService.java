package com.hinata.backend.modules.context.application;

import java.util.List;
import java.util.Map;

import com.hinata.backend.global.error.ForbiddenException;
import com.hinata.backend.global.error.ValidationException;
import com.hinata.backend.global.security.AuthenticatedUser;
import com.hinata.backend.modules.auth.application.token.TokenClaims;
import com.hinata.backend.modules.auth.application.token.TokenService;
import com.hinata.backend.modules.organization.application.MembershipService;
import com.hinata.backend.modules.organization.domain.TeamMember;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Re-issues the caller's access token for another organization and/or team.
 *
 * <p>Checks run in a fixed order: organization membership, then team membership, then that the team
 * belongs to the organization. The new token embeds the context as it exists now; it is not re-checked
 * until the next switch.
 */
@Service
public class ContextSwitchService {

    private static final Logger log = LoggerFactory.getLogger(ContextSwitchService.class);

    private final MembershipService membershipService;
    private final TokenService tokenService;
    private final ContextPayloadAssembler payloadAssembler;

    public ContextSwitchService(MembershipService membershipService, TokenService tokenService,
                                ContextPayloadAssembler payloadAssembler) {
        this.membershipService = membershipService;
        this.tokenService = tokenService;
        this.payloadAssembler = payloadAssembler;
    }

    /**
     * Activates an organization and clears any active team.
     */
    public ContextToken switchOrganization(AuthenticatedUser user, Long organizationId) {
        requireOrganizationMembership(user.userId(), organizationId);
        return mint(user, organizationId, null);
    }

    /**
     * Activates a team together with the organization that owns it.
     */
    public ContextToken switchTeam(AuthenticatedUser user, Long teamId) {
        TeamMember membership = requireTeamMembership(user.userId(), teamId);
        return mint(user, membership.getTeam().getOrganization().getId(), teamId);
    }

    public ContextToken switchContext(AuthenticatedUser user, Long organizationId, Long teamId) {
        ActiveContext context = resolveContext(user.userId(), organizationId, teamId);
        return mint(user, context.organizationId(), context.teamId());
    }

    /**
     * Runs the switch preconditions without minting a token. A team alone implies its owning organization.
     */
    public ActiveContext resolveContext(Long userId, Long organizationId, Long teamId) {
        if (organizationId != null) {
            requireOrganizationMembership(userId, organizationId);
        }
        Long effectiveOrganizationId = organizationId;
        if (teamId != null) {
            TeamMember membership = requireTeamMembership(userId, teamId);
            Long owningOrganizationId = membership.getTeam().getOrganization().getId();
            if (organizationId != null && !organizationId.equals(owningOrganizationId)) {
                throw new ValidationException("TEAM_NOT_IN_ORGANIZATION", "Team does not belong to the specified organization");
            }
            effectiveOrganizationId = owningOrganizationId;
        }
        return new ActiveContext(effectiveOrganizationId, teamId);
    }

    public CurrentContext currentContext(TokenClaims claims) {
        return new CurrentContext(
                asMap(claims.get(TokenClaims.ACTIVE_ORGANIZATION)),
                asMap(claims.get(TokenClaims.ACTIVE_TEAM)),
                asMap(claims.get(TokenClaims.PERMISSIONS))
        );
    }

    public AvailableContexts availableContexts(AuthenticatedUser user) {
        return new AvailableContexts(
                payloadAssembler.availableOrganizations(user.userId()),
                payloadAssembler.availableTeams(user.userId(), null)
        );
    }

    private void requireOrganizationMembership(Long userId, Long organizationId) {
        if (membershipService.findOrganizationMembership(userId, organizationId).isEmpty()) {
            log.warn("Context switch denied: userId={}, organizationId={}", userId, organizationId);
            throw new ForbiddenException("ORGANIZATION_ACCESS_DENIED", "You do not have access to this organization");
        }
    }

    private TeamMember requireTeamMembership(Long userId, Long teamId) {
        return membershipService.findTeamMembership(userId, teamId)
                .orElseThrow(() -> {
                    log.warn("Context switch denied: userId={}, teamId={}", userId, teamId);
                    return new ForbiddenException("TEAM_ACCESS_DENIED", "You do not have access to this team");
                });
    }

    private ContextToken mint(AuthenticatedUser user, Long organizationId, Long teamId) {
        String token = tokenService.createContextEnrichedToken(user.email(), organizationId, teamId);
        log.info("Context switched: userId={}, organizationId={}, teamId={}", user.userId(), organizationId, teamId);
        return new ContextToken(token, tokenService.getAccessTokenTtl().toSeconds(), organizationId, teamId);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object claim) {
        return claim instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    public record CurrentContext(Map<String, Object> activeOrganization,
                                 Map<String, Object> activeTeam,
                                 Map<String, Object> permissions) {
    }

    public record ActiveContext(Long organizationId, Long teamId) {
    }

    public record AvailableContexts(List<Map<String, Object>> organizations, List<Map<String, Object>> teams) {
    }
}

package com.hinata.backend.modules.context.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hinata.backend.modules.organization.application.MembershipService;
import com.hinata.backend.modules.organization.domain.Organization;
import com.hinata.backend.modules.organization.domain.OrganizationUser;
import com.hinata.backend.modules.organization.domain.Team;
import com.hinata.backend.modules.organization.domain.TeamMember;
import com.hinata.backend.modules.rbac.application.EffectivePermissionResolver;
import com.hinata.backend.modules.rbac.application.cache.FallbackPermissions;
import com.hinata.backend.modules.rbac.application.cache.PermissionCache;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.Scope;
import com.hinata.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContextPayloadAssemblerTest {

    private static final String EMAIL = "alice@example.com";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private MembershipService membershipService;

    @Mock
    private PermissionCache permissionCache;

    private ContextPayloadAssembler assembler;
    private AppUser alice;
    private Organization acme;
    private Team platform;

    @BeforeEach
    void setUp() {
        assembler = new ContextPayloadAssembler(appUserRepository, membershipService,
                new EffectivePermissionResolver(permissionCache), permissionCache, Clock.fixed(NOW, ZoneOffset.UTC));
        alice = TestEntities.user(1L, EMAIL);
        acme = TestEntities.organization(5L, "Acme");
        platform = TestEntities.team(9L, acme, "Platform");
    }

    @Test
    void organizationAdminGetsAdminRoutes() {
        Role admin = TestEntities.role(1L, "Admin", Scope.ORGANIZATION);
        givenUserWithMemberships(List.of(new OrganizationUser(acme, alice, admin)), List.of());
        when(membershipService.findOrganizationMembership(1L, 5L)).thenReturn(Optional.of(new OrganizationUser(acme, alice, admin)));

        Map<String, Object> payload = assembler.assemble(EMAIL, 5L, null, Map.of());

        assertThat(payload).containsEntry("sub", EMAIL).containsEntry("iat", NOW.getEpochSecond());
        assertThat(payload).doesNotContainKey("active_team");
        assertThat(payload.get("permissions")).isEqualTo(Map.of(
                "/rbac/teams/create", List.of("POST"),
                "/rbac/teams/assign-user", List.of("POST"),
                "/rbac/teams/remove-user", List.of("DELETE"),
                "/rbac/teams", List.of("GET")));
        @SuppressWarnings("unchecked")
        Map<String, Object> organization = (Map<String, Object>) payload.get("active_organization");
        assertThat(organization).containsEntry("id", 5L).containsEntry("name", "Acme");
        assertThat(payload.get("available_organizations")).isEqualTo(List.of(Map.of("id", 5L, "name", "Acme")));
    }

    @Test
    void teamPermissionsOverrideOrganizationPermissionsPerRoute() {
        Role admin = TestEntities.role(1L, "Admin", Scope.ORGANIZATION);
        Role teamMember = TestEntities.role(4L, "Team_Member", Scope.TEAM);
        OrganizationUser orgMembership = new OrganizationUser(acme, alice, admin);
        TeamMember teamMembership = new TeamMember(platform, alice, teamMember);
        givenUserWithMemberships(List.of(orgMembership), List.of(teamMembership));
        when(membershipService.findOrganizationMembership(1L, 5L)).thenReturn(Optional.of(orgMembership));
        when(membershipService.findTeamMembership(1L, 9L)).thenReturn(Optional.of(teamMembership));

        Map<String, Object> payload = assembler.assemble(EMAIL, 5L, 9L, Map.of());

        @SuppressWarnings("unchecked")
        Map<String, List<String>> permissions = (Map<String, List<String>>) payload.get("permissions");
        assertThat(permissions)
                .containsEntry("/rbac/teams", List.of("GET"))
                .containsEntry("/rbac/teams/create", List.of("POST"))
                .containsEntry("/rbac/teams/assign-user", List.of("POST"));
        assertThat(payload).containsKey("active_team");
        assertThat(payload.get("available_teams"))
                .isEqualTo(List.of(Map.of("id", 9L, "name", "Platform", "organization_id", 5L)));
    }

    @Test
    void contextWithoutMembershipIsLeftOut() {
        givenUserWithMemberships(List.of(), List.of());
        when(membershipService.findOrganizationMembership(1L, 5L)).thenReturn(Optional.empty());

        Map<String, Object> payload = assembler.assemble(EMAIL, 5L, null, Map.of());

        assertThat(payload).doesNotContainKey("active_organization");
        assertThat(payload.get("permissions")).isEqualTo(Map.of());
    }

    @Test
    void teamOfAnotherOrganizationIsLeftOut() {
        Organization globex = TestEntities.organization(7L, "Globex");
        Team research = TestEntities.team(11L, globex, "Research");
        Role admin = TestEntities.role(1L, "Admin", Scope.ORGANIZATION);
        Role lead = TestEntities.role(3L, "Lead", Scope.TEAM);
        OrganizationUser orgMembership = new OrganizationUser(acme, alice, admin);
        TeamMember foreignTeam = new TeamMember(research, alice, lead);
        givenUserWithMemberships(List.of(orgMembership), List.of(foreignTeam));
        when(membershipService.findOrganizationMembership(1L, 5L)).thenReturn(Optional.of(orgMembership));
        when(membershipService.findTeamMembership(1L, 11L)).thenReturn(Optional.of(foreignTeam));

        Map<String, Object> payload = assembler.assemble(EMAIL, 5L, 11L, Map.of());

        assertThat(payload).containsKey("active_organization").doesNotContainKey("active_team");
        @SuppressWarnings("unchecked")
        Map<String, List<String>> permissions = (Map<String, List<String>>) payload.get("permissions");
        assertThat(permissions).containsEntry("/rbac/teams/create", List.of("POST"));
    }

    @Test
    void customClaimsCannotOverrideReservedClaims() {
        givenUserWithMemberships(List.of(), List.of());

        Map<String, Object> payload = assembler.assemble(EMAIL, null, null, Map.of("sub", "mallory", "device", "cli"));

        assertThat(payload).containsEntry("sub", EMAIL).containsEntry("device", "cli");
    }

    @Test
    void lookupFailureFallsBackToMinimalPayload() {
        when(appUserRepository.findByEmailIgnoreCase(EMAIL)).thenThrow(new IllegalStateException("database down"));

        Map<String, Object> payload = assembler.assemble(EMAIL, 5L, 9L, Map.of());

        assertThat(payload).containsOnlyKeys("sub", "email", "iat");
        assertThat(payload).containsEntry("email", EMAIL);
    }

    private void givenUserWithMemberships(List<OrganizationUser> organizations, List<TeamMember> teams) {
        when(appUserRepository.findByEmailIgnoreCase(EMAIL)).thenReturn(Optional.of(alice));
        when(permissionCache.snapshot()).thenReturn(FallbackPermissions.snapshot());
        when(membershipService.listOrganizationsOfUser(1L)).thenReturn(organizations);
        when(membershipService.listTeamsOfUser(1L)).thenReturn(teams);
    }
}

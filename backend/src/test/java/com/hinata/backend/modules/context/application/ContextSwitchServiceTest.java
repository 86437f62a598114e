package com.hinata.backend.modules.context.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hinata.backend.global.error.ForbiddenException;
import com.hinata.backend.global.error.ValidationException;
import com.hinata.backend.global.security.AuthenticatedUser;
import com.hinata.backend.modules.auth.application.token.TokenClaims;
import com.hinata.backend.modules.auth.application.token.TokenService;
import com.hinata.backend.modules.auth.domain.AppUser;
import com.hinata.backend.modules.organization.application.MembershipService;
import com.hinata.backend.modules.organization.domain.Organization;
import com.hinata.backend.modules.organization.domain.OrganizationUser;
import com.hinata.backend.modules.organization.domain.Team;
import com.hinata.backend.modules.organization.domain.TeamMember;
import com.hinata.backend.modules.rbac.domain.Scope;
import com.hinata.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContextSwitchServiceTest {

    private static final String EMAIL = "alice@example.com";

    @Mock
    private MembershipService membershipService;

    @Mock
    private TokenService tokenService;

    @Mock
    private ContextPayloadAssembler payloadAssembler;

    @InjectMocks
    private ContextSwitchService contextSwitchService;

    private AuthenticatedUser alice;
    private AppUser aliceEntity;
    private Organization acme;
    private Team platform;

    @BeforeEach
    void setUp() {
        alice = new AuthenticatedUser(1L, EMAIL, List.of(), new TokenClaims(Map.of("sub", EMAIL)));
        aliceEntity = TestEntities.user(1L, EMAIL);
        acme = TestEntities.organization(5L, "Acme");
        platform = TestEntities.team(9L, acme, "Platform");
        lenient().when(tokenService.getAccessTokenTtl()).thenReturn(Duration.ofMinutes(15));
    }

    @Test
    void switchOrganizationMintsTokenWithoutTeam() {
        givenOrganizationMember(5L);
        when(tokenService.createContextEnrichedToken(EMAIL, 5L, null)).thenReturn("org-token");

        ContextToken token = contextSwitchService.switchOrganization(alice, 5L);

        assertThat(token).isEqualTo(new ContextToken("org-token", 900L, 5L, null));
    }

    @Test
    void switchOrganizationWithoutMembershipIsForbidden() {
        when(membershipService.findOrganizationMembership(1L, 7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> contextSwitchService.switchOrganization(alice, 7L))
                .isInstanceOf(ForbiddenException.class)
                .hasFieldOrPropertyWithValue("code", "ORGANIZATION_ACCESS_DENIED");
        verify(tokenService, never()).createContextEnrichedToken(any(), any(), any());
    }

    @Test
    void switchTeamAlsoActivatesOwningOrganization() {
        givenTeamMember(9L);
        when(tokenService.createContextEnrichedToken(EMAIL, 5L, 9L)).thenReturn("team-token");

        ContextToken token = contextSwitchService.switchTeam(alice, 9L);

        assertThat(token.activeOrganizationId()).isEqualTo(5L);
        assertThat(token.activeTeamId()).isEqualTo(9L);
    }

    @Test
    void switchTeamWithoutMembershipIsForbidden() {
        when(membershipService.findTeamMembership(anyLong(), anyLong())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> contextSwitchService.switchTeam(alice, 9L))
                .isInstanceOf(ForbiddenException.class)
                .hasFieldOrPropertyWithValue("code", "TEAM_ACCESS_DENIED");
    }

    @Test
    void switchContextChecksOrganizationBeforeTeam() {
        when(membershipService.findOrganizationMembership(1L, 5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> contextSwitchService.switchContext(alice, 5L, 9L))
                .hasFieldOrPropertyWithValue("code", "ORGANIZATION_ACCESS_DENIED");
        verify(membershipService, never()).findTeamMembership(anyLong(), anyLong());
    }

    @Test
    void switchContextRejectsTeamOfAnotherOrganization() {
        Organization other = TestEntities.organization(6L, "Other");
        OrganizationUser membership = new OrganizationUser(other, aliceEntity, TestEntities.role(2L, "Member", Scope.ORGANIZATION));
        when(membershipService.findOrganizationMembership(1L, 6L)).thenReturn(Optional.of(membership));
        givenTeamMember(9L);

        assertThatThrownBy(() -> contextSwitchService.switchContext(alice, 6L, 9L))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("code", "TEAM_NOT_IN_ORGANIZATION");
    }

    @Test
    void switchContextWithOrganizationAndTeam() {
        givenOrganizationMember(5L);
        givenTeamMember(9L);
        when(tokenService.createContextEnrichedToken(EMAIL, 5L, 9L)).thenReturn("full-token");

        ContextToken token = contextSwitchService.switchContext(alice, 5L, 9L);

        assertThat(token.accessToken()).isEqualTo("full-token");
        assertThat(token.expiresIn()).isEqualTo(900L);
    }

    @Test
    void organizationAdminNeedsTeamMembershipBeforeSwitchingIntoTeam() {
        givenOrganizationMember(5L);
        TeamMember lead = new TeamMember(platform, aliceEntity, TestEntities.role(3L, "Lead", Scope.TEAM));
        when(membershipService.findTeamMembership(1L, 9L)).thenReturn(Optional.empty(), Optional.of(lead));
        when(tokenService.createContextEnrichedToken(EMAIL, 5L, 9L)).thenReturn("lead-token");

        assertThatThrownBy(() -> contextSwitchService.switchTeam(alice, 9L))
                .isInstanceOf(ForbiddenException.class);

        ContextToken token = contextSwitchService.switchContext(alice, 5L, 9L);
        assertThat(token.activeOrganizationId()).isEqualTo(5L);
        assertThat(token.activeTeamId()).isEqualTo(9L);
    }

    @Test
    void resolveContextChecksWithoutMinting() {
        givenTeamMember(9L);

        assertThat(contextSwitchService.resolveContext(1L, null, 9L))
                .isEqualTo(new ContextSwitchService.ActiveContext(5L, 9L));
        assertThat(contextSwitchService.resolveContext(1L, null, null))
                .isEqualTo(new ContextSwitchService.ActiveContext(null, null));
        verify(tokenService, never()).createContextEnrichedToken(any(), any(), any());
    }

    @Test
    void currentContextReadsClaims() {
        TokenClaims claims = new TokenClaims(Map.of(
                "sub", EMAIL,
                "active_organization", Map.of("id", 5, "name", "Acme"),
                "permissions", Map.of("/rbac/teams", List.of("GET"))));

        ContextSwitchService.CurrentContext current = contextSwitchService.currentContext(claims);

        assertThat(current.activeOrganization()).containsEntry("name", "Acme");
        assertThat(current.activeTeam()).isNull();
        assertThat(current.permissions()).containsKey("/rbac/teams");
    }

    private void givenOrganizationMember(long organizationId) {
        OrganizationUser membership = new OrganizationUser(acme, aliceEntity, TestEntities.role(1L, "Admin", Scope.ORGANIZATION));
        when(membershipService.findOrganizationMembership(1L, organizationId)).thenReturn(Optional.of(membership));
    }

    private void givenTeamMember(long teamId) {
        TeamMember membership = new TeamMember(platform, aliceEntity, TestEntities.role(3L, "Lead", Scope.TEAM));
        when(membershipService.findTeamMembership(1L, teamId)).thenReturn(Optional.of(membership));
    }
}

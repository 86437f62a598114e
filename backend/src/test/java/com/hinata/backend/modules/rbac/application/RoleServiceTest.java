package com.hinata.backend.modules.rbac.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.hinata.backend.global.error.ConflictException;
import com.hinata.backend.global.error.ValidationException;
import com.hinata.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.hinata.backend.modules.organization.infrastructure.persistence.OrganizationUserRepository;
import com.hinata.backend.modules.organization.infrastructure.persistence.TeamMemberRepository;
import com.hinata.backend.modules.rbac.application.cache.PermissionCache;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.Scope;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.hinata.backend.modules.rbac.presentation.dto.CreateRoleRequest;
import com.hinata.backend.modules.rbac.presentation.dto.RoleResponse;
import com.hinata.backend.modules.rbac.presentation.dto.UpdateRoleRequest;
import com.hinata.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RoleServiceTest {

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    @Mock
    private OrganizationUserRepository organizationUserRepository;

    @Mock
    private TeamMemberRepository teamMemberRepository;

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private PermissionCache permissionCache;

    private RoleService roleService;

    @BeforeEach
    void setUp() {
        roleService = new RoleService(roleRepository, rolePermissionRepository, organizationUserRepository,
                teamMemberRepository, userRoleRepository, permissionCache);
    }

    @Test
    void createInheritingRoleOfSameScope() {
        Role member = TestEntities.role(2L, "Member", Scope.ORGANIZATION);
        when(roleRepository.findById(2L)).thenReturn(Optional.of(member));
        when(roleRepository.saveAndFlush(any(Role.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RoleResponse response = roleService.createRole(
                new CreateRoleRequest("Billing Admin", "organization", null, "Manages billing", 2L));

        assertThat(response.slug()).isEqualTo("billing-admin");
        assertThat(response.scope()).isEqualTo("organization");
        assertThat(response.inheritsRoleId()).isEqualTo(2L);
        verify(permissionCache).refreshAfterCommit();
    }

    @Test
    void createRejectsParentOfOtherScope() {
        Role lead = TestEntities.role(3L, "Lead", Scope.TEAM);
        when(roleRepository.findById(3L)).thenReturn(Optional.of(lead));

        assertThatThrownBy(() -> roleService.createRole(
                new CreateRoleRequest("Owner", "organization", null, null, 3L)))
                .isInstanceOf(ValidationException.class)
                .extracting("code")
                .isEqualTo("ROLE_SCOPE_MISMATCH");
    }

    @Test
    void createRejectsDuplicateName() {
        when(roleRepository.existsByName("Admin")).thenReturn(true);

        assertThatThrownBy(() -> roleService.createRole(new CreateRoleRequest("Admin", "organization", null, null, null)))
                .isInstanceOf(ConflictException.class)
                .extracting("code")
                .isEqualTo("ROLE_NAME_EXISTS");
    }

    @Test
    void updateRejectsInheritanceCycle() {
        Role admin = TestEntities.role(1L, "Admin", Scope.ORGANIZATION);
        Role member = TestEntities.role(2L, "Member", Scope.ORGANIZATION);
        member.setInherits(admin);
        when(roleRepository.findById(1L)).thenReturn(Optional.of(admin));
        when(roleRepository.findById(2L)).thenReturn(Optional.of(member));

        assertThatThrownBy(() -> roleService.updateRole(1L, new UpdateRoleRequest(null, null, null, 2L, null)))
                .isInstanceOf(ValidationException.class)
                .extracting("code")
                .isEqualTo("ROLE_INHERITANCE_CYCLE");
        verify(roleRepository, never()).saveAndFlush(any());
    }

    @Test
    void updateCanClearParent() {
        Role admin = TestEntities.role(1L, "Admin", Scope.ORGANIZATION);
        admin.setInherits(TestEntities.role(2L, "Member", Scope.ORGANIZATION));
        when(roleRepository.findById(1L)).thenReturn(Optional.of(admin));
        when(roleRepository.saveAndFlush(admin)).thenReturn(admin);

        RoleResponse response = roleService.updateRole(1L, new UpdateRoleRequest(null, null, null, null, true));

        assertThat(response.inheritsRoleId()).isNull();
    }

    @Test
    void deleteRejectsRoleHeldByTeamMember() {
        Role lead = TestEntities.role(3L, "Lead", Scope.TEAM);
        when(roleRepository.findById(3L)).thenReturn(Optional.of(lead));
        when(organizationUserRepository.existsByRoleId(3L)).thenReturn(false);
        when(teamMemberRepository.existsByRoleId(3L)).thenReturn(true);

        assertThatThrownBy(() -> roleService.deleteRole(3L))
                .isInstanceOf(ConflictException.class)
                .extracting("code")
                .isEqualTo("ROLE_IN_USE");
        verify(rolePermissionRepository, never()).deleteByRoleId(any());
    }

    @Test
    void deleteRemovesGrantsThenRole() {
        Role unused = TestEntities.role(4L, "Auditor", Scope.ORGANIZATION);
        when(roleRepository.findById(4L)).thenReturn(Optional.of(unused));

        roleService.deleteRole(4L);

        verify(rolePermissionRepository).deleteByRoleId(4L);
        verify(roleRepository).delete(unused);
        verify(permissionCache).refreshAfterCommit();
    }
}

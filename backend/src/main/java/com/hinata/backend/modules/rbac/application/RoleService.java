package com.hinata.backend.modules.rbac.application;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import com.hinata.backend.global.error.ConflictException;
import com.hinata.backend.global.error.DatabaseException;
import com.hinata.backend.global.error.NotFoundException;
import com.hinata.backend.global.error.ValidationException;
import com.hinata.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.hinata.backend.modules.organization.infrastructure.persistence.OrganizationUserRepository;
import com.hinata.backend.modules.organization.infrastructure.persistence.TeamMemberRepository;
import com.hinata.backend.modules.rbac.application.cache.PermissionCache;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.Scope;
import com.hinata.backend.modules.rbac.domain.SlugGenerator;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.hinata.backend.modules.rbac.presentation.dto.CreateRoleRequest;
import com.hinata.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.hinata.backend.modules.rbac.presentation.dto.RoleResponse;
import com.hinata.backend.modules.rbac.presentation.dto.UpdateRoleRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class RoleService {

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    private final RoleRepository roleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final OrganizationUserRepository organizationUserRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final UserRoleRepository userRoleRepository;
    private final PermissionCache permissionCache;

    public RoleService(
            RoleRepository roleRepository,
            RolePermissionRepository rolePermissionRepository,
            OrganizationUserRepository organizationUserRepository,
            TeamMemberRepository teamMemberRepository,
            UserRoleRepository userRoleRepository,
            PermissionCache permissionCache
    ) {
        this.roleRepository = roleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.organizationUserRepository = organizationUserRepository;
        this.teamMemberRepository = teamMemberRepository;
        this.userRoleRepository = userRoleRepository;
        this.permissionCache = permissionCache;
    }

    public RoleResponse createRole(CreateRoleRequest request) {
        Scope scope = PermissionService.parseScope(request.scope());
        String name = request.name().trim();
        String slug = SlugGenerator.slugify(request.slug() != null && !request.slug().isBlank() ? request.slug() : name);
        if (roleRepository.existsByName(name)) {
            throw new ConflictException("ROLE_NAME_EXISTS", "Role '" + name + "' already exists");
        }
        if (roleRepository.existsBySlug(slug)) {
            throw new ConflictException("ROLE_SLUG_EXISTS", "Role slug '" + slug + "' already exists");
        }

        Role role = new Role();
        role.setName(name);
        role.setSlug(slug);
        role.setDescription(request.description());
        role.setScope(scope);
        if (request.inheritsRoleId() != null) {
            role.setInherits(loadParent(request.inheritsRoleId(), scope));
        }
        Role saved = persist(() -> roleRepository.saveAndFlush(role), "ROLE_CREATE_FAILED");
        permissionCache.refreshAfterCommit();
        log.info("Role created: id={}, name={}, scope={}", saved.getId(), name, scope.key());
        return RoleResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public RoleResponse getRole(Long roleId) {
        return RoleResponse.from(loadRole(roleId));
    }

    @Transactional(readOnly = true)
    public RoleResponse getRoleByName(String name) {
        return roleRepository.findByName(name)
                .map(RoleResponse::from)
                .orElseThrow(() -> new NotFoundException("ROLE_NOT_FOUND", "Role '" + name + "' not found"));
    }

    @Transactional(readOnly = true)
    public RoleResponse getRoleBySlug(String slug) {
        return roleRepository.findBySlug(slug)
                .map(RoleResponse::from)
                .orElseThrow(() -> new NotFoundException("ROLE_NOT_FOUND", "Role with slug '" + slug + "' not found"));
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles() {
        return roleRepository.findAllWithInherits().stream()
                .map(RoleResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PermissionResponse> listPermissionsOfRole(Long roleId) {
        loadRole(roleId);
        return rolePermissionRepository.findPermissionsByRoleId(roleId).stream()
                .map(PermissionResponse::from)
                .toList();
    }

    public RoleResponse updateRole(Long roleId, UpdateRoleRequest request) {
        Role role = loadRole(roleId);

        if (request.name() != null && !request.name().isBlank()) {
            String name = request.name().trim();
            if (!name.equals(role.getName()) && roleRepository.existsByName(name)) {
                throw new ConflictException("ROLE_NAME_EXISTS", "Role '" + name + "' already exists");
            }
            role.setName(name);
        }
        if (request.slug() != null) {
            String slug = SlugGenerator.slugify(request.slug());
            if (!slug.equals(role.getSlug()) && roleRepository.existsBySlug(slug)) {
                throw new ConflictException("ROLE_SLUG_EXISTS", "Role slug '" + slug + "' already exists");
            }
            role.setSlug(slug);
        }
        if (request.description() != null) {
            role.setDescription(request.description());
        }
        if (Boolean.TRUE.equals(request.clearInherits())) {
            role.setInherits(null);
        } else if (request.inheritsRoleId() != null) {
            Role parent = loadParent(request.inheritsRoleId(), role.getScope());
            ensureNoCycle(role, parent);
            role.setInherits(parent);
        }

        Role saved = persist(() -> roleRepository.saveAndFlush(role), "ROLE_UPDATE_FAILED");
        permissionCache.refreshAfterCommit();
        log.info("Role updated: id={}, name={}", saved.getId(), saved.getName());
        return RoleResponse.from(saved);
    }

    /**
     * Deletes the role together with its grants. Roles still held by a member, a user or a child role stay.
     */
    public void deleteRole(Long roleId) {
        Role role = loadRole(roleId);
        if (isRoleInUse(roleId)) {
            throw new ConflictException("ROLE_IN_USE", "Role '" + role.getName() + "' is still in use");
        }
        persist(() -> {
            rolePermissionRepository.deleteByRoleId(roleId);
            roleRepository.delete(role);
            roleRepository.flush();
            return role;
        }, "ROLE_DELETE_FAILED");
        permissionCache.refreshAfterCommit();
        log.info("Role deleted: id={}, name={}", roleId, role.getName());
    }

    @Transactional(readOnly = true)
    public boolean isRoleInUse(Long roleId) {
        return organizationUserRepository.existsByRoleId(roleId)
                || teamMemberRepository.existsByRoleId(roleId)
                || userRoleRepository.existsByRoleId(roleId)
                || roleRepository.existsByInheritsId(roleId);
    }

    private Role loadParent(Long parentId, Scope scope) {
        Role parent = loadRole(parentId);
        if (parent.getScope() != scope) {
            throw new ValidationException("ROLE_SCOPE_MISMATCH",
                    "Role can only inherit from a role of scope " + scope.key());
        }
        return parent;
    }

    private void ensureNoCycle(Role role, Role parent) {
        Set<Long> seen = new HashSet<>();
        Role current = parent;
        int hops = 0;
        while (current != null) {
            if (current.getId().equals(role.getId()) || !seen.add(current.getId())
                    || ++hops > EffectivePermissionResolver.MAX_INHERITANCE_DEPTH) {
                throw new ValidationException("ROLE_INHERITANCE_CYCLE",
                        "Role '" + role.getName() + "' cannot inherit from role " + parent.getId());
            }
            current = current.getInherits();
        }
    }

    private Role loadRole(Long roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> new NotFoundException("ROLE_NOT_FOUND", "Role " + roleId + " not found"));
    }

    private <T> T persist(Supplier<T> write, String failureCode) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException("ROLE_CONFLICT", "The role data changed concurrently");
        } catch (DataAccessException ex) {
            throw new DatabaseException(failureCode, "Failed to persist role data", ex);
        }
    }
}

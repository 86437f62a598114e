package com.hinata.backend.modules.rbac.application;

import java.util.List;
import java.util.function.Supplier;

import com.hinata.backend.global.error.ConflictException;
import com.hinata.backend.global.error.DatabaseException;
import com.hinata.backend.global.error.NotFoundException;
import com.hinata.backend.global.error.ValidationException;
import com.hinata.backend.modules.rbac.application.cache.PermissionCache;
import com.hinata.backend.modules.rbac.domain.Permission;
import com.hinata.backend.modules.rbac.domain.PermissionName;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.RolePermission;
import com.hinata.backend.modules.rbac.domain.Scope;
import com.hinata.backend.modules.rbac.domain.SlugGenerator;
import com.hinata.backend.modules.rbac.infrastructure.persistence.PermissionRepository;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RoleRepository;
import com.hinata.backend.modules.rbac.presentation.dto.CreatePermissionRequest;
import com.hinata.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.hinata.backend.modules.rbac.presentation.dto.UpdatePermissionRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 권한 및 역할-권한 매핑 관리. 변경이 커밋되면 권한 캐시를 다시 만든다.
 */
@Service
@Transactional
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    private final PermissionRepository permissionRepository;
    private final RoleRepository roleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final PermissionCache permissionCache;

    public PermissionService(
            PermissionRepository permissionRepository,
            RoleRepository roleRepository,
            RolePermissionRepository rolePermissionRepository,
            PermissionCache permissionCache
    ) {
        this.permissionRepository = permissionRepository;
        this.roleRepository = roleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.permissionCache = permissionCache;
    }

    public PermissionResponse createPermission(CreatePermissionRequest request) {
        PermissionName parsed = PermissionName.parse(request.name());
        Scope scope = parseScope(request.scope());
        String slug = request.slug() != null && !request.slug().isBlank()
                ? SlugGenerator.slugify(request.slug())
                : slugFromName(parsed.name());

        if (permissionRepository.existsByName(parsed.name())) {
            throw new ConflictException("PERMISSION_EXISTS", "Permission '" + parsed.name() + "' already exists");
        }
        if (permissionRepository.existsBySlug(slug)) {
            throw new ConflictException("PERMISSION_SLUG_EXISTS", "Permission slug '" + slug + "' already exists");
        }

        Permission permission = new Permission();
        permission.setName(parsed.name());
        permission.setSlug(slug);
        permission.setDescription(request.description().trim());
        permission.setScope(scope);
        Permission saved = persist(() -> permissionRepository.saveAndFlush(permission), "PERMISSION_CREATE_FAILED");
        permissionCache.refreshAfterCommit();
        log.info("Permission created: id={}, name={}, scope={}", saved.getId(), saved.getName(), scope.key());
        return PermissionResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public PermissionResponse getPermission(Long permissionId) {
        return PermissionResponse.from(loadPermission(permissionId));
    }

    @Transactional(readOnly = true)
    public PermissionResponse getPermissionByName(String name) {
        return permissionRepository.findByName(name)
                .map(PermissionResponse::from)
                .orElseThrow(() -> new NotFoundException("PERMISSION_NOT_FOUND", "Permission '" + name + "' not found"));
    }

    @Transactional(readOnly = true)
    public List<PermissionResponse> listPermissions() {
        return permissionRepository.findAll(Sort.by("name")).stream()
                .map(PermissionResponse::from)
                .toList();
    }

    public PermissionResponse updatePermission(Long permissionId, UpdatePermissionRequest request) {
        Permission permission = loadPermission(permissionId);

        if (request.name() != null && !request.name().equals(permission.getName())) {
            PermissionName parsed = PermissionName.parse(request.name());
            if (!parsed.name().equals(permission.getName()) && permissionRepository.existsByName(parsed.name())) {
                throw new ConflictException("PERMISSION_EXISTS", "Permission '" + parsed.name() + "' already exists");
            }
            permission.setName(parsed.name());
        }
        if (request.slug() != null) {
            String slug = SlugGenerator.slugify(request.slug());
            if (!slug.equals(permission.getSlug()) && permissionRepository.existsBySlug(slug)) {
                throw new ConflictException("PERMISSION_SLUG_EXISTS", "Permission slug '" + slug + "' already exists");
            }
            permission.setSlug(slug);
        }
        if (request.description() != null && !request.description().isBlank()) {
            permission.setDescription(request.description().trim());
        }

        Permission saved = persist(() -> permissionRepository.saveAndFlush(permission), "PERMISSION_UPDATE_FAILED");
        permissionCache.refreshAfterCommit();
        log.info("Permission updated: id={}, name={}", saved.getId(), saved.getName());
        return PermissionResponse.from(saved);
    }

    public void deletePermission(Long permissionId) {
        Permission permission = loadPermission(permissionId);
        if (isPermissionInUse(permissionId)) {
            throw new ConflictException("PERMISSION_IN_USE",
                    "Permission '" + permission.getName() + "' is still granted to at least one role");
        }
        persist(() -> {
            permissionRepository.delete(permission);
            permissionRepository.flush();
            return permission;
        }, "PERMISSION_DELETE_FAILED");
        permissionCache.refreshAfterCommit();
        log.info("Permission deleted: id={}, name={}", permissionId, permission.getName());
    }

    @Transactional(readOnly = true)
    public boolean isPermissionInUse(Long permissionId) {
        return rolePermissionRepository.existsByPermissionId(permissionId);
    }

    /**
     * @return {@code true} when the grant was added, {@code false} when the role already had it
     */
    public boolean assignPermissionToRole(Long roleId, Long permissionId) {
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> new NotFoundException("ROLE_NOT_FOUND", "Role " + roleId + " not found"));
        Permission permission = loadPermission(permissionId);
        if (rolePermissionRepository.existsByRoleIdAndPermissionId(roleId, permissionId)) {
            return false;
        }
        try {
            rolePermissionRepository.saveAndFlush(new RolePermission(role, permission));
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException("PERMISSION_ALREADY_ASSIGNED",
                    "Permission " + permissionId + " was assigned to role " + roleId + " concurrently");
        } catch (DataAccessException ex) {
            throw new DatabaseException("PERMISSION_ASSIGN_FAILED", "Failed to assign permission", ex);
        }
        permissionCache.refreshAfterCommit();
        log.info("Permission assigned: roleId={}, permission={}", roleId, permission.getName());
        return true;
    }

    /**
     * @return {@code true} when a grant was removed, {@code false} when there was none
     */
    public boolean removePermissionFromRole(Long roleId, Long permissionId) {
        return rolePermissionRepository.findByRoleIdAndPermissionId(roleId, permissionId)
                .map(grant -> {
                    persist(() -> {
                        rolePermissionRepository.delete(grant);
                        rolePermissionRepository.flush();
                        return grant;
                    }, "PERMISSION_REMOVE_FAILED");
                    permissionCache.refreshAfterCommit();
                    log.info("Permission removed: roleId={}, permissionId={}", roleId, permissionId);
                    return true;
                })
                .orElse(false);
    }

    static Scope parseScope(String value) {
        try {
            return Scope.fromValue(value);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("INVALID_SCOPE", "Scope must be 'organization' or 'team'");
        }
    }

    // "teams:assign-user:POST,DELETE" -> "teams-assign-user-post-delete"
    private static String slugFromName(String name) {
        return SlugGenerator.slugify(name.replace(':', ' ').replace(',', ' ').replace('_', ' '));
    }

    private Permission loadPermission(Long permissionId) {
        return permissionRepository.findById(permissionId)
                .orElseThrow(() -> new NotFoundException("PERMISSION_NOT_FOUND", "Permission " + permissionId + " not found"));
    }

    private <T> T persist(Supplier<T> write, String failureCode) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException("PERMISSION_CONFLICT", "The permission data changed concurrently");
        } catch (DataAccessException ex) {
            throw new DatabaseException(failureCode, "Failed to persist permission data", ex);
        }
    }
}

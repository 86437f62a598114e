package com.hinata.backend.modules.rbac.application.cache;

import java.util.List;

import com.hinata.backend.global.error.ValidationException;
import com.hinata.backend.modules.rbac.domain.PermissionName;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.Scope;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RoleGrantRow;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.hinata.backend.modules.rbac.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads roles and grants from the database and turns them into a {@link PermissionSnapshot}.
 * Runs in its own read-only transaction so it can be called from an after-commit hook.
 */
@Component
public class PermissionCacheLoader {

    private static final Logger log = LoggerFactory.getLogger(PermissionCacheLoader.class);

    private final RoleRepository roleRepository;
    private final RolePermissionRepository rolePermissionRepository;

    public PermissionCacheLoader(RoleRepository roleRepository, RolePermissionRepository rolePermissionRepository) {
        this.roleRepository = roleRepository;
        this.rolePermissionRepository = rolePermissionRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public PermissionSnapshot load() {
        List<RoleGrantRow> grants = rolePermissionRepository.findAllGrantRows();
        if (grants.isEmpty()) {
            log.info("No role-permission rows found, using built-in fallback permissions");
            return FallbackPermissions.snapshot();
        }

        PermissionSnapshot.Builder builder = PermissionSnapshot.builder();
        for (Role role : roleRepository.findAllWithInherits()) {
            String scopeKey = role.getScope().key();
            String inherits = role.getInherits() != null ? role.getInherits().getName() : null;
            builder.role(scopeKey, role.getName(), inherits);
            if (Role.SUPER_ADMIN.equals(role.getName())) {
                builder.grant(scopeKey, role.getName(), PermissionName.WILDCARD_ROUTE, PermissionName.ALL_METHODS);
            }
        }

        for (RoleGrantRow grant : grants) {
            PermissionName parsed;
            try {
                parsed = PermissionName.parse(grant.permissionName());
            } catch (ValidationException ex) {
                log.warn("Skipping unparseable permission '{}' on role '{}'", grant.permissionName(), grant.roleName());
                continue;
            }
            builder.grant(grant.scope().key(), grant.roleName(), parsed.route(), parsed.methods());
        }

        builder.grant(Scope.SUPER_ADMIN_KEY, Role.SUPER_ADMIN, PermissionName.WILDCARD_ROUTE, PermissionName.ALL_METHODS);
        return builder.build();
    }
}

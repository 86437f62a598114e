package com.hinata.backend.modules.rbac.application;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.hinata.backend.global.error.InternalServerException;
import com.hinata.backend.modules.rbac.application.cache.PermissionCache;
import com.hinata.backend.modules.rbac.application.cache.PermissionSnapshot;
import com.hinata.backend.modules.rbac.application.cache.RoleEntry;
import com.hinata.backend.modules.rbac.domain.PermissionName;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes what a role may do in a scope by walking its {@code inherits} chain in the permission cache.
 * Methods from inherited roles are added to, never replace, those already collected.
 */
@Component
public class EffectivePermissionResolver {

    public static final int MAX_INHERITANCE_DEPTH = 16;

    private static final Logger log = LoggerFactory.getLogger(EffectivePermissionResolver.class);

    private final PermissionCache permissionCache;

    public EffectivePermissionResolver(PermissionCache permissionCache) {
        this.permissionCache = permissionCache;
    }

    public EffectivePermissions resolve(String roleName, String scopeKey) {
        return resolve(permissionCache.snapshot(), roleName, scopeKey);
    }

    /**
     * Resolves against one snapshot so a concurrent refresh cannot mix old and new grants.
     */
    public EffectivePermissions resolve(PermissionSnapshot snapshot, String roleName, String scopeKey) {
        Map<String, Set<String>> routes = new LinkedHashMap<>();
        Set<String> wildcardMethods = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();

        String current = roleName;
        while (current != null) {
            Optional<RoleEntry> entry = snapshot.find(scopeKey, current);
            if (entry.isEmpty()) {
                break;
            }
            if (!visited.add(current)) {
                log.error("Role inheritance cycle: role={}, scope={}, chain={}", roleName, scopeKey, visited);
                throw new InternalServerException("ROLE_INHERITANCE_UNBOUNDED", "Role inheritance cycle at '" + current + "'");
            }
            if (visited.size() > MAX_INHERITANCE_DEPTH) {
                log.error("Role inheritance too deep: role={}, scope={}, depth={}", roleName, scopeKey, visited.size());
                throw new InternalServerException("ROLE_INHERITANCE_UNBOUNDED", "Role inheritance deeper than " + MAX_INHERITANCE_DEPTH);
            }
            for (Map.Entry<String, List<String>> grant : entry.get().routes().entrySet()) {
                if (PermissionName.WILDCARD_ROUTE.equals(grant.getKey())) {
                    wildcardMethods.addAll(grant.getValue());
                } else {
                    routes.computeIfAbsent(grant.getKey(), key -> new LinkedHashSet<>()).addAll(grant.getValue());
                }
            }
            current = entry.get().inherits();
        }

        if (!wildcardMethods.isEmpty()) {
            routes.put(PermissionName.WILDCARD_ROUTE, wildcardMethods);
        }
        return EffectivePermissions.of(routes);
    }
}

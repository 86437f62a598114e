package com.hinata.backend.global.security;

import com.hinata.backend.modules.rbac.domain.Scope;

/**
 * Where an RBAC request applies and which permission route it needs.
 *
 * @param scope     organization or team, or {@code null} for global administration paths
 * @param contextId organization or team id taken from the path, {@code null} when global
 * @param route     permission route checked against the effective permissions
 */
public record RequestScope(Scope scope, Long contextId, String route) {

    public static RequestScope global(String route) {
        return new RequestScope(null, null, route);
    }

    public boolean isGlobal() {
        return scope == null;
    }

    public String scopeKey() {
        return isGlobal() ? Scope.SUPER_ADMIN_KEY : scope.key();
    }
}

package com.hinata.backend.modules.rbac.infrastructure.persistence;

import com.hinata.backend.modules.rbac.domain.Scope;

public record RoleGrantRow(Scope scope, String roleName, String permissionName) {
}

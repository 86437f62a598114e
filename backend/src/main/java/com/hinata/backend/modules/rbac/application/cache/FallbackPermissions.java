package com.hinata.backend.modules.rbac.application.cache;

import java.util.List;

import com.hinata.backend.modules.rbac.domain.PermissionName;
import com.hinata.backend.modules.rbac.domain.Role;
import com.hinata.backend.modules.rbac.domain.Scope;

/**
 * DB에 역할-권한 매핑이 하나도 없을 때(초기 설치) 쓰는 기본 권한.
 */
public final class FallbackPermissions {

    private FallbackPermissions() {
    }

    public static PermissionSnapshot snapshot() {
        String org = Scope.ORGANIZATION.key();
        String team = Scope.TEAM.key();
        return PermissionSnapshot.builder()
                .fallback(true)
                .grant(org, "Admin", "/rbac/teams/create", List.of("POST"))
                .grant(org, "Admin", "/rbac/teams/assign-user", List.of("POST"))
                .grant(org, "Admin", "/rbac/teams/remove-user", List.of("DELETE"))
                .grant(org, "Admin", "/rbac/teams", List.of("GET"))
                .grant(org, "Member", "/rbac/teams", List.of("GET"))
                .grant(team, "Lead", "/rbac/teams/assign-user", List.of("POST"))
                .grant(team, "Lead", "/rbac/teams/remove-user", List.of("DELETE"))
                .grant(team, "Lead", "/rbac/teams", List.of("GET"))
                .grant(team, "Team_Member", "/rbac/teams", List.of("GET"))
                .grant(Scope.SUPER_ADMIN_KEY, Role.SUPER_ADMIN, PermissionName.WILDCARD_ROUTE, PermissionName.ALL_METHODS)
                .build();
    }
}

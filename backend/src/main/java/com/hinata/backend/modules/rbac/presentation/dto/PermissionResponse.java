package com.hinata.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.hinata.backend.modules.rbac.domain.Permission;
import com.hinata.backend.modules.rbac.domain.PermissionName;

public record PermissionResponse(
        Long id,
        String name,
        String slug,
        String description,
        String scope,
        String route,
        List<String> methods,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static PermissionResponse from(Permission permission) {
        PermissionName parsed = PermissionName.parse(permission.getName());
        return new PermissionResponse(
                permission.getId(),
                permission.getName(),
                permission.getSlug(),
                permission.getDescription(),
                permission.getScope().key(),
                parsed.route(),
                parsed.methods(),
                permission.getCreatedAt(),
                permission.getUpdatedAt()
        );
    }
}

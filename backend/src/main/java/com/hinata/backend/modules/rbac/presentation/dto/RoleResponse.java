package com.hinata.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;

import com.hinata.backend.modules.rbac.domain.Role;

public record RoleResponse(
        Long id,
        String name,
        String slug,
        String description,
        String scope,
        Long inheritsRoleId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(
                role.getId(),
                role.getName(),
                role.getSlug(),
                role.getDescription(),
                role.getScope().key(),
                role.getInherits() != null ? role.getInherits().getId() : null,
                role.getCreatedAt(),
                role.getUpdatedAt()
        );
    }
}

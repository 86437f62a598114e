package com.hinata.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} leaves a field unchanged. {@code clearInherits} drops the parent role.
 */
public record UpdateRoleRequest(
        @Size(max = 100) String name,
        @Size(max = 120) String slug,
        @Size(max = 255) String description,
        Long inheritsRoleId,
        Boolean clearInherits
) {
}

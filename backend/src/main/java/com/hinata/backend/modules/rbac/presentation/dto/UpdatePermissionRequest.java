package com.hinata.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.Size;

public record UpdatePermissionRequest(
        @Size(max = 150) String name,
        @Size(max = 255) String description,
        @Size(max = 160) String slug
) {
}

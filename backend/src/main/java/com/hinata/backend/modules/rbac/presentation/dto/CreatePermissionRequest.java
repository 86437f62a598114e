package com.hinata.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePermissionRequest(
        @NotBlank(message = "name is required") @Size(max = 150) String name,
        @NotBlank(message = "description is required") @Size(max = 255) String description,
        @NotBlank(message = "scope is required") String scope,
        @Size(max = 160) String slug
) {
}

package com.hinata.backend.modules.rbac.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @NotBlank(message = "scope is required") String scope,
        @Size(max = 120) String slug,
        @Size(max = 255) String description,
        Long inheritsRoleId
) {
}

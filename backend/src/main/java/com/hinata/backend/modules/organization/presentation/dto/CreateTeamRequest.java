package com.hinata.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTeamRequest(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @Size(max = 255) String description
) {
}

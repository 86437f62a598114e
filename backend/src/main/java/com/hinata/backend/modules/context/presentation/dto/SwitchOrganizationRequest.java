package com.hinata.backend.modules.context.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record SwitchOrganizationRequest(@NotNull(message = "organizationId is required") Long organizationId) {
}

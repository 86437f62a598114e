package com.hinata.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Role assignment for a user. {@code teamId} is only read on organization-level team routes.
 */
public record AssignMemberRequest(
        Long teamId,
        @NotNull(message = "userId is required") Long userId,
        @NotNull(message = "roleId is required") Long roleId
) {
}

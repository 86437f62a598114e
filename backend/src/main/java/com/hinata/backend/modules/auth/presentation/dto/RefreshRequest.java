package com.hinata.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * {@code organizationId} and {@code teamId} select the active context of the new access token and are
 * checked like a context switch: 403 without membership, 400 when the team belongs to another organization.
 */
public record RefreshRequest(
        @NotBlank(message = "refreshToken is required") String refreshToken,
        Long organizationId,
        Long teamId
) {
}

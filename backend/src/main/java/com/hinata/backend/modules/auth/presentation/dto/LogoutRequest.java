package com.hinata.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Logout answers the same way whether or not the token was known.
 */
public record LogoutRequest(
        @NotBlank(message = "refreshToken is required")
        @Size(max = 4096, message = "refreshToken is too long")
        String refreshToken
) {
}

package com.hinata.backend.modules.context.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record SwitchTeamRequest(@NotNull(message = "teamId is required") Long teamId) {
}

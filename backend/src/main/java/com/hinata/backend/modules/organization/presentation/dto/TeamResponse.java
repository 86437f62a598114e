package com.hinata.backend.modules.organization.presentation.dto;

import com.hinata.backend.modules.organization.domain.Team;

public record TeamResponse(Long id, Long organizationId, String name, String description) {

    public static TeamResponse from(Team team) {
        return new TeamResponse(team.getId(), team.getOrganization().getId(), team.getName(), team.getDescription());
    }
}

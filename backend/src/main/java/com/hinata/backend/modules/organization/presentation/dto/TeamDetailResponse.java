package com.hinata.backend.modules.organization.presentation.dto;

import java.util.List;

public record TeamDetailResponse(TeamResponse team, List<TeamMemberResponse> members) {

    public record TeamMemberResponse(Long userId, String email, String roleName) {
    }
}

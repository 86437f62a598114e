package com.hinata.backend.modules.organization.presentation.dto;

import com.hinata.backend.modules.organization.domain.OrganizationUser;
import com.hinata.backend.modules.organization.domain.TeamMember;

public record MembershipResponse(
        Long organizationId,
        Long teamId,
        Long userId,
        Long roleId,
        String roleName
) {

    public static MembershipResponse from(OrganizationUser membership) {
        return new MembershipResponse(
                membership.getOrganization().getId(),
                null,
                membership.getUser().getId(),
                membership.getRole().getId(),
                membership.getRole().getName()
        );
    }

    public static MembershipResponse from(TeamMember membership) {
        return new MembershipResponse(
                membership.getTeam().getOrganization().getId(),
                membership.getTeam().getId(),
                membership.getUser().getId(),
                membership.getRole().getId(),
                membership.getRole().getName()
        );
    }
}

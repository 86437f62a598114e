package com.hinata.backend.modules.organization.presentation;

import com.hinata.backend.global.security.SecurityUtils;
import com.hinata.backend.modules.organization.application.MembershipService;
import com.hinata.backend.modules.organization.presentation.dto.MembershipResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 호출자 본인의 조직/팀 역할 조회. 인증만 필요하고 RBAC 권한 검사는 하지 않는다.
 */
@RestController
@RequestMapping("/rbac/roles/current-role")
public class CurrentRoleController {

    private final MembershipService membershipService;

    public CurrentRoleController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @Operation(summary = "Caller's role in an organization")
    @ApiResponse(responseCode = "404", description = "MEMBERSHIP_NOT_FOUND")
    @GetMapping("/organization/{organizationId}")
    public ResponseEntity<MembershipResponse> organizationRole(@PathVariable("organizationId") Long organizationId) {
        Long userId = SecurityUtils.getCurrentUser().userId();
        return ResponseEntity.ok(MembershipResponse.from(membershipService.getOrganizationMembership(userId, organizationId)));
    }

    @Operation(summary = "Caller's role in a team")
    @ApiResponse(responseCode = "404", description = "MEMBERSHIP_NOT_FOUND")
    @GetMapping("/team/{teamId}")
    public ResponseEntity<MembershipResponse> teamRole(@PathVariable("teamId") Long teamId) {
        Long userId = SecurityUtils.getCurrentUser().userId();
        return ResponseEntity.ok(MembershipResponse.from(membershipService.getTeamMembership(userId, teamId)));
    }
}

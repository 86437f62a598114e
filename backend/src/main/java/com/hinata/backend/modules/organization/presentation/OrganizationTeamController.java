package com.hinata.backend.modules.organization.presentation;

import java.util.List;

import com.hinata.backend.global.error.ValidationException;
import com.hinata.backend.modules.organization.application.MembershipService;
import com.hinata.backend.modules.organization.presentation.dto.AssignMemberRequest;
import com.hinata.backend.modules.organization.presentation.dto.CreateTeamRequest;
import com.hinata.backend.modules.organization.presentation.dto.MembershipResponse;
import com.hinata.backend.modules.organization.presentation.dto.TeamResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 조직 단위 API. 접근 여부는 RBAC 필터가 {@code orgId}에서의 호출자 역할로 라우트마다 판단한다.
 */
@RestController
@RequestMapping("/rbac/organizations/{orgId}")
public class OrganizationTeamController {

    private final MembershipService membershipService;

    public OrganizationTeamController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @Operation(summary = "List teams of organization")
    @GetMapping("/teams")
    public ResponseEntity<List<TeamResponse>> listTeams(@PathVariable("orgId") Long orgId) {
        List<TeamResponse> teams = membershipService.listTeams(orgId).stream()
                .map(TeamResponse::from)
                .toList();
        return ResponseEntity.ok(teams);
    }

    @Operation(summary = "Create team")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "403", description = "Caller's organization role lacks teams:create:POST"),
            @ApiResponse(responseCode = "409", description = "Team name already used in this organization")
    })
    @PostMapping("/teams/create")
    public ResponseEntity<TeamResponse> createTeam(
            @PathVariable("orgId") Long orgId,
            @Valid @RequestBody CreateTeamRequest request
    ) {
        TeamResponse team = TeamResponse.from(membershipService.createTeam(orgId, request.name().trim(), request.description()));
        return ResponseEntity.status(HttpStatus.CREATED).body(team);
    }

    @Operation(summary = "Add user to team or change the user's team role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assigned"),
            @ApiResponse(responseCode = "400", description = "Team outside organization, role of wrong scope, or user not in organization")
    })
    @PostMapping("/teams/assign-user")
    public ResponseEntity<MembershipResponse> assignTeamUser(
            @PathVariable("orgId") Long orgId,
            @Valid @RequestBody AssignMemberRequest request
    ) {
        Long teamId = requireTeamId(request.teamId());
        membershipService.getTeamInOrganization(orgId, teamId);
        return ResponseEntity.ok(MembershipResponse.from(
                membershipService.assignTeamRole(teamId, request.userId(), request.roleId())));
    }

    @DeleteMapping("/teams/remove-user")
    public ResponseEntity<Void> removeTeamUser(
            @PathVariable("orgId") Long orgId,
            @RequestParam("teamId") Long teamId,
            @RequestParam("userId") Long userId
    ) {
        membershipService.getTeamInOrganization(orgId, teamId);
        membershipService.removeTeamMember(teamId, userId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Add user to organization or change the user's organization role")
    @PostMapping("/members/assign-role")
    public ResponseEntity<MembershipResponse> assignOrganizationRole(
            @PathVariable("orgId") Long orgId,
            @Valid @RequestBody AssignMemberRequest request
    ) {
        return ResponseEntity.ok(MembershipResponse.from(
                membershipService.assignOrganizationRole(orgId, request.userId(), request.roleId())));
    }

    private static Long requireTeamId(Long teamId) {
        if (teamId == null) {
            throw new ValidationException("TEAM_ID_REQUIRED", "teamId is required");
        }
        return teamId;
    }
}

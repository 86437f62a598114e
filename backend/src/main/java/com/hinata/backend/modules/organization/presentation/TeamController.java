package com.hinata.backend.modules.organization.presentation;

import java.util.List;

import com.hinata.backend.modules.organization.application.MembershipService;
import com.hinata.backend.modules.organization.presentation.dto.AssignMemberRequest;
import com.hinata.backend.modules.organization.presentation.dto.MembershipResponse;
import com.hinata.backend.modules.organization.presentation.dto.TeamDetailResponse;
import com.hinata.backend.modules.organization.presentation.dto.TeamDetailResponse.TeamMemberResponse;
import com.hinata.backend.modules.organization.presentation.dto.TeamResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rbac/teams/{teamId}")
public class TeamController {

    private final MembershipService membershipService;

    public TeamController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @Operation(summary = "Team with its members")
    @GetMapping
    public ResponseEntity<TeamDetailResponse> getTeam(@PathVariable("teamId") Long teamId) {
        TeamResponse team = TeamResponse.from(membershipService.getTeam(teamId));
        List<TeamMemberResponse> members = membershipService.listTeamMembers(teamId).stream()
                .map(member -> new TeamMemberResponse(
                        member.getUser().getId(),
                        member.getUser().getEmail(),
                        member.getRole().getName()))
                .toList();
        return ResponseEntity.ok(new TeamDetailResponse(team, members));
    }

    @Operation(summary = "Add user to team or change the user's team role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Assigned"),
            @ApiResponse(responseCode = "400", description = "Role of wrong scope, or user not in the team's organization"),
            @ApiResponse(responseCode = "403", description = "Caller's team role lacks teams:assign-user:POST")
    })
    @PostMapping("/assign-user")
    public ResponseEntity<MembershipResponse> assignUser(
            @PathVariable("teamId") Long teamId,
            @Valid @RequestBody AssignMemberRequest request
    ) {
        return ResponseEntity.ok(MembershipResponse.from(
                membershipService.assignTeamRole(teamId, request.userId(), request.roleId())));
    }

    @DeleteMapping("/remove-user")
    public ResponseEntity<Void> removeUser(
            @PathVariable("teamId") Long teamId,
            @RequestParam("userId") Long userId
    ) {
        membershipService.removeTeamMember(teamId, userId);
        return ResponseEntity.noContent().build();
    }
}

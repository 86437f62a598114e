package com.hinata.backend.modules.context.presentation;

import com.hinata.backend.global.security.AuthenticatedUser;
import com.hinata.backend.global.security.SecurityUtils;
import com.hinata.backend.modules.context.application.ContextSwitchService;
import com.hinata.backend.modules.context.application.ContextSwitchService.AvailableContexts;
import com.hinata.backend.modules.context.application.ContextSwitchService.CurrentContext;
import com.hinata.backend.modules.context.application.ContextToken;
import com.hinata.backend.modules.context.presentation.dto.SwitchContextRequest;
import com.hinata.backend.modules.context.presentation.dto.SwitchOrganizationRequest;
import com.hinata.backend.modules.context.presentation.dto.SwitchTeamRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rbac/context")
public class ContextController {

    private final ContextSwitchService contextSwitchService;

    public ContextController(ContextSwitchService contextSwitchService) {
        this.contextSwitchService = contextSwitchService;
    }

    @Operation(summary = "Activate an organization", description = "Issues a new access token; any active team is cleared.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New access token"),
            @ApiResponse(responseCode = "403", description = "Not a member of the organization")
    })
    @PostMapping("/switch-organization")
    public ResponseEntity<ContextToken> switchOrganization(@Valid @RequestBody SwitchOrganizationRequest request) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(contextSwitchService.switchOrganization(user, request.organizationId()));
    }

    @Operation(summary = "Activate a team and its organization")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New access token"),
            @ApiResponse(responseCode = "403", description = "Not a member of the team")
    })
    @PostMapping("/switch-team")
    public ResponseEntity<ContextToken> switchTeam(@Valid @RequestBody SwitchTeamRequest request) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(contextSwitchService.switchTeam(user, request.teamId()));
    }

    @Operation(summary = "Activate organization and team in one call")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New access token"),
            @ApiResponse(responseCode = "400", description = "Team belongs to another organization"),
            @ApiResponse(responseCode = "403", description = "Not a member of the organization or team")
    })
    @PostMapping("/switch-context")
    public ResponseEntity<ContextToken> switchContext(@RequestBody SwitchContextRequest request) {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(contextSwitchService.switchContext(user, request.organizationId(), request.teamId()));
    }

    @GetMapping("/current")
    public ResponseEntity<CurrentContext> currentContext() {
        return ResponseEntity.ok(contextSwitchService.currentContext(SecurityUtils.getCurrentUser().claims()));
    }

    @GetMapping("/available")
    public ResponseEntity<AvailableContexts> availableContexts() {
        return ResponseEntity.ok(contextSwitchService.availableContexts(SecurityUtils.getCurrentUser()));
    }
}

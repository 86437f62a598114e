package com.hinata.backend.modules.auth.presentation;

import com.hinata.backend.global.security.SecurityUtils;
import com.hinata.backend.modules.auth.application.AuthService;
import com.hinata.backend.modules.auth.presentation.dto.LoginRequest;
import com.hinata.backend.modules.auth.presentation.dto.LoginResponse;
import com.hinata.backend.modules.auth.presentation.dto.LogoutRequest;
import com.hinata.backend.modules.auth.presentation.dto.RefreshRequest;
import com.hinata.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Token endpoints, public except {@code /users/me}. Access tokens issued here carry no active
 * organization or team until the caller switches context, unless a refresh request names one.
 */
@Tag(name = "auth")
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Exchange email and password for a token pair")
    @ApiResponse(responseCode = "401", description = "Unknown email or wrong password, indistinguishable")
    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @Operation(summary = "Rotate a refresh token, optionally carrying the active context forward")
    @ApiResponse(responseCode = "401", description = "INVALID_REFRESH_TOKEN")
    @PostMapping("/refresh")
    public LoginResponse refresh(@Valid @RequestBody RefreshRequest request) {
        return authService.refresh(request);
    }

    @Operation(summary = "Profile and global roles of the caller")
    @ApiResponse(responseCode = "401", description = "Missing or invalid access token")
    @GetMapping("/users/me")
    public UserProfileResponse me() {
        return authService.currentProfile(SecurityUtils.getCurrentUser().userId());
    }

    @Operation(summary = "Revoke a refresh token")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @PostMapping("/logout")
    public void logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
    }
}

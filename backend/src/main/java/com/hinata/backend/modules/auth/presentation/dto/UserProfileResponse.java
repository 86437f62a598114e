package com.hinata.backend.modules.auth.presentation.dto;

import java.util.List;

import com.hinata.backend.modules.auth.domain.AppUser;

public record UserProfileResponse(
        Long userId,
        String email,
        String firstName,
        String lastName,
        boolean verified,
        String authType,
        List<String> roles
) {

    public static UserProfileResponse from(AppUser user, List<String> roles) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.isVerified(),
                user.getAuthType().name(),
                List.copyOf(roles)
        );
    }
}

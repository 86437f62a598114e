package com.hinata.backend.modules.context.application;

/**
 * 컨텍스트용으로 새로 발급한 액세스 토큰과 해당 컨텍스트.
 */
public record ContextToken(String accessToken, long expiresIn, Long activeOrganizationId, Long activeTeamId) {
}

package com.hinata.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hinata.backend.modules.auth.application.token.TokenService;
import com.hinata.backend.modules.auth.domain.RefreshToken;
import com.hinata.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.hinata.backend.support.AbstractPostgresIntegrationTest;
import com.hinata.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String EMAIL = "auth-user@example.com";
    private static final String PASSWORD = "correct-horse-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @BeforeEach
    void setUp() {
        testUserFactory.ensureUser(EMAIL, PASSWORD);
    }

    @Test
    void loginReturnsTokenPairAndProfile() throws Exception {
        JsonNode response = login(EMAIL, PASSWORD);

        assertThat(response.path("tokens").path("tokenType").asText()).isEqualTo("Bearer");
        assertThat(response.path("tokens").path("expiresIn").asLong()).isEqualTo(900L);
        assertThat(response.path("tokens").path("refreshExpiresIn").asLong()).isEqualTo(3600L);
        assertThat(response.path("tokens").path("signing").asText()).isEqualTo("HMAC");
        assertThat(response.path("user").path("email").asText()).isEqualTo(EMAIL);

        String refreshToken = response.path("tokens").path("refreshToken").asText();
        RefreshToken row = refreshTokenRepository.findByTokenHash(TokenService.hash(refreshToken)).orElseThrow();
        assertThat(row.isRevoked()).isFalse();
    }

    @Test
    void wrongPasswordAndUnknownEmailLookTheSame() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(EMAIL, "wrong-password")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.detail").value("Invalid email or password"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials("nobody@example.com", PASSWORD)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.detail").value("Invalid email or password"));
    }

    @Test
    void blankPasswordIsValidationError() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(EMAIL, "")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void refreshRotatesAndRejectsReuse() throws Exception {
        String originalRefreshToken = login(EMAIL, PASSWORD).path("tokens").path("refreshToken").asText();

        String body = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(originalRefreshToken)))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString();
        String rotated = objectMapper.readTree(body).path("tokens").path("refreshToken").asText();
        assertThat(rotated).isNotBlank().isNotEqualTo(originalRefreshToken);

        RefreshToken oldRow = refreshTokenRepository.findByTokenHash(TokenService.hash(originalRefreshToken)).orElseThrow();
        assertThat(oldRow.getRevokedReason()).isEqualTo("ROTATED");

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(originalRefreshToken)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));
    }

    @Test
    void logoutRevokesRefreshToken() throws Exception {
        String refreshToken = login(EMAIL, PASSWORD).path("tokens").path("refreshToken").asText();

        mockMvc.perform(post("/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(refreshToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(refreshBody(refreshToken)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void protectedEndpointNeedsValidAccessToken() throws Exception {
        mockMvc.perform(get("/rbac/context/current"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/rbac/context/current").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized());

        String refreshToken = login(EMAIL, PASSWORD).path("tokens").path("refreshToken").asText();
        mockMvc.perform(get("/rbac/context/current").header("Authorization", "Bearer " + refreshToken))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void profileEndpointNeedsAccessToken() throws Exception {
        mockMvc.perform(get("/auth/users/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));

        mockMvc.perform(get("/auth/users/me").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("invalid_token"));

        String accessToken = login(EMAIL, PASSWORD).path("tokens").path("accessToken").asText();
        mockMvc.perform(get("/auth/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.roles").isArray());
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(post("/auth/login")
                        .header("X-Request-Id", "req-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(EMAIL, PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-123"));
    }

    private JsonNode login(String email, String password) throws Exception {
        String body = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(email, password)))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString();
        return objectMapper.readTree(body);
    }

    private static String credentials(String email, String password) {
        return """
                {"email":"%s","password":"%s"}
                """.formatted(email, password);
    }

    private static String refreshBody(String refreshToken) {
        return """
                {"refreshToken":"%s"}
                """.formatted(refreshToken);
    }
}

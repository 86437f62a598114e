package com.hinata.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import com.hinata.backend.global.web.RequestIdFilter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

class ProblemResponseTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void buildsBodyFromProblemException() {
        MDC.put(RequestIdFilter.REQUEST_ID_MDC_KEY, "req-7");

        ProblemResponse body = ProblemResponse.of(
                new ForbiddenException("NOT_TEAM_MEMBER", "Not a member of team 3"), "/rbac/teams/3/members");

        assertThat(body.status()).isEqualTo(403);
        assertThat(body.code()).isEqualTo("NOT_TEAM_MEMBER");
        assertThat(body.type()).endsWith("/not_team_member");
        assertThat(body.detail()).isEqualTo("Not a member of team 3");
        assertThat(body.instance()).isEqualTo("/rbac/teams/3/members");
        assertThat(body.requestId()).isEqualTo("req-7");
    }

    @Test
    void fallsBackToStatusWhenCodeAndDetailAreBlank() {
        ProblemResponse body = ProblemResponse.of(HttpStatus.NOT_FOUND, " ", null, "/x");

        assertThat(body.code()).isEqualTo("NOT_FOUND");
        assertThat(body.detail()).isEqualTo("Not Found");
        assertThat(body.requestId()).isNull();
    }
}

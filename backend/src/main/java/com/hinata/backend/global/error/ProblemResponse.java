package com.hinata.backend.global.error;

import java.util.Locale;

import com.hinata.backend.global.web.RequestIdFilter;

import org.springframework.http.HttpStatus;

/**
 * Problem+json body. {@code code} is the stable machine-readable value clients switch on;
 * {@code requestId} matches the {@code X-Request-Id} response header.
 */
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    private static final String TYPE_PREFIX = "https://hinata.dev/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String effectiveCode = (code == null || code.isBlank()) ? httpStatus.name() : code;
        String effectiveDetail = (detail == null || detail.isBlank()) ? httpStatus.getReasonPhrase() : detail;
        String slug = effectiveCode.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.]+", "-");
        return new ProblemResponse(
                TYPE_PREFIX + slug,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                effectiveDetail,
                instance,
                effectiveCode,
                RequestIdFilter.currentRequestId()
        );
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        return of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), instance);
    }
}

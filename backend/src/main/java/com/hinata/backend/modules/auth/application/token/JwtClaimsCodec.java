package com.hinata.backend.modules.auth.application.token;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.jsonwebtoken.JwtBuilder;

/**
 * Writes the flat claims map as the signed JSON payload and reads it back verbatim.
 * {@code exp} goes on the wire as an ISO-8601 UTC string with second precision and {@code iat} as epoch seconds.
 */
final class JwtClaimsCodec {

    static final String EXPIRES_AT = "exp";
    static final String ISSUED_AT = "iat";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.USE_LONG_FOR_INTS)
            .build();
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private JwtClaimsCodec() {
    }

    static JwtBuilder write(JwtBuilder builder, Map<String, Object> claims) {
        Map<String, Object> payload = new LinkedHashMap<>(claims);
        Object expiresAt = payload.get(EXPIRES_AT);
        if (expiresAt != null) {
            payload.put(EXPIRES_AT, toInstant(expiresAt).truncatedTo(ChronoUnit.SECONDS).toString());
        }
        Object issuedAt = payload.get(ISSUED_AT);
        if (issuedAt != null) {
            payload.put(ISSUED_AT, toInstant(issuedAt).getEpochSecond());
        }
        try {
            return builder.content(MAPPER.writeValueAsBytes(payload));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Token claims cannot be serialized", ex);
        }
    }

    /**
     * Decodes the payload segment of a token whose signature has already been verified.
     */
    static Map<String, Object> read(String token) {
        String[] segments = token.split("\\.");
        if (segments.length != 3) {
            throw new InvalidTokenException("Token is not a compact JWS");
        }
        try {
            return MAPPER.readValue(Base64.getUrlDecoder().decode(segments[1]), PAYLOAD_TYPE);
        } catch (IOException | IllegalArgumentException ex) {
            throw new InvalidTokenException("Token payload is not a JSON object", ex);
        }
    }

    static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof Number epochSeconds) {
            return Instant.ofEpochSecond(epochSeconds.longValue());
        }
        try {
            return OffsetDateTime.parse(value.toString()).toInstant();
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Not a timestamp: " + value, ex);
        }
    }
}

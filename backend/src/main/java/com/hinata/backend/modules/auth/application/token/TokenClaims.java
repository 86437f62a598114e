package com.hinata.backend.modules.auth.application.token;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Verified token payload with typed accessors for the claims the service relies on.
 */
public final class TokenClaims {

    public static final String SUBJECT = "sub";
    public static final String EXPIRES_AT = "exp";
    public static final String ISSUED_AT = "iat";
    public static final String EMAIL = "email";
    public static final String NONCE = "nonce";
    public static final String TOKEN_USE = "token_use";
    public static final String ACTIVE_ORGANIZATION = "active_organization";
    public static final String ACTIVE_TEAM = "active_team";
    public static final String PERMISSIONS = "permissions";

    static final String REFRESH_TOKEN_USE = "refresh";

    private final Map<String, Object> values;

    public TokenClaims(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String subject() {
        Object subject = values.get(SUBJECT);
        return subject != null ? subject.toString() : null;
    }

    public Instant expiresAt() {
        return Instant.parse(values.get(EXPIRES_AT).toString());
    }

    public Optional<String> nonce() {
        return Optional.ofNullable(values.get(NONCE)).map(Object::toString);
    }

    public boolean isRefreshToken() {
        return REFRESH_TOKEN_USE.equals(values.get(TOKEN_USE));
    }

    public Optional<Long> activeOrganizationId() {
        return nestedId(ACTIVE_ORGANIZATION);
    }

    public Optional<Long> activeTeamId() {
        return nestedId(ACTIVE_TEAM);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Optional<Long> nestedId(String claim) {
        if (values.get(claim) instanceof Map<?, ?> nested && nested.get("id") instanceof Number id) {
            return Optional.of(id.longValue());
        }
        return Optional.empty();
    }
}

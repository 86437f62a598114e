package com.hinata.backend.modules.rbac.domain;

import java.util.Locale;

/**
 * 역할/권한이 적용되는 범위. 권한 캐시의 최상위 키로도 쓰인다.
 */
public enum Scope {
    ORGANIZATION("organization"),
    TEAM("team");

    /**
     * Cache key of the pseudo-scope holding global {@code super_admin} grants.
     */
    public static final String SUPER_ADMIN_KEY = "super_admin";

    private final String key;

    Scope(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Scope fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Scope scope : values()) {
            if (scope.key.equals(normalized)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown scope: " + value);
    }
}

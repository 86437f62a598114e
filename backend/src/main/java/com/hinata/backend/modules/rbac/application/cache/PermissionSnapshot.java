package com.hinata.backend.modules.rbac.application.cache;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of every role's grants, keyed by scope key then role name.
 * A new snapshot is built on each refresh and swapped in whole.
 */
public final class PermissionSnapshot {

    private static final PermissionSnapshot EMPTY = new PermissionSnapshot(Map.of(), false);

    private final Map<String, Map<String, RoleEntry>> scopes;
    private final boolean fallback;

    private PermissionSnapshot(Map<String, Map<String, RoleEntry>> scopes, boolean fallback) {
        this.scopes = scopes;
        this.fallback = fallback;
    }

    public static PermissionSnapshot empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RoleEntry> find(String scopeKey, String roleName) {
        Map<String, RoleEntry> roles = scopes.get(scopeKey);
        if (roles == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(roles.get(roleName));
    }

    public RoleEntry get(String scopeKey, String roleName) {
        return find(scopeKey, roleName).orElse(RoleEntry.empty());
    }

    public boolean isEmpty() {
        return scopes.isEmpty();
    }

    /**
     * True when built from {@link FallbackPermissions} because the database held no grants.
     */
    public boolean isFallback() {
        return fallback;
    }

    public int roleCount() {
        return scopes.values().stream().mapToInt(Map::size).sum();
    }

    public static final class Builder {

        private final Map<String, Map<String, MutableEntry>> scopes = new LinkedHashMap<>();
        private boolean fallback;

        private Builder() {
        }

        public Builder role(String scopeKey, String roleName, String inherits) {
            MutableEntry entry = entry(scopeKey, roleName);
            if (inherits != null) {
                entry.inherits = inherits;
            }
            return this;
        }

        public Builder grant(String scopeKey, String roleName, String route, Collection<String> methods) {
            entry(scopeKey, roleName).routes
                    .computeIfAbsent(route, key -> new LinkedHashSet<>())
                    .addAll(methods);
            return this;
        }

        public Builder fallback(boolean fallback) {
            this.fallback = fallback;
            return this;
        }

        public PermissionSnapshot build() {
            Map<String, Map<String, RoleEntry>> built = new LinkedHashMap<>();
            scopes.forEach((scopeKey, roles) -> {
                Map<String, RoleEntry> entries = new LinkedHashMap<>();
                roles.forEach((roleName, entry) -> {
                    Map<String, List<String>> routes = new LinkedHashMap<>();
                    entry.routes.forEach((route, methods) -> routes.put(route, List.copyOf(methods)));
                    entries.put(roleName, new RoleEntry(routes, entry.inherits));
                });
                built.put(scopeKey, Collections.unmodifiableMap(entries));
            });
            return new PermissionSnapshot(Collections.unmodifiableMap(built), fallback);
        }

        private MutableEntry entry(String scopeKey, String roleName) {
            return scopes.computeIfAbsent(scopeKey, key -> new LinkedHashMap<>())
                    .computeIfAbsent(roleName, key -> new MutableEntry());
        }
    }

    private static final class MutableEntry {
        private final Map<String, LinkedHashSet<String>> routes = new LinkedHashMap<>();
        private String inherits;
    }
}

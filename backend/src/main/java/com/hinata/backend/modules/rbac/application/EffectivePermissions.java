package com.hinata.backend.modules.rbac.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.hinata.backend.modules.rbac.domain.PermissionName;

public final class EffectivePermissions {

    private static final EffectivePermissions NONE = new EffectivePermissions(Map.of());

    private final Map<String, List<String>> routes;

    private EffectivePermissions(Map<String, List<String>> routes) {
        this.routes = routes;
    }

    public static EffectivePermissions none() {
        return NONE;
    }

    public static EffectivePermissions of(Map<String, ? extends Iterable<String>> routes) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        routes.forEach((route, methods) -> {
            List<String> list = new ArrayList<>();
            methods.forEach(list::add);
            copy.put(route, List.copyOf(list));
        });
        return new EffectivePermissions(Collections.unmodifiableMap(copy));
    }

    /**
     * Exact route match first, then the wildcard entry.
     */
    public boolean allows(String route, String method) {
        String normalizedMethod = method.toUpperCase(Locale.ROOT);
        List<String> exact = routes.get(route);
        if (exact != null && exact.contains(normalizedMethod)) {
            return true;
        }
        List<String> wildcard = routes.get(PermissionName.WILDCARD_ROUTE);
        return wildcard != null && wildcard.contains(normalizedMethod);
    }

    public Map<String, List<String>> routes() {
        return routes;
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    /**
     * Overlays {@code other} on this map: for a route present in both, {@code other}'s methods win.
     */
    public EffectivePermissions overriddenBy(EffectivePermissions other) {
        Map<String, List<String>> merged = new LinkedHashMap<>(routes);
        merged.putAll(other.routes);
        return new EffectivePermissions(Collections.unmodifiableMap(merged));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EffectivePermissions that && routes.equals(that.routes);
    }

    @Override
    public int hashCode() {
        return routes.hashCode();
    }

    @Override
    public String toString() {
        return "EffectivePermissions" + routes;
    }
}

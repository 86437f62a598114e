package com.hinata.backend.modules.rbac.application.cache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RoleEntry(Map<String, List<String>> routes, String inherits) {

    private static final RoleEntry EMPTY = new RoleEntry(Map.of(), null);

    public RoleEntry {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        routes.forEach((route, methods) -> copy.put(route, List.copyOf(methods)));
        routes = Collections.unmodifiableMap(copy);
    }

    public static RoleEntry empty() {
        return EMPTY;
    }
}

package com.hinata.backend.modules.rbac.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.hinata.backend.global.error.ValidationException;

/**
 * Parsed form of a permission name.
 *
 * <pre>
 * name     := "super_admin" | resource [ ":" action ] ":" methods
 * resource := [a-z0-9][a-z0-9_-]*
 * action   := [a-z0-9][a-z0-9_-]*
 * methods  := method ( "," method )*
 * method   := GET | POST | PUT | DELETE | PATCH
 * </pre>
 *
 * {@code teams:assign-user:POST} maps to route {@code /rbac/teams/assign-user} with method {@code POST}.
 * {@code super_admin} maps to the wildcard route with every method.
 */
public record PermissionName(String name, String route, List<String> methods) {

    public static final String SUPER_ADMIN = "super_admin";
    public static final String WILDCARD_ROUTE = "*";
    public static final String ROUTE_PREFIX = "/rbac/";
    public static final List<String> ALL_METHODS = List.of("GET", "POST", "PUT", "DELETE", "PATCH");

    private static final Pattern SEGMENT = Pattern.compile("[a-z0-9][a-z0-9_-]*");

    public PermissionName {
        methods = List.copyOf(methods);
    }

    public boolean isWildcard() {
        return WILDCARD_ROUTE.equals(route);
    }

    public static PermissionName parse(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            throw invalid(rawName, "name is empty");
        }
        String name = rawName.trim();
        if (SUPER_ADMIN.equals(name)) {
            return new PermissionName(name, WILDCARD_ROUTE, ALL_METHODS);
        }

        String[] parts = name.split(":", -1);
        if (parts.length < 2 || parts.length > 3) {
            throw invalid(name, "expected resource[:action]:METHODS");
        }
        List<String> segments = new ArrayList<>();
        for (int i = 0; i < parts.length - 1; i++) {
            if (!SEGMENT.matcher(parts[i]).matches()) {
                throw invalid(name, "bad segment '" + parts[i] + "'");
            }
            segments.add(parts[i]);
        }
        List<String> methods = parseMethods(name, parts[parts.length - 1]);
        return new PermissionName(name, ROUTE_PREFIX + String.join("/", segments), methods);
    }

    public static boolean isValid(String rawName) {
        try {
            parse(rawName);
            return true;
        } catch (ValidationException ex) {
            return false;
        }
    }

    private static List<String> parseMethods(String name, String methodPart) {
        if (methodPart.isBlank()) {
            throw invalid(name, "no HTTP methods");
        }
        Set<String> methods = new LinkedHashSet<>();
        for (String raw : methodPart.split(",", -1)) {
            String method = raw.trim().toUpperCase(Locale.ROOT);
            if (!ALL_METHODS.contains(method)) {
                throw invalid(name, "unsupported method '" + raw.trim() + "'");
            }
            methods.add(method);
        }
        return new ArrayList<>(methods);
    }

    private static ValidationException invalid(String name, String reason) {
        return new ValidationException("INVALID_PERMISSION_NAME", "Invalid permission name '" + name + "': " + reason);
    }
}

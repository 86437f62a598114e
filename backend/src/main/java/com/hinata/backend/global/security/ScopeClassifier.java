package com.hinata.backend.global.security;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hinata.backend.modules.rbac.domain.Scope;

import org.springframework.stereotype.Component;

/**
 * Maps an RBAC request path to its scope, context id and permission route.
 *
 * <pre>
 * /rbac/organizations/5/teams/create  -> organization 5, route /rbac/teams/create
 * /rbac/teams/9/assign-user           -> team 9,         route /rbac/teams/assign-user
 * /rbac/roles/3                       -> global,         route /rbac/roles/3
 * </pre>
 */
@Component
public class ScopeClassifier {

    private static final Pattern ORGANIZATION_PATH = Pattern.compile("^/rbac/organizations/(\\d+)(/.*)?$");
    private static final Pattern TEAM_PATH = Pattern.compile("^/rbac/teams/(\\d+)(/.*)?$");
    private static final List<String> GLOBAL_PREFIXES = List.of("/rbac/roles", "/rbac/permissions");

    public Optional<RequestScope> classify(String path) {
        Matcher organization = ORGANIZATION_PATH.matcher(path);
        if (organization.matches()) {
            Optional<Long> id = parseId(organization.group(1));
            String rest = organization.group(2);
            return id.map(value -> new RequestScope(Scope.ORGANIZATION, value, rest == null ? "/rbac/organizations" : "/rbac" + rest));
        }
        Matcher team = TEAM_PATH.matcher(path);
        if (team.matches()) {
            Optional<Long> id = parseId(team.group(1));
            String rest = team.group(2);
            return id.map(value -> new RequestScope(Scope.TEAM, value, rest == null ? "/rbac/teams" : "/rbac/teams" + rest));
        }
        for (String prefix : GLOBAL_PREFIXES) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return Optional.of(RequestScope.global(path));
            }
        }
        return Optional.empty();
    }

    private static Optional<Long> parseId(String digits) {
        try {
            return Optional.of(Long.parseLong(digits));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}

package com.hinata.backend.modules.rbac.domain;

import java.util.Locale;
import java.util.regex.Pattern;

import com.hinata.backend.global.error.ValidationException;

public final class SlugGenerator {

    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]+");

    private SlugGenerator() {
    }

    /**
     * "Team Lead (EU)" becomes "team-lead-eu". Fails when nothing usable is left.
     */
    public static String slugify(String value) {
        if (value == null) {
            throw new ValidationException("INVALID_SLUG", "Slug source must not be null");
        }
        String slug = value.toLowerCase(Locale.ROOT);
        slug = DISALLOWED.matcher(slug).replaceAll("");
        slug = SEPARATORS.matcher(slug.trim()).replaceAll("-");
        slug = trimHyphens(slug);
        if (slug.isEmpty()) {
            throw new ValidationException("INVALID_SLUG", "Cannot derive a slug from '" + value + "'");
        }
        return slug;
    }

    private static String trimHyphens(String slug) {
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }
}

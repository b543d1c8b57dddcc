package com.cgi.schemasense.pattern;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes identifiers into lower-case, underscore-separated tokens.
 * {@code "CancelledDate"}, {@code "cancelled-date"} and {@code "CANCELLED_DATE"} all become
 * {@code "cancelled_date"}.
 */
public final class NameNormalizer {
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private NameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String split = CAMEL_BOUNDARY.matcher(name.trim()).replaceAll("_");
        String lowered = NON_ALPHANUMERIC.matcher(split.toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = lowered.length();
        while (start < end && lowered.charAt(start) == '_') {
            start++;
        }
        while (end > start && lowered.charAt(end - 1) == '_') {
            end--;
        }
        return lowered.substring(start, end);
    }

    /**
     * Normalized name with separators removed, e.g. {@code "emailaddress"}.
     */
    public static String compact(String name) {
        return normalize(name).replace("_", "");
    }

    public static List<String> tokens(String name) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split("_"));
    }
}

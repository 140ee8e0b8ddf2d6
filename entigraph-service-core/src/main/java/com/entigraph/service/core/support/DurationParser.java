package com.entigraph.service.core.support;

import java.time.Duration;
import java.util.Locale;

/** Utility to parse simplified duration strings like "75m" as well as ISO-8601 "PT75M". */
public final class DurationParser {

    private DurationParser() {}

    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Duration cannot be null or empty");
        }

        String trimmed = input.trim();
        if (trimmed.regionMatches(true, 0, "P", 0, 1)) {
            try {
                return requirePositive(Duration.parse(trimmed.toUpperCase(Locale.ROOT)), input);
            } catch (RuntimeException ex) {
                throw new IllegalArgumentException("Unsupported duration format: " + input, ex);
            }
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        try {
            if (lower.endsWith("ms")) {
                return requirePositive(Duration.ofMillis(number(lower, 2)), input);
            }
            if (lower.endsWith("s")) {
                return requirePositive(Duration.ofSeconds(number(lower, 1)), input);
            }
            if (lower.endsWith("m")) {
                return requirePositive(Duration.ofMinutes(number(lower, 1)), input);
            }
            if (lower.endsWith("h")) {
                return requirePositive(Duration.ofHours(number(lower, 1)), input);
            }
            if (lower.endsWith("d")) {
                return requirePositive(Duration.ofDays(number(lower, 1)), input);
            }
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unsupported duration format: " + input, ex);
        }

        throw new IllegalArgumentException("Unsupported duration format: " + input);
    }

    private static long number(String value, int suffixLength) {
        return Long.parseLong(value.substring(0, value.length() - suffixLength).trim());
    }

    private static Duration requirePositive(Duration duration, String input) {
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Duration must be positive: " + input);
        }
        return duration;
    }
}

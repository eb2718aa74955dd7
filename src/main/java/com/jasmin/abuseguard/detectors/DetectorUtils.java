package com.jasmin.abuseguard.detectors;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public class DetectorUtils {
    private static final DateTimeFormatter MINUTE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd:HH:mm");

    /**
     * Returns a non-null, non-blank string.
     * If the input is null or blank, returns "unknown".
     */
    public static String nullSafe(String s) {
        return (s == null || s.isBlank()) ? "unknown" : s.trim();
    }

    /**
     * Normalizes a value for consistent storage and comparison.
     * Trims and converts to lower-case using a fixed locale; blank input yields null.
     */
    public static String normalizeValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /** UTC minute bucket used by the per-minute statistics counters. */
    public static String minuteKey(Instant instant) {
        return minuteKey(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    public static String minuteKey(LocalDateTime utc) {
        return utc.format(MINUTE_FMT);
    }

    /** Whole seconds, rounded up, never below 1. */
    public static long ceilSeconds(long millis) {
        return Math.max(1L, (millis + 999L) / 1000L);
    }

    public static long ceilSeconds(Duration duration) {
        return ceilSeconds(duration.toMillis());
    }
}

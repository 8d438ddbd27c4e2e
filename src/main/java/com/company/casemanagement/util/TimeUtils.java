package com.company.casemanagement.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

public class TimeUtils {

    private static final double MILLIS_PER_HOUR = 60 * 60 * 1000;

    private TimeUtils() {
    }

    /**
     * Fractional hours from {@code from} to {@code to}; negative when {@code to} is earlier
     */
    public static double hoursBetween(Instant from, Instant to) {
        if (from == null || to == null) return 0;
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }

    public static long minutesToMillis(int minutes) {
        return minutes * 60L * 1000L;
    }

    public static Instant startOfDayUtc(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else if (seconds > 0) {
            return String.format("%ds", seconds);
        } else {
            return String.format("%dms", durationMs);
        }
    }
}

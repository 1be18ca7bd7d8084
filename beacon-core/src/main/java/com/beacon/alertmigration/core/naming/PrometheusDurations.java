/*
 * Copyright (c) 2025 Beacon Alert Migration
 * Licensed under the Apache License, Version 2.0
 */
package com.beacon.alertmigration.core.naming;

import java.time.Duration;

/**
 * Formats durations the way Prometheus prints them: largest units first,
 * zero components omitted ("1m30s", "2h", "1w"). Years, weeks and days are
 * only used when they divide the remaining time exactly.
 */
public final class PrometheusDurations {

    private static final long SECONDS_PER_MINUTE = 60;
    private static final long SECONDS_PER_HOUR = 60 * SECONDS_PER_MINUTE;
    private static final long SECONDS_PER_DAY = 24 * SECONDS_PER_HOUR;
    private static final long SECONDS_PER_WEEK = 7 * SECONDS_PER_DAY;
    private static final long SECONDS_PER_YEAR = 365 * SECONDS_PER_DAY;

    private PrometheusDurations() {
    }

    public static String format(Duration duration) {
        boolean negative = duration.isNegative();
        Duration abs = duration.abs();
        long seconds = abs.getSeconds();
        long millis = abs.getNano() / 1_000_000;
        if (seconds == 0 && millis == 0) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        if (negative) {
            sb.append('-');
        }
        // Years, weeks and days never divide a value with a millisecond part.
        if (millis == 0) {
            seconds = appendUnit(sb, seconds, "y", SECONDS_PER_YEAR, true);
            seconds = appendUnit(sb, seconds, "w", SECONDS_PER_WEEK, true);
            seconds = appendUnit(sb, seconds, "d", SECONDS_PER_DAY, true);
        }
        seconds = appendUnit(sb, seconds, "h", SECONDS_PER_HOUR, false);
        seconds = appendUnit(sb, seconds, "m", SECONDS_PER_MINUTE, false);
        appendUnit(sb, seconds, "s", 1, false);
        if (millis > 0) {
            sb.append(millis).append("ms");
        }
        return sb.toString();
    }

    /**
     * Formats a whole number of seconds; any non-negative value is accepted.
     */
    public static String formatSeconds(long seconds) {
        return format(Duration.ofSeconds(seconds));
    }

    private static long appendUnit(StringBuilder sb, long seconds, String unit, long multiple, boolean exact) {
        if (exact && seconds % multiple != 0) {
            return seconds;
        }
        long count = seconds / multiple;
        if (count > 0) {
            sb.append(count).append(unit);
            return seconds - count * multiple;
        }
        return seconds;
    }
}

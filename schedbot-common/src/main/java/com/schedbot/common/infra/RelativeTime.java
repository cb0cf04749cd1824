package com.schedbot.common.infra;

import java.time.Duration;
import java.time.Instant;

/**
 * Human-readable offsets between two instants, e.g. "in 5m" or "3h ago".
 */
public final class RelativeTime {

    private RelativeTime() {
    }

    /**
     * Describe {@code target} relative to {@code now}.
     */
    public static String describe(Instant target, Instant now) {
        if (target == null || now == null) {
            return "unknown";
        }
        long ms = Duration.between(now, target).toMillis();
        if (Math.abs(ms) < 60_000) {
            return ms >= 0 ? "in less than a minute" : "just now";
        }
        String amount = compact(Math.abs(ms));
        return ms > 0 ? "in " + amount : amount + " ago";
    }

    /**
     * Compact duration: "45s", "5m", "2h 15m", "3d 4h".
     */
    public static String compact(long ms) {
        long seconds = Math.max(0, ms) / 1000;
        if (seconds < 60) {
            return seconds + "s";
        }
        long minutes = seconds / 60;
        if (minutes < 60) {
            return minutes + "m";
        }
        long hours = minutes / 60;
        if (hours < 48) {
            long m = minutes % 60;
            return m > 0 ? hours + "h " + m + "m" : hours + "h";
        }
        long days = hours / 24;
        long h = hours % 24;
        return h > 0 ? days + "d " + h + "h" : days + "d";
    }
}

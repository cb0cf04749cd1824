package com.schedbot.scheduler.cron;

import org.springframework.scheduling.support.CronExpression;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Bridges stored expressions to Spring's {@link CronExpression}, which wants
 * six fields. Five-field expressions (minute-interval phrases) get a zero
 * seconds field.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(expression, "empty cron expression");
        }
        String trimmed = expression.trim();
        String sixField = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        try {
            return CronExpression.parse(sixField);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, "invalid cron expression: " + e.getMessage());
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    /**
     * Next fire time strictly after {@code after}, empty if the expression never
     * fires again.
     */
    public static Optional<ZonedDateTime> next(String expression, ZonedDateTime after) {
        return Optional.ofNullable(parse(expression).next(after));
    }
}

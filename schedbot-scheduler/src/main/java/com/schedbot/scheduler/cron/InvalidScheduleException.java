package com.schedbot.scheduler.cron;

/**
 * A time phrase or expression that cannot be turned into a schedule.
 */
public class InvalidScheduleException extends RuntimeException {

    private final String input;

    public InvalidScheduleException(String input, String message) {
        super(message);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}

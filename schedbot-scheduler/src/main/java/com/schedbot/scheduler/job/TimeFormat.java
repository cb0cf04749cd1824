package com.schedbot.scheduler.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a job's schedule was authored.
 */
public enum TimeFormat {
    CRON, HUMAN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TimeFormat fromValue(String value) {
        if (value == null) {
            return CRON;
        }
        return "human".equalsIgnoreCase(value) ? HUMAN : CRON;
    }
}

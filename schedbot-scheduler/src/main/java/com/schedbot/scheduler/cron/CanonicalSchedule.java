package com.schedbot.scheduler.cron;

/**
 * Result of translating a schedule input.
 *
 * @param expression  cron expression the timer runs on
 * @param humanPhrase the phrase it was derived from, or null if the input
 *                    was already an expression
 */
public record CanonicalSchedule(String expression, String humanPhrase) {

    public boolean isHuman() {
        return humanPhrase != null;
    }

    /** What to show users: the phrase when there is one. */
    public String display() {
        return isHuman() ? humanPhrase : expression;
    }
}

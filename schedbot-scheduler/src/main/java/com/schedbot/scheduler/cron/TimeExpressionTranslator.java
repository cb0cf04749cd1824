package com.schedbot.scheduler.cron;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates English and Vietnamese time phrases into cron expressions.
 * <p>
 * Phrases are tried in a fixed order and the first match wins. Input that
 * matches no phrase is accepted verbatim if it is a six-field expression in
 * the supported grammar ({@code *}, a number, or {@code *}/N per field).
 * Minute intervals translate to the five-field form {@code *}/N * * * *;
 * everything else to six fields (seconds first).
 */
public final class TimeExpressionTranslator {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Map<String, Integer> EN_DAYS = Map.of(
            "sunday", 0, "monday", 1, "tuesday", 2, "wednesday", 3,
            "thursday", 4, "friday", 5, "saturday", 6);

    /** "thứ 2" is Monday; Sunday is "chủ nhật". */
    private static final Map<String, Integer> VI_DAYS = Map.of(
            "2", 1, "3", 2, "4", 3, "5", 4, "6", 5, "7", 6, "chủ nhật", 0);

    private static final String HM = "([0-9]{1,2}):([0-9]{1,2})";

    private record PhrasePattern(Pattern pattern, Function<Matcher, String> formatter) {
        PhrasePattern(String regex, Function<Matcher, String> formatter) {
            this(Pattern.compile(regex, FLAGS), formatter);
        }
    }

    private static final List<PhrasePattern> PATTERNS = List.of(
            // daily
            new PhrasePattern("daily at " + HM, m -> daily(m.group(1), m.group(2))),
            new PhrasePattern("every day at " + HM, m -> daily(m.group(1), m.group(2))),
            new PhrasePattern("mỗi ngày lúc " + HM, m -> daily(m.group(1), m.group(2))),
            new PhrasePattern("hàng ngày lúc " + HM, m -> daily(m.group(1), m.group(2))),
            // weekly
            new PhrasePattern("every (monday|tuesday|wednesday|thursday|friday|saturday|sunday) at " + HM,
                    m -> weekly(EN_DAYS.get(m.group(1).toLowerCase(Locale.ROOT)), m.group(2), m.group(3))),
            new PhrasePattern("mỗi (thứ [2-7]|(?:thứ )?chủ nhật) lúc " + HM,
                    m -> weekly(viDay(m.group(1)), m.group(2), m.group(3))),
            // monthly
            new PhrasePattern("every ([0-9]{1,2})(st|nd|rd|th) of( the)? month at " + HM,
                    m -> monthly(m.group(1), m.group(4), m.group(5))),
            new PhrasePattern("mỗi ngày ([0-9]{1,2}) hàng tháng lúc " + HM,
                    m -> monthly(m.group(1), m.group(2), m.group(3))),
            // intervals
            new PhrasePattern("every ([0-9]+) (minutes|minute|hours|hour|days|day)",
                    m -> interval(m.group(1), m.group(2).toLowerCase(Locale.ROOT).charAt(0))),
            new PhrasePattern("mỗi ([0-9]+) (phút|giờ|ngày)",
                    m -> interval(m.group(1), viUnit(m.group(2)))),
            // clock time with period
            new PhrasePattern("at " + HM + " (am|pm)", m -> {
                int hour = number(m.group(1), 1, 12, "hour");
                boolean pm = m.group(3).equalsIgnoreCase("pm");
                if (pm && hour < 12) {
                    hour += 12;
                } else if (!pm && hour == 12) {
                    hour = 0;
                }
                return daily(String.valueOf(hour), m.group(2));
            }),
            new PhrasePattern("lúc " + HM + " (sáng|chiều|tối)", m -> {
                int hour = number(m.group(1), 0, 23, "hour");
                String period = m.group(3).toLowerCase(Locale.ROOT);
                if (!period.equals("sáng") && hour < 12) {
                    hour += 12;
                } else if (period.equals("sáng") && hour == 12) {
                    hour = 0;
                }
                return daily(String.valueOf(hour), m.group(2));
            }));

    private static final String[] FIELD_GRAMMAR = {
            "[0-9]|[1-5][0-9]",          // seconds
            "[0-9]|[1-5][0-9]",          // minutes
            "[0-9]|1[0-9]|2[0-3]",       // hours
            "[1-9]|[12][0-9]|3[01]",     // day of month
            "[1-9]|1[0-2]",              // month
            "[0-6]"                      // day of week
    };

    private static final Pattern LITERAL_EXPRESSION;

    static {
        StringBuilder sb = new StringBuilder("^");
        for (int i = 0; i < FIELD_GRAMMAR.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            String values = FIELD_GRAMMAR[i];
            sb.append("(?:\\*|(?:").append(values).append(")|\\*/(?:").append(values).append("))");
        }
        LITERAL_EXPRESSION = Pattern.compile(sb.append('$').toString());
    }

    private TimeExpressionTranslator() {
    }

    /**
     * Translate a phrase or expression.
     *
     * @throws InvalidScheduleException if the input is neither a known phrase
     *                                  nor a supported six-field expression
     */
    public static CanonicalSchedule translate(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidScheduleException(input, "schedule is empty");
        }
        String text = Normalizer.normalize(input.trim(), Normalizer.Form.NFC);
        for (PhrasePattern phrase : PATTERNS) {
            Matcher m = phrase.pattern().matcher(text);
            if (m.find()) {
                return new CanonicalSchedule(phrase.formatter().apply(m), text);
            }
        }
        if (LITERAL_EXPRESSION.matcher(text).matches()) {
            return new CanonicalSchedule(text, null);
        }
        throw new InvalidScheduleException(input, "unrecognized schedule: " + input);
    }

    public static boolean isLiteralExpression(String input) {
        return input != null && LITERAL_EXPRESSION.matcher(input.trim()).matches();
    }

    // =========================================================================
    // Formatters
    // =========================================================================

    private static String daily(String hours, String minutes) {
        int h = number(hours, 0, 23, "hour");
        int m = number(minutes, 0, 59, "minute");
        return "0 " + m + " " + h + " * * *";
    }

    private static String weekly(int dayOfWeek, String hours, String minutes) {
        int h = number(hours, 0, 23, "hour");
        int m = number(minutes, 0, 59, "minute");
        return "0 " + m + " " + h + " * * " + dayOfWeek;
    }

    private static String monthly(String day, String hours, String minutes) {
        int d = number(day, 1, 31, "day of month");
        int h = number(hours, 0, 23, "hour");
        int m = number(minutes, 0, 59, "minute");
        return "0 " + m + " " + h + " " + d + " * *";
    }

    /** unit: 'm'inutes, 'h'ours or 'd'ays */
    private static String interval(String amount, char unit) {
        switch (unit) {
            case 'm':
                return "*/" + number(amount, 1, 59, "minute interval") + " * * * *";
            case 'h':
                return "0 0 */" + number(amount, 1, 23, "hour interval") + " * * *";
            default:
                return "0 0 0 */" + number(amount, 1, 31, "day interval") + " * *";
        }
    }

    private static int viDay(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        if (lower.endsWith("chủ nhật")) {
            return VI_DAYS.get("chủ nhật");
        }
        return VI_DAYS.get(lower.substring(lower.length() - 1));
    }

    private static char viUnit(String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "phút":
                return 'm';
            case "giờ":
                return 'h';
            default:
                return 'd';
        }
    }

    private static int number(String raw, int min, int max, String what) {
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException(raw, what + " is not a number: " + raw);
        }
        if (value < min || value > max) {
            throw new InvalidScheduleException(raw, what + " out of range " + min + "-" + max + ": " + value);
        }
        return value;
    }
}

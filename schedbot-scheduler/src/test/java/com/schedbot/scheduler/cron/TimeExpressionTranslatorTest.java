package com.schedbot.scheduler.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TimeExpressionTranslator}.
 */
class TimeExpressionTranslatorTest {

    // =========================================================================
    // Phrases
    // =========================================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "every 1 minute            | */1 * * * *",
            "every 15 minutes          | */15 * * * *",
            "every 2 hours             | 0 0 */2 * * *",
            "every 3 days              | 0 0 0 */3 * *",
            "daily at 08:30            | 0 30 8 * * *",
            "DAILY AT 08:30            | 0 30 8 * * *",
            "Every day at 7:05         | 0 5 7 * * *",
            "every monday at 09:15     | 0 15 9 * * 1",
            "every Sunday at 10:00     | 0 0 10 * * 0",
            "every 15th of the month at 10:00 | 0 0 10 15 * *",
            "every 1st of month at 00:00      | 0 0 0 1 * *",
            "at 3:30 pm                | 0 30 15 * * *",
            "at 12:00 am               | 0 0 0 * * *",
            "at 12:10 pm               | 0 10 12 * * *"
    })
    void translate_englishPhrases(String phrase, String expected) {
        CanonicalSchedule result = TimeExpressionTranslator.translate(phrase);

        assertEquals(expected, result.expression());
        assertTrue(result.isHuman());
        assertEquals(phrase, result.humanPhrase());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "mỗi ngày lúc 08:00                | 0 0 8 * * *",
            "hàng ngày lúc 21:15               | 0 15 21 * * *",
            "mỗi thứ 2 lúc 09:15               | 0 15 9 * * 1",
            "mỗi thứ 7 lúc 9:00                | 0 0 9 * * 6",
            "mỗi chủ nhật lúc 10:00            | 0 0 10 * * 0",
            "mỗi thứ chủ nhật lúc 10:00        | 0 0 10 * * 0",
            "mỗi ngày 15 hàng tháng lúc 10:00  | 0 0 10 15 * *",
            "mỗi 30 phút                       | */30 * * * *",
            "mỗi 2 giờ                         | 0 0 */2 * * *",
            "mỗi 3 ngày                        | 0 0 0 */3 * *",
            "lúc 8:00 tối                      | 0 0 20 * * *",
            "lúc 2:45 chiều                    | 0 45 14 * * *",
            "lúc 12:00 sáng                    | 0 0 0 * * *"
    })
    void translate_vietnamesePhrases(String phrase, String expected) {
        assertEquals(expected, TimeExpressionTranslator.translate(phrase).expression());
    }

    @Test
    void translate_isPure() {
        String phrase = "every monday at 09:15";
        assertEquals(TimeExpressionTranslator.translate(phrase), TimeExpressionTranslator.translate(phrase));
    }

    @Test
    void translate_phraseInsideSentence_matches() {
        assertEquals("0 0 7 * * *",
                TimeExpressionTranslator.translate("please remind us every day at 07:00 sharp").expression());
    }

    // =========================================================================
    // Literal expressions
    // =========================================================================

    @ParameterizedTest
    @ValueSource(strings = {"0 30 8 * * 1", "*/10 * * * * *", "0 0 */2 * * *", "0 0 9 1 1 *", "59 59 23 31 12 6"})
    void translate_literalSixField_acceptedVerbatim(String expression) {
        CanonicalSchedule result = TimeExpressionTranslator.translate(expression);

        assertEquals(expression, result.expression());
        assertFalse(result.isHuman());
        assertEquals(expression, result.display());
    }

    // =========================================================================
    // Rejections
    // =========================================================================

    @ParameterizedTest
    @ValueSource(strings = {
            "whenever you like",
            "0 8 * * *",
            "0 60 * * * *",
            "0 0 24 * * *",
            "0 0 8 * * 7",
            "0 0 8 0 * *",
            "daily at 25:00",
            "daily at 08:75",
            "every 0 minutes",
            "every 32nd of the month at 10:00"
    })
    void translate_invalid_throws(String input) {
        assertThrows(InvalidScheduleException.class, () -> TimeExpressionTranslator.translate(input));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = "   ")
    void translate_blank_throws(String input) {
        InvalidScheduleException e = assertThrows(InvalidScheduleException.class,
                () -> TimeExpressionTranslator.translate(input));
        assertEquals(input, e.getInput());
    }

    @Test
    void isLiteralExpression() {
        assertTrue(TimeExpressionTranslator.isLiteralExpression("0 0 8 * * *"));
        assertFalse(TimeExpressionTranslator.isLiteralExpression("every day at 08:00"));
        assertFalse(TimeExpressionTranslator.isLiteralExpression(null));
    }
}

package com.schedbot.app.commands;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits command arguments on whitespace, keeping double-quoted runs as one
 * token: {@code add ping "every 1 minute" hi} gives
 * {@code [add, ping, every 1 minute, hi]}.
 */
public final class CommandTokenizer {

    private static final Pattern TOKEN = Pattern.compile("\"(.*?)\"|(\\S+)");

    private CommandTokenizer() {
    }

    /**
     * Leading tokens plus the untouched remainder of the input.
     *
     * @param rest text after the last head token, trimmed, with one pair of
     *             enclosing quotes removed; empty if nothing follows
     */
    public record Split(List<String> head, String rest) {

        public String head(int index) {
            return index < head.size() ? head.get(index) : null;
        }
    }

    public static List<String> tokenize(String input) {
        List<String> tokens = new ArrayList<>();
        if (input == null) {
            return tokens;
        }
        Matcher m = TOKEN.matcher(input);
        while (m.find()) {
            tokens.add(m.group(1) != null ? m.group(1) : m.group(2));
        }
        return tokens;
    }

    /**
     * Take up to {@code headCount} tokens and keep the rest verbatim, so JSON
     * values and multi-line text survive.
     */
    public static Split split(String input, int headCount) {
        List<String> head = new ArrayList<>();
        if (input == null) {
            return new Split(head, "");
        }
        Matcher m = TOKEN.matcher(input);
        int end = 0;
        while (head.size() < headCount && m.find()) {
            head.add(m.group(1) != null ? m.group(1) : m.group(2));
            end = m.end();
        }
        return new Split(head, unquote(input.substring(end).trim()));
    }

    static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")
                && value.indexOf('"', 1) == value.length() - 1) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}

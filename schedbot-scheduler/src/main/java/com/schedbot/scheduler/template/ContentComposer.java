package com.schedbot.scheduler.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.schedbot.scheduler.fetch.JsonPaths;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {placeholder}} tokens in message templates.
 * <p>
 * Lookup order for a token: built-in values (date and time variants,
 * {@code random A-B}, {@code uuid}), then the caller's context map, then the
 * remote data. {@code {api.some.path}} always addresses the remote data.
 * A token that resolves to nothing is left in the output as written.
 */
@Slf4j
public class ContentComposer {

    private static final Pattern TOKEN = Pattern.compile("\\{([^{}]+)}");
    private static final Pattern RANDOM = Pattern.compile("random\\s*(-?\\d+)\\s*-\\s*(-?\\d+)");
    private static final String API_PREFIX = "api.";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");

    private final Clock clock;
    private final ZoneId zone;
    private final Locale locale;

    public ContentComposer(ZoneId zone, Locale locale) {
        this(Clock.system(zone), zone, locale);
    }

    public ContentComposer(Clock clock, ZoneId zone, Locale locale) {
        this.clock = clock;
        this.zone = zone;
        this.locale = locale;
    }

    public String compose(String template, JsonNode remoteData) {
        return compose(template, Map.of(), remoteData);
    }

    /**
     * Substitute every token in {@code template}.
     *
     * @param context    extra named values; may be empty
     * @param remoteData fetched data, or null when the job has none
     */
    public String compose(String template, Map<String, ?> context, JsonNode remoteData) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Map<String, String> builtIns = builtIns(ZonedDateTime.now(clock).withZoneSameInstant(zone));
        Matcher m = TOKEN.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 32);
        while (m.find()) {
            String replacement;
            try {
                replacement = resolve(m.group(1).trim(), builtIns, context, remoteData).orElse(m.group());
            } catch (RuntimeException e) {
                log.debug("Leaving token {} unresolved: {}", m.group(), e.getMessage());
                replacement = m.group();
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    private Optional<String> resolve(String token, Map<String, String> builtIns, Map<String, ?> context,
            JsonNode remoteData) {
        Matcher random = RANDOM.matcher(token);
        if (random.matches()) {
            long a = Long.parseLong(random.group(1));
            long b = Long.parseLong(random.group(2));
            long low = Math.min(a, b);
            long high = Math.max(a, b);
            return Optional.of(String.valueOf(ThreadLocalRandom.current().nextLong(low, high + 1)));
        }
        if (token.equals("uuid")) {
            return Optional.of(UUID.randomUUID().toString());
        }
        String builtIn = builtIns.get(token);
        if (builtIn != null) {
            return Optional.of(builtIn);
        }
        if (token.startsWith(API_PREFIX)) {
            return lookup(remoteData, token.substring(API_PREFIX.length()));
        }
        Optional<String> fromContext = fromContext(token, context);
        if (fromContext.isPresent()) {
            return fromContext;
        }
        return lookup(remoteData, token);
    }

    private static Optional<String> fromContext(String token, Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return Optional.empty();
        }
        Object direct = context.get(token);
        if (direct instanceof JsonNode) {
            return Optional.of(JsonPaths.asText((JsonNode) direct));
        }
        if (direct != null) {
            return Optional.of(String.valueOf(direct));
        }
        int dot = token.indexOf('.');
        if (dot > 0 && context.get(token.substring(0, dot)) instanceof JsonNode) {
            return lookup((JsonNode) context.get(token.substring(0, dot)), token.substring(dot + 1));
        }
        return Optional.empty();
    }

    private static Optional<String> lookup(JsonNode data, String path) {
        if (data == null) {
            return Optional.empty();
        }
        return JsonPaths.find(data, path).map(JsonPaths::asText);
    }

    private Map<String, String> builtIns(ZonedDateTime now) {
        Map<String, String> values = new HashMap<>();
        values.put("date", now.format(DATE));
        values.put("time", now.format(TIME));
        values.put("datetime", now.format(DATETIME));
        String dayName = now.format(DateTimeFormatter.ofPattern("EEEE", locale));
        values.put("day", dayName);
        values.put("dayOfWeek", dayName);
        values.put("dayOfMonth", String.valueOf(now.getDayOfMonth()));
        values.put("month", now.format(DateTimeFormatter.ofPattern("MM")));
        values.put("monthName", now.format(DateTimeFormatter.ofPattern("MMMM", locale)));
        values.put("year", now.format(DateTimeFormatter.ofPattern("yyyy")));
        values.put("hour", now.format(DateTimeFormatter.ofPattern("HH")));
        values.put("minute", now.format(DateTimeFormatter.ofPattern("mm")));
        values.put("second", now.format(DateTimeFormatter.ofPattern("ss")));
        values.put("timestamp", String.valueOf(now.toInstant().toEpochMilli()));
        return values;
    }
}

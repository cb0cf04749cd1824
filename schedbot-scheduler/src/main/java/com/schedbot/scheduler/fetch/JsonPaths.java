package com.schedbot.scheduler.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Dotted-path lookup into JSON trees. {@code items[0].title} and
 * {@code items.0.title} address the same node.
 */
public final class JsonPaths {

    private static final Pattern BRACKET_INDEX = Pattern.compile("\\[(\\d+)]");

    private JsonPaths() {
    }

    public static List<String> segments(String path) {
        List<String> result = new ArrayList<>();
        if (path == null) {
            return result;
        }
        for (String segment : BRACKET_INDEX.matcher(path.trim()).replaceAll(".$1").split("\\.")) {
            if (!segment.isEmpty()) {
                result.add(segment);
            }
        }
        return result;
    }

    /**
     * Walk {@code path} from {@code root}. Empty if any segment is missing or
     * the walk ends on JSON null.
     */
    public static Optional<JsonNode> find(JsonNode root, String path) {
        JsonNode current = root;
        for (String segment : segments(path)) {
            current = step(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        if (current == null || current.isMissingNode() || current.isNull()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    /**
     * Like {@link #find} but reports the first segment that was missing.
     *
     * @throws PathNotFoundException naming the full path and missing segment
     */
    public static JsonNode require(JsonNode root, String path, String url, boolean required) {
        JsonNode current = root;
        for (String segment : segments(path)) {
            JsonNode next = step(current, segment);
            if (next == null) {
                throw new PathNotFoundException(url, path, segment, required);
            }
            current = next;
        }
        return current;
    }

    /** Text form of a leaf: strings unquoted, everything else as JSON. */
    public static String asText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static JsonNode step(JsonNode node, String segment) {
        if (node == null) {
            return null;
        }
        JsonNode next;
        if (node.isArray()) {
            try {
                next = node.get(Integer.parseInt(segment));
            } catch (NumberFormatException e) {
                return null;
            }
        } else if (node.isObject()) {
            next = node.get(segment);
        } else {
            return null;
        }
        return next == null || next.isMissingNode() ? null : next;
    }
}

package com.schedbot.media;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed media reference: a bundled default asset, an http(s) URL, an inline
 * {@code data:} payload, or a local path.
 */
public record MediaReference(Type type, String value) {

    /** Reserved prefix naming a bundled placeholder asset, e.g. {@code default:notification}. */
    public static final String DEFAULT_ASSET_PREFIX = "default:";

    private static final Pattern DATA_URI = Pattern.compile("^data:([\\w.+-]+/[\\w.+-]+)?(;[^,]*)?,(.*)$",
            Pattern.DOTALL);

    public enum Type {
        DEFAULT_ASSET, URL, INLINE, LOCAL_PATH
    }

    public static MediaReference parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MediaUnavailableException(raw, "empty media reference");
        }
        String ref = raw.trim();
        String lower = ref.toLowerCase(Locale.ROOT);
        if (lower.startsWith(DEFAULT_ASSET_PREFIX)) {
            return new MediaReference(Type.DEFAULT_ASSET, ref.substring(DEFAULT_ASSET_PREFIX.length()).trim());
        }
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new MediaReference(Type.URL, ref);
        }
        if (lower.startsWith("data:")) {
            return new MediaReference(Type.INLINE, ref);
        }
        return new MediaReference(Type.LOCAL_PATH, ref);
    }

    public static boolean isUrl(String raw) {
        return raw != null && !raw.isBlank() && parse(raw).type() == Type.URL;
    }

    /**
     * Decoded inline payload. Only meaningful for {@link Type#INLINE}.
     */
    public InlinePayload decodeInline() {
        Matcher m = DATA_URI.matcher(value);
        if (type != Type.INLINE || !m.matches()) {
            throw new MediaUnavailableException(value, "not a data URI");
        }
        String mime = m.group(1) != null ? m.group(1) : "application/octet-stream";
        String params = m.group(2) != null ? m.group(2) : "";
        String data = m.group(3);
        try {
            byte[] bytes = params.toLowerCase(Locale.ROOT).contains(";base64")
                    ? Base64.getDecoder().decode(data.replaceAll("\\s", ""))
                    : URLDecoder.decode(data, StandardCharsets.UTF_8)
                            .getBytes(StandardCharsets.UTF_8);
            return new InlinePayload(mime, bytes);
        } catch (IllegalArgumentException e) {
            throw new MediaUnavailableException(abbreviate(), "inline payload is not valid base64", e);
        }
    }

    /** Short form for logs; inline payloads can be megabytes long. */
    public String abbreviate() {
        return value.length() > 64 ? value.substring(0, 61) + "..." : value;
    }

    public record InlinePayload(String mimeType, byte[] bytes) {
    }
}

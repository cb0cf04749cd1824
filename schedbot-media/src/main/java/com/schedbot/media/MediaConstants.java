package com.schedbot.media;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Media kinds, recognized file extensions, and folder layout.
 */
public final class MediaConstants {

    public static final String DOWNLOADS_DIR = "downloads";
    public static final String DEFAULTS_DIR = "defaults";
    public static final String API_RESPONSES_DIR = "api_responses";

    /** Placeholder used when a remote download cannot be completed. */
    public static final String NOTIFICATION_ASSET = "notification";

    private MediaConstants() {
    }

    public enum MediaKind {
        IMAGE("images"), AUDIO("audio"), VIDEO("videos"), DOCUMENT("documents"), UNKNOWN(null);

        private final String folder;

        MediaKind(String folder) {
            this.folder = folder;
        }

        /** Sub-folder of the media root holding local files of this kind, or null. */
        public String folder() {
            return folder;
        }
    }

    private static final Map<String, MediaKind> EXTENSIONS = Map.ofEntries(
            Map.entry("jpg", MediaKind.IMAGE),
            Map.entry("jpeg", MediaKind.IMAGE),
            Map.entry("png", MediaKind.IMAGE),
            Map.entry("gif", MediaKind.IMAGE),
            Map.entry("webp", MediaKind.IMAGE),
            Map.entry("bmp", MediaKind.IMAGE),
            Map.entry("mp4", MediaKind.VIDEO),
            Map.entry("mov", MediaKind.VIDEO),
            Map.entry("webm", MediaKind.VIDEO),
            Map.entry("mkv", MediaKind.VIDEO),
            Map.entry("mp3", MediaKind.AUDIO),
            Map.entry("m4a", MediaKind.AUDIO),
            Map.entry("aac", MediaKind.AUDIO),
            Map.entry("ogg", MediaKind.AUDIO),
            Map.entry("wav", MediaKind.AUDIO),
            Map.entry("pdf", MediaKind.DOCUMENT),
            Map.entry("doc", MediaKind.DOCUMENT),
            Map.entry("docx", MediaKind.DOCUMENT),
            Map.entry("xls", MediaKind.DOCUMENT),
            Map.entry("xlsx", MediaKind.DOCUMENT),
            Map.entry("txt", MediaKind.DOCUMENT),
            Map.entry("zip", MediaKind.DOCUMENT));

    private static final Map<String, String> MIME_EXTENSIONS = Map.ofEntries(
            Map.entry("image/jpeg", "jpg"),
            Map.entry("image/png", "png"),
            Map.entry("image/gif", "gif"),
            Map.entry("image/webp", "webp"),
            Map.entry("video/mp4", "mp4"),
            Map.entry("video/webm", "webm"),
            Map.entry("video/quicktime", "mov"),
            Map.entry("audio/mpeg", "mp3"),
            Map.entry("audio/mp4", "m4a"),
            Map.entry("audio/ogg", "ogg"),
            Map.entry("audio/wav", "wav"),
            Map.entry("application/pdf", "pdf"),
            Map.entry("application/zip", "zip"),
            Map.entry("text/plain", "txt"));

    public static final Set<String> RECOGNIZED_EXTENSIONS = EXTENSIONS.keySet();

    /**
     * Lower-case extension of a file name or URL path without the dot, or "" if
     * there is none.
     */
    public static String extensionOf(String name) {
        if (name == null) {
            return "";
        }
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        int dot = name.lastIndexOf('.');
        if (dot <= slash || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean isRecognizedExtension(String ext) {
        return ext != null && EXTENSIONS.containsKey(ext.toLowerCase(Locale.ROOT));
    }

    public static MediaKind kindFromExtension(String ext) {
        if (ext == null) {
            return MediaKind.UNKNOWN;
        }
        return EXTENSIONS.getOrDefault(ext.toLowerCase(Locale.ROOT), MediaKind.UNKNOWN);
    }

    /**
     * Map a Content-Type (parameters allowed) to a file extension, or "" when the
     * type is not one we store.
     */
    public static String extensionFromMime(String mime) {
        if (mime == null || mime.isBlank()) {
            return "";
        }
        String base = mime.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return MIME_EXTENSIONS.getOrDefault(base, "");
    }
}

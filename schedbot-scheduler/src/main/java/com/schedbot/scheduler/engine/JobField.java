package com.schedbot.scheduler.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fields accepted by {@link JobService#update}, with their command aliases.
 */
public enum JobField {
    TIME("time", "schedule", "cron", "lịch"),
    TEXT("text", "message", "tin nhắn", "nội dung"),
    ONE_TIME("oneTime", "single", "một lần"),
    DYNAMIC("dynamic", "động"),
    FUNCTION("function", "hàm"),
    NAME("name", "tên"),
    IMAGE_PATH("imagePath", "image", "ảnh"),
    VIDEO_PATH("videoPath", "video"),
    AUDIO_PATH("audioPath", "audio", "âm thanh"),
    ATTACHMENTS("attachments", "attachment", "đính kèm"),
    RICH_TEXT("richText", "rich"),
    URGENCY("urgency", "urgent"),
    STYLES("styles"),
    MENTIONS("mentions"),
    API_URL("apiUrl", "api"),
    API_METHOD("apiMethod"),
    API_HEADERS("apiHeaders"),
    API_DATA("apiData", "apiBody"),
    API_PARAMS("apiParams"),
    API_REQUIRED("apiRequired"),
    API_RESPONSE_PATH("apiResponsePath"),
    API_MEDIA_PATH("apiMediaPath"),
    API_CACHE_TTL("apiCacheTTL"),
    API_FALLBACK("apiFallback"),
    API_TIMEOUT("apiTimeout"),
    API_SAVE_RESPONSE("apiSaveResponse"),
    TEMPLATE("template");

    private final String displayName;
    private final List<String> aliases;

    JobField(String displayName, String... aliases) {
        this.displayName = displayName;
        this.aliases = Arrays.asList(aliases);
    }

    public String displayName() {
        return displayName;
    }

    public boolean isMedia() {
        return this == IMAGE_PATH || this == VIDEO_PATH || this == AUDIO_PATH || this == ATTACHMENTS;
    }

    public static Optional<JobField> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (JobField field : values()) {
            if (field.displayName.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(field);
            }
            for (String alias : field.aliases) {
                if (alias.toLowerCase(Locale.ROOT).equals(wanted)) {
                    return Optional.of(field);
                }
            }
        }
        return Optional.empty();
    }
}

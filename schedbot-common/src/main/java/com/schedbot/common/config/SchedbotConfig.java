package com.schedbot.common.config;

import lombok.Data;

/**
 * Root configuration type for schedbot, bound from {@code config.json}.
 */
@Data
public class SchedbotConfig {

    /** Job scheduling and persistence settings. */
    private SchedulerConfig scheduler;

    /** Media storage and download settings. */
    private MediaConfig media;

    /** Remote data fetch settings. */
    private FetchConfig fetch;

    /** Outbound dispatch settings. */
    private DispatchConfig dispatch;

    // --- Nested config types ---

    @Data
    public static class SchedulerConfig {
        private boolean enabled = true;
        /** Root for the job store and media; "~" expands to the user home. */
        private String dataDir = "~/.schedbot/data";
        private String storeFile = "schedules.json";
        /** IANA zone id; null means the system default. */
        private String timezone;
        /** BCP-47 tag used for day and month names in templates. */
        private String locale = "en";
        private int workerThreads = 4;
    }

    @Data
    public static class MediaConfig {
        /** Defaults to {@code <dataDir>/media} when unset. */
        private String dir;
        private int downloadTimeoutSeconds = 30;
        private long maxBytes = 100L * 1024 * 1024;
        /** Downloads older than this are pruned periodically; 0 disables pruning. */
        private long downloadMaxAgeMinutes = 0;
    }

    @Data
    public static class FetchConfig {
        private long defaultCacheTtlMs = 300_000;
        private long timeoutMs = 10_000;
        private int previewMaxChars = 2000;
    }

    @Data
    public static class DispatchConfig {
        /** log | webhook */
        private String mode = "log";
        private String webhookUrl;
    }
}

package com.schedbot.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the schedbot configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, SchedbotConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this(configPath, cacheTtl, System::getenv);
    }

    /** Constructor for testing – allows injecting the environment lookup. */
    ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath.toString());
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public SchedbotConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public SchedbotConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    // --- Derived settings ---

    public Path resolveDataDir() {
        return expandHome(loadConfig().getScheduler().getDataDir());
    }

    public Path resolveStorePath() {
        return resolveDataDir().resolve(loadConfig().getScheduler().getStoreFile());
    }

    public Path resolveMediaDir() {
        String dir = loadConfig().getMedia().getDir();
        return dir != null && !dir.isBlank() ? expandHome(dir) : resolveDataDir().resolve("media");
    }

    public ZoneId resolveZone() {
        String tz = loadConfig().getScheduler().getTimezone();
        if (tz == null || tz.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (Exception e) {
            log.warn("Unknown timezone '{}' in config, using system default", tz);
            return ZoneId.systemDefault();
        }
    }

    public Locale resolveLocale() {
        String tag = loadConfig().getScheduler().getLocale();
        return tag == null || tag.isBlank() ? Locale.ENGLISH : Locale.forLanguageTag(tag.trim());
    }

    // --- Loading ---

    private SchedbotConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new SchedbotConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            SchedbotConfig config = raw.isBlank()
                    ? new SchedbotConfig()
                    : objectMapper.readValue(raw, SchedbotConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new SchedbotConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            if (value == null) {
                String defaultValue = matcher.group(2);
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill missing config sections with their defaults.
     */
    SchedbotConfig applyDefaults(SchedbotConfig config) {
        if (config.getScheduler() == null) {
            config.setScheduler(new SchedbotConfig.SchedulerConfig());
        }
        if (config.getMedia() == null) {
            config.setMedia(new SchedbotConfig.MediaConfig());
        }
        if (config.getFetch() == null) {
            config.setFetch(new SchedbotConfig.FetchConfig());
        }
        if (config.getDispatch() == null) {
            config.setDispatch(new SchedbotConfig.DispatchConfig());
        }
        return config;
    }

    /**
     * Expand a leading {@code ~} to the user home directory.
     */
    public static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    /** Exposed for diagnostics. */
    public Map<String, Object> describe() {
        return Map.of(
                "configPath", configPath.toString(),
                "storePath", resolveStorePath().toString(),
                "mediaDir", resolveMediaDir().toString(),
                "timezone", resolveZone().getId());
    }
}

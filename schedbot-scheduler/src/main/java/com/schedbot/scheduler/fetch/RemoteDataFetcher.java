package com.schedbot.scheduler.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.schedbot.common.infra.JsonFile;
import com.schedbot.scheduler.job.ApiCallSpec;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Performs a job's remote call and caches the extracted result.
 * <p>
 * Cache entries are keyed by the whole call description and live for the call's
 * {@code cacheTTL}, or the configured default. Failures resolve to the call's
 * fallback when one is set; otherwise a {@link RemoteCallFailedException}
 * carrying the call's {@code required} flag is thrown.
 */
@Slf4j
public class RemoteDataFetcher {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private static final ObjectMapper KEY_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private static final ObjectMapper RESPONSE_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    private record CachedResponse(JsonNode data, long ttlMs) {
    }

    private final OkHttpClient httpClient;
    private final long defaultTtlMs;
    private final long defaultTimeoutMs;
    private final Path responsesDir;
    private final Clock clock;
    private final Cache<String, CachedResponse> cache;

    public RemoteDataFetcher(long defaultTtlMs, long defaultTimeoutMs, Path responsesDir) {
        this(new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .build(), defaultTtlMs, defaultTimeoutMs, responsesDir, Clock.systemUTC());
    }

    /** Constructor for testing: custom client and clock. */
    RemoteDataFetcher(OkHttpClient httpClient, long defaultTtlMs, long defaultTimeoutMs,
            Path responsesDir, Clock clock) {
        this.httpClient = httpClient;
        this.defaultTtlMs = defaultTtlMs;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.responsesDir = responsesDir;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(256)
                .expireAfter(new Expiry<String, CachedResponse>() {
                    @Override
                    public long expireAfterCreate(String key, CachedResponse value, long currentTime) {
                        return TimeUnit.MILLISECONDS.toNanos(value.ttlMs());
                    }

                    @Override
                    public long expireAfterUpdate(String key, CachedResponse value, long currentTime,
                            long currentDuration) {
                        return TimeUnit.MILLISECONDS.toNanos(value.ttlMs());
                    }

                    @Override
                    public long expireAfterRead(String key, CachedResponse value, long currentTime,
                            long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    public JsonNode fetch(ApiCallSpec spec) {
        return fetch(spec, null);
    }

    /**
     * Fetch (or serve from cache) the data a call describes.
     *
     * @param jobName owning job, used to name saved responses; may be null
     * @throws RemoteCallFailedException when the call or extraction fails and
     *                                   the call has no fallback
     */
    public JsonNode fetch(ApiCallSpec spec, String jobName) {
        if (spec == null || spec.getUrl() == null || spec.getUrl().isBlank()) {
            throw new RemoteCallFailedException(null, spec != null && spec.isRequired(), "no URL configured");
        }
        String key = cacheKey(spec);
        CachedResponse cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Remote data cache hit for {}", spec.getUrl());
            return cached.data();
        }
        try {
            JsonNode data = call(spec);
            if (spec.getResponsePath() != null && !spec.getResponsePath().isBlank()) {
                data = JsonPaths.require(data, spec.getResponsePath(), spec.getUrl(), spec.isRequired());
            }
            long ttl = spec.getCacheTtl() != null && spec.getCacheTtl() > 0 ? spec.getCacheTtl() : defaultTtlMs;
            cache.put(key, new CachedResponse(data, ttl));
            if (spec.isSaveResponse() && jobName != null) {
                saveResponse(jobName, data);
            }
            return data;
        } catch (RemoteCallFailedException e) {
            return fallbackOrThrow(spec, e);
        }
    }

    /**
     * Drop every cached response.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    long cachedEntries() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private JsonNode fallbackOrThrow(ApiCallSpec spec, RemoteCallFailedException e) {
        log.error("Remote call to {} failed: {}", spec.getUrl(), e.getMessage());
        JsonNode fallback = spec.getFallback();
        if (fallback != null && !fallback.isNull() && !fallback.isMissingNode()) {
            log.warn("Using fallback data for {}", spec.getUrl());
            return fallback;
        }
        throw e;
    }

    private JsonNode call(ApiCallSpec spec) {
        String url = spec.getUrl();
        HttpUrl base = HttpUrl.parse(url);
        if (base == null) {
            throw new RemoteCallFailedException(url, spec.isRequired(), "malformed URL: " + url);
        }
        HttpUrl.Builder urlBuilder = base.newBuilder();
        for (Map.Entry<String, Object> param : spec.paramsOrEmpty().entrySet()) {
            urlBuilder.addQueryParameter(param.getKey(), String.valueOf(param.getValue()));
        }

        String method = spec.getMethod() == null ? "GET" : spec.getMethod().toUpperCase(Locale.ROOT);
        RequestBody body = null;
        if (BODY_METHODS.contains(method)) {
            String payload = spec.getData() == null ? "" : spec.getData().toString();
            body = RequestBody.create(payload, JSON);
        }
        Request.Builder request = new Request.Builder().url(urlBuilder.build()).method(method, body);
        Map<String, String> headers = spec.headersOrEmpty();
        if (headers.isEmpty()) {
            request.header("Content-Type", "application/json");
        }
        headers.forEach(request::header);

        long timeout = spec.getTimeout() != null && spec.getTimeout() > 0 ? spec.getTimeout() : defaultTimeoutMs;
        OkHttpClient client = httpClient.newBuilder().callTimeout(timeout, TimeUnit.MILLISECONDS).build();

        log.info("Calling remote API {} {}", method, url);
        try (Response response = client.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new RemoteCallFailedException(url, spec.isRequired(), "HTTP " + response.code());
            }
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            return parse(text);
        } catch (IOException | IllegalArgumentException e) {
            throw new RemoteCallFailedException(url, spec.isRequired(), e.getMessage(), e);
        }
    }

    /** Non-JSON bodies become a text node. */
    private static JsonNode parse(String text) {
        try {
            JsonNode node = RESPONSE_MAPPER.readTree(text);
            return node == null || node.isMissingNode() ? TextNode.valueOf(text) : node;
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    private void saveResponse(String jobName, JsonNode data) {
        if (responsesDir == null) {
            return;
        }
        String safeName = jobName.replaceAll("[^\\p{L}\\p{N}_-]", "_");
        Path target = responsesDir.resolve(safeName + "_" + clock.millis() + ".json");
        ObjectNode doc = RESPONSE_MAPPER.createObjectNode();
        doc.put("job", jobName);
        doc.put("timestamp", clock.instant().toString());
        doc.set("response", data);
        try {
            JsonFile.write(RESPONSE_MAPPER, target, doc);
            log.info("Saved API response to {}", target);
        } catch (IOException e) {
            log.warn("Cannot save API response for {}: {}", jobName, e.getMessage());
        }
    }

    static String cacheKey(ApiCallSpec spec) {
        try {
            // round-trip through a tree so map keys come out sorted
            return KEY_MAPPER.writeValueAsString(KEY_MAPPER.convertValue(spec, Map.class));
        } catch (JsonProcessingException e) {
            return spec.toString();
        }
    }
}

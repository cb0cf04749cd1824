package com.schedbot.scheduler.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.schedbot.media.MediaReference;
import com.schedbot.media.MediaResolver;
import com.schedbot.scheduler.cron.CanonicalSchedule;
import com.schedbot.scheduler.cron.TimeExpressionTranslator;
import com.schedbot.scheduler.engine.ExecutionRecord.Trigger;
import com.schedbot.scheduler.handler.CustomHandlerRegistry;
import com.schedbot.scheduler.job.ApiCallSpec;
import com.schedbot.scheduler.job.JobStats;
import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.job.TimeFormat;
import com.schedbot.scheduler.outbound.Destination;
import com.schedbot.scheduler.store.JobRepository;
import com.schedbot.scheduler.store.JobStoreDocument;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Job management: the operations behind the command surface.
 * <p>
 * Store changes and the matching timer changes happen under the repository
 * lock as one step. Network work (prefetching media for an update) happens
 * before the lock is taken.
 */
@Slf4j
public class JobService {

    static final String MANUAL_DISABLE_REASON = "Manually disabled";
    static final String UNARMABLE_REASON = "its schedule is invalid or has no upcoming run, or it has no destination";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JobRepository repository;
    private final JobScheduler scheduler;
    private final ExecutionEngine engine;
    private final MediaResolver mediaResolver;
    private final CustomHandlerRegistry handlers;
    private final Clock clock;

    public JobService(JobRepository repository, JobScheduler scheduler, ExecutionEngine engine,
            MediaResolver mediaResolver, CustomHandlerRegistry handlers, Clock clock) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.engine = engine;
        this.mediaResolver = mediaResolver;
        this.handlers = handlers;
        this.clock = clock;
    }

    public record AddResult(ScheduledJob job, Optional<ZonedDateTime> nextFire) {
    }

    /** {@code changed} is false when the job was already in the requested state. */
    public record ToggleResult(ScheduledJob job, boolean changed, Optional<ZonedDateTime> nextFire) {
    }

    /**
     * @param notes extra remarks for the user, e.g. that media was downloaded
     */
    public record UpdateResult(ScheduledJob job, JobField field, Optional<ZonedDateTime> nextFire,
            List<String> notes) {
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public List<ScheduledJob> list() {
        return repository.list();
    }

    public ScheduledJob get(String name) {
        return repository.find(name).orElseThrow(() -> new JobNotFoundException(name));
    }

    public JobStoreDocument.Metadata metadata() {
        return repository.read(JobStoreDocument::getMetadata);
    }

    public Optional<ZonedDateTime> nextFireTime(String name) {
        return scheduler.nextFireTime(name);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Create and arm a job.
     *
     * @throws com.schedbot.scheduler.cron.InvalidScheduleException if the schedule does not parse
     * @throws DuplicateJobNameException                           if the name is taken
     */
    public AddResult add(String name, String schedule, String text, Destination destination) {
        requireName(name);
        CanonicalSchedule canonical = TimeExpressionTranslator.translate(schedule);
        Instant now = clock.instant();
        ScheduledJob job = ScheduledJob.builder()
                .name(name)
                .enabled(true)
                .cronExpression(canonical.expression())
                .timeFormat(canonical.isHuman() ? TimeFormat.HUMAN : TimeFormat.CRON)
                .humanTime(canonical.humanPhrase())
                .threadId(destination.threadId())
                .group(destination.group())
                .text(text)
                .useDynamicContent(ScheduledJob.looksDynamic(text))
                .createdAt(now)
                .stats(JobStats.builder().executionCount(0).createdAt(now).build())
                .build();
        return repository.locked(() -> {
            repository.mutate(doc -> {
                if (doc.contains(name)) {
                    throw new DuplicateJobNameException(name);
                }
                doc.getJobs().add(job);
                return null;
            });
            log.info("Added job \"{}\" ({})", name, canonical.expression());
            return new AddResult(job, scheduler.arm(job));
        });
    }

    public void remove(String name) {
        repository.locked(() -> {
            repository.mutate(doc -> {
                if (!doc.remove(name)) {
                    throw new JobNotFoundException(name);
                }
                return null;
            });
            scheduler.disarm(name);
            log.info("Removed job \"{}\"", name);
            return null;
        });
    }

    /**
     * Arm a disabled job and only then persist it as enabled.
     *
     * @throws IllegalStateException if the job cannot be armed (bad schedule,
     *                               no upcoming run or no destination); it
     *                               stays disabled with the reason recorded
     */
    public ToggleResult enable(String name) {
        return repository.locked(() -> {
            ScheduledJob current = get(name);
            if (current.isEnabled()) {
                return new ToggleResult(current, false, scheduler.nextFireTime(name));
            }
            Optional<ZonedDateTime> next = scheduler.arm(current.toBuilder().enabled(true).build());
            if (next.isEmpty()) {
                repository.mutate(doc -> {
                    doc.find(name).ifPresent(job -> job.setDisabledReason(UNARMABLE_REASON));
                    return null;
                });
                log.warn("Job \"{}\" left disabled: {}", name, UNARMABLE_REASON);
                throw new IllegalStateException("Job \"" + name + "\" stays disabled: " + UNARMABLE_REASON + ".");
            }
            ScheduledJob updated;
            try {
                updated = repository.mutate(doc -> {
                    ScheduledJob job = doc.find(name).orElseThrow(() -> new JobNotFoundException(name));
                    job.setEnabled(true);
                    job.setEnabledAt(clock.instant());
                    job.setDisabledReason(null);
                    return job;
                });
            } catch (RuntimeException e) {
                scheduler.disarm(name);
                throw e;
            }
            log.info("Enabled job \"{}\"", name);
            return new ToggleResult(updated, true, next);
        });
    }

    public ToggleResult disable(String name) {
        return repository.locked(() -> {
            ScheduledJob[] updated = new ScheduledJob[1];
            boolean changed = repository.mutate(doc -> {
                ScheduledJob job = doc.find(name).orElseThrow(() -> new JobNotFoundException(name));
                updated[0] = job;
                if (!job.isEnabled()) {
                    return false;
                }
                job.setEnabled(false);
                job.setDisabledAt(clock.instant());
                job.setDisabledReason(MANUAL_DISABLE_REASON);
                return true;
            });
            scheduler.disarm(name);
            if (changed) {
                log.info("Disabled job \"{}\"", name);
            }
            return new ToggleResult(updated[0], changed, Optional.empty());
        });
    }

    /**
     * Point a job at a remote API with method GET, keeping other API settings.
     */
    public ScheduledJob configureApi(String name, String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("API URL is required");
        }
        return repository.mutate(doc -> {
            ScheduledJob job = doc.find(name).orElseThrow(() -> new JobNotFoundException(name));
            ApiCallSpec api = job.getApi() != null ? job.getApi() : new ApiCallSpec();
            api.setUrl(url.trim());
            api.setMethod("GET");
            job.setApi(api);
            return job;
        });
    }

    /**
     * Fire a job now, outside its timer. One-shot jobs stay enabled.
     */
    public ExecutionRecord run(String name) {
        return engine.execute(get(name), Trigger.MANUAL);
    }

    /**
     * Dry-run the job's remote call. Reads the store, never writes it, never
     * dispatches.
     */
    public ApiPreview testApi(String name, int maxChars) {
        ScheduledJob job = get(name);
        if (!job.hasApi()) {
            throw new IllegalStateException("Job \"" + name + "\" has no API configured");
        }
        return engine.preview(job, maxChars);
    }

    // =========================================================================
    // Updates
    // =========================================================================

    /**
     * Change one field of a job. A schedule change re-arms the job; a rename
     * moves its timer.
     *
     * @throws IllegalArgumentException for an unknown field or malformed value
     */
    public UpdateResult update(String name, String fieldName, String value) {
        JobField field = JobField.fromName(fieldName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown field: " + fieldName));
        String v = value == null ? "" : value.trim();
        List<String> notes = new ArrayList<>();

        // outside the lock: may download
        if (field.isMedia() && MediaReference.isUrl(v)) {
            get(name);
            if (!mediaResolver.prefetch(v)) {
                throw new IllegalArgumentException("Could not download " + v);
            }
            notes.add("Downloaded media from URL");
        }
        CanonicalSchedule schedule = field == JobField.TIME ? TimeExpressionTranslator.translate(v) : null;
        if (field == JobField.NAME) {
            requireName(v);
        }
        if (field == JobField.FUNCTION && !isClear(v) && !handlers.contains(v)) {
            notes.add("No handler named " + v + " is registered yet");
        }

        return repository.locked(() -> {
            ScheduledJob job = repository.mutate(doc -> {
                ScheduledJob target = doc.find(name).orElseThrow(() -> new JobNotFoundException(name));
                if (field == JobField.NAME && !v.equals(name) && doc.contains(v)) {
                    throw new DuplicateJobNameException(v);
                }
                apply(target, field, v, schedule);
                return target;
            });
            Optional<ZonedDateTime> next;
            if (field == JobField.NAME && !v.equals(name)) {
                scheduler.disarm(name);
                next = scheduler.arm(job);
            } else if (field == JobField.TIME) {
                next = scheduler.arm(job);
            } else {
                next = scheduler.nextFireTime(job.getName());
            }
            log.info("Updated {} of job \"{}\"", field.displayName(), name);
            return new UpdateResult(job, field, next, notes);
        });
    }

    private void apply(ScheduledJob job, JobField field, String v, CanonicalSchedule schedule) {
        switch (field) {
            case TIME:
                job.setCronExpression(schedule.expression());
                job.setTimeFormat(schedule.isHuman() ? TimeFormat.HUMAN : TimeFormat.CRON);
                job.setHumanTime(schedule.humanPhrase());
                break;
            case TEXT:
                job.setText(v);
                job.setUseDynamicContent(ScheduledJob.looksDynamic(v));
                break;
            case ONE_TIME:
                job.setOneTime(parseFlag(v));
                break;
            case DYNAMIC:
                job.setUseDynamicContent(parseFlag(v));
                break;
            case FUNCTION:
                job.setCustomFunction(isClear(v) ? null : v);
                break;
            case NAME:
                job.setName(v);
                break;
            case IMAGE_PATH:
                job.setImagePath(isClear(v) ? null : v);
                break;
            case VIDEO_PATH:
                job.setVideoPath(isClear(v) ? null : v);
                break;
            case AUDIO_PATH:
                job.setAudioPath(isClear(v) ? null : v);
                break;
            case ATTACHMENTS:
                if (isClear(v)) {
                    job.setAttachments(null);
                } else {
                    job.addAttachment(v);
                }
                break;
            case RICH_TEXT:
                job.setUseRichText(parseFlag(v));
                break;
            case URGENCY:
                job.setUrgency(parseUrgency(v));
                break;
            case STYLES:
                job.setStyles(isClear(v) ? null : parseArray(v, "styles"));
                break;
            case MENTIONS:
                job.setMentions(isClear(v) ? null : parseArray(v, "mentions"));
                break;
            case TEMPLATE:
                job.setTemplate(isClear(v) ? null : v);
                break;
            default:
                applyApi(job, field, v);
        }
    }

    private void applyApi(ScheduledJob job, JobField field, String v) {
        if (field == JobField.API_URL && isClear(v)) {
            job.setApi(null);
            return;
        }
        ApiCallSpec api = job.getApi() != null ? job.getApi() : new ApiCallSpec();
        switch (field) {
            case API_URL:
                api.setUrl(v);
                break;
            case API_METHOD:
                api.setMethod(v.toUpperCase(Locale.ROOT));
                break;
            case API_HEADERS:
                api.setHeaders(convert(parseJson(v, "apiHeaders"), new TypeReference<Map<String, String>>() {
                }, "apiHeaders"));
                break;
            case API_DATA:
                api.setData(parseJson(v, "apiData"));
                break;
            case API_PARAMS:
                api.setParams(convert(parseJson(v, "apiParams"), new TypeReference<Map<String, Object>>() {
                }, "apiParams"));
                break;
            case API_REQUIRED:
                api.setRequired(parseFlag(v));
                break;
            case API_RESPONSE_PATH:
                api.setResponsePath(isClear(v) ? null : v);
                break;
            case API_MEDIA_PATH:
                api.setMediaPath(isClear(v) ? null : v);
                break;
            case API_CACHE_TTL:
                api.setCacheTtl(secondsToMillis(parseLong(v, "apiCacheTTL"), "apiCacheTTL"));
                break;
            case API_FALLBACK:
                api.setFallback(isClear(v) ? null : parseJsonOrText(v));
                break;
            case API_TIMEOUT:
                api.setTimeout(parseLong(v, "apiTimeout"));
                break;
            case API_SAVE_RESPONSE:
                api.setSaveResponse(parseFlag(v));
                break;
            default:
                throw new IllegalArgumentException("Unsupported field: " + field.displayName());
        }
        job.setApi(api);
    }

    // =========================================================================
    // Value parsing
    // =========================================================================

    static boolean parseFlag(String v) {
        return v.equalsIgnoreCase("true") || v.equals("1");
    }

    private static boolean isClear(String v) {
        return v.isEmpty() || v.equalsIgnoreCase("none") || v.equalsIgnoreCase("null");
    }

    private static int parseUrgency(String v) {
        try {
            int level = Integer.parseInt(v);
            if (level < 0 || level > 2) {
                throw new IllegalArgumentException("urgency must be 0, 1 or 2");
            }
            return level;
        } catch (NumberFormatException e) {
            return parseFlag(v) ? 1 : 0;
        }
    }

    static long secondsToMillis(long seconds, String what) {
        try {
            return Math.multiplyExact(seconds, 1000L);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(what + " is too large: " + seconds);
        }
    }

    private static long parseLong(String v, String what) {
        try {
            long value = Long.parseLong(v);
            if (value < 0) {
                throw new IllegalArgumentException(what + " must not be negative");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " must be a number: " + v);
        }
    }

    private static JsonNode parseJson(String v, String what) {
        try {
            return MAPPER.readTree(v);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(what + " must be valid JSON");
        }
    }

    private static JsonNode parseJsonOrText(String v) {
        try {
            return MAPPER.readTree(v);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(v);
        }
    }

    private static <T> T convert(JsonNode node, TypeReference<T> type, String what) {
        if (!node.isObject()) {
            throw new IllegalArgumentException(what + " must be a JSON object");
        }
        return MAPPER.convertValue(node, type);
    }

    private static List<JsonNode> parseArray(String v, String what) {
        JsonNode node = parseJson(v, what);
        if (!node.isArray()) {
            throw new IllegalArgumentException(what + " must be a JSON array");
        }
        List<JsonNode> items = new ArrayList<>();
        node.forEach(items::add);
        return items;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name is required");
        }
    }
}

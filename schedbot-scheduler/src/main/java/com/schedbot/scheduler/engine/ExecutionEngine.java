package com.schedbot.scheduler.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schedbot.media.MediaConstants.MediaKind;
import com.schedbot.media.MediaReference;
import com.schedbot.media.MediaResolver;
import com.schedbot.scheduler.engine.ExecutionRecord.Outcome;
import com.schedbot.scheduler.engine.ExecutionRecord.Stage;
import com.schedbot.scheduler.engine.ExecutionRecord.Trigger;
import com.schedbot.scheduler.fetch.JsonPaths;
import com.schedbot.scheduler.fetch.RemoteCallFailedException;
import com.schedbot.scheduler.fetch.RemoteDataFetcher;
import com.schedbot.scheduler.handler.CustomHandlerRegistry;
import com.schedbot.scheduler.handler.CustomJobHandler;
import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.outbound.Destination;
import com.schedbot.scheduler.outbound.DispatchResult;
import com.schedbot.scheduler.outbound.MessageContent;
import com.schedbot.scheduler.outbound.MessageDispatcher;
import com.schedbot.scheduler.store.JobRepository;
import com.schedbot.scheduler.store.JobStoreDocument;
import com.schedbot.scheduler.template.ContentComposer;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs one firing of a job.
 * <p>
 * Order per firing: fetch remote data, compose text, resolve attachments,
 * append the remote media, dispatch, bump stats, deactivate one-shot jobs,
 * run the custom handler. A required remote call that fails stops the firing
 * before anything is composed. Nothing thrown inside a firing escapes
 * {@link #execute}; the returned record says how far it got.
 */
@Slf4j
public class ExecutionEngine {

    static final String ONE_SHOT_REASON = "One-time job completed";

    private static final ObjectMapper PREVIEW_MAPPER = new ObjectMapper();

    private final JobRepository repository;
    private final RemoteDataFetcher fetcher;
    private final ContentComposer composer;
    private final MediaResolver mediaResolver;
    private final MessageDispatcher dispatcher;
    private final CustomHandlerRegistry handlers;
    private final Clock clock;

    private Consumer<String> oneShotHandler = name -> {
    };

    public ExecutionEngine(JobRepository repository, RemoteDataFetcher fetcher, ContentComposer composer,
            MediaResolver mediaResolver, MessageDispatcher dispatcher, CustomHandlerRegistry handlers,
            Clock clock) {
        this.repository = repository;
        this.fetcher = fetcher;
        this.composer = composer;
        this.mediaResolver = mediaResolver;
        this.dispatcher = dispatcher;
        this.handlers = handlers;
        this.clock = clock;
    }

    /**
     * Called with the job name, under the store lock, after a one-shot job has
     * been disabled on disk. The scheduler uses it to drop the job's timer.
     */
    public void setOneShotHandler(Consumer<String> oneShotHandler) {
        this.oneShotHandler = oneShotHandler;
    }

    public ExecutionRecord execute(ScheduledJob job, Trigger trigger) {
        Instant start = clock.instant();
        ExecutionRecord record = ExecutionRecord.builder()
                .jobName(job.getName())
                .trigger(trigger)
                .startedAt(start)
                .build();
        log.info("Executing job \"{}\" ({})", job.getName(), trigger);
        try {
            run(job, trigger, record);
        } catch (RuntimeException e) {
            // anything not attributed to a stage by run()
            fail(record, record.getStage() != null ? record.getStage() : Stage.COMPOSE, e);
        }
        Instant end = clock.instant();
        record.setFinishedAt(end);
        record.setDurationMs(Duration.between(start, end).toMillis());
        return record;
    }

    private void run(ScheduledJob job, Trigger trigger, ExecutionRecord record) {
        // 1. remote data
        JsonNode remoteData = null;
        if (job.hasApi()) {
            record.setStage(Stage.FETCH);
            try {
                remoteData = fetcher.fetch(job.getApi(), job.getName());
                record.setRemoteData(remoteData);
            } catch (RemoteCallFailedException e) {
                if (e.isRequired()) {
                    log.error("Job \"{}\" aborted: required remote call failed: {}", job.getName(), e.getMessage());
                    record.setOutcome(Outcome.ABORTED_REMOTE);
                    record.setError(e.getMessage());
                    return;
                }
                log.warn("Job \"{}\" continues without remote data: {}", job.getName(), e.getMessage());
            }
        }

        // 2. text
        record.setStage(Stage.COMPOSE);
        String text = composeText(job, remoteData);
        record.setText(text);

        // 3 + 4. attachments
        record.setStage(Stage.MEDIA);
        List<Path> attachments = resolveAttachments(job, record);
        appendRemoteMedia(job, remoteData, attachments);
        record.setAttachments(attachments);
        record.setStage(null);

        // 5. dispatch
        MessageContent content = buildContent(job, text, attachments);
        if (content == null) {
            log.warn("Job \"{}\" has no content to send", job.getName());
            record.setOutcome(Outcome.NO_CONTENT);
        } else {
            record.setStage(Stage.DISPATCH);
            DispatchResult result = dispatcher.dispatch(content, new Destination(job.getThreadId(), job.isGroup()));
            if (result == null || !result.isSuccess()) {
                String error = result == null ? "dispatcher returned no result" : result.getError();
                log.error("Job \"{}\" failed at {}: {}", job.getName(), Stage.DISPATCH, error);
                record.setOutcome(Outcome.FAILED);
                record.setError(error);
                return;
            }
            record.setStage(null);
            record.setOutcome(Outcome.DISPATCHED);
            log.info("Job \"{}\" dispatched to {}", job.getName(), job.getThreadId());

            // 6. stats
            record.setStatsUpdated(persistStats(job.getName(), record));
        }

        // 7. one-shot
        if (job.isOneTime() && trigger == Trigger.SCHEDULED) {
            record.setDeactivated(deactivate(job.getName(), record));
        }

        // 8. custom handler
        if (job.getCustomFunction() != null && !job.getCustomFunction().isBlank()) {
            runHandler(job, remoteData, record);
        }
    }

    // =========================================================================
    // Steps
    // =========================================================================

    private String composeText(ScheduledJob job, JsonNode remoteData) {
        Map<String, Object> context = Map.of("jobName", job.getName());
        String text = job.getText();
        if (text != null && job.isUseDynamicContent()) {
            text = composer.compose(text, context, remoteData);
        }
        if (job.getTemplate() != null && remoteData != null) {
            text = composer.compose(job.getTemplate(), context, remoteData);
        }
        return text;
    }

    private List<Path> resolveAttachments(ScheduledJob job, ExecutionRecord record) {
        List<Path> resolved = new ArrayList<>();
        addResolved(job, job.getImagePath(), MediaKind.IMAGE, resolved, record);
        addResolved(job, job.getVideoPath(), MediaKind.VIDEO, resolved, record);
        addResolved(job, job.getAudioPath(), MediaKind.AUDIO, resolved, record);
        for (String ref : job.attachmentsOrEmpty()) {
            addResolved(job, ref, MediaKind.UNKNOWN, resolved, record);
        }
        return resolved;
    }

    private void addResolved(ScheduledJob job, String ref, MediaKind kind, List<Path> into, ExecutionRecord record) {
        if (ref == null || ref.isBlank()) {
            return;
        }
        try {
            into.add(mediaResolver.resolve(ref, kind));
        } catch (RuntimeException e) {
            log.warn("Job \"{}\": skipping attachment {}: {}", job.getName(), abbreviate(ref), e.getMessage());
            record.getSkippedAttachments().add(ref);
        }
    }

    private void appendRemoteMedia(ScheduledJob job, JsonNode remoteData, List<Path> into) {
        Optional<String> url = remoteMediaUrl(job, remoteData);
        if (url.isEmpty()) {
            return;
        }
        try {
            into.add(mediaResolver.resolve(url.get()));
            log.info("Job \"{}\": attached media from remote data {}", job.getName(), url.get());
        } catch (RuntimeException e) {
            log.warn("Job \"{}\": cannot attach remote media {}: {}", job.getName(), url.get(), e.getMessage());
        }
    }

    private static Optional<String> remoteMediaUrl(ScheduledJob job, JsonNode remoteData) {
        if (remoteData == null || job.getApi() == null || job.getApi().getMediaPath() == null) {
            return Optional.empty();
        }
        return JsonPaths.find(remoteData, job.getApi().getMediaPath())
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(MediaReference::isUrl);
    }

    /** Null when there is nothing to send. */
    private static MessageContent buildContent(ScheduledJob job, String text, List<Path> attachments) {
        boolean hasText = text != null && !text.isEmpty();
        boolean hasStyles = job.getStyles() != null && !job.getStyles().isEmpty();
        boolean hasMentions = job.isGroup() && job.getMentions() != null && !job.getMentions().isEmpty();
        Integer urgency = job.getUrgency() != null && job.getUrgency() != 0 ? job.getUrgency() : null;
        if (!hasText && !hasStyles && !hasMentions && urgency == null && attachments.isEmpty()) {
            return null;
        }
        if (hasText && !hasStyles && !hasMentions && urgency == null && attachments.isEmpty()
                && !job.isUseRichText()) {
            return new MessageContent.PlainText(text);
        }
        return new MessageContent.RichMessage(hasText ? text : "",
                hasStyles ? job.getStyles() : null,
                hasMentions ? job.getMentions() : null,
                attachments,
                urgency);
    }

    private boolean persistStats(String name, ExecutionRecord record) {
        Instant now = clock.instant();
        try {
            return repository.mutate(doc -> {
                JobStoreDocument.AggregateStats totals = doc.getMetadata().getStats();
                totals.setTotalExecutions(totals.getTotalExecutions() + 1);
                totals.setLastExecution(now);
                Optional<ScheduledJob> stored = doc.find(name);
                stored.ifPresent(j -> {
                    j.getStats().setExecutionCount(j.getStats().getExecutionCount() + 1);
                    j.getStats().setLastExecuted(now);
                });
                if (stored.isEmpty()) {
                    log.warn("Job \"{}\" was removed while firing; only aggregate stats updated", name);
                }
                return true;
            });
        } catch (RuntimeException e) {
            log.error("Job \"{}\" failed at {}: {}", name, Stage.PERSIST, e.getMessage());
            record.setStage(Stage.PERSIST);
            record.setError(e.getMessage());
            return false;
        }
    }

    private boolean deactivate(String name, ExecutionRecord record) {
        Instant now = clock.instant();
        try {
            return repository.mutate(doc -> {
                Optional<ScheduledJob> stored = doc.find(name);
                if (stored.isEmpty()) {
                    return false;
                }
                ScheduledJob job = stored.get();
                job.setEnabled(false);
                // spent; re-enabling makes it a recurring job
                job.setOneTime(false);
                job.setDisabledAt(now);
                job.setDisabledReason(ONE_SHOT_REASON);
                doc.getMetadata().setLastDisabledJob(new JobStoreDocument.DisabledJob(name, now));
                oneShotHandler.accept(name);
                log.info("One-time job \"{}\" disabled", name);
                return true;
            });
        } catch (RuntimeException e) {
            log.error("Job \"{}\" failed at {}: {}", name, Stage.DEACTIVATE, e.getMessage());
            record.setStage(Stage.DEACTIVATE);
            record.setError(e.getMessage());
            return false;
        }
    }

    private void runHandler(ScheduledJob job, JsonNode remoteData, ExecutionRecord record) {
        Optional<CustomJobHandler> handler = handlers.find(job.getCustomFunction());
        if (handler.isEmpty()) {
            log.warn("Job \"{}\": no custom handler named {}", job.getName(), job.getCustomFunction());
            record.setHandlerError("unknown handler " + job.getCustomFunction());
            return;
        }
        log.info("Job \"{}\": running custom handler {}", job.getName(), job.getCustomFunction());
        try {
            handler.get().handle(new CustomJobHandler.Invocation(job, remoteData, dispatcher));
        } catch (Exception e) {
            log.error("Job \"{}\" failed at {}: {}", job.getName(), Stage.HANDLER, e.getMessage(), e);
            record.setHandlerError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void fail(ExecutionRecord record, Stage stage, Exception e) {
        log.error("Job \"{}\" failed at {}: {}", record.getJobName(), stage, e.getMessage(), e);
        record.setOutcome(Outcome.FAILED);
        record.setStage(stage);
        record.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    // =========================================================================
    // Dry run
    // =========================================================================

    /**
     * Call the job's remote API and show what a firing would produce. Never
     * dispatches and never writes the job store.
     *
     * @throws RemoteCallFailedException when the call fails without fallback
     */
    public ApiPreview preview(ScheduledJob job, int maxChars) {
        if (!job.hasApi()) {
            throw new IllegalStateException("Job \"" + job.getName() + "\" has no API configured");
        }
        JsonNode data = fetcher.fetch(job.getApi());
        String pretty;
        try {
            pretty = PREVIEW_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (JsonProcessingException e) {
            pretty = String.valueOf(data);
        }
        if (pretty.length() > maxChars) {
            pretty = pretty.substring(0, Math.max(0, maxChars - 3)) + "...";
        }
        String composed = null;
        if (job.getTemplate() != null) {
            composed = composer.compose(job.getTemplate(), Map.of("jobName", job.getName()), data);
        } else if (job.getText() != null && job.isUseDynamicContent()) {
            composed = composer.compose(job.getText(), Map.of("jobName", job.getName()), data);
        }
        String mediaUrl = remoteMediaUrl(job, data).orElse(null);
        Path mediaFile = mediaUrl == null ? null : mediaResolver.resolve(mediaUrl);
        return new ApiPreview(job.getName(), job.getApi().getUrl(), data, pretty, composed, mediaUrl, mediaFile);
    }

    private static String abbreviate(String ref) {
        return ref.length() > 64 ? ref.substring(0, 61) + "..." : ref;
    }
}

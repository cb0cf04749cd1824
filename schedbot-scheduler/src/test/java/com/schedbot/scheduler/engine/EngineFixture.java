package com.schedbot.scheduler.engine;

import com.schedbot.media.MediaResolver;
import com.schedbot.scheduler.fetch.RemoteDataFetcher;
import com.schedbot.scheduler.handler.CustomHandlerRegistry;
import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.store.JobRepository;
import com.schedbot.scheduler.store.JobStore;
import com.schedbot.scheduler.store.JobStoreDocument;
import com.schedbot.scheduler.template.ContentComposer;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Wires the engine's collaborators over a temp directory.
 */
final class EngineFixture {

    static final Instant NOW = Instant.parse("2024-03-05T14:07:09Z");

    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final Path storePath;
    final JobRepository repository;
    final RemoteDataFetcher fetcher;
    final ContentComposer composer;
    final MediaResolver media;
    final RecordingDispatcher dispatcher = new RecordingDispatcher();
    final CustomHandlerRegistry handlers = new CustomHandlerRegistry();
    final ExecutionEngine engine;

    EngineFixture(Path root) throws IOException {
        storePath = root.resolve("data").resolve("schedules.json");
        repository = new JobRepository(new JobStore(storePath, clock));
        repository.initialize();
        media = new MediaResolver(root.resolve("media"), Duration.ofSeconds(5), 1_000_000);
        fetcher = new RemoteDataFetcher(300_000, 2_000, media.getApiResponsesDir());
        composer = new ContentComposer(clock, ZoneOffset.UTC, Locale.ENGLISH);
        engine = new ExecutionEngine(repository, fetcher, composer, media, dispatcher, handlers, clock);
    }

    ScheduledJob save(ScheduledJob job) {
        repository.mutate(doc -> doc.getJobs().add(job));
        return job;
    }

    ScheduledJob stored(String name) {
        return repository.find(name).orElseThrow();
    }

    JobStoreDocument.Metadata metadata() {
        return repository.read(JobStoreDocument::getMetadata);
    }

    static ScheduledJob.ScheduledJobBuilder job(String name) {
        return ScheduledJob.builder()
                .name(name)
                .cronExpression("0 0 8 * * *")
                .threadId("thread-1");
    }
}

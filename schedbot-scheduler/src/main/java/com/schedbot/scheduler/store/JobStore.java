package com.schedbot.scheduler.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.schedbot.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;

/**
 * Reads and writes the job document. Not thread-safe; {@link JobRepository}
 * serializes access.
 */
@Slf4j
public class JobStore {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path path;
    private final Clock clock;

    public JobStore(Path path) {
        this(path, Clock.systemUTC());
    }

    public JobStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Create an empty document when none exists.
     *
     * @return true if a new document was written
     */
    public boolean initialize() throws IOException {
        if (Files.exists(path)) {
            return false;
        }
        JsonFile.write(MAPPER, path, JobStoreDocument.empty(clock.instant()));
        log.info("Created empty job store at {}", path);
        return true;
    }

    /**
     * Load the full document. A missing file reads as empty.
     *
     * @throws StoreCorruptException if the file exists but is not a job document
     */
    public JobStoreDocument load() throws IOException {
        if (!Files.exists(path)) {
            return JobStoreDocument.empty(clock.instant());
        }
        JobStoreDocument doc;
        try {
            doc = JsonFile.read(MAPPER, path, JobStoreDocument.class);
        } catch (JsonProcessingException e) {
            throw new StoreCorruptException(path, e);
        }
        if (doc == null) {
            throw new StoreCorruptException(path, new IOException("document is empty"));
        }
        if (doc.getJobs() == null) {
            doc.setJobs(new ArrayList<>());
        }
        if (doc.getMetadata() == null) {
            doc.setMetadata(new JobStoreDocument.Metadata());
        }
        if (doc.getMetadata().getStats() == null) {
            doc.getMetadata().setStats(new JobStoreDocument.AggregateStats());
        }
        return doc;
    }

    /**
     * Replace the document on disk, stamping {@code metadata.lastUpdated}.
     */
    public void save(JobStoreDocument doc) throws IOException {
        doc.getMetadata().setLastUpdated(clock.instant());
        JsonFile.write(MAPPER, path, doc);
        log.debug("Saved job store {} ({} jobs)", path, doc.getJobs().size());
    }
}

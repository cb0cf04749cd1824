package com.schedbot.scheduler.store;

import com.schedbot.scheduler.job.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The single mutual-exclusion point for the job document.
 * <p>
 * Every access loads the full document, and every mutation writes it back,
 * while holding one reentrant lock. The scheduler takes the same lock around
 * its timer map so store state and live timers change together. Jobs handed
 * out are fresh copies; editing them has no effect until passed through
 * {@link #mutate(Function)}.
 */
@Slf4j
public class JobRepository {

    private final JobStore store;
    private final ReentrantLock lock = new ReentrantLock();

    public JobRepository(JobStore store) {
        this.store = store;
    }

    public JobStore getStore() {
        return store;
    }

    /**
     * Create the document if missing and verify it parses.
     *
     * @throws StoreCorruptException if an existing document is malformed
     */
    public JobStoreDocument initialize() throws IOException {
        lock.lock();
        try {
            store.initialize();
            return store.load();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read-only access to a freshly loaded document.
     */
    public <T> T read(Function<JobStoreDocument, T> reader) {
        lock.lock();
        try {
            return reader.apply(load());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read-modify-write. Nothing is saved if {@code mutation} throws.
     */
    public <T> T mutate(Function<JobStoreDocument, T> mutation) {
        lock.lock();
        try {
            JobStoreDocument doc = load();
            T result = mutation.apply(doc);
            try {
                store.save(doc);
            } catch (IOException e) {
                log.error("Failed to save job store {}: {}", store.getPath(), e.getMessage());
                throw new UncheckedIOException(e);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run {@code action} under the store lock without touching the document.
     */
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public List<ScheduledJob> list() {
        return read(JobStoreDocument::getJobs);
    }

    public Optional<ScheduledJob> find(String name) {
        return read(doc -> doc.find(name));
    }

    private JobStoreDocument load() {
        try {
            return store.load();
        } catch (IOException e) {
            log.error("Failed to load job store {}: {}", store.getPath(), e.getMessage());
            throw new UncheckedIOException(e);
        }
    }
}

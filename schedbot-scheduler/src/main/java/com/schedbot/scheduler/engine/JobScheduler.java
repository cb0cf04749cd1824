package com.schedbot.scheduler.engine;

import com.schedbot.common.infra.RelativeTime;
import com.schedbot.scheduler.cron.CronSchedules;
import com.schedbot.scheduler.cron.InvalidScheduleException;
import com.schedbot.scheduler.cron.TimeExpressionTranslator;
import com.schedbot.scheduler.engine.ExecutionRecord.Trigger;
import com.schedbot.scheduler.job.ScheduledJob;
import com.schedbot.scheduler.job.TimeFormat;
import com.schedbot.scheduler.store.JobRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the live timers, one per armed job.
 * <p>
 * Each timer is a single delayed task; after the firing completes the next
 * one is armed from the job's expression, so firings of one job never
 * overlap while different jobs fire in parallel on the worker pool. Arming
 * always cancels the previous handle first, and a handle carries a generation
 * number so a firing whose timer was replaced meanwhile does not re-arm.
 * The handle map only changes under the job repository's lock.
 */
@Slf4j
public class JobScheduler {

    /** A live timer. */
    record TimerHandle(String name, String expression, long generation, ZonedDateTime fireAt,
            ScheduledFuture<?> future) {
    }

    private final JobRepository repository;
    private final ExecutionEngine engine;
    private final Clock clock;
    private final ZoneId zone;
    private final ScheduledExecutorService timer;
    private final ExecutorService workers;
    private final Map<String, TimerHandle> handles = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    public JobScheduler(JobRepository repository, ExecutionEngine engine, ZoneId zone, int workerThreads) {
        this(repository, engine, Clock.system(zone), zone, workerThreads);
    }

    public JobScheduler(JobRepository repository, ExecutionEngine engine, Clock clock, ZoneId zone,
            int workerThreads) {
        this.repository = repository;
        this.engine = engine;
        this.clock = clock;
        this.zone = zone;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-timer");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(Math.max(1, workerThreads), Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
                    Thread t = new Thread(r, "job-worker-" + workerIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        engine.setOneShotHandler(this::disarm);
    }

    /**
     * Arm every enabled job in the store.
     *
     * @return number of jobs armed
     */
    public int start() {
        List<ScheduledJob> jobs = repository.list();
        int armed = 0;
        for (ScheduledJob job : jobs) {
            if (arm(job).isPresent()) {
                armed++;
            }
        }
        log.info("Job scheduler started: {} of {} jobs armed", armed, jobs.size());
        return armed;
    }

    /**
     * Cancel any timer for the job and, if it is enabled and valid, start a new
     * one.
     *
     * @return the next fire time, empty if the job was left unarmed
     */
    public Optional<ZonedDateTime> arm(ScheduledJob job) {
        return repository.locked(() -> {
            if (job.getName() != null) {
                disarm(job.getName());
            }
            if (!job.isEnabled()) {
                log.debug("Job \"{}\" is disabled, not armed", job.getName());
                return Optional.empty();
            }
            String expression = effectiveExpression(job);
            if (job.getName() == null || job.getName().isBlank() || expression == null
                    || job.getThreadId() == null || job.getThreadId().isBlank()) {
                log.warn("Job \"{}\" is missing a name, schedule or destination; not armed",
                        job.getName() == null ? "unnamed" : job.getName());
                return Optional.empty();
            }
            return schedule(job.getName(), expression, ZonedDateTime.now(clock).withZoneSameInstant(zone));
        });
    }

    /**
     * Cancel the job's timer without waiting for a firing in progress.
     *
     * @return true if a timer was live
     */
    public boolean disarm(String name) {
        return repository.locked(() -> {
            TimerHandle handle = handles.remove(name);
            if (handle == null) {
                return false;
            }
            handle.future().cancel(false);
            log.debug("Disarmed job \"{}\"", name);
            return true;
        });
    }

    public boolean isArmed(String name) {
        return handles.containsKey(name);
    }

    public Optional<ZonedDateTime> nextFireTime(String name) {
        return Optional.ofNullable(handles.get(name)).map(TimerHandle::fireAt);
    }

    public Set<String> armedJobs() {
        return new TreeSet<>(handles.keySet());
    }

    public void shutdown() {
        repository.locked(() -> {
            handles.values().forEach(h -> h.future().cancel(false));
            handles.clear();
            return null;
        });
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Job workers still running at shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Job scheduler stopped");
    }

    // =========================================================================
    // Timer plumbing
    // =========================================================================

    private String effectiveExpression(ScheduledJob job) {
        String expression = job.getCronExpression();
        if ((expression == null || expression.isBlank()) && job.getTimeFormat() == TimeFormat.HUMAN) {
            // documents written without the derived expression
            try {
                expression = TimeExpressionTranslator.translate(job.getHumanTime()).expression();
            } catch (InvalidScheduleException e) {
                log.warn("Job \"{}\" has an invalid schedule: {}", job.getName(), e.getMessage());
                return null;
            }
        }
        if (expression == null || expression.isBlank()) {
            return null;
        }
        if (!CronSchedules.isValid(expression)) {
            log.warn("Job \"{}\" has an invalid expression: {}", job.getName(), expression);
            return null;
        }
        return expression;
    }

    /** Caller holds the repository lock. */
    private Optional<ZonedDateTime> schedule(String name, String expression, ZonedDateTime after) {
        Optional<ZonedDateTime> next = CronSchedules.next(expression, after);
        if (next.isEmpty()) {
            log.warn("Job \"{}\" ({}) has no future fire time; not armed", name, expression);
            return Optional.empty();
        }
        ZonedDateTime fireAt = next.get();
        long generation = generations.incrementAndGet();
        long delayMs = Math.max(0, Duration.between(ZonedDateTime.now(clock), fireAt).toMillis());
        ScheduledFuture<?> future = timer.schedule(() -> hand(name, generation, expression, fireAt),
                delayMs, TimeUnit.MILLISECONDS);
        handles.put(name, new TimerHandle(name, expression, generation, fireAt, future));
        log.info("Armed job \"{}\" ({}), next run {} ({})", name, expression, fireAt,
                RelativeTime.describe(fireAt.toInstant(), clock.instant()));
        return Optional.of(fireAt);
    }

    /** Runs on the timer thread; the firing itself goes to the worker pool. */
    private void hand(String name, long generation, String expression, ZonedDateTime fireAt) {
        try {
            workers.execute(() -> fire(name, generation, expression, fireAt));
        } catch (RejectedExecutionException e) {
            log.warn("Job \"{}\" not fired: scheduler is shutting down", name);
        }
    }

    private void fire(String name, long generation, String expression, ZonedDateTime fireAt) {
        if (!isCurrent(name, generation)) {
            return;
        }
        try {
            Optional<ScheduledJob> job = repository.find(name);
            if (job.isEmpty() || !job.get().isEnabled()) {
                log.debug("Job \"{}\" no longer active at fire time", name);
                // dropping the handle makes the rearm below a no-op
                repository.locked(() -> isCurrent(name, generation) && handles.remove(name) != null);
                return;
            }
            ExecutionRecord record = engine.execute(job.get(), Trigger.SCHEDULED);
            log.info("Job \"{}\" finished: {} in {}ms", name, record.getOutcome(), record.getDurationMs());
        } catch (RuntimeException e) {
            // store unreadable or engine failure; the timer keeps running
            log.error("Job \"{}\" firing failed: {}", name, e.getMessage(), e);
        } finally {
            rearm(name, generation, expression, fireAt);
        }
    }

    private void rearm(String name, long generation, String expression, ZonedDateTime firedAt) {
        repository.locked(() -> {
            if (!isCurrent(name, generation)) {
                // disarmed, replaced or disabled while firing
                return null;
            }
            ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
            Optional<ZonedDateTime> candidate = CronSchedules.next(expression, firedAt);
            ZonedDateTime after = candidate.isPresent() && candidate.get().isAfter(now) ? firedAt : now;
            handles.remove(name);
            schedule(name, expression, after);
            return null;
        });
    }

    private boolean isCurrent(String name, long generation) {
        TimerHandle handle = handles.get(name);
        return handle != null && handle.generation() == generation;
    }
}

package io.shiftwatch.internal;

import io.shiftwatch.JobHandler;
import io.shiftwatch.JobScheduler;
import io.shiftwatch.config.ShiftWatchProperties;
import io.shiftwatch.core.DuplicateJobException;
import io.shiftwatch.core.JobHandlerRegistry;
import io.shiftwatch.core.JobNotFoundException;
import io.shiftwatch.core.JobState;
import io.shiftwatch.core.MonitorJob;
import io.shiftwatch.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process job scheduler backed by a durable {@link JobStore}.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Interval and calendar triggers, evaluated in the clock's zone</li>
 *   <li>At most {@code maxInstances} concurrent firings per job; one extra firing is coalesced</li>
 *   <li>Misfire grace: a firing later than {@code misfireGraceTime} is skipped</li>
 *   <li>Job state and next run time persisted so a restart resumes the schedule</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 * scheduler.addJob(MonitorJob.active("line_a_counter", IntervalTrigger.every(15, IntervalUnit.MINUTES),
 *         FunctionKind.CUMULATIVE, params));
 * scheduler.pauseJob("line_a_counter");
 * scheduler.stop();
 * }</pre>
 */
public class PooledJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(PooledJobScheduler.class);

    private static final Comparator<MonitorJob> BY_NEXT_RUN = Comparator
            .comparing(MonitorJob::nextRunAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(MonitorJob::name);

    private final ShiftWatchProperties props;
    private final JobStore jobStore;
    private final JobHandlerRegistry handlerRegistry;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    private volatile ExecutorService workerPool;
    private Thread dispatcherThread;

    private final DelayQueue<DelayedFiring> queue = new DelayQueue<>();
    private final ConcurrentHashMap<String, JobEntry> entries = new ConcurrentHashMap<>();

    private final class DelayedFiring implements Delayed {
        private final String name;
        private final JobEntry entry;
        private final long generation;
        private final Instant scheduledAt;

        private DelayedFiring(String name, JobEntry entry, long generation, Instant scheduledAt) {
            this.name = name;
            this.entry = entry;
            this.generation = generation;
            this.scheduledAt = scheduledAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(nowInstant(), scheduledAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedFiring o) {
                return this.scheduledAt.compareTo(o.scheduledAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    /**
     * Runtime state of one registered job. {@code generation} changes whenever queued firings
     * must be discarded (pause, resume, removal, stop). A firing only runs against the entry it
     * was queued for, so a job re-created under the same name starts a fresh firing chain.
     */
    private static final class JobEntry {
        private volatile MonitorJob job;
        private final Semaphore running;
        private final AtomicBoolean pending = new AtomicBoolean(false);
        private final AtomicLong generation = new AtomicLong();

        private JobEntry(MonitorJob job, int maxInstances) {
            this.job = job;
            this.running = new Semaphore(maxInstances);
        }
    }

    public PooledJobScheduler(ShiftWatchProperties props, JobStore jobStore, JobHandlerRegistry handlerRegistry, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxWorkers() <= 0) {
            throw new IllegalArgumentException("shiftwatch.maxWorkers must be a positive number");
        }
        if (props.getMaxInstances() <= 0) {
            throw new IllegalArgumentException("shiftwatch.maxInstances must be a positive number");
        }
        Duration grace = Objects.requireNonNull(props.getMisfireGraceTime(), "shiftwatch.misfireGraceTime must not be null");
        if (grace.isNegative()) {
            throw new IllegalArgumentException("shiftwatch.misfireGraceTime must not be negative");
        }
    }

    /**
     * Load persisted jobs and start dispatching. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("shiftwatch scheduler starting maxWorkers={} maxInstances={} misfireGraceTime={} zone={}",
                props.getMaxWorkers(),
                props.getMaxInstances(),
                props.getMisfireGraceTime(),
                zone());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxWorkers(), r -> {
                Thread t = new Thread(r);
                t.setName("shiftwatch.worker");
                t.setDaemon(true);
                return t;
            });
        }

        rehydrate();

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("shiftwatch.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }
        log.info("shiftwatch scheduler started jobs={}", entries.size());
    }

    /**
     * Stop dispatching; in-flight firings get {@code shutdownTimeout} to finish. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("shiftwatch scheduler stopping...");

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("shiftwatch in-flight firings did not finish within {}", props.getShutdownTimeout());
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        for (JobEntry entry : entries.values()) {
            synchronized (entry) {
                entry.generation.incrementAndGet();
                entry.pending.set(false);
            }
        }
        queue.clear();
        log.info("shiftwatch scheduler stopped");
    }

    @Override
    public MonitorJob addJob(MonitorJob job) {
        Objects.requireNonNull(job, "job must not be null");

        JobEntry entry = new JobEntry(job, props.getMaxInstances());
        if (entries.putIfAbsent(job.name(), entry) != null) {
            throw new DuplicateJobException(job.name());
        }

        MonitorJob scheduled = job.isPaused()
                ? job.withSchedule(JobState.PAUSED, null)
                : job.withSchedule(JobState.ACTIVE, job.trigger().nextFireTime(null, nowInstant(), zone()));
        try {
            jobStore.insert(scheduled);
        } catch (RuntimeException e) {
            entries.remove(job.name(), entry);
            throw e;
        }

        entry.job = scheduled;
        if (started.get()) {
            enqueue(entry);
        }
        log.info("shiftwatch job added name={} kind={} nextRunAt={}", scheduled.name(), scheduled.kind(), scheduled.nextRunAt());
        return scheduled;
    }

    @Override
    public void removeJob(String name) {
        JobEntry entry = entries.remove(name);
        if (entry == null) {
            throw new JobNotFoundException(name);
        }
        synchronized (entry) {
            entry.generation.incrementAndGet();
            entry.pending.set(false);
        }
        jobStore.deleteByName(name);
        log.info("shiftwatch job removed name={}", name);
    }

    @Override
    public MonitorJob pauseJob(String name) {
        JobEntry entry = requireEntry(name);
        synchronized (entry) {
            if (!entry.job.isPaused()) {
                entry.generation.incrementAndGet();
                entry.pending.set(false);
                entry.job = entry.job.withSchedule(JobState.PAUSED, null);
                jobStore.updateSchedule(name, JobState.PAUSED, null);
                log.info("shiftwatch job paused name={}", name);
            }
            return entry.job;
        }
    }

    @Override
    public MonitorJob resumeJob(String name) {
        JobEntry entry = requireEntry(name);
        synchronized (entry) {
            if (entry.job.isPaused()) {
                Instant next = entry.job.trigger().nextFireTime(null, nowInstant(), zone());
                entry.generation.incrementAndGet();
                entry.job = entry.job.withSchedule(JobState.ACTIVE, next);
                jobStore.updateSchedule(name, JobState.ACTIVE, next);
                if (started.get()) {
                    enqueue(entry);
                }
                log.info("shiftwatch job resumed name={} nextRunAt={}", name, next);
            }
            return entry.job;
        }
    }

    @Override
    public Optional<MonitorJob> getJob(String name) {
        JobEntry entry = entries.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.job);
    }

    @Override
    public boolean jobExists(String name) {
        return entries.containsKey(name);
    }

    @Override
    public List<MonitorJob> listJobs() {
        return entries.values().stream()
                .map(e -> e.job)
                .sorted(BY_NEXT_RUN)
                .toList();
    }

    @Override
    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("shiftwatch scheduler paused");
        }
    }

    @Override
    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("shiftwatch scheduler resumed");
        }
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    private ZoneId zone() {
        return clock.getZone();
    }

    private JobEntry requireEntry(String name) {
        JobEntry entry = entries.get(name);
        if (entry == null) {
            throw new JobNotFoundException(name);
        }
        return entry;
    }

    private void rehydrate() {
        for (MonitorJob stored : jobStore.findAll()) {
            entries.putIfAbsent(stored.name(), new JobEntry(stored, props.getMaxInstances()));
        }

        for (JobEntry entry : entries.values()) {
            synchronized (entry) {
                MonitorJob job = entry.job;
                if (!job.isPaused() && job.nextRunAt() == null) {
                    Instant next = job.trigger().nextFireTime(null, nowInstant(), zone());
                    entry.job = job.withSchedule(JobState.ACTIVE, next);
                    persistSchedule(entry.job);
                }
                enqueue(entry);
            }
        }
    }

    private void enqueue(JobEntry entry) {
        MonitorJob job = entry.job;
        if (job.isPaused() || job.nextRunAt() == null) {
            return;
        }
        queue.offer(new DelayedFiring(job.name(), entry, entry.generation.get(), job.nextRunAt()));
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                dispatch(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("shiftwatch dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void dispatch(DelayedFiring firing) {
        JobEntry entry = firing.entry;
        if (entries.get(firing.name) != entry) {
            return;
        }

        Instant now = nowInstant();
        MonitorJob job;
        synchronized (entry) {
            if (!started.get() || entry.generation.get() != firing.generation || entry.job.isPaused()) {
                return;
            }
            job = entry.job;
            Instant next = job.trigger().nextFireTime(firing.scheduledAt, now, zone());
            entry.job = job.withSchedule(JobState.ACTIVE, next);
            if (next != null) {
                queue.offer(new DelayedFiring(job.name(), entry, firing.generation, next));
            }
        }
        persistSchedule(entry.job);

        if (paused.get()) {
            log.debug("shiftwatch scheduler paused, firing skipped name={} scheduledAt={}", job.name(), firing.scheduledAt);
            return;
        }

        Duration lateness = Duration.between(firing.scheduledAt, now);
        if (lateness.compareTo(props.getMisfireGraceTime()) > 0) {
            log.warn("shiftwatch firing misfired name={} scheduledAt={} late={}", job.name(), firing.scheduledAt, lateness);
            return;
        }

        submit(entry, job);
    }

    private void submit(JobEntry entry, MonitorJob job) {
        if (!entry.running.tryAcquire()) {
            if (entry.pending.compareAndSet(false, true)) {
                log.debug("shiftwatch firing coalesced name={}", job.name());
            } else {
                log.debug("shiftwatch firing dropped, one already pending name={}", job.name());
            }
            return;
        }

        ExecutorService pool = workerPool;
        try {
            if (pool == null) {
                throw new RejectedExecutionException("worker pool is shut down");
            }
            pool.execute(() -> runFiring(entry, job));
        } catch (RejectedExecutionException e) {
            entry.running.release();
            log.debug("shiftwatch firing not submitted, scheduler stopping name={}", job.name());
        }
    }

    private void runFiring(JobEntry entry, MonitorJob job) {
        try {
            execute(job);
        } finally {
            entry.running.release();
        }

        if (entry.pending.compareAndSet(true, false)
                && started.get()
                && entries.get(job.name()) == entry
                && !entry.job.isPaused()) {
            submit(entry, entry.job);
        }
    }

    private void execute(MonitorJob job) {
        String name = job.name();
        try {
            JobHandler handler = handlerRegistry.getRequired(job.kind());
            log.debug("shiftwatch job started name={} at={}", name, nowInstant());
            handler.execute(job);
            log.debug("shiftwatch job succeeded name={} at={}", name, nowInstant());
        } catch (Exception e) {
            log.error("shiftwatch job failed name={} msg={}", name, e.getMessage(), e);
        }
    }

    private void persistSchedule(MonitorJob job) {
        try {
            jobStore.updateSchedule(job.name(), job.state(), job.nextRunAt());
        } catch (RuntimeException e) {
            log.error("shiftwatch schedule update failed name={} msg={}", job.name(), e.getMessage(), e);
        }
    }
}

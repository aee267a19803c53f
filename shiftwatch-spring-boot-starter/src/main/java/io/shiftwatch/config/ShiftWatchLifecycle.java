package io.shiftwatch.config;

import io.shiftwatch.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the job scheduler once the context is refreshed and stops it on shutdown.
 */
public class ShiftWatchLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ShiftWatchLifecycle.class);

    // started last, stopped first
    static final int PHASE = Integer.MAX_VALUE;

    private final JobScheduler scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ShiftWatchLifecycle(JobScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            scheduler.start();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            scheduler.stop();
            log.info("shiftwatch stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}

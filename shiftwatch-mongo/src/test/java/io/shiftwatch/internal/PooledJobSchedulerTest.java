package io.shiftwatch.internal;

import io.shiftwatch.JobHandler;
import io.shiftwatch.config.ShiftWatchProperties;
import io.shiftwatch.core.DuplicateJobException;
import io.shiftwatch.core.FunctionKind;
import io.shiftwatch.core.IntervalTrigger;
import io.shiftwatch.core.IntervalUnit;
import io.shiftwatch.core.JobHandlerRegistry;
import io.shiftwatch.core.JobNotFoundException;
import io.shiftwatch.core.JobState;
import io.shiftwatch.core.MonitorJob;
import io.shiftwatch.core.SensorRef;
import io.shiftwatch.core.SensorType;
import io.shiftwatch.core.SimpleParameters;
import io.shiftwatch.support.InMemoryJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PooledJobSchedulerTest {

    private InMemoryJobStore jobStore;
    private RecordingHandler handler;
    private PooledJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        handler = new RecordingHandler();
        scheduler = new PooledJobScheduler(defaultProps(), jobStore, new JobHandlerRegistry(List.of(handler)),
                Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        handler.release.countDown();
        scheduler.stop();
    }

    @Test
    void firingBeyondGraceTimeShouldBeSkipped() throws Exception {
        Instant twoHoursAgo = Instant.now().minus(Duration.ofHours(2));
        jobStore.insert(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.MINUTES))
                .withSchedule(JobState.ACTIVE, twoHoursAgo));

        scheduler.start();

        boolean rescheduled = waitUntil(5, TimeUnit.SECONDS, () -> jobStore.findByName("line_a_counter")
                .map(j -> j.nextRunAt().isAfter(Instant.now()))
                .orElse(false));

        assertTrue(rescheduled);
        Thread.sleep(200);
        assertEquals(0, handler.calls.get());
    }

    @Test
    void lateFiringWithinGraceTimeShouldRun() throws Exception {
        Instant tenMinutesAgo = Instant.now().minus(Duration.ofMinutes(10));
        jobStore.insert(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.HOURS))
                .withSchedule(JobState.ACTIVE, tenMinutesAgo));

        scheduler.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.calls.get() == 1));
        assertTrue(scheduler.getJob("line_a_counter").orElseThrow().nextRunAt().isAfter(Instant.now()));
    }

    @Test
    void failingFiringShouldStayScheduled() throws Exception {
        handler.fail = true;
        scheduler.start();
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.SECONDS)));

        assertTrue(waitUntil(8, TimeUnit.SECONDS, () -> handler.calls.get() >= 2));
        assertTrue(scheduler.jobExists("line_a_counter"));
        assertNotNull(jobStore.findByName("line_a_counter").orElseThrow().nextRunAt());
    }

    @Test
    void duplicateNameShouldBeRejected() {
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.MINUTES)));

        assertThrows(DuplicateJobException.class,
                () -> scheduler.addJob(job("line_a_counter", IntervalTrigger.every(5, IntervalUnit.MINUTES))));
        assertEquals(1, jobStore.findAll().size());
    }

    @Test
    void pauseAndResumeShouldPersistState() {
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.MINUTES)));
        scheduler.addJob(job("line_b_temp", IntervalTrigger.every(5, IntervalUnit.MINUTES)));

        MonitorJob paused = scheduler.pauseJob("line_a_counter");

        assertEquals(JobState.PAUSED, paused.state());
        assertNull(jobStore.findByName("line_a_counter").orElseThrow().nextRunAt());
        assertEquals(List.of("line_b_temp", "line_a_counter"),
                scheduler.listJobs().stream().map(MonitorJob::name).toList());

        MonitorJob resumed = scheduler.resumeJob("line_a_counter");

        assertEquals(JobState.ACTIVE, resumed.state());
        assertNotNull(jobStore.findByName("line_a_counter").orElseThrow().nextRunAt());
        assertEquals("line_a_counter", scheduler.listJobs().get(0).name());
    }

    @Test
    void pausedJobShouldNotFire() throws Exception {
        scheduler.start();
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.SECONDS)));
        scheduler.pauseJob("line_a_counter");

        Thread.sleep(2500);

        assertEquals(0, handler.calls.get());
    }

    @Test
    void schedulerWidePauseShouldSkipFiringsUntilResumed() throws Exception {
        scheduler.start();
        scheduler.pause();
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.SECONDS)));

        Thread.sleep(2500);
        assertEquals(0, handler.calls.get());

        scheduler.resume();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.calls.get() >= 1));
    }

    @Test
    void overlappingFiringsShouldBeCappedAndCoalesced() throws Exception {
        handler.block = true;
        scheduler.start();
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.SECONDS)));

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.calls.get() == 2));
        Thread.sleep(2500);
        assertEquals(2, handler.calls.get());
        assertEquals(2, handler.maxConcurrent.get());

        handler.block = false;
        handler.release.countDown();

        // the coalesced firing runs once a slot frees up
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.calls.get() >= 3));
    }

    @Test
    void removeShouldDeleteJobAndReportUnknownNames() {
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.MINUTES)));

        scheduler.removeJob("line_a_counter");

        assertTrue(jobStore.findAll().isEmpty());
        assertThrows(JobNotFoundException.class, () -> scheduler.removeJob("line_a_counter"));
        assertThrows(JobNotFoundException.class, () -> scheduler.pauseJob("line_a_counter"));
        assertThrows(JobNotFoundException.class, () -> scheduler.resumeJob("line_a_counter"));
    }

    @Test
    void shouldFireRecreatedJobOncePerInterval() throws Exception {
        scheduler.start();
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.SECONDS)));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.calls.get() >= 1));

        scheduler.removeJob("line_a_counter");
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.SECONDS)));
        handler.calls.set(0);

        Thread.sleep(3500);

        // one chain fires about 3 times here, a leftover chain would double it
        int calls = handler.calls.get();
        assertTrue(calls >= 2 && calls <= 4, "calls=" + calls);
    }

    @Test
    void shouldFireOncePerIntervalAfterRestart() throws Exception {
        scheduler.start();
        scheduler.addJob(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.SECONDS)));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.calls.get() >= 1));

        scheduler.stop();
        scheduler.start();
        handler.calls.set(0);

        Thread.sleep(3500);

        int calls = handler.calls.get();
        assertTrue(calls >= 2 && calls <= 4, "calls=" + calls);
    }

    @Test
    void startShouldRehydratePersistedJobs() {
        jobStore.insert(job("line_a_counter", IntervalTrigger.every(1, IntervalUnit.MINUTES)));
        jobStore.insert(job("line_b_temp", IntervalTrigger.every(1, IntervalUnit.MINUTES))
                .withSchedule(JobState.PAUSED, null));

        scheduler.start();

        assertTrue(scheduler.jobExists("line_a_counter"));
        assertNotNull(scheduler.getJob("line_a_counter").orElseThrow().nextRunAt());
        assertTrue(scheduler.getJob("line_b_temp").orElseThrow().isPaused());
    }

    private static MonitorJob job(String name, IntervalTrigger trigger) {
        SimpleParameters params = new SimpleParameters(name, "Test job",
                List.of(SensorRef.of(SensorType.OPC, "s1")), false, false, false, null);
        return MonitorJob.active(name, trigger, FunctionKind.SIMPLE, params);
    }

    private static ShiftWatchProperties defaultProps() {
        ShiftWatchProperties props = new ShiftWatchProperties();
        props.setMaxWorkers(4);
        props.setMaxInstances(2);
        props.setMisfireGraceTime(Duration.ofSeconds(3600));
        props.setShutdownTimeout(Duration.ofSeconds(2));
        return props;
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }

    static class RecordingHandler implements JobHandler {
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger maxConcurrent = new AtomicInteger();
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean fail;
        volatile boolean block;

        @Override
        public FunctionKind kind() {
            return FunctionKind.SIMPLE;
        }

        @Override
        public void execute(MonitorJob job) throws Exception {
            calls.incrementAndGet();
            maxConcurrent.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                if (block) {
                    release.await(10, TimeUnit.SECONDS);
                }
                if (fail) {
                    throw new IllegalStateException("simulated failure");
                }
            } finally {
                running.decrementAndGet();
            }
        }
    }
}

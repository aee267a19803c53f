package io.shiftwatch.idle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-job count of consecutive firings that produced no new information.
 *
 * <p>The alert fires exactly when the count reaches {@link #THRESHOLD} and not again until an
 * accepted sample resets it. Updates for one job name are atomic; different names never contend.
 */
public class IdleFaultDetector {
    private static final Logger log = LoggerFactory.getLogger(IdleFaultDetector.class);

    public static final int THRESHOLD = 3;

    private final ConcurrentHashMap<String, Integer> counters = new ConcurrentHashMap<>();

    /**
     * Count one idle cycle.
     *
     * @param fault whether a sensor failed this cycle
     * @return the alert to deliver, only on the cycle that reaches the threshold
     */
    public Optional<IdleAlert> recordIdle(String jobName, boolean fault) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        int count = counters.merge(jobName, 1, Integer::sum);
        if (count != THRESHOLD) {
            log.debug("shiftwatch idle cycle name={} count={} fault={}", jobName, count, fault);
            return Optional.empty();
        }

        if (fault) {
            log.warn("shiftwatch job in fault state name={}", jobName);
        } else {
            log.warn("shiftwatch job idle name={}", jobName);
        }
        return Optional.of(new IdleAlert(jobName, count, fault));
    }

    /**
     * Clear the counter after an accepted sample.
     */
    public void reset(String jobName) {
        if (counters.remove(jobName) != null) {
            log.info("shiftwatch idle counter reset name={}", jobName);
        }
    }

    /**
     * Drop the entry of a deleted job.
     */
    public void evict(String jobName) {
        counters.remove(jobName);
    }

    public int count(String jobName) {
        return counters.getOrDefault(jobName, 0);
    }
}

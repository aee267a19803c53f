package io.shiftwatch.store;

import io.shiftwatch.core.SampleRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only production series, one per key. An append is atomic: it either stores the whole
 * record or nothing.
 */
public interface TimeSeriesStore {

    /**
     * Create the series if missing. Idempotent.
     */
    void createSeries(String key);

    boolean seriesExists(String key);

    void append(String key, SampleRecord record);

    /**
     * The record {@code skip} positions before the most recent one ({@code skip = 0} is the latest).
     */
    Optional<SampleRecord> last(String key, int skip);

    default Optional<SampleRecord> last(String key) {
        return last(key, 0);
    }

    /**
     * Records with {@code from <= timestamp <= to}, oldest first, at most {@code limit}.
     */
    List<SampleRecord> query(String key, Instant from, Instant to, int limit);

    /**
     * Drop the series if present. Idempotent.
     */
    void dropSeries(String key);
}

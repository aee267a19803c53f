package io.shiftwatch.core;

import java.time.Instant;

/**
 * One immutable entry of a job's production series.
 */
public interface SampleRecord {

    Instant timestamp();
}

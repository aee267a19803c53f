package io.shiftwatch.core;

import java.util.List;

/**
 * Typed arguments handed to a job handler on every firing.
 *
 * <p>Built and validated once, when the job is created. Implementations are plain records so
 * that stores can convert them to and from documents.
 */
public interface JobParameters {

    /**
     * Series the firing writes into (the job name, or {@code <name>_shift_report} for report children).
     */
    String seriesKey();

    String description();

    List<SensorRef> sensors();

    boolean tgSend();

    boolean shiftReport();

    String chat();
}

package io.shiftwatch;

import io.shiftwatch.core.FunctionKind;
import io.shiftwatch.core.MonitorJob;

/**
 * Executes one firing of every job of a given {@link FunctionKind}.
 */
public interface JobHandler {

    FunctionKind kind();

    void execute(MonitorJob job) throws Exception;
}

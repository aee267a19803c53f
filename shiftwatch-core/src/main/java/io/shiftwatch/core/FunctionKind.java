package io.shiftwatch.core;

/**
 * Selects the firing handler of a job.
 */
public enum FunctionKind {
    /**
     * Snapshot of one or more sensor values, stored as-is.
     */
    SIMPLE(SimpleParameters.class),
    /**
     * Monotonic counter; the stored metric is the increment since the previous sample.
     */
    CUMULATIVE(CumulativeParameters.class);

    private final Class<? extends JobParameters> parametersType;

    FunctionKind(Class<? extends JobParameters> parametersType) {
        this.parametersType = parametersType;
    }

    public Class<? extends JobParameters> parametersType() {
        return parametersType;
    }
}

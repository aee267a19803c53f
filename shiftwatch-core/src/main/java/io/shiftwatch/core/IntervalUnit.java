package io.shiftwatch.core;

import java.time.Duration;

public enum IntervalUnit {
    SECONDS,
    MINUTES,
    HOURS,
    DAYS,
    WEEKS;

    public Duration toDuration(long count) {
        return switch (this) {
            case SECONDS -> Duration.ofSeconds(count);
            case MINUTES -> Duration.ofMinutes(count);
            case HOURS -> Duration.ofHours(count);
            case DAYS -> Duration.ofDays(count);
            case WEEKS -> Duration.ofDays(7L * count);
        };
    }
}

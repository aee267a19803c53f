package io.shiftwatch.core;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fires every {@code count} {@code unit}s, anchored on the previous scheduled time.
 */
public record IntervalTrigger(IntervalUnit unit, int count) implements Trigger {

    public static IntervalTrigger every(int count, IntervalUnit unit) {
        return new IntervalTrigger(unit, count);
    }

    public Duration interval() {
        return unit.toDuration(count);
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now, ZoneId zone) {
        Objects.requireNonNull(now, "now must not be null");
        Duration step = interval();
        if (previousFireTime == null) {
            return now.plus(step);
        }

        Instant next = previousFireTime.plus(step);
        if (next.isAfter(now)) {
            return next;
        }

        long behindMillis = Duration.between(previousFireTime, now).toMillis();
        long skipped = behindMillis / step.toMillis() + 1;
        return previousFireTime.plus(step.multipliedBy(skipped));
    }

    @Override
    public List<String> violations() {
        List<String> problems = new ArrayList<>(2);
        if (unit == null) {
            problems.add("interval unit must be set");
        }
        if (count <= 0) {
            problems.add("interval must be a positive number");
        }
        return problems;
    }
}

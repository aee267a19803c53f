package io.shiftwatch.core;

import io.shiftwatch.utils.CronSchedule;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Calendar trigger. Every field accepts a literal, {@code *}, a step {@code *&#47;n}, a range
 * {@code a-b} or a comma separated list of those; {@code null} means {@code *}.
 *
 * <p>{@code dayOfWeek} counts from 0 (Monday) to 6 (Sunday) and also accepts {@code mon..sun};
 * {@code week} is the ISO week of the year.
 */
public record CronTrigger(
        String day,
        String week,
        String dayOfWeek,
        String hour,
        String minute,
        String second
) implements Trigger {

    /**
     * Daily trigger at the given wall-clock time.
     */
    public static CronTrigger daily(int hour, int minute, int second) {
        return new CronTrigger(null, null, null,
                String.valueOf(hour), String.valueOf(minute), String.valueOf(second));
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now, ZoneId zone) {
        Objects.requireNonNull(now, "now must not be null");
        Instant base = previousFireTime != null && previousFireTime.isAfter(now) ? previousFireTime : now;
        return CronSchedule.compile(this, zone).nextAfter(base);
    }

    @Override
    public List<String> violations() {
        return CronSchedule.violations(this);
    }
}

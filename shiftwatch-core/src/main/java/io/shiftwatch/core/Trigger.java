package io.shiftwatch.core;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * When a job fires.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IntervalTrigger.class, name = "interval"),
        @JsonSubTypes.Type(value = CronTrigger.class, name = "cron")
})
public interface Trigger {

    /**
     * Computes the next fire time strictly after {@code now}.
     *
     * <p>Ticks that fell between {@code previousFireTime} and {@code now} are skipped, so a late
     * dispatcher never produces a burst of catch-up firings.
     *
     * @param previousFireTime last scheduled fire time, or {@code null} for a fresh schedule
     * @param now              current instant
     * @param zone             zone used for calendar based triggers
     * @return next fire time, or {@code null} if the trigger will never fire again
     */
    Instant nextFireTime(Instant previousFireTime, Instant now, ZoneId zone);

    /**
     * Returns human readable problems with this trigger; empty when it is valid.
     */
    List<String> violations();
}

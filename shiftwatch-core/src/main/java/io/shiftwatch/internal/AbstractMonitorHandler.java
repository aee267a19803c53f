package io.shiftwatch.internal;

import io.shiftwatch.JobHandler;
import io.shiftwatch.core.DeliveryException;
import io.shiftwatch.core.JobParameters;
import io.shiftwatch.idle.IdleAlert;
import io.shiftwatch.idle.IdleFaultDetector;
import io.shiftwatch.notify.Notifier;
import io.shiftwatch.report.MessageFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Shared idle handling and best-effort delivery of the firing handlers.
 */
abstract class AbstractMonitorHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(AbstractMonitorHandler.class);

    protected final IdleFaultDetector idleDetector;
    protected final MessageFormatter formatter;
    protected final Notifier notifier;

    protected AbstractMonitorHandler(IdleFaultDetector idleDetector, MessageFormatter formatter, Notifier notifier) {
        this.idleDetector = Objects.requireNonNull(idleDetector, "idleDetector must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
    }

    /**
     * Count a cycle without new information and deliver the alert when the threshold is reached.
     */
    protected void onIdle(String jobName, JobParameters params, boolean fault) {
        Optional<IdleAlert> alert = idleDetector.recordIdle(jobName, fault);
        if (alert.isPresent() && params.tgSend()) {
            String text = formatter.idleMessage(params.description(), alert.get());
            deliver(jobName, () -> notifier.send(params.chat(), text));
        }
    }

    /**
     * Delivery failures are logged and dropped; the sample is already stored.
     */
    protected void deliver(String jobName, Runnable delivery) {
        try {
            delivery.run();
        } catch (DeliveryException e) {
            log.warn("shiftwatch delivery dropped name={} msg={}", jobName, e.getMessage());
        }
    }
}

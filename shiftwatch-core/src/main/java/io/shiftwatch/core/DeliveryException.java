package io.shiftwatch.core;

/**
 * A notification could not be delivered after the notifier's own retries.
 */
public class DeliveryException extends ShiftWatchException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.shiftwatch.core;

/**
 * Base type of every error raised by the monitoring engine.
 */
public class ShiftWatchException extends RuntimeException {

    public ShiftWatchException(String message) {
        super(message);
    }

    public ShiftWatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

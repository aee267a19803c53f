package io.shiftwatch.core;

/**
 * The job store or the time-series store failed.
 */
public class StorageException extends ShiftWatchException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

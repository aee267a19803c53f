package io.shiftwatch.core;

import java.util.List;

/**
 * A job definition was rejected before scheduling.
 */
public class InvalidJobException extends ShiftWatchException {

    private final List<String> violations;

    public InvalidJobException(List<String> violations) {
        super("Invalid job definition: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}

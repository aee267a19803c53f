package io.shiftwatch.shift;

public enum Shift {
    DAY("Day ☀"),
    NIGHT("Night ☾");

    private final String label;

    Shift(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

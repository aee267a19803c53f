package io.shiftwatch.core;

public enum JobState {
    ACTIVE,
    PAUSED
}

package com.bookwatch.monitor.model;

public enum AlertOutcome {
    DELIVERED,
    BELOW_THRESHOLD,
    CHANNEL_FILTERED,
    RATE_LIMITED,
    COOLDOWN,
    FAILED;

    /** Qualifying alert that was held back; the change itself is still persisted. */
    public boolean isSuppressed() {
        return this == RATE_LIMITED || this == COOLDOWN;
    }
}

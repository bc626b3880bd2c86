package com.bookwatch.monitor.model;

/**
 * Stages of one detection run. FAILED is reachable from any stage.
 */
public enum RunState {
    IDLE,
    LOADING,
    DETECTING,
    PERSISTING,
    ALERTING,
    REPORTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean isActive() {
        return this != IDLE && !isTerminal();
    }
}

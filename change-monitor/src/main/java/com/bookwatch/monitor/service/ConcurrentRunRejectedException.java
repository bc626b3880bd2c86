package com.bookwatch.monitor.service;

import com.bookwatch.monitor.model.RunState;

public class ConcurrentRunRejectedException extends RuntimeException {

    private final RunState activeState;

    public ConcurrentRunRejectedException(RunState activeState) {
        super("A detection run is already in progress (state " + activeState + ")");
        this.activeState = activeState;
    }

    public RunState getActiveState() {
        return activeState;
    }
}

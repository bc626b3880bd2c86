package com.bookwatch.monitor.service;

import java.util.List;

/**
 * Invalid monitor configuration. Raised at orchestrator startup, before any run begins.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("Invalid change-monitor configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}

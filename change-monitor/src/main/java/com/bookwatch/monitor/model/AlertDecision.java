package com.bookwatch.monitor.model;

import java.time.Instant;

/**
 * Result of routing one change to one channel. Channel is "*" for decisions taken before
 * any channel was considered (severity threshold, cooldown).
 */
public record AlertDecision(String changeId, String channel, AlertOutcome outcome, String detail, Instant decidedAt) {

    public static final String ANY_CHANNEL = "*";
}

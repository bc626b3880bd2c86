package com.bookwatch.monitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A single detected difference between two observations of the same item.
 * Written once to change_logs and never updated.
 */
@Value
@Builder
@Jacksonized
public class Change {

    public static final double EXACT_CONFIDENCE = 1.0;

    String changeId;
    String runId;
    String itemId;
    String sourceUrl;

    ChangeType changeType;
    Severity severity;

    /** Null when the item is new or the previous raw value could not be recovered. */
    String oldValue;
    String newValue;
    String fieldName;

    String humanSummary;
    Instant detectedAt;

    /** 1.0 for exact evidence, lower for hash-only evidence. */
    double confidenceScore;
}

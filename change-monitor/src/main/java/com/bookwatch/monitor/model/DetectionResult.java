package com.bookwatch.monitor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of one orchestration run. Built once the run ends and persisted as-is.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DetectionResult {

    String runId;
    Instant runTimestamp;

    int totalChecked;
    int changesDetected;
    int newItems;
    int updatedItems;
    int removedItems;

    double durationSeconds;
    double averageItemProcessingTime;

    @Singular("changeTypeCount")
    Map<ChangeType, Integer> changesByType;

    @Singular("severityCount")
    Map<Severity, Integer> changesBySeverity;

    boolean success;
    boolean cancelled;

    /** Stage the run ended in: DONE or FAILED. */
    RunState finalState;

    @Singular
    List<String> errors;
}

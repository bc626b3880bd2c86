package com.bookwatch.monitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Per-day aggregate of detection runs and their changes.
 * The report date is the storage key; regenerating a day replaces the stored report.
 */
@Value
@Builder
@Jacksonized
public class DailyReport {

    String reportId;
    LocalDate reportDate;
    Instant generatedAt;

    int runsAggregated;
    long totalItemsInSystem;
    int itemsChecked;
    int changesDetected;
    int newItems;
    int updatedItems;
    int removedItems;

    Map<ChangeType, Integer> changesByType;
    Map<Severity, Integer> changesBySeverity;

    double systemHealthScore;
    double detectionDurationSeconds;
    double averageItemProcessingTime;

    List<String> errorsEncountered;

    /** Changes of medium severity and above, newest first. */
    List<Change> significantChanges;

    public static String reportIdFor(LocalDate date) {
        return "report-" + date;
    }
}

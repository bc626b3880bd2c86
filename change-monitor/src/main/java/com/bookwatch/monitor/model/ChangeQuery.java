package com.bookwatch.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filters for browsing change_logs. Null fields do not filter.
 */
@Value
@Builder
public class ChangeQuery {

    String itemId;
    ChangeType changeType;
    Severity minSeverity;
    Instant detectedFrom;
    Instant detectedTo;

    public static ChangeQuery all() {
        return ChangeQuery.builder().build();
    }
}

package com.bookwatch.monitor.service;

import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.DetectionResult;
import com.bookwatch.monitor.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one detection pass produced, before it is committed.
 *
 * @param checked    items taken from the catalog batch, including ones that failed
 * @param cancelled  true when the pass stopped at a chunk boundary
 */
public record DetectionBatch(int checked, List<ItemDetection> detections, List<Change> removals,
                             List<String> errors, boolean cancelled) {

    public List<Change> allChanges() {
        List<Change> all = new ArrayList<>();
        detections.forEach(d -> all.addAll(d.changes()));
        all.addAll(removals);
        return all;
    }

    /** Counters and breakdowns of this batch; timing and final state are left to the caller. */
    public DetectionResult.DetectionResultBuilder summarize(String runId, Instant runTimestamp) {
        List<Change> all = allChanges();

        Map<ChangeType, Integer> byType = new EnumMap<>(ChangeType.class);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Change c : all) {
            byType.merge(c.getChangeType(), 1, Integer::sum);
            bySeverity.merge(c.getSeverity(), 1, Integer::sum);
        }

        int newItems = 0;
        int updatedItems = 0;
        for (ItemDetection d : detections) {
            if (d.changes().isEmpty()) continue;
            if (d.changes().get(0).getChangeType() == ChangeType.NEW_ITEM) {
                newItems++;
            } else {
                updatedItems++;
            }
        }

        return DetectionResult.builder()
                .runId(runId)
                .runTimestamp(runTimestamp)
                .totalChecked(checked)
                .changesDetected(all.size())
                .newItems(newItems)
                .updatedItems(updatedItems)
                .removedItems(removals.size())
                .changesByType(byType)
                .changesBySeverity(bySeverity)
                .errors(errors)
                .cancelled(cancelled);
    }
}

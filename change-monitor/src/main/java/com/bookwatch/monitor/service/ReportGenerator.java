package com.bookwatch.monitor.service;

import com.bookwatch.monitor.alert.AlertManager;
import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.DailyReport;
import com.bookwatch.monitor.model.DetectionResult;
import com.bookwatch.monitor.model.Severity;
import com.bookwatch.monitor.output.ChangeLogStore;
import com.bookwatch.monitor.output.DailyReportStore;
import com.bookwatch.monitor.output.DetectionResultStore;
import com.bookwatch.monitor.output.FingerprintStore;
import com.bookwatch.monitor.output.ReportOutputRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolls detection results and their changes into one report per calendar day.
 *
 * Generating a report for a date overwrites the stored report for that date. Generation and
 * retention cleanup share one lock, so cleanup never runs against a report being written.
 */
@Service
@Slf4j
public class ReportGenerator {

    private final FingerprintStore fingerprintStore;
    private final ChangeLogStore changeLogStore;
    private final DetectionResultStore resultStore;
    private final DailyReportStore reportStore;
    private final ReportOutputRouter outputRouter;
    private final AlertManager alertManager;
    private final MonitorProperties properties;
    private final Clock clock;

    private final ReentrantLock reportLock = new ReentrantLock();

    public ReportGenerator(FingerprintStore fingerprintStore,
                           ChangeLogStore changeLogStore,
                           DetectionResultStore resultStore,
                           DailyReportStore reportStore,
                           ReportOutputRouter outputRouter,
                           AlertManager alertManager,
                           MonitorProperties properties,
                           Clock clock) {
        this.fingerprintStore = fingerprintStore;
        this.changeLogStore = changeLogStore;
        this.resultStore = resultStore;
        this.reportStore = reportStore;
        this.outputRouter = outputRouter;
        this.alertManager = alertManager;
        this.properties = properties;
        this.clock = clock;
    }

    public DailyReport generate(DetectionResult result, List<Change> changes, LocalDate reportDate) {
        return generate(List.of(result), changes, reportDate);
    }

    public DailyReport generate(List<DetectionResult> results, List<Change> changes, LocalDate reportDate) {
        reportLock.lock();
        try {
            DailyReport report = aggregate(results, changes, reportDate, fingerprintStore.count());
            reportStore.upsert(report);

            if (properties.getReporting().isEnabled()) {
                try {
                    List<Path> files = outputRouter.export(report);
                    log.debug("Report {} exported to {}", report.getReportId(), files);
                } catch (RuntimeException e) {
                    log.error("Export of report {} failed, stored copy is still available: {}",
                            report.getReportId(), e.getMessage(), e);
                }
            }

            alertManager.publishDailySummary(report);
            log.info("Generated report {}: {} runs, {} changes, health {}", report.getReportId(),
                    report.getRunsAggregated(), report.getChangesDetected(),
                    String.format("%.2f", report.getSystemHealthScore()));
            return report;
        } finally {
            reportLock.unlock();
        }
    }

    /** Rebuilds a day's report from the stored detection results and change log. */
    public DailyReport generateForDate(LocalDate reportDate) {
        List<DetectionResult> results = resultStore.findByRunDate(reportDate);
        List<Change> changes = changeLogStore.findDetectedOn(reportDate);
        log.info("Regenerating report for {} from {} runs and {} changes", reportDate, results.size(), changes.size());
        return generate(results, changes, reportDate);
    }

    public Optional<DailyReport> find(LocalDate reportDate) {
        return reportStore.find(reportDate);
    }

    public List<DailyReport> history(int days) {
        return reportStore.history(today(), days);
    }

    /**
     * Deletes stored reports and export files older than the retention horizon.
     *
     * @return number of stored reports deleted
     */
    public int cleanupOldReports() {
        LocalDate cutoff = today().minusDays(properties.getReporting().getRetentionDays());
        reportLock.lock();
        try {
            int deleted = reportStore.deleteOlderThan(cutoff);
            int files = outputRouter.purgeExportsBefore(cutoff);
            log.info("Report cleanup: {} reports and {} files older than {} removed", deleted, files, cutoff);
            return deleted;
        } finally {
            reportLock.unlock();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    DailyReport aggregate(List<DetectionResult> results, List<Change> changes, LocalDate reportDate, long itemsInSystem) {
        int checked = 0;
        int newItems = 0;
        int updated = 0;
        int removed = 0;
        double duration = 0;
        List<String> errors = new ArrayList<>();

        for (DetectionResult r : results) {
            checked += r.getTotalChecked();
            newItems += r.getNewItems();
            updated += r.getUpdatedItems();
            removed += r.getRemovedItems();
            duration += r.getDurationSeconds();
            errors.addAll(r.getErrors());
        }

        Map<ChangeType, Integer> byType = new EnumMap<>(ChangeType.class);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Change c : changes) {
            byType.merge(c.getChangeType(), 1, Integer::sum);
            bySeverity.merge(c.getSeverity(), 1, Integer::sum);
        }

        List<Change> significant = changes.stream()
                .filter(c -> c.getSeverity().isAtLeast(Severity.MEDIUM))
                .sorted(Comparator.comparing(Change::getDetectedAt).reversed().thenComparing(Change::getChangeId))
                .toList();

        int severe = bySeverity.getOrDefault(Severity.HIGH, 0) + bySeverity.getOrDefault(Severity.CRITICAL, 0);

        return DailyReport.builder()
                .reportId(DailyReport.reportIdFor(reportDate))
                .reportDate(reportDate)
                .generatedAt(clock.instant())
                .runsAggregated(results.size())
                .totalItemsInSystem(itemsInSystem)
                .itemsChecked(checked)
                .changesDetected(changes.size())
                .newItems(newItems)
                .updatedItems(updated)
                .removedItems(removed)
                .changesByType(byType)
                .changesBySeverity(bySeverity)
                .systemHealthScore(healthScore(checked, errors.size(), severe, removed))
                .detectionDurationSeconds(duration)
                .averageItemProcessingTime(checked > 0 ? duration / checked : 0.0)
                .errorsEncountered(errors)
                .significantChanges(significant)
                .build();
    }

    /**
     * 1 minus the weighted error, severe-change and removal rates, clamped to [0, 1].
     * A day with nothing checked scores 0.
     */
    double healthScore(int checked, int errors, int severeChanges, int removed) {
        if (checked <= 0) return 0.0;

        MonitorProperties.Reporting.Health weights = properties.getReporting().getHealth();
        double penalty = weights.getErrorRateWeight() * rate(errors, checked)
                + weights.getSevereChangeWeight() * rate(severeChanges, checked)
                + weights.getRemovalRateWeight() * rate(removed, checked);
        return clamp(1.0 - penalty);
    }

    private static double rate(int count, int checked) {
        return clamp((double) count / checked);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}

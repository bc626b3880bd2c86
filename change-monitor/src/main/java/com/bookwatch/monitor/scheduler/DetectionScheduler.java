package com.bookwatch.monitor.scheduler;

import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.output.MonitorSchema;
import com.bookwatch.monitor.service.ConcurrentRunRejectedException;
import com.bookwatch.monitor.service.DetectionOrchestrator;
import com.bookwatch.monitor.service.ReportGenerator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup detection runs.
 *
 * Default schedule: every day at 14:30 UTC, report cleanup at 01:00 UTC.
 *
 * Override with change-monitor.scheduling.cron / cleanup-cron / zone.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DetectionScheduler {

    private final DetectionOrchestrator orchestrator;
    private final ReportGenerator reportGenerator;
    private final MonitorSchema schema;
    private final MonitorProperties properties;

    /**
     * On application startup:
     *  1. Ensure the monitor tables exist
     *  2. Start the orchestrator; invalid configuration aborts startup here
     *  3. Optionally trigger a run if run-on-startup=true
     */
    @PostConstruct
    public void onStartup() {
        schema.ensureSchema();
        orchestrator.start();

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, triggering detection run");
            triggerRun();
        } else {
            log.info("Change monitor ready. Next scheduled run: {} ({})",
                    properties.getScheduling().getCron(), properties.getScheduling().getZone());
        }
    }

    @Scheduled(cron = "${change-monitor.scheduling.cron:0 30 14 * * *}",
               zone = "${change-monitor.scheduling.zone:UTC}")
    public void scheduledRun() {
        log.info("Scheduled detection run triggered");
        triggerRun();
    }

    @Scheduled(cron = "${change-monitor.scheduling.cleanup-cron:0 0 1 * * *}",
               zone = "${change-monitor.scheduling.zone:UTC}")
    public void scheduledCleanup() {
        try {
            reportGenerator.cleanupOldReports();
        } catch (Exception e) {
            log.error("Report cleanup failed: {}", e.getMessage(), e);
        }
    }

    private void triggerRun() {
        try {
            orchestrator.trigger();
        } catch (ConcurrentRunRejectedException e) {
            log.warn("Skipping scheduled run: {}", e.getMessage());
        }
    }
}

package com.bookwatch.monitor.output;

import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.model.DailyReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Routes report exports to the configured file format(s).
 * Supports JSON, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportOutputRouter {

    private final ReportExporter exporter;
    private final MonitorProperties properties;

    public List<Path> export(DailyReport report) {
        Path outputDir = outputDir();
        List<Path> written = new ArrayList<>();

        switch (properties.getReporting().getExportFormat()) {
            case JSON -> written.add(exporter.exportJson(report, outputDir));
            case CSV -> written.add(exporter.exportCsv(report, outputDir));
            case BOTH -> {
                written.add(exporter.exportJson(report, outputDir));
                written.add(exporter.exportCsv(report, outputDir));
            }
        }
        return written;
    }

    public int purgeExportsBefore(LocalDate cutoff) {
        int deleted = exporter.deleteExportsBefore(outputDir(), cutoff);
        if (deleted > 0) {
            log.info("Deleted {} export files older than {}", deleted, cutoff);
        }
        return deleted;
    }

    private Path outputDir() {
        return Paths.get(properties.getReporting().getOutputDir());
    }
}

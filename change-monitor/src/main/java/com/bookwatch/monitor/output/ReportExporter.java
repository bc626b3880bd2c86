package com.bookwatch.monitor.output;

import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.DailyReport;
import com.bookwatch.monitor.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes daily reports to files.
 *
 * Output path pattern: {outputDir}/daily_report_{yyyyMMdd}.{json|csv}
 * e.g. ./reports/daily_report_20240115.csv
 *
 * Files are written to a temp file in the same directory and moved into place, so a
 * reader never sees a half-written report.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReportExporter {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Pattern EXPORT_FILE = Pattern.compile("daily_report_(\\d{8})\\.(json|csv)");

    private static final String[] SUMMARY_HEADERS = {
            "report_id", "report_date", "generated_at",
            "total_items_in_system", "items_checked", "changes_detected",
            "new_items", "updated_items", "removed_items",
            "runs_aggregated", "detection_duration_seconds", "average_item_processing_time",
            "system_health_score"
    };

    private static final String[] CHANGE_HEADERS = {
            "significant_changes", "item_id", "change_type", "severity", "field_name",
            "old_value", "new_value", "summary", "detected_at"
    };

    private final ObjectMapper objectMapper;

    public Path exportJson(DailyReport report, Path outputDir) {
        return writeAtomically(outputDir, fileName(report.getReportDate(), "json"), writer -> writer.write(renderJson(report)));
    }

    public Path exportCsv(DailyReport report, Path outputDir) {
        return writeAtomically(outputDir, fileName(report.getReportDate(), "csv"), writer -> writeCsv(report, writer));
    }

    public String renderJson(DailyReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise report " + report.getReportId(), e);
        }
    }

    public String renderCsv(DailyReport report) {
        StringWriter out = new StringWriter();
        try {
            writeCsv(report, out);
        } catch (IOException e) {
            throw new IllegalStateException("Could not render CSV for report " + report.getReportId(), e);
        }
        return out.toString();
    }

    /**
     * Deletes export files whose report date is before the cutoff.
     *
     * @return number of files deleted
     */
    public int deleteExportsBefore(Path outputDir, LocalDate cutoff) {
        if (!Files.isDirectory(outputDir)) return 0;

        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(outputDir, "daily_report_*")) {
            for (Path file : files) {
                LocalDate reportDate = reportDateOf(file);
                if (reportDate != null && reportDate.isBefore(cutoff) && Files.deleteIfExists(file)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot clean export directory: " + outputDir, e);
        }
        return deleted;
    }

    public static String fileName(LocalDate reportDate, String extension) {
        return "daily_report_" + FILE_DATE.format(reportDate) + "." + extension;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void writeCsv(DailyReport report, Writer out) throws IOException {
        CSVWriter writer = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);

        writer.writeNext(SUMMARY_HEADERS);
        writer.writeNext(new String[]{
                report.getReportId(),
                str(report.getReportDate()),
                str(report.getGeneratedAt()),
                str(report.getTotalItemsInSystem()),
                str(report.getItemsChecked()),
                str(report.getChangesDetected()),
                str(report.getNewItems()),
                str(report.getUpdatedItems()),
                str(report.getRemovedItems()),
                str(report.getRunsAggregated()),
                str(report.getDetectionDurationSeconds()),
                str(report.getAverageItemProcessingTime()),
                str(report.getSystemHealthScore())
        });

        writer.writeNext(new String[0]);
        writer.writeNext(new String[]{"changes_by_type"});
        for (Map.Entry<ChangeType, Integer> e : report.getChangesByType().entrySet()) {
            writer.writeNext(new String[]{e.getKey().label(), str(e.getValue())});
        }

        writer.writeNext(new String[0]);
        writer.writeNext(new String[]{"changes_by_severity"});
        for (Map.Entry<Severity, Integer> e : report.getChangesBySeverity().entrySet()) {
            writer.writeNext(new String[]{e.getKey().label(), str(e.getValue())});
        }

        if (!report.getSignificantChanges().isEmpty()) {
            writer.writeNext(new String[0]);
            writer.writeNext(CHANGE_HEADERS);
            for (Change c : report.getSignificantChanges()) {
                writer.writeNext(new String[]{
                        "",
                        c.getItemId(),
                        c.getChangeType().label(),
                        c.getSeverity().label(),
                        str(c.getFieldName()),
                        str(c.getOldValue()),
                        str(c.getNewValue()),
                        c.getHumanSummary(),
                        str(c.getDetectedAt())
                });
            }
        }
        writer.flush();
    }

    private Path writeAtomically(Path outputDir, String fileName, WriterAction action) {
        ensureDirectory(outputDir);
        Path target = outputDir.resolve(fileName);
        Path temp = null;
        try {
            temp = Files.createTempFile(outputDir, fileName, ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                action.write(writer);
            }
            move(temp, target);
            log.info("Exported report file: {}", target);
            return target;
        } catch (IOException e) {
            log.error("Failed to export report file {}: {}", target, e.getMessage(), e);
            deleteQuietly(temp);
            throw new IllegalStateException("Report export failed: " + target, e);
        }
    }

    private void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, falling back to replace", target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private LocalDate reportDateOf(Path file) {
        Matcher m = EXPORT_FILE.matcher(file.getFileName().toString());
        if (!m.matches()) return null;
        try {
            return LocalDate.parse(m.group(1), FILE_DATE);
        } catch (DateTimeParseException e) {
            log.debug("Skipping {}: {}", file, e.getMessage());
            return null;
        }
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create output directory: " + dir, e);
        }
    }

    @FunctionalInterface
    private interface WriterAction {
        void write(Writer writer) throws IOException;
    }
}

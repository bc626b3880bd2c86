package com.bookwatch.monitor.output;

import com.bookwatch.monitor.TestSupport;
import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.DailyReport;
import com.bookwatch.monitor.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ReportExporterTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    private final ObjectMapper objectMapper = TestSupport.objectMapper();
    private final ReportExporter exporter = new ReportExporter(objectMapper);

    @TempDir
    Path dir;

    @Test
    void jsonExportReadsBackAsSameReport() throws Exception {
        DailyReport report = report(List.of(significantChange()));

        Path file = exporter.exportJson(report, dir.resolve("reports"));

        assertThat(file.getFileName().toString()).isEqualTo("daily_report_20240115.json");
        DailyReport read = objectMapper.readValue(Files.readString(file), DailyReport.class);
        assertThat(read).usingRecursiveComparison().isEqualTo(report);
        try (Stream<Path> files = Files.list(dir.resolve("reports"))) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void csvExportHasSummaryBreakdownsAndSignificantChanges() throws Exception {
        Path file = exporter.exportCsv(report(List.of(significantChange())), dir);

        List<String[]> rows;
        try (CSVReader reader = new CSVReader(new StringReader(Files.readString(file)))) {
            rows = reader.readAll();
        }

        assertThat(file.getFileName().toString()).isEqualTo("daily_report_20240115.csv");
        assertThat(rows.get(0)[0]).isEqualTo("report_id");
        assertThat(rows.get(1)).startsWith("report-2024-01-15", "2024-01-15");
        assertThat(rows).anySatisfy(r -> assertThat(r).containsExactly("changes_by_type"));
        assertThat(rows).anySatisfy(r -> assertThat(r).containsExactly("price_change", "2"));
        assertThat(rows).anySatisfy(r -> assertThat(r).containsExactly("high", "1"));
        assertThat(rows).anySatisfy(r -> assertThat(r[0]).isEqualTo("significant_changes"));
        assertThat(rows.get(rows.size() - 1)).contains("book_a", "availability_change", "high",
                "In stock (22 available)", "Out of stock");
    }

    @Test
    void csvWithoutSignificantChangesOmitsChangeSection() {
        String csv = exporter.renderCsv(report(List.of()));

        assertThat(csv).contains("changes_by_severity").doesNotContain("significant_changes");
    }

    @Test
    void reExportReplacesExistingFile() throws Exception {
        exporter.exportJson(report(List.of(significantChange())), dir);
        Path file = exporter.exportJson(report(List.of()), dir);

        DailyReport read = objectMapper.readValue(Files.readString(file), DailyReport.class);
        assertThat(read.getSignificantChanges()).isEmpty();
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void deletesOnlyExportsOlderThanCutoff() throws Exception {
        Files.writeString(dir.resolve("daily_report_20240101.json"), "{}");
        Files.writeString(dir.resolve("daily_report_20240101.csv"), "");
        Files.writeString(dir.resolve("daily_report_20240115.json"), "{}");
        Files.writeString(dir.resolve("daily_report_notes.txt"), "keep");
        Files.writeString(dir.resolve("other.json"), "{}");

        int deleted = exporter.deleteExportsBefore(dir, LocalDate.of(2024, 1, 10));

        assertThat(deleted).isEqualTo(2);
        assertThat(dir.resolve("daily_report_20240115.json")).exists();
        assertThat(dir.resolve("daily_report_notes.txt")).exists();
        assertThat(dir.resolve("other.json")).exists();
        assertThat(dir.resolve("daily_report_20240101.json")).doesNotExist();
    }

    @Test
    void missingDirectoryHasNothingToDelete() {
        assertThat(exporter.deleteExportsBefore(dir.resolve("absent"), DATE)).isZero();
    }

    static DailyReport report(List<Change> significant) {
        Map<ChangeType, Integer> byType = new LinkedHashMap<>();
        byType.put(ChangeType.PRICE_CHANGE, 2);
        byType.put(ChangeType.AVAILABILITY_CHANGE, 1);
        Map<Severity, Integer> bySeverity = new LinkedHashMap<>();
        bySeverity.put(Severity.MEDIUM, 2);
        bySeverity.put(Severity.HIGH, 1);

        return DailyReport.builder()
                .reportId(DailyReport.reportIdFor(DATE))
                .reportDate(DATE)
                .generatedAt(Instant.parse("2024-01-15T15:00:00Z"))
                .runsAggregated(1)
                .totalItemsInSystem(1000)
                .itemsChecked(1000)
                .changesDetected(3)
                .updatedItems(3)
                .changesByType(byType)
                .changesBySeverity(bySeverity)
                .systemHealthScore(0.99)
                .detectionDurationSeconds(10.0)
                .averageItemProcessingTime(0.01)
                .errorsEncountered(List.of())
                .significantChanges(significant)
                .build();
    }

    private static Change significantChange() {
        return Change.builder()
                .changeId("c-1")
                .runId("run-1")
                .itemId("book_a")
                .sourceUrl("https://books.toscrape.com/catalogue/a/index.html")
                .changeType(ChangeType.AVAILABILITY_CHANGE)
                .severity(Severity.HIGH)
                .fieldName("availability")
                .oldValue("In stock (22 available)")
                .newValue("Out of stock")
                .humanSummary("'A' went out of stock")
                .detectedAt(Instant.parse("2024-01-15T14:31:00Z"))
                .confidenceScore(1.0)
                .build();
    }
}

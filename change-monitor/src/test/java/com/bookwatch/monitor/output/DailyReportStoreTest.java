package com.bookwatch.monitor.output;

import com.bookwatch.monitor.TestSupport;
import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.DailyReport;
import com.bookwatch.monitor.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DailyReportStoreTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 31);

    private DailyReportStore store;

    @BeforeEach
    void setUp() {
        store = new DailyReportStore(TestSupport.h2WithSchema(), TestSupport.objectMapper());
    }

    @Test
    void storesAndReadsBackFullReport() {
        DailyReport report = report(TODAY, 5);

        store.upsert(report);

        DailyReport stored = store.find(TODAY).orElseThrow();
        assertThat(stored).usingRecursiveComparison().isEqualTo(report);
        assertThat(stored.getChangesBySeverity()).containsEntry(Severity.HIGH, 1);
        assertThat(stored.getSignificantChanges()).extracting(Change::getChangeType)
                .containsExactly(ChangeType.AVAILABILITY_CHANGE);
    }

    @Test
    void storingSameDateReplacesReport() {
        store.upsert(report(TODAY, 5));
        store.upsert(report(TODAY, 9));

        assertThat(store.find(TODAY).orElseThrow().getChangesDetected()).isEqualTo(9);
        assertThat(store.history(TODAY, 7)).hasSize(1);
    }

    @Test
    void historyCoversRequestedDaysNewestFirst() {
        for (int i = 0; i < 10; i++) {
            store.upsert(report(TODAY.minusDays(i), i));
        }

        List<DailyReport> week = store.history(TODAY, 7);

        assertThat(week).extracting(DailyReport::getReportDate)
                .containsExactly(TODAY, TODAY.minusDays(1), TODAY.minusDays(2), TODAY.minusDays(3),
                        TODAY.minusDays(4), TODAY.minusDays(5), TODAY.minusDays(6));
    }

    @Test
    void deletesReportsBeforeCutoff() {
        for (int i = 0; i < 5; i++) {
            store.upsert(report(TODAY.minusDays(i), i));
        }

        int deleted = store.deleteOlderThan(TODAY.minusDays(2));

        assertThat(deleted).isEqualTo(2);
        assertThat(store.find(TODAY.minusDays(3))).isEmpty();
        assertThat(store.find(TODAY.minusDays(2))).isPresent();
    }

    private static DailyReport report(LocalDate date, int changes) {
        Change significant = Change.builder()
                .changeId("c-" + date)
                .runId("run-1")
                .itemId("book_a")
                .sourceUrl("https://books.toscrape.com/catalogue/a/index.html")
                .changeType(ChangeType.AVAILABILITY_CHANGE)
                .severity(Severity.HIGH)
                .fieldName("availability")
                .oldValue("In stock (22 available)")
                .newValue("Out of stock")
                .humanSummary("Availability changed")
                .detectedAt(date.atTime(14, 31).toInstant(ZoneOffset.UTC))
                .confidenceScore(1.0)
                .build();

        return DailyReport.builder()
                .reportId(DailyReport.reportIdFor(date))
                .reportDate(date)
                .generatedAt(Instant.parse("2024-03-31T15:00:00Z"))
                .runsAggregated(1)
                .totalItemsInSystem(1000)
                .itemsChecked(1000)
                .changesDetected(changes)
                .newItems(0)
                .updatedItems(1)
                .removedItems(0)
                .changesByType(Map.of(ChangeType.AVAILABILITY_CHANGE, 1))
                .changesBySeverity(Map.of(Severity.HIGH, 1))
                .systemHealthScore(0.97)
                .detectionDurationSeconds(12.5)
                .averageItemProcessingTime(0.0125)
                .errorsEncountered(List.of())
                .significantChanges(List.of(significant))
                .build();
    }
}

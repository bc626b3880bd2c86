package com.bookwatch.monitor.config;

import com.bookwatch.monitor.TestSupport;
import com.bookwatch.monitor.model.ChangePage;
import com.bookwatch.monitor.model.ChangeQuery;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.DailyReport;
import com.bookwatch.monitor.model.FingerprintStats;
import com.bookwatch.monitor.model.RunState;
import com.bookwatch.monitor.model.Severity;
import com.bookwatch.monitor.output.ChangeLogStore;
import com.bookwatch.monitor.output.FingerprintStore;
import com.bookwatch.monitor.output.ReportExporter;
import com.bookwatch.monitor.service.ConcurrentRunRejectedException;
import com.bookwatch.monitor.service.DetectionOrchestrator;
import com.bookwatch.monitor.service.ReportGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class MonitorControllerTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    @Mock
    private DetectionOrchestrator orchestrator;

    @Mock
    private ChangeLogStore changeLogStore;

    @Mock
    private FingerprintStore fingerprintStore;

    @Mock
    private ReportGenerator reportGenerator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MonitorController controller = new MonitorController(orchestrator, changeLogStore, fingerprintStore,
                reportGenerator, new ReportExporter(TestSupport.objectMapper()));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setMessageConverters(new StringHttpMessageConverter(),
                        new MappingJackson2HttpMessageConverter(TestSupport.objectMapper()))
                .build();
    }

    @Test
    void triggerIsAccepted() throws Exception {
        when(orchestrator.trigger()).thenReturn(new CompletableFuture<>());

        mockMvc.perform(post("/monitor/runs"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"));
    }

    @Test
    void triggerDuringActiveRunIsConflict() throws Exception {
        when(orchestrator.trigger()).thenThrow(new ConcurrentRunRejectedException(RunState.DETECTING));

        mockMvc.perform(post("/monitor/runs"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.state").value("DETECTING"));
    }

    @Test
    void statusShowsCurrentStateWithoutPreviousRun() throws Exception {
        when(orchestrator.currentState()).thenReturn(RunState.IDLE);
        when(orchestrator.lastResult()).thenReturn(Optional.empty());

        mockMvc.perform(get("/monitor/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentRunState").value("IDLE"))
                .andExpect(jsonPath("$.lastResult").doesNotExist());
    }

    @Test
    void cancelReportsWhetherRequestWasTaken() throws Exception {
        when(orchestrator.cancel()).thenReturn(true);
        when(orchestrator.currentState()).thenReturn(RunState.DETECTING);

        mockMvc.perform(post("/monitor/runs/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelRequested").value(true));
    }

    @Test
    void changeFiltersAreParsed() throws Exception {
        when(changeLogStore.queryChanges(any(ChangeQuery.class), eq(1), eq(20)))
                .thenReturn(new ChangePage(List.of(), 1, 20, 0));

        mockMvc.perform(get("/monitor/changes")
                        .param("type", "PRICE_CHANGE")
                        .param("minSeverity", "HIGH")
                        .param("from", "2024-01-01T00:00:00Z")
                        .param("page", "1")
                        .param("size", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));

        ArgumentCaptor<ChangeQuery> captor = ArgumentCaptor.forClass(ChangeQuery.class);
        verify(changeLogStore).queryChanges(captor.capture(), eq(1), eq(20));
        assertThat(captor.getValue().getChangeType()).isEqualTo(ChangeType.PRICE_CHANGE);
        assertThat(captor.getValue().getMinSeverity()).isEqualTo(Severity.HIGH);
        assertThat(captor.getValue().getDetectedFrom()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(captor.getValue().getItemId()).isNull();
    }

    @Test
    void badChangeQueryIsRejected() throws Exception {
        mockMvc.perform(get("/monitor/changes").param("size", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/monitor/changes").param("minSeverity", "URGENT"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(changeLogStore);
    }

    @Test
    void missingReportIsNotFound() throws Exception {
        when(reportGenerator.find(DATE)).thenReturn(Optional.empty());

        mockMvc.perform(get("/monitor/reports/2024-01-15"))
                .andExpect(status().isNotFound());
    }

    @Test
    void reportHistoryDefaultsToSevenDays() throws Exception {
        when(reportGenerator.history(anyInt())).thenReturn(List.of(report()));

        mockMvc.perform(get("/monitor/reports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].reportDate").value("2024-01-15"));

        verify(reportGenerator).history(7);
    }

    @Test
    void csvExportIsAttachment() throws Exception {
        when(reportGenerator.find(DATE)).thenReturn(Optional.of(report()));

        mockMvc.perform(get("/monitor/reports/2024-01-15/export").param("format", "csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("daily_report_20240115.csv")))
                .andExpect(content().string(containsString("changes_by_severity")));
    }

    @Test
    void unknownExportFormatIsBadRequest() throws Exception {
        when(reportGenerator.find(DATE)).thenReturn(Optional.of(report()));

        mockMvc.perform(get("/monitor/reports/2024-01-15/export").param("format", "xml"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void regenerateReturnsFreshReport() throws Exception {
        when(reportGenerator.generateForDate(DATE)).thenReturn(report());

        mockMvc.perform(post("/monitor/reports/2024-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reportId").value("report-2024-01-15"));
    }

    @Test
    void unknownFingerprintIsNotFound() throws Exception {
        when(fingerprintStore.findBySourceUrl("https://example.com/x")).thenReturn(Optional.empty());

        mockMvc.perform(get("/monitor/fingerprints").param("url", "https://example.com/x"))
                .andExpect(status().isNotFound());
    }

    @Test
    void fingerprintStats() throws Exception {
        when(fingerprintStore.stats()).thenReturn(new FingerprintStats(10, 8, 2, null, null));

        mockMvc.perform(get("/monitor/fingerprints/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(2));
    }

    @Test
    void storeFailureIsServerError() throws Exception {
        when(fingerprintStore.stats()).thenThrow(new IllegalStateException("store down"));

        mockMvc.perform(get("/monitor/fingerprints/stats"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("store down"));
    }

    private static DailyReport report() {
        return DailyReport.builder()
                .reportId(DailyReport.reportIdFor(DATE))
                .reportDate(DATE)
                .generatedAt(Instant.parse("2024-01-15T15:00:00Z"))
                .changesByType(Map.of(ChangeType.PRICE_CHANGE, 1))
                .changesBySeverity(Map.of(Severity.MEDIUM, 1))
                .errorsEncountered(List.of())
                .significantChanges(List.of())
                .build();
    }
}

package com.bookwatch.monitor.config;

import com.bookwatch.monitor.model.ChangePage;
import com.bookwatch.monitor.model.ChangeQuery;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.DailyReport;
import com.bookwatch.monitor.model.DetectionResult;
import com.bookwatch.monitor.model.Fingerprint;
import com.bookwatch.monitor.model.FingerprintStats;
import com.bookwatch.monitor.model.Severity;
import com.bookwatch.monitor.output.ChangeLogStore;
import com.bookwatch.monitor.output.FingerprintStore;
import com.bookwatch.monitor.output.ReportExporter;
import com.bookwatch.monitor.service.ConcurrentRunRejectedException;
import com.bookwatch.monitor.service.DetectionOrchestrator;
import com.bookwatch.monitor.service.ReportGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class MonitorController {

    private final DetectionOrchestrator orchestrator;
    private final ChangeLogStore changeLogStore;
    private final FingerprintStore fingerprintStore;
    private final ReportGenerator reportGenerator;
    private final ReportExporter reportExporter;

    // ── Run control ───────────────────────────────────────────────────────────

    @PostMapping("/monitor/runs")
    public ResponseEntity<Map<String, String>> triggerRun() {
        try {
            orchestrator.trigger();
            return ResponseEntity.accepted().body(Map.of("status", "accepted"));
        } catch (ConcurrentRunRejectedException e) {
            log.warn("Manual trigger rejected: {}", e.getMessage());
            return ResponseEntity.status(409).body(Map.of(
                    "error", e.getMessage(),
                    "state", e.getActiveState().name()));
        }
    }

    @PostMapping("/monitor/runs/cancel")
    public ResponseEntity<Map<String, Object>> cancelRun() {
        boolean requested = orchestrator.cancel();
        return ResponseEntity.ok(Map.of(
                "cancelRequested", requested,
                "state", orchestrator.currentState().name()));
    }

    @GetMapping("/monitor/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "bookwatch-change-monitor");
        body.put("currentRunState", orchestrator.currentState().name());
        DetectionResult last = orchestrator.lastResult().orElse(null);
        body.put("lastResult", last);
        return ResponseEntity.ok(body);
    }

    // ── Change log ────────────────────────────────────────────────────────────

    /**
     * Browse detected changes, newest first.
     *
     * GET /monitor/changes?type=PRICE_CHANGE&minSeverity=HIGH&from=2024-01-01T00:00:00Z&page=0&size=50
     */
    @GetMapping("/monitor/changes")
    public ResponseEntity<?> changes(
            @RequestParam(required = false) String itemId,
            @RequestParam(required = false) ChangeType type,
            @RequestParam(required = false) Severity minSeverity,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        if (page < 0 || size < 1 || size > 500) {
            return ResponseEntity.badRequest().body(Map.of("error", "page must be >= 0 and size between 1 and 500"));
        }
        ChangeQuery query = ChangeQuery.builder()
                .itemId(itemId)
                .changeType(type)
                .minSeverity(minSeverity)
                .detectedFrom(from)
                .detectedTo(to)
                .build();
        ChangePage result = changeLogStore.queryChanges(query, page, size);
        return ResponseEntity.ok(result);
    }

    // ── Reports ───────────────────────────────────────────────────────────────

    @GetMapping("/monitor/reports")
    public ResponseEntity<List<DailyReport>> reportHistory(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(reportGenerator.history(days));
    }

    @GetMapping("/monitor/reports/{date}")
    public ResponseEntity<?> report(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return reportGenerator.find(date)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "No report for " + date)));
    }

    @PostMapping("/monitor/reports/{date}")
    public ResponseEntity<DailyReport> regenerateReport(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(reportGenerator.generateForDate(date));
    }

    /**
     * Download a stored report.
     *
     * GET /monitor/reports/2024-01-15/export?format=csv
     */
    @GetMapping("/monitor/reports/{date}/export")
    public ResponseEntity<?> exportReport(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "json") String format) {
        DailyReport report = reportGenerator.find(date).orElse(null);
        if (report == null) {
            return ResponseEntity.status(404).body(Map.of("error", "No report for " + date));
        }
        return switch (format.toLowerCase()) {
            case "json" -> download(reportExporter.renderJson(report), MediaType.APPLICATION_JSON,
                    ReportExporter.fileName(date, "json"));
            case "csv" -> download(reportExporter.renderCsv(report), MediaType.parseMediaType("text/csv"),
                    ReportExporter.fileName(date, "csv"));
            default -> ResponseEntity.badRequest().body(Map.of("error", "format must be json or csv"));
        };
    }

    // ── Fingerprints ──────────────────────────────────────────────────────────

    @GetMapping("/monitor/fingerprints")
    public ResponseEntity<?> fingerprint(@RequestParam String url) {
        Fingerprint fp = fingerprintStore.findBySourceUrl(url).orElse(null);
        if (fp == null) {
            return ResponseEntity.status(404).body(Map.of("error", "No fingerprint for " + url));
        }
        return ResponseEntity.ok(fp);
    }

    @GetMapping("/monitor/fingerprints/stats")
    public ResponseEntity<FingerprintStats> fingerprintStats() {
        return ResponseEntity.ok(fingerprintStore.stats());
    }

    // ── Error mapping ─────────────────────────────────────────────────────────

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> serverError(RuntimeException e) {
        log.error("Monitor request failed: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private ResponseEntity<?> download(String body, MediaType type, String fileName) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(type)
                .body(body);
    }
}

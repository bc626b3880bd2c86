package com.bookwatch.monitor.service;

import com.bookwatch.monitor.alert.AlertManager;
import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.DetectionResult;
import com.bookwatch.monitor.model.Item;
import com.bookwatch.monitor.model.RunState;
import com.bookwatch.monitor.output.ChangeLogStore;
import com.bookwatch.monitor.output.DetectionResultStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives detection runs through
 * IDLE -> LOADING -> DETECTING -> PERSISTING -> ALERTING -> REPORTING -> DONE,
 * or FAILED on an unrecoverable error or cancellation.
 *
 * At most one run is active. A trigger while a run is active is rejected, not queued.
 * Every run, including a failed one, ends with its DetectionResult persisted.
 */
@Service
@Slf4j
public class DetectionOrchestrator {

    private final CatalogItemSource catalogSource;
    private final ChangeDetector detector;
    private final AlertManager alertManager;
    private final ReportGenerator reportGenerator;
    private final DetectionResultStore resultStore;
    private final ChangeLogStore changeLogStore;
    private final MonitorProperties properties;
    private final Clock clock;

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicReference<DetectionResult> lastResult = new AtomicReference<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private volatile ExecutorService runner;

    public DetectionOrchestrator(CatalogItemSource catalogSource,
                                 ChangeDetector detector,
                                 AlertManager alertManager,
                                 ReportGenerator reportGenerator,
                                 DetectionResultStore resultStore,
                                 ChangeLogStore changeLogStore,
                                 MonitorProperties properties,
                                 Clock clock) {
        this.catalogSource = catalogSource;
        this.detector = detector;
        this.alertManager = alertManager;
        this.reportGenerator = reportGenerator;
        this.resultStore = resultStore;
        this.changeLogStore = changeLogStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Validates configuration and opens the orchestrator for runs.
     *
     * @throws ConfigurationException when any configured value is invalid; no run can start
     */
    public synchronized void start() {
        properties.validate();
        if (runner == null) {
            runner = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "detection-run");
                t.setDaemon(true);
                return t;
            });
        }
        if (lastResult.get() == null) {
            restoreLastResult();
        }
        log.info("Detection orchestrator started (concurrency {}, batch size {})",
                properties.getDetection().getConcurrency(), properties.getDetection().getBatchSize());
    }

    @PreDestroy
    public synchronized void stop() {
        cancel();
        ExecutorService current = runner;
        runner = null;
        if (current == null) return;

        current.shutdown();
        try {
            if (!current.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Detection run did not stop within 30s, interrupting");
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        }
        log.info("Detection orchestrator stopped");
    }

    /**
     * Starts a run in the background.
     *
     * @throws ConcurrentRunRejectedException when a run is already active
     */
    public CompletableFuture<DetectionResult> trigger() {
        ExecutorService current = requireStarted();
        claimRunSlot();
        String runId = UUID.randomUUID().toString();
        try {
            return CompletableFuture.supplyAsync(() -> execute(runId), current);
        } catch (RejectedExecutionException e) {
            state.set(RunState.FAILED);
            throw new IllegalStateException("Detection orchestrator is shutting down", e);
        }
    }

    /** Runs detection on the calling thread. Same rules as {@link #trigger()}. */
    public DetectionResult runNow() {
        requireStarted();
        claimRunSlot();
        return execute(UUID.randomUUID().toString());
    }

    /**
     * Requests cooperative cancellation of the active run. Takes effect at the next chunk boundary.
     *
     * @return false when no run is active
     */
    public boolean cancel() {
        RunState current = state.get();
        if (!current.isActive()) return false;
        cancelRequested.set(true);
        log.warn("Cancellation requested for run in state {}", current);
        return true;
    }

    public RunState currentState() {
        return state.get();
    }

    public Optional<DetectionResult> lastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ExecutorService requireStarted() {
        ExecutorService current = runner;
        if (current == null) {
            throw new IllegalStateException("Detection orchestrator is not started");
        }
        return current;
    }

    private void restoreLastResult() {
        try {
            resultStore.latest().ifPresent(previous -> {
                lastResult.compareAndSet(null, previous);
                log.info("Last recorded run {} ended {} at {}", previous.getRunId(), previous.getFinalState(),
                        previous.getRunTimestamp());
            });
        } catch (RuntimeException e) {
            log.warn("Could not load the last recorded run, status starts empty: {}", e.getMessage());
        }
    }

    private void claimRunSlot() {
        while (true) {
            RunState current = state.get();
            if (current.isActive()) {
                throw new ConcurrentRunRejectedException(current);
            }
            if (state.compareAndSet(current, RunState.LOADING)) break;
        }
        cancelRequested.set(false);
    }

    private DetectionResult execute(String runId) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        List<String> runErrors = new ArrayList<>();
        DetectionBatch batch = null;

        log.info("Detection run {} started", runId);
        try {
            List<Item> items = catalogSource.fetchCurrentItemBatch();

            transition(RunState.DETECTING);
            batch = detector.detectBatch(runId, items, cancelRequested::get);

            transition(RunState.PERSISTING);
            runErrors.addAll(detector.commit(batch));

            if (batch.cancelled()) {
                runErrors.add("run cancelled after " + batch.checked() + " of " + items.size() + " items");
                return finish(runId, startedAt, startNanos, batch, runErrors, RunState.FAILED);
            }

            transition(RunState.ALERTING);
            try {
                alertManager.process(batch.allChanges());
            } catch (RuntimeException e) {
                log.error("Alerting failed for run {}: {}", runId, e.getMessage(), e);
                runErrors.add("alerting failed: " + e.getMessage());
            }

            transition(RunState.REPORTING);
            if (properties.getReporting().isEnabled()) {
                report(runId, startedAt, startNanos, batch, runErrors);
            }

            return finish(runId, startedAt, startNanos, batch, runErrors, RunState.DONE);

        } catch (RuntimeException e) {
            log.error("Detection run {} failed in state {}: {}", runId, state.get(), e.getMessage(), e);
            runErrors.add("run failed in " + state.get() + ": " + e.getMessage());
            return finish(runId, startedAt, startNanos, batch, runErrors, RunState.FAILED);
        }
    }

    private void report(String runId, Instant startedAt, long startNanos, DetectionBatch batch, List<String> runErrors) {
        // Reported under the UTC day the run started, the day its result is filed under.
        LocalDate runDay = LocalDate.ofInstant(startedAt, ZoneOffset.UTC);
        try {
            List<DetectionResult> results = new ArrayList<>(resultStore.findByRunDate(runDay));
            results.add(buildResult(runId, startedAt, startNanos, batch, runErrors, RunState.DONE));
            List<Change> changes = changeLogStore.findDetectedOn(runDay);
            reportGenerator.generate(results, changes, runDay);
        } catch (RuntimeException e) {
            log.error("Report generation failed for run {}: {}", runId, e.getMessage(), e);
            runErrors.add("report generation failed: " + e.getMessage());
        }
    }

    private DetectionResult finish(String runId, Instant startedAt, long startNanos, DetectionBatch batch,
                                   List<String> runErrors, RunState finalState) {
        DetectionResult result = buildResult(runId, startedAt, startNanos, batch, runErrors, finalState);
        try {
            resultStore.persist(result);
        } catch (RuntimeException e) {
            log.error("Could not persist result of run {}: {}", runId, e.getMessage(), e);
        }
        lastResult.set(result);
        state.set(finalState);

        log.info("Detection run {} {}: checked={} changes={} new={} updated={} removed={} errors={} in {}s",
                runId, finalState, result.getTotalChecked(), result.getChangesDetected(), result.getNewItems(),
                result.getUpdatedItems(), result.getRemovedItems(), result.getErrors().size(),
                String.format("%.2f", result.getDurationSeconds()));
        return result;
    }

    private DetectionResult buildResult(String runId, Instant startedAt, long startNanos, DetectionBatch batch,
                                        List<String> runErrors, RunState finalState) {
        double duration = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        DetectionResult.DetectionResultBuilder builder = batch != null
                ? batch.summarize(runId, startedAt)
                : DetectionResult.builder().runId(runId).runTimestamp(startedAt);

        DetectionResult draft = builder.errors(runErrors).build();
        return draft.toBuilder()
                .durationSeconds(duration)
                .averageItemProcessingTime(draft.getTotalChecked() > 0 ? duration / draft.getTotalChecked() : 0.0)
                .finalState(finalState)
                .success(finalState == RunState.DONE && draft.getErrors().isEmpty())
                .build();
    }

    private void transition(RunState next) {
        RunState previous = state.getAndSet(next);
        log.info("Run state {} -> {}", previous, next);
    }
}

package com.bookwatch.monitor.service;

import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.Fingerprint;
import com.bookwatch.monitor.model.Item;
import com.bookwatch.monitor.model.Severity;
import com.bookwatch.monitor.output.ChangeLogStore;
import com.bookwatch.monitor.output.FingerprintStore;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Compares freshly crawled items against their stored fingerprints and emits classified changes.
 *
 * A content hash mismatch yields one change per differing field group. The stored item
 * snapshot supplies the exact old and new values; without it the change is reported as
 * hash-only evidence with reduced confidence.
 *
 * Batch detection runs items on the detection worker pool in chunks of
 * {@code detection.batch-size}. Cancellation is honoured between chunks only.
 */
@Service
@Slf4j
public class ChangeDetector {

    private final FingerprintEngine engine;
    private final FingerprintStore fingerprintStore;
    private final ChangeLogStore changeLogStore;
    private final ChangePolicy policy;
    private final Executor workerPool;
    private final Retry storeRetry;
    private final Clock clock;
    private final MonitorProperties properties;

    public ChangeDetector(FingerprintEngine engine,
                          FingerprintStore fingerprintStore,
                          ChangeLogStore changeLogStore,
                          ChangePolicy policy,
                          @Qualifier("detectionWorkerPool") Executor workerPool,
                          @Qualifier("monitorStoreRetry") Retry storeRetry,
                          Clock clock,
                          MonitorProperties properties) {
        this.engine = engine;
        this.fingerprintStore = fingerprintStore;
        this.changeLogStore = changeLogStore;
        this.policy = policy;
        this.workerPool = workerPool;
        this.storeRetry = storeRetry;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Classifies the differences between an observed item and its stored fingerprint.
     * Pure with respect to the stores.
     *
     * @param stored previous fingerprint, or null when the item has never been seen
     */
    public List<Change> detect(Item item, Fingerprint stored) {
        return inspect(null, item, stored).changes();
    }

    public DetectionBatch detectBatch(List<Item> items) {
        return detectBatch(UUID.randomUUID().toString(), items, () -> false);
    }

    /**
     * Runs detection over the full observed batch, then flags stored items that were not observed.
     * Per-item failures are collected as error entries and never abort the batch.
     */
    public DetectionBatch detectBatch(String runId, List<Item> items, BooleanSupplier cancelRequested) {
        int chunkSize = properties.getDetection().getBatchSize();
        Set<String> observedIds = ConcurrentHashMap.newKeySet();
        Queue<ItemDetection> detections = new ConcurrentLinkedQueue<>();
        Queue<String> errors = new ConcurrentLinkedQueue<>();

        int checked = 0;
        boolean cancelled = false;

        for (int from = 0; from < items.size(); from += chunkSize) {
            if (cancelRequested.getAsBoolean()) {
                log.warn("Run {} cancelled after {} of {} items", runId, checked, items.size());
                cancelled = true;
                break;
            }
            List<Item> chunk = items.subList(from, Math.min(from + chunkSize, items.size()));

            CompletableFuture<?>[] futures = chunk.stream()
                    .map(item -> CompletableFuture.runAsync(
                            () -> detectOne(runId, item, observedIds, detections, errors), workerPool))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(futures).join();

            checked += chunk.size();
            log.debug("Run {}: {}/{} items checked", runId, checked, items.size());
        }

        List<Change> removals = cancelled ? List.of() : detectRemovals(runId, observedIds, errors);

        DetectionBatch batch = new DetectionBatch(checked, new ArrayList<>(detections), removals,
                new ArrayList<>(errors), cancelled);
        log.info("Run {}: checked {} items, {} changes, {} removals, {} errors",
                runId, checked, batch.allChanges().size() - removals.size(), removals.size(), errors.size());
        return batch;
    }

    /**
     * Makes the batch durable: change records first, then fingerprints, so a fingerprint never
     * moves ahead of the changes that explain it.
     *
     * @return per-item errors from fingerprint writes; a failure to persist the change records propagates
     */
    public List<String> commit(DetectionBatch batch) {
        List<Change> changes = batch.allChanges();
        storeRetry.executeRunnable(() -> changeLogStore.persistChanges(changes));

        Queue<String> errors = new ConcurrentLinkedQueue<>();

        CompletableFuture<?>[] upserts = batch.detections().stream()
                .filter(ItemDetection::needsUpsert)
                .map(d -> CompletableFuture.runAsync(() -> upsertFingerprint(d, errors), workerPool))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(upserts).join();

        for (Change removal : batch.removals()) {
            try {
                storeRetry.executeRunnable(() -> fingerprintStore.markRemoved(removal.getItemId(), removal.getDetectedAt()));
            } catch (RuntimeException e) {
                log.error("Failed to mark {} removed: {}", removal.getItemId(), e.getMessage(), e);
                errors.add("mark removed " + removal.getItemId() + ": " + e.getMessage());
            }
        }

        log.info("Committed {} changes and {} fingerprints", changes.size(), upserts.length);
        return new ArrayList<>(errors);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void detectOne(String runId, Item item, Set<String> observedIds,
                           Queue<ItemDetection> detections, Queue<String> errors) {
        String label = item.getSourceUrl() == null ? "<missing source_url>" : item.getSourceUrl();
        try {
            String itemId = engine.itemIdFor(item.getSourceUrl());
            if (!observedIds.add(itemId)) {
                throw new DataIntegrityException("duplicate source_url in batch");
            }
            Fingerprint stored = storeRetry.executeSupplier(() -> fingerprintStore.find(itemId)).orElse(null);
            detections.add(inspect(runId, item, stored));

        } catch (DataIntegrityException e) {
            log.warn("Skipping invalid item {}: {}", label, e.getMessage());
            errors.add("invalid item " + label + ": " + e.getMessage());
        } catch (TransientStoreException e) {
            log.error("Store unavailable for {} after retries: {}", label, e.getMessage());
            errors.add("store unavailable for " + label + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Detection failed for {}: {}", label, e.getMessage(), e);
            errors.add("detection failed for " + label + ": " + e.getMessage());
        }
    }

    private List<Change> detectRemovals(String runId, Set<String> observedIds, Queue<String> errors) {
        Set<String> missing;
        try {
            missing = new TreeSet<>(storeRetry.executeSupplier(fingerprintStore::listActiveItemIds));
        } catch (RuntimeException e) {
            log.error("Could not list stored fingerprints, skipping removal detection: {}", e.getMessage(), e);
            errors.add("removal detection skipped: " + e.getMessage());
            return List.of();
        }
        missing.removeAll(observedIds);

        List<Change> removals = new ArrayList<>();
        for (String itemId : missing) {
            try {
                storeRetry.executeSupplier(() -> fingerprintStore.find(itemId))
                        .ifPresent(stored -> removals.add(removedChange(runId, stored)));
            } catch (RuntimeException e) {
                log.error("Could not load fingerprint {} for removal check: {}", itemId, e.getMessage());
                errors.add("removal check failed for " + itemId + ": " + e.getMessage());
            }
        }
        return removals;
    }

    private void upsertFingerprint(ItemDetection detection, Queue<String> errors) {
        try {
            storeRetry.executeRunnable(() -> fingerprintStore.upsert(detection.fingerprint()));
        } catch (RuntimeException e) {
            log.error("Failed to store fingerprint {}: {}", detection.itemId(), e.getMessage(), e);
            errors.add("fingerprint write failed for " + detection.itemId() + ": " + e.getMessage());
        }
    }

    ItemDetection inspect(String runId, Item item, Fingerprint stored) {
        validate(item);
        Fingerprint fresh = engine.computeFingerprint(item);
        Instant now = fresh.getUpdatedAt();

        if (stored == null) {
            Change added = Change.builder()
                    .changeId(UUID.randomUUID().toString())
                    .runId(runId)
                    .itemId(fresh.getItemId())
                    .sourceUrl(fresh.getSourceUrl())
                    .changeType(ChangeType.NEW_ITEM)
                    .severity(policy.newItemSeverity())
                    .newValue(item.getName())
                    .humanSummary("New item: '" + item.getName() + "'")
                    .detectedAt(now)
                    .confidenceScore(Change.EXACT_CONFIDENCE)
                    .build();
            return new ItemDetection(fresh.getItemId(), List.of(added), fresh, true);
        }

        if (stored.getContentHash().equals(fresh.getContentHash())) {
            // Unchanged; rewrite only to capture a missing snapshot or clear a removal marker.
            boolean refresh = stored.getSnapshot() == null || stored.isRemoved();
            return new ItemDetection(fresh.getItemId(), List.of(), fresh, refresh);
        }

        Item before = stored.getSnapshot();
        List<Change> changes = new ArrayList<>();
        for (FieldGroup group : differingGroups(stored, fresh, before, item)) {
            changes.add(groupChange(runId, group, before, item, fresh, now));
        }
        if (stored.isRemoved()) {
            log.info("Item {} reappeared with changes", fresh.getItemId());
        }
        return new ItemDetection(fresh.getItemId(), Collections.unmodifiableList(changes), fresh, true);
    }

    private List<FieldGroup> differingGroups(Fingerprint stored, Fingerprint fresh, Item before, Item after) {
        List<FieldGroup> groups = new ArrayList<>();
        if (!Objects.equals(stored.getPriceHash(), fresh.getPriceHash())) groups.add(FieldGroup.PRICE);
        if (!Objects.equals(stored.getAvailabilityHash(), fresh.getAvailabilityHash())) groups.add(FieldGroup.AVAILABILITY);
        if (!Objects.equals(stored.getMetadataHash(), fresh.getMetadataHash())) groups.add(FieldGroup.METADATA);

        boolean nameChanged = before != null && !changedFields(FieldGroup.CONTENT, before, after).isEmpty();
        if (nameChanged || groups.isEmpty()) {
            groups.add(FieldGroup.CONTENT);
        }
        return groups;
    }

    private Change groupChange(String runId, FieldGroup group, Item before, Item after, Fingerprint fresh, Instant now) {
        List<TrackedField> changed = before == null ? List.of() : changedFields(group, before, after);
        Change.ChangeBuilder change = Change.builder()
                .changeId(UUID.randomUUID().toString())
                .runId(runId)
                .itemId(fresh.getItemId())
                .sourceUrl(fresh.getSourceUrl())
                .detectedAt(now);

        if (changed.isEmpty()) {
            ChangePolicy.Rule rule = policy.hashOnlyRuleFor(group);
            String fieldName = group.name().toLowerCase();
            return change
                    .changeType(rule.type())
                    .severity(rule.baseSeverity())
                    .fieldName(fieldName)
                    .newValue(groupValues(group, after))
                    .humanSummary(String.format("%s of '%s' changed (previous values unavailable)",
                            capitalize(fieldName), after.getName()))
                    .confidenceScore(properties.getDetection().getHashOnlyConfidence())
                    .build();
        }

        TrackedField primary = changed.get(0);
        Severity severity = changed.stream()
                .map(f -> policy.ruleFor(f).severity(before, after))
                .reduce(Severity.LOW, Severity::max);
        String oldValue = primary.displayValue(before);
        String newValue = primary.displayValue(after);

        return change
                .changeType(policy.ruleFor(primary).type())
                .severity(severity)
                .fieldName(primary.key())
                .oldValue(oldValue)
                .newValue(newValue)
                .humanSummary(summarize(primary, changed.size(), after.getName(), oldValue, newValue))
                .confidenceScore(Change.EXACT_CONFIDENCE)
                .build();
    }

    private static List<TrackedField> changedFields(FieldGroup group, Item before, Item after) {
        return TrackedField.inGroup(group).stream()
                .filter(f -> !f.canonical(before).equals(f.canonical(after)))
                .toList();
    }

    private Change removedChange(String runId, Fingerprint stored) {
        String name = stored.getSnapshot() == null ? stored.getSourceUrl() : stored.getSnapshot().getName();
        return Change.builder()
                .changeId(UUID.randomUUID().toString())
                .runId(runId)
                .itemId(stored.getItemId())
                .sourceUrl(stored.getSourceUrl())
                .changeType(ChangeType.ITEM_REMOVED)
                .severity(policy.removedItemSeverity())
                .oldValue(stored.getSnapshot() == null ? null : stored.getSnapshot().getName())
                .humanSummary("Item no longer in catalog: '" + name + "'")
                .detectedAt(clock.instant())
                .confidenceScore(Change.EXACT_CONFIDENCE)
                .build();
    }

    private static String summarize(TrackedField field, int changedCount, String name, String oldValue, String newValue) {
        String summary = String.format("%s of '%s' changed: %s -> %s",
                capitalize(field.key().replace('_', ' ')), name, display(oldValue), display(newValue));
        if (changedCount > 1) {
            summary += " (+" + (changedCount - 1) + " more field" + (changedCount > 2 ? "s" : "") + ")";
        }
        return summary;
    }

    private static String groupValues(FieldGroup group, Item item) {
        return TrackedField.inGroup(group).stream()
                .map(f -> f.key() + "=" + f.canonical(item))
                .collect(Collectors.joining(", "));
    }

    private static String display(String value) {
        return value == null ? "(none)" : value;
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static void validate(Item item) {
        List<String> problems = new ArrayList<>();
        if (isBlank(item.getName())) problems.add("name is required");
        if (isBlank(item.getAvailability())) problems.add("availability is required");
        checkPrice("price_including_tax", item.getPriceIncludingTax(), problems);
        checkPrice("price_excluding_tax", item.getPriceExcludingTax(), problems);
        if (item.getNumberOfReviews() != null && item.getNumberOfReviews() < 0) {
            problems.add("number_of_reviews must not be negative");
        }
        if (item.getRating() != null && (item.getRating() < 1 || item.getRating() > 5)) {
            problems.add("rating must be between 1 and 5 (was " + item.getRating() + ")");
        }
        if (!problems.isEmpty()) {
            throw new DataIntegrityException(String.join(", ", problems));
        }
    }

    private static void checkPrice(String field, BigDecimal price, List<String> problems) {
        if (price == null) {
            problems.add(field + " is required");
        } else if (price.signum() < 0) {
            problems.add(field + " must not be negative");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

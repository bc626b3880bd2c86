package com.bookwatch.monitor.alert;

import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.model.AlertDecision;
import com.bookwatch.monitor.model.AlertDispatch;
import com.bookwatch.monitor.model.AlertOutcome;
import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.ChangeType;
import com.bookwatch.monitor.model.DailyReport;
import com.bookwatch.monitor.model.Severity;
import com.bookwatch.monitor.output.AlertDispatchStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns detected changes into alert deliveries.
 *
 * Per change: severity threshold, then item/type cooldown, then for each channel its own
 * minimum severity and rate-limit bucket. Every decision is recorded. Suppressed changes
 * stay in the change log; they are only not delivered.
 */
@Service
@Slf4j
public class AlertManager {

    private final List<AlertChannel> channels;
    private final AlertThrottle throttle;
    private final AlertDispatchStore dispatchStore;
    private final MonitorProperties properties;
    private final Clock clock;

    public AlertManager(List<AlertChannel> channels, AlertThrottle throttle, AlertDispatchStore dispatchStore,
                        MonitorProperties properties, Clock clock) {
        this.channels = List.copyOf(channels);
        this.throttle = throttle;
        this.dispatchStore = dispatchStore;
        this.properties = properties;
        this.clock = clock;
        log.info("Alert channels: {}", this.channels.stream().map(AlertChannel::name).toList());
    }

    public List<AlertDecision> process(List<Change> changes) {
        if (!properties.getAlerting().isEnabled()) {
            log.debug("Alerting disabled, {} changes not routed", changes.size());
            return List.of();
        }
        throttle.sweep();

        // Most severe first, so they get the bucket permits.
        List<Change> ordered = new ArrayList<>(changes);
        ordered.sort(Comparator.comparing(Change::getSeverity).reversed());

        List<AlertDecision> decisions = new ArrayList<>();
        for (Change change : ordered) {
            decisions.addAll(route(change));
        }

        try {
            dispatchStore.record(decisions);
        } catch (RuntimeException e) {
            log.error("Could not record {} alert decisions: {}", decisions.size(), e.getMessage(), e);
        }

        Map<AlertOutcome, Integer> byOutcome = new EnumMap<>(AlertOutcome.class);
        decisions.forEach(d -> byOutcome.merge(d.outcome(), 1, Integer::sum));
        log.info("Alerting done for {} changes: {}", changes.size(), byOutcome);
        return decisions;
    }

    /** Logs the human-readable summary of a generated daily report. */
    public void publishDailySummary(DailyReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Daily change summary for ").append(report.getReportDate()).append('\n')
                .append("  items checked:   ").append(report.getItemsChecked()).append('\n')
                .append("  changes:         ").append(report.getChangesDetected()).append('\n')
                .append("  new / updated / removed: ").append(report.getNewItems()).append(" / ")
                .append(report.getUpdatedItems()).append(" / ").append(report.getRemovedItems()).append('\n')
                .append("  health score:    ").append(String.format("%.2f", report.getSystemHealthScore()));

        for (Map.Entry<ChangeType, Integer> e : report.getChangesByType().entrySet()) {
            sb.append("\n  ").append(e.getKey().label()).append(": ").append(e.getValue());
        }
        for (Map.Entry<Severity, Integer> e : report.getChangesBySeverity().entrySet()) {
            sb.append("\n  severity ").append(e.getKey().label()).append(": ").append(e.getValue());
        }
        if (!report.getErrorsEncountered().isEmpty()) {
            sb.append("\n  errors:          ").append(report.getErrorsEncountered().size());
        }
        log.info(sb.toString());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<AlertDecision> route(Change change) {
        Severity minimum = properties.getAlerting().getMinSeverity();
        if (!change.getSeverity().isAtLeast(minimum)) {
            return List.of(decision(change, AlertDecision.ANY_CHANNEL, AlertOutcome.BELOW_THRESHOLD,
                    "below " + minimum.label()));
        }
        if (throttle.inCooldown(change)) {
            log.debug("Cooldown active for {} {}", change.getItemId(), change.getChangeType().label());
            return List.of(decision(change, AlertDecision.ANY_CHANNEL, AlertOutcome.COOLDOWN, null));
        }

        String summary = "[" + change.getChangeType().label() + "] " + change.getHumanSummary();
        List<AlertDecision> decisions = new ArrayList<>();
        boolean delivered = false;

        for (AlertChannel channel : channels) {
            if (!change.getSeverity().isAtLeast(channel.minimumSeverity())) {
                decisions.add(decision(change, channel.name(), AlertOutcome.CHANNEL_FILTERED,
                        "channel minimum " + channel.minimumSeverity().label()));
                continue;
            }
            if (!throttle.tryAcquire(channel.name(), change.getSeverity())) {
                log.warn("Rate limit reached on {} channel, alert for {} suppressed", channel.name(), change.getItemId());
                decisions.add(decision(change, channel.name(), AlertOutcome.RATE_LIMITED, null));
                continue;
            }
            try {
                channel.deliver(new AlertDispatch(channel.name(), change.getSeverity(), summary, change));
                decisions.add(decision(change, channel.name(), AlertOutcome.DELIVERED, null));
                delivered = true;
            } catch (RuntimeException e) {
                log.error("Alert delivery on {} failed for change {}: {}", channel.name(), change.getChangeId(),
                        e.getMessage(), e);
                decisions.add(decision(change, channel.name(), AlertOutcome.FAILED, e.getMessage()));
            }
        }

        if (delivered) {
            throttle.markAlerted(change);
        }
        return decisions;
    }

    private AlertDecision decision(Change change, String channel, AlertOutcome outcome, String detail) {
        return new AlertDecision(change.getChangeId(), channel, outcome, detail, clock.instant());
    }
}

package com.bookwatch.monitor.alert;

import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.Severity;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate-limit buckets and cooldown entries for alert delivery.
 *
 * Buckets are keyed "channel:severity" (or "channel:*" when per-severity limiting is off) and
 * each holds a fixed-window limiter of {@code quota} permits per {@code window}. Cooldown entries
 * are keyed by item id and change type and hold the instant the cooldown ends.
 * Both maps are pruned by {@link #sweep()}.
 */
@Component
@Slf4j
public class AlertThrottle {

    private final MonitorProperties properties;
    private final Clock clock;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final Map<String, Instant> cooldowns = new ConcurrentHashMap<>();

    private record Bucket(RateLimiter limiter, Instant lastUsed) {}

    public AlertThrottle(MonitorProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /** Takes one permit from the channel's bucket; false when the bucket is exhausted. */
    public boolean tryAcquire(String channel, Severity severity) {
        String key = bucketKey(channel, severity);
        Bucket bucket = buckets.compute(key, (k, existing) -> new Bucket(
                existing == null ? newLimiter(k) : existing.limiter(), clock.instant()));
        return bucket.limiter().acquirePermission();
    }

    public boolean inCooldown(Change change) {
        Instant until = cooldowns.get(cooldownKey(change));
        return until != null && clock.instant().isBefore(until);
    }

    public void markAlerted(Change change) {
        Duration cooldown = properties.getAlerting().getCooldown();
        if (cooldown.isZero()) return;
        cooldowns.put(cooldownKey(change), clock.instant().plus(cooldown));
    }

    /** Drops expired cooldowns and buckets idle for longer than one window. */
    public void sweep() {
        Instant now = clock.instant();
        Instant idleBefore = now.minus(properties.getAlerting().getRateLimit().getWindow());

        int cooldownsBefore = cooldowns.size();
        int bucketsBefore = buckets.size();
        cooldowns.values().removeIf(until -> !now.isBefore(until));
        buckets.values().removeIf(b -> b.lastUsed().isBefore(idleBefore));

        int dropped = (cooldownsBefore - cooldowns.size()) + (bucketsBefore - buckets.size());
        if (dropped > 0) {
            log.debug("Swept {} expired throttle entries", dropped);
        }
    }

    int bucketCount() {
        return buckets.size();
    }

    int cooldownCount() {
        return cooldowns.size();
    }

    private RateLimiter newLimiter(String key) {
        MonitorProperties.Alerting.RateLimit rateLimit = properties.getAlerting().getRateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(rateLimit.getQuota())
                .limitRefreshPeriod(rateLimit.getWindow())
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("alert-" + key, config);
    }

    private String bucketKey(String channel, Severity severity) {
        return properties.getAlerting().getRateLimit().isPerSeverity()
                ? channel + ":" + severity.label()
                : channel + ":*";
    }

    private static String cooldownKey(Change change) {
        return change.getItemId() + "|" + change.getChangeType().name();
    }
}

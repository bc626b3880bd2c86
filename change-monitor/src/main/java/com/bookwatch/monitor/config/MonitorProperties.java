package com.bookwatch.monitor.config;

import com.bookwatch.monitor.model.Severity;
import com.bookwatch.monitor.service.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "change-monitor")
@Data
public class MonitorProperties {

    private Detection detection = new Detection();
    private Alerting alerting = new Alerting();
    private Reporting reporting = new Reporting();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Detection {
        /** Worker threads used for per-item detection. */
        private int concurrency = 8;
        /** Items per chunk; cancellation is checked between chunks. */
        private int batchSize = 100;
        /** Relative price delta at or above which a price change is HIGH. */
        private double priceChangeThreshold = 0.10;
        /** Confidence assigned when only hashes, not raw values, show the change. */
        private double hashOnlyConfidence = 0.5;
    }

    @Data
    public static class Alerting {
        private boolean enabled = true;
        private Severity minSeverity = Severity.MEDIUM;
        private RateLimit rateLimit = new RateLimit();
        private Duration cooldown = Duration.ofMinutes(30);
        private Email email = new Email();

        @Data
        public static class RateLimit {
            private Duration window = Duration.ofHours(1);
            private int quota = 10;
            /** Separate bucket per severity when true, one bucket per channel otherwise. */
            private boolean perSeverity = true;
        }

        @Data
        public static class Email {
            private boolean enabled = false;
            private Severity minSeverity = Severity.HIGH;
            private String from = "change-monitor@localhost";
            private List<String> to = new ArrayList<>();
        }
    }

    @Data
    public static class Reporting {
        private boolean enabled = true;
        private ExportFormat exportFormat = ExportFormat.JSON;
        private String outputDir = "./reports";
        private int retentionDays = 30;
        private Health health = new Health();

        public enum ExportFormat {
            JSON, CSV, BOTH
        }

        @Data
        public static class Health {
            private double errorRateWeight = 0.5;
            private double severeChangeWeight = 0.3;
            private double removalRateWeight = 0.2;
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 30 14 * * *";
        private String zone = "UTC";
        private String cleanupCron = "0 0 1 * * *";
        private boolean runOnStartup = false;
    }

    /**
     * Checks every value the detection core depends on.
     *
     * @throws ConfigurationException listing all invalid values
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        if (detection.getConcurrency() < 1) {
            problems.add("detection.concurrency must be >= 1 (was " + detection.getConcurrency() + ")");
        }
        if (detection.getBatchSize() < 1) {
            problems.add("detection.batch-size must be >= 1 (was " + detection.getBatchSize() + ")");
        }
        if (detection.getPriceChangeThreshold() <= 0) {
            problems.add("detection.price-change-threshold must be > 0 (was " + detection.getPriceChangeThreshold() + ")");
        }
        if (detection.getHashOnlyConfidence() < 0 || detection.getHashOnlyConfidence() >= 1) {
            problems.add("detection.hash-only-confidence must be in [0, 1) (was " + detection.getHashOnlyConfidence() + ")");
        }

        Alerting.RateLimit rateLimit = alerting.getRateLimit();
        if (rateLimit.getQuota() < 1) {
            problems.add("alerting.rate-limit.quota must be >= 1 (was " + rateLimit.getQuota() + ")");
        }
        if (isNotPositive(rateLimit.getWindow())) {
            problems.add("alerting.rate-limit.window must be positive (was " + rateLimit.getWindow() + ")");
        }
        if (alerting.getCooldown() == null || alerting.getCooldown().isNegative()) {
            problems.add("alerting.cooldown must not be negative (was " + alerting.getCooldown() + ")");
        }
        if (alerting.getMinSeverity() == null) {
            problems.add("alerting.min-severity is required");
        }
        if (alerting.getEmail().isEnabled() && alerting.getEmail().getTo().isEmpty()) {
            problems.add("alerting.email.to needs at least one recipient when email is enabled");
        }

        if (reporting.getRetentionDays() < 1) {
            problems.add("reporting.retention-days must be >= 1 (was " + reporting.getRetentionDays() + ")");
        }
        Reporting.Health health = reporting.getHealth();
        if (health.getErrorRateWeight() < 0 || health.getSevereChangeWeight() < 0 || health.getRemovalRateWeight() < 0) {
            problems.add("reporting.health weights must not be negative");
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private static boolean isNotPositive(Duration duration) {
        return duration == null || duration.isZero() || duration.isNegative();
    }
}

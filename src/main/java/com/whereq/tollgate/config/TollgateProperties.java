package com.whereq.tollgate.config;

import com.whereq.tollgate.model.Complexity;
import com.whereq.tollgate.model.JobPriority;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for WhereQ Tollgate.
 *
 * @author WhereQ Inc.
 */
@ConfigurationProperties(prefix = "tollgate")
@Data
public class TollgateProperties {

    private AgentsConfig agents = new AgentsConfig();

    private QueueConfig queue = new QueueConfig();

    private RateLimitingConfig rateLimiting = new RateLimitingConfig();

    private CostControlsConfig costControls = new CostControlsConfig();

    private ModelSelectionConfig modelSelection = new ModelSelectionConfig();

    private ShutdownConfig shutdown = new ShutdownConfig();

    private WorkersConfig workers = new WorkersConfig();

    @Data
    public static class AgentsConfig {
        /**
         * Maximum number of jobs executing at the same time.
         */
        private int maxConcurrent = 2;
    }

    @Data
    public static class QueueConfig {
        /**
         * Maximum number of jobs waiting for execution. Submissions beyond it are rejected.
         */
        private int maxSize = 200;

        /**
         * Worker timeout per priority, in milliseconds.
         */
        private Map<JobPriority, Long> timeoutThresholds = defaultTimeouts();

        /**
         * Timeout used when a priority has no entry in the table.
         */
        private long defaultTimeoutMs = 90_000;

        public long timeoutFor(JobPriority priority) {
            Long timeout = timeoutThresholds.get(priority);
            return timeout != null ? timeout : defaultTimeoutMs;
        }

        private static Map<JobPriority, Long> defaultTimeouts() {
            Map<JobPriority, Long> timeouts = new EnumMap<>(JobPriority.class);
            timeouts.put(JobPriority.HIGH, 45_000L);
            timeouts.put(JobPriority.NORMAL, 90_000L);
            timeouts.put(JobPriority.LOW, 180_000L);
            return timeouts;
        }
    }

    @Data
    public static class RateLimitingConfig {
        /**
         * Executions allowed per fixed 60-second window.
         */
        private int requestsPerMinute = 45;
    }

    @Data
    public static class CostControlsConfig {
        private double hourlySpendLimit = 2.0;

        private double dailySpendLimit = 10.0;

        private AlertThresholds alertThresholds = new AlertThresholds();

        /**
         * Escalate to emergency shutdown when the emergency threshold is crossed.
         */
        private boolean autoShutdownOnOverspend = true;
    }

    /**
     * Percentages of the daily spend limit.
     */
    @Data
    public static class AlertThresholds {
        private double warning = 70;
        private double critical = 85;
        private double emergency = 95;
    }

    @Data
    public static class ModelSelectionConfig {
        /**
         * Model used for each complexity class. The SIMPLE model is the cheapest tier.
         */
        private Map<Complexity, String> models = defaultModels();

        /**
         * Dollar rate per 1000 units, per model.
         */
        private Map<String, Double> rates = defaultRates();

        /**
         * Hourly spend ratio at which every job is forced onto the cheapest tier.
         */
        private double downgradeRatio = 0.8;

        public String modelFor(Complexity complexity) {
            String model = models.get(complexity);
            return model != null ? model : models.get(Complexity.MODERATE);
        }

        public String cheapestModel() {
            return modelFor(Complexity.SIMPLE);
        }

        private static Map<Complexity, String> defaultModels() {
            Map<Complexity, String> models = new EnumMap<>(Complexity.class);
            models.put(Complexity.SIMPLE, "claude-3-haiku");
            models.put(Complexity.MODERATE, "claude-3-sonnet");
            models.put(Complexity.COMPLEX, "claude-3-opus");
            return models;
        }

        private static Map<String, Double> defaultRates() {
            Map<String, Double> rates = new LinkedHashMap<>();
            rates.put("claude-3-haiku", 0.00025);
            rates.put("claude-3-sonnet", 0.003);
            rates.put("claude-3-opus", 0.015);
            return rates;
        }
    }

    @Data
    public static class ShutdownConfig {
        /**
         * How long graceful shutdown waits for active jobs.
         */
        private Duration gracePeriod = Duration.ofSeconds(30);

        /**
         * Delay between an emergency stop and the graceful shutdown it schedules.
         */
        private Duration emergencyDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class WorkersConfig {
        /**
         * Local workers created per model tier.
         */
        private int perTier = 1;

        /**
         * Threads executing dispatched jobs.
         */
        private int executorThreads = 8;
    }
}

package com.whereq.warden.config;

import com.whereq.warden.model.ResultStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for WhereQ Warden.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "warden")
@Validated
@Data
public class WardenProperties {

    @Valid
    private ExecutionConfig execution = new ExecutionConfig();

    @Valid
    private TimeoutConfig timeout = new TimeoutConfig();

    @Valid
    private RetryConfig retry = new RetryConfig();

    @Valid
    private PoolConfig pool = new PoolConfig();

    @Valid
    private SchedulerConfig scheduler = new SchedulerConfig();

    @Valid
    private AggregationConfig aggregation = new AggregationConfig();

    @Valid
    private RegistryConfig registry = new RegistryConfig();

    @Data
    public static class ExecutionConfig {
        /**
         * Run independent jobs concurrently on a bounded worker pool.
         */
        private boolean parallelExecution = false;

        /**
         * Maximum number of jobs in flight in parallel mode.
         */
        @Min(1)
        private int maxParallelTests = 4;

        private boolean enableTimeouts = true;

        private boolean enableRetries = true;

        private boolean enableResultInversion = true;

        /**
         * Stop a sequential batch at the first fail, error or timeout.
         */
        private boolean failFast = false;

        /**
         * Default time budget for one job attempt.
         */
        @NotNull
        private Duration executionTimeout = Duration.ofSeconds(300);

        /**
         * Derive job timeouts from past execution times of the same probe and target.
         */
        private boolean adaptiveTimeouts = false;

        /**
         * Tune retry count and delay from past failures of the same probe and target.
         */
        private boolean smartRetries = false;

        /**
         * Entries kept per probe and target in the execution history.
         */
        @Min(1)
        private int historySize = 50;
    }

    @Data
    public static class TimeoutConfig {
        @NotNull
        private Duration defaultTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration minTimeout = Duration.ofSeconds(1);

        @NotNull
        private Duration maxTimeout = Duration.ofSeconds(300);

        /**
         * How timeouts are enforced.
         */
        @NotNull
        private TimeoutStrategyType strategy = TimeoutStrategyType.INTERRUPT;
    }

    @Data
    public static class RetryConfig {
        @Min(0)
        private int maxRetries = 3;

        @NotNull
        private Duration retryDelay = Duration.ofSeconds(1);

        private boolean exponentialBackoff = true;

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        @NotNull
        private Duration maxRetryDelay = Duration.ofSeconds(60);

        /**
         * Add random noise to every delay so that concurrent retries spread out.
         */
        private boolean jitter = true;

        /**
         * Upper bound of the jitter as a fraction of the delay.
         */
        @DecimalMin("0.0")
        private double jitterMax = 0.1;

        private Set<ResultStatus> retryableStatuses = EnumSet.of(ResultStatus.ERROR, ResultStatus.TIMEOUT);
    }

    @Data
    public static class PoolConfig {
        /**
         * Number of warm handles kept available.
         */
        @Min(0)
        private int poolSize = 20;

        /**
         * Hard ceiling on simultaneously borrowed handles.
         */
        @Min(1)
        private int maxConnections = 10;

        @NotNull
        private Duration idleTimeout = Duration.ofSeconds(300);

        /**
         * Handles older than this are marked unhealthy by the health check.
         */
        @NotNull
        private Duration maxAge = Duration.ofHours(1);

        /**
         * Wait ceiling for acquire.
         */
        @NotNull
        private Duration acquireTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration pollInterval = Duration.ofMillis(100);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(30);

        private String userAgent = "Warden/1.0";

        @Min(0)
        private int maxRedirects = 5;

        @NotNull
        private Duration healthCheckInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class SchedulerConfig {
        private boolean priorityScheduling = true;

        private boolean loadBalancing = true;

        private boolean adaptiveBatching = true;
    }

    @Data
    public static class AggregationConfig {
        /**
         * Category weights of the overall score. Unknown categories weigh 0.1.
         */
        private Map<String, Double> scoreWeights = defaultWeights();

        private boolean calculateTrends = true;

        private static Map<String, Double> defaultWeights() {
            Map<String, Double> weights = new LinkedHashMap<>();
            weights.put("security", 0.4);
            weights.put("performance", 0.3);
            weights.put("availability", 0.3);
            return weights;
        }
    }

    @Data
    public static class RegistryConfig {
        /**
         * Whether newly registered probes start enabled.
         */
        private boolean defaultEnabled = true;

        /**
         * Categories accepted at registration, empty for all.
         */
        private Set<String> allowedCategories = new LinkedHashSet<>();
    }

    public enum TimeoutStrategyType {
        /**
         * Run the probe on a worker thread and interrupt it at the deadline.
         */
        INTERRUPT,

        /**
         * Run the probe in the caller thread and check the elapsed time afterwards.
         * Cannot abort a probe that blocks past its deadline.
         */
        POLLING
    }
}

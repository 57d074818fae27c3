package com.whereq.warden.executor;

import com.whereq.warden.config.WardenProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Duration;

/**
 * Retry policy for failed probe attempts
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Maximum number of retries after the first attempt
     */
    @Builder.Default
    private int maxRetries = 3;

    /**
     * Delay before the first retry
     */
    @Builder.Default
    private Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    private boolean exponentialBackoff = true;

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private double backoffMultiplier = 2.0;

    /**
     * Maximum backoff delay, jitter excluded
     */
    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    private boolean jitter = true;

    /**
     * Upper bound of the jitter as a fraction of the delay
     */
    @Builder.Default
    private double jitterMax = 0.1;

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy from(WardenProperties.RetryConfig config) {
        return RetryPolicy.builder()
            .maxRetries(config.getMaxRetries())
            .initialDelay(config.getRetryDelay())
            .exponentialBackoff(config.isExponentialBackoff())
            .backoffMultiplier(config.getBackoffMultiplier())
            .maxDelay(config.getMaxRetryDelay())
            .jitter(config.isJitter())
            .jitterMax(config.getJitterMax())
            .build();
    }

    /**
     * Total number of attempts allowed
     */
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Calculate the delay after a failed attempt
     *
     * @param attempt 1-based number of the attempt that just failed
     * @param random  value in [0, 1) scaling the jitter
     */
    public Duration calculateBackoff(int attempt, double random) {
        double delayMs = initialDelay.toMillis();
        if (exponentialBackoff) {
            delayMs = delayMs * Math.pow(backoffMultiplier, attempt - 1);
        }
        delayMs = Math.min(delayMs, maxDelay.toMillis());

        if (jitter) {
            delayMs += delayMs * jitterMax * random;
        }
        return Duration.ofMillis((long) delayMs);
    }
}

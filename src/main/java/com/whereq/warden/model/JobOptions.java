package com.whereq.warden.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-job overrides of the engine configuration. Null fields fall back to configured defaults.
 */
@Value
@Builder(toBuilder = true)
public class JobOptions {
    private static final JobOptions DEFAULTS = JobOptions.builder().build();

    /**
     * Time budget for one attempt
     */
    Duration timeout;

    /**
     * Retries after the first attempt
     */
    Integer maxRetries;

    /**
     * Base delay between attempts
     */
    Duration retryDelay;

    /**
     * Name of the inversion rule applied to the raw result
     */
    String inversionMode;

    /**
     * Set to false to bypass the timeout controller for this job
     */
    @Builder.Default
    boolean timeoutEnabled = true;

    /**
     * Set to false to bypass the retry controller for this job
     */
    @Builder.Default
    boolean retriesEnabled = true;

    public static JobOptions defaults() {
        return DEFAULTS;
    }

    public boolean hasInversion() {
        return inversionMode != null && !inversionMode.isBlank() && !"none".equals(inversionMode);
    }
}

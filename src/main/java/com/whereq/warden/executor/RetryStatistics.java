package com.whereq.warden.executor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Snapshot of the retry controller's counters, overall and per probe
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryStatistics {
    private int probesWithRetries;
    private long totalExecutions;
    private long totalAttempts;

    /**
     * Executions that needed more than one attempt and ended successfully
     */
    private long successfulRetries;

    /**
     * Executions that needed more than one attempt and still failed
     */
    private long failedRetries;

    /**
     * Percentage of executions that were retried at least once
     */
    private double overallRetryRate;

    /**
     * Percentage of retried executions that eventually succeeded
     */
    private double overallSuccessRate;

    private Map<String, ProbeRetryStats> perProbe;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProbeRetryStats {
        private long totalExecutions;
        private long totalAttempts;
        private long successfulRetries;
        private long failedRetries;
        private double averageAttempts;
    }
}

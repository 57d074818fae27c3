package com.whereq.warden.executor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Snapshot of the timeout controller's counters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeoutStatistics {
    private long totalExecutions;
    private long timeoutsOccurred;

    /**
     * Seconds
     */
    private double averageExecutionTime;

    /**
     * Percentage of executions that timed out
     */
    private double timeoutRate;

    /**
     * Execution counts per duration bucket: {@code < 5s, 5-15s, 15-30s, 30-60s, > 60s}
     */
    private Map<String, Long> durationDistribution;
}

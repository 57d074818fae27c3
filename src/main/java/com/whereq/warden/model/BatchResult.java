package com.whereq.warden.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Results of one batch, keyed by job id in the order they were recorded
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {
    private String name;

    /**
     * Common target of the batch, null when jobs address several targets
     */
    private String target;

    @Builder.Default
    private Map<String, ProbeResult> results = new LinkedHashMap<>();

    /**
     * Wall-clock time of the whole batch in seconds
     */
    private double executionTime;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    @Builder.Default
    private Instant timestamp = Instant.now();

    public int getTotalCount() {
        return results.size();
    }

    public long getPassedCount() {
        return countByStatus(ResultStatus.PASS);
    }

    public long getFailedCount() {
        return countByStatus(ResultStatus.FAIL);
    }

    public long countByStatus(ResultStatus status) {
        return results.values().stream()
            .filter(result -> result.getStatus() == status)
            .count();
    }

    /**
     * Percentage of passed results, 0 for an empty batch
     */
    public double getSuccessRate() {
        int total = getTotalCount();
        return total > 0 ? (getPassedCount() * 100.0) / total : 0.0;
    }

    public ProbeResult getResult(String jobId) {
        return results.get(jobId);
    }
}

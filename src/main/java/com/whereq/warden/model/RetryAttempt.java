package com.whereq.warden.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a job's append-only attempt log
 */
@Value
@AllArgsConstructor
public class RetryAttempt {
    /**
     * 1-based attempt number
     */
    int attemptNumber;

    /**
     * Result of the attempt, null when it raised
     */
    ProbeResult result;

    /**
     * Fault raised by the attempt, null when it returned a result
     */
    Throwable error;

    /**
     * Attempt duration in seconds
     */
    double executionTime;

    public static RetryAttempt ofResult(int attemptNumber, ProbeResult result, double executionTime) {
        return new RetryAttempt(attemptNumber, result, null, executionTime);
    }

    public static RetryAttempt ofError(int attemptNumber, Throwable error, double executionTime) {
        return new RetryAttempt(attemptNumber, null, error, executionTime);
    }

    public boolean failedWithError() {
        return error != null;
    }

    /**
     * Summary stored in the final result's retry history
     */
    public Map<String, Object> summarize() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("attempt", attemptNumber);
        summary.put("execution_time", executionTime);
        if (result != null) {
            summary.put("status", result.getStatus().value());
            summary.put("message", result.getMessage());
        } else if (error != null) {
            summary.put("status", "exception");
            summary.put("exception", error.getClass().getName());
            summary.put("message", error.getMessage());
        }
        return summary;
    }
}

package com.whereq.warden.service;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.model.FailureRecord;
import com.whereq.warden.model.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recent execution times and failures per probe and target.
 * Feeds adaptive timeouts and smart retries; each series keeps the newest entries only.
 */
@Slf4j
@Component
public class ExecutionHistory {

    private final int capacity;
    private final Map<String, Series> series = new ConcurrentHashMap<>();

    @Autowired
    public ExecutionHistory(WardenProperties properties) {
        this(properties.getExecution().getHistorySize());
    }

    public ExecutionHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History size must be at least 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Record a finished execution. A success following a failure sets that failure's recovery time.
     */
    public void record(String probeName, String target, ProbeResult result) {
        if (result.isSkipped()) {
            return;
        }

        Series entry = series.computeIfAbsent(key(probeName, target), key -> new Series());
        synchronized (entry) {
            if (result.getExecutionTime() > 0) {
                append(entry.executionTimes, result.getExecutionTime());
            }

            if (result.hasProblems()) {
                append(entry.failures, FailureRecord.builder()
                    .status(result.getStatus())
                    .timestamp(Instant.now())
                    .build());
            } else if (result.isSuccessful()) {
                FailureRecord last = entry.failures.peekLast();
                if (last != null && last.getRecoveryTime() == null) {
                    Duration recovery = Duration.between(last.getTimestamp(), Instant.now());
                    last.setRecoveryTime(recovery.toNanos() / 1_000_000_000.0);
                    log.debug("{} recovered on {} after {}", probeName, target, recovery);
                }
            }
        }
    }

    public List<Double> getExecutionTimes(String probeName, String target) {
        Series entry = series.get(key(probeName, target));
        if (entry == null) {
            return List.of();
        }
        synchronized (entry) {
            return new ArrayList<>(entry.executionTimes);
        }
    }

    /**
     * Failures, oldest first
     */
    public List<FailureRecord> getFailures(String probeName, String target) {
        Series entry = series.get(key(probeName, target));
        if (entry == null) {
            return List.of();
        }
        synchronized (entry) {
            List<FailureRecord> copies = new ArrayList<>();
            for (FailureRecord failure : entry.failures) {
                copies.add(new FailureRecord(failure.getStatus(), failure.getRecoveryTime(), failure.getTimestamp()));
            }
            return copies;
        }
    }

    public void clear() {
        series.clear();
    }

    private <T> void append(Deque<T> deque, T value) {
        deque.addLast(value);
        while (deque.size() > capacity) {
            deque.removeFirst();
        }
    }

    private static String key(String probeName, String target) {
        return probeName + "|" + target;
    }

    private static class Series {
        private final Deque<Double> executionTimes = new ArrayDeque<>();
        private final Deque<FailureRecord> failures = new ArrayDeque<>();
    }
}

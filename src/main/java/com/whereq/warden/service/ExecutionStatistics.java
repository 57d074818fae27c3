package com.whereq.warden.service;

import com.whereq.warden.model.BatchResult;
import com.whereq.warden.model.ProbeResult;
import com.whereq.warden.model.ResultStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Execution counters per probe and per batch, mirrored to Micrometer
 */
@Slf4j
@Component
public class ExecutionStatistics {

    private static final int BATCH_HISTORY_SIZE = 20;

    private final Timer executionTimer;
    private final Counter batchCounter;
    private final Map<ResultStatus, Counter> statusCounters = new EnumMap<>(ResultStatus.class);

    private final Map<String, ProbeCounters> probes = new ConcurrentHashMap<>();
    private final Deque<BatchMetrics> batches = new ArrayDeque<>();

    @Autowired
    public ExecutionStatistics(MeterRegistry meterRegistry) {
        for (ResultStatus status : ResultStatus.values()) {
            statusCounters.put(status, Counter.builder("warden.jobs.executed")
                .description("Number of executed jobs by final status")
                .tag("status", status.value())
                .register(meterRegistry));
        }

        executionTimer = Timer.builder("warden.jobs.execution.time")
            .description("Job execution time")
            .register(meterRegistry);

        batchCounter = Counter.builder("warden.batches.executed")
            .description("Number of executed batches")
            .register(meterRegistry);
    }

    /**
     * Record one finished job
     *
     * @param seconds wall-clock time of the job including retries
     */
    public void recordJob(String probeName, ProbeResult result, double seconds) {
        ProbeCounters counters = probes.computeIfAbsent(String.valueOf(probeName), key -> new ProbeCounters());
        counters.executions.increment();
        counters.totalTime.add(seconds);
        counters.statusCounts.computeIfAbsent(result.getStatus(), key -> new LongAdder()).increment();

        statusCounters.get(result.getStatus()).increment();
        executionTimer.record(Duration.ofNanos((long) (seconds * 1_000_000_000L)));
    }

    /**
     * Record a finished batch
     */
    public BatchMetrics recordBatch(BatchResult batch) {
        Map<String, Long> statusCounts = new TreeMap<>();
        for (ProbeResult result : batch.getResults().values()) {
            statusCounts.merge(result.getStatus().value(), 1L, Long::sum);
        }

        int total = batch.getTotalCount();
        double duration = batch.getExecutionTime();
        BatchMetrics metrics = BatchMetrics.builder()
            .batchId("batch_" + UUID.randomUUID().toString().substring(0, 8))
            .name(batch.getName())
            .totalJobs(total)
            .passedJobs(batch.getPassedCount())
            .failedJobs(batch.getFailedCount())
            .successRate(batch.getSuccessRate())
            .totalDuration(duration)
            .averageJobDuration(total > 0 ? duration / total : 0.0)
            .jobsPerSecond(duration > 0 ? total / duration : 0.0)
            .statusCounts(statusCounts)
            .build();

        synchronized (batches) {
            batches.addLast(metrics);
            while (batches.size() > BATCH_HISTORY_SIZE) {
                batches.removeFirst();
            }
        }
        batchCounter.increment();
        return metrics;
    }

    public Map<String, ProbeExecutionStats> getProbeStatistics() {
        Map<String, ProbeExecutionStats> snapshot = new TreeMap<>();
        probes.forEach((name, counters) -> snapshot.put(name, counters.snapshot()));
        return snapshot;
    }

    public ProbeExecutionStats getProbeStatistics(String probeName) {
        ProbeCounters counters = probes.get(probeName);
        return counters != null ? counters.snapshot() : null;
    }

    /**
     * Most recent batch, null before the first one
     */
    public BatchMetrics getLastBatch() {
        synchronized (batches) {
            return batches.peekLast();
        }
    }

    public List<BatchMetrics> getBatchHistory() {
        synchronized (batches) {
            return new ArrayList<>(batches);
        }
    }

    public void reset() {
        probes.clear();
        synchronized (batches) {
            batches.clear();
        }
        log.info("Execution statistics reset");
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProbeExecutionStats {
        private long totalExecutions;

        /**
         * Seconds
         */
        private double totalTime;

        private double averageExecutionTime;

        private Map<String, Long> statusCounts;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchMetrics {
        private String batchId;
        private String name;
        private int totalJobs;
        private long passedJobs;
        private long failedJobs;
        private double successRate;

        /**
         * Seconds
         */
        private double totalDuration;

        private double averageJobDuration;
        private double jobsPerSecond;
        private Map<String, Long> statusCounts;
    }

    private static class ProbeCounters {
        private final LongAdder executions = new LongAdder();
        private final DoubleAdder totalTime = new DoubleAdder();
        private final Map<ResultStatus, LongAdder> statusCounts = new ConcurrentHashMap<>();

        ProbeExecutionStats snapshot() {
            long total = executions.sum();
            double time = totalTime.sum();
            Map<String, Long> counts = new LinkedHashMap<>();
            for (ResultStatus status : ResultStatus.values()) {
                LongAdder count = statusCounts.get(status);
                if (count != null) {
                    counts.put(status.value(), count.sum());
                }
            }
            return ProbeExecutionStats.builder()
                .totalExecutions(total)
                .totalTime(time)
                .averageExecutionTime(total > 0 ? time / total : 0.0)
                .statusCounts(counts)
                .build();
        }
    }
}

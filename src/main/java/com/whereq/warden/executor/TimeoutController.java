package com.whereq.warden.executor;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.model.ProbeResult;
import com.whereq.warden.model.ResultStatus;
import com.whereq.warden.probe.Probe;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounds probe executions in time and turns overruns into TIMEOUT results.
 *
 * Faults raised by the probe itself propagate unchanged.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class TimeoutController {

    private static final double ADAPTIVE_BUFFER = 1.5;
    private static final List<String> DURATION_BUCKETS = List.of("< 5s", "5-15s", "15-30s", "30-60s", "> 60s");

    private final WardenProperties.TimeoutConfig config;
    private final TimeoutStrategy strategy;
    private final Counter timeoutCounter;

    private final Map<String, Duration> probeTimeouts = new ConcurrentHashMap<>();

    private final LongAdder executions = new LongAdder();
    private final LongAdder timeouts = new LongAdder();
    private final DoubleAdder totalSeconds = new DoubleAdder();
    private final Map<String, LongAdder> distribution = new ConcurrentHashMap<>();

    @Autowired
    public TimeoutController(WardenProperties properties, MeterRegistry meterRegistry) {
        this(properties.getTimeout(), meterRegistry);
    }

    public TimeoutController(WardenProperties.TimeoutConfig config, MeterRegistry meterRegistry) {
        this(config, createStrategy(config.getStrategy()), meterRegistry);
    }

    public TimeoutController(WardenProperties.TimeoutConfig config, TimeoutStrategy strategy, MeterRegistry meterRegistry) {
        this.config = config;
        this.strategy = strategy;
        this.timeoutCounter = Counter.builder("warden.timeouts")
            .description("Probe executions that exceeded their time budget")
            .register(meterRegistry);

        log.info("TimeoutController initialized: strategy={}, default={}, min={}, max={}",
            strategy.getType(), config.getDefaultTimeout(), config.getMinTimeout(), config.getMaxTimeout());
    }

    private static TimeoutStrategy createStrategy(WardenProperties.TimeoutStrategyType type) {
        return switch (type) {
            case INTERRUPT -> new InterruptTimeoutStrategy();
            case POLLING -> new PollingTimeoutStrategy();
        };
    }

    /**
     * Execute a probe bounded by a timeout
     *
     * @param timeout time budget, null for the probe's custom timeout or the default; clamped to [min, max]
     * @return the probe's result, or a synthesized TIMEOUT result
     * @throws Exception the fault raised by the probe
     */
    public ProbeResult executeWithTimeout(Probe probe, String target, Map<String, Object> context, Duration timeout)
            throws Exception {
        return execute(probe.getName(), target, () -> probe.run(target, context), timeout);
    }

    /**
     * Execute an arbitrary invocation bounded by a timeout
     */
    public ProbeResult execute(String probeName, String target, ProbeInvocation invocation, Duration timeout)
            throws Exception {
        return execute(probeName, target, invocation, timeout, null);
    }

    /**
     * Execute an invocation bounded by a timeout and a hard ceiling.
     * The ceiling applies after clamping, so it may cut the limit below the minimum timeout.
     *
     * @param ceiling upper bound on the effective limit, null for none
     */
    public ProbeResult execute(String probeName, String target, ProbeInvocation invocation, Duration timeout,
                               Duration ceiling) throws Exception {
        Duration limit = clamp(timeout != null ? timeout : getProbeTimeout(probeName));
        if (ceiling != null && ceiling.compareTo(limit) < 0) {
            limit = ceiling.isNegative() ? Duration.ZERO : ceiling;
        }

        ProbeInvocation guarded = () -> {
            ProbeResult result = invocation.invoke();
            return result != null ? result : ProbeResult.noResult(probeName, target);
        };

        long start = System.nanoTime();
        Optional<ProbeResult> outcome;
        try {
            outcome = strategy.execute(guarded, limit);
        } catch (Exception e) {
            record(elapsedSeconds(start), false);
            throw e;
        }

        double elapsed = elapsedSeconds(start);
        if (outcome.isEmpty()) {
            record(elapsed, true);
            timeoutCounter.increment();
            log.warn("Probe {} timed out on {} after {}s (limit: {}s)",
                probeName, target, format(elapsed), format(seconds(limit)));
            return createTimeoutResult(probeName, target, seconds(limit), elapsed);
        }

        record(elapsed, false);
        return outcome.get();
    }

    /**
     * Timeout derived from past execution times: 1.5 times their average, clamped.
     * Falls back to the probe's timeout when there is no usable history.
     */
    public Duration calculateAdaptiveTimeout(String probeName, Collection<Double> executionTimes) {
        Duration base = getProbeTimeout(probeName);
        if (executionTimes == null || executionTimes.isEmpty()) {
            return base;
        }

        double total = 0;
        int count = 0;
        for (Double time : executionTimes) {
            if (time != null && time > 0) {
                total += time;
                count++;
            }
        }
        if (count == 0) {
            return base;
        }

        return clamp(toDuration((total / count) * ADAPTIVE_BUFFER));
    }

    public ProbeResult executeWithAdaptiveTimeout(Probe probe, String target, Map<String, Object> context,
                                                  Collection<Double> executionTimes) throws Exception {
        return executeWithTimeout(probe, target, context, calculateAdaptiveTimeout(probe.getName(), executionTimes));
    }

    /**
     * Run the probe with timeouts of base, 2 x base, ... until it finishes within one
     *
     * @param maxAttempts number of attempts, at least 1
     */
    public ProbeResult executeWithEscalatingTimeout(Probe probe, String target, Map<String, Object> context,
                                                    int maxAttempts) throws Exception {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }

        Duration base = getProbeTimeout(probe.getName());
        ProbeResult result = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration timeout = clamp(base.multipliedBy(attempt));
            result = executeWithTimeout(probe, target, context, timeout);

            if (!result.isTimeout()) {
                return result
                    .addData("timeout_attempts", attempt)
                    .addData("timeout_used", seconds(timeout));
            }
            log.debug("Escalating timeout for {}: attempt {}/{} timed out at {}", probe.getName(), attempt, maxAttempts, timeout);
        }

        return result
            .addData("timeout_attempts", maxAttempts)
            .addData("max_attempts_reached", true);
    }

    /**
     * Run probes one after another sharing a total time budget.
     * Probes left without remaining time are reported as timed out without running.
     *
     * @param totalTimeout shared budget, null for no overall limit
     */
    public List<ProbeResult> executeBatchWithTimeouts(List<? extends Probe> probes, String target,
                                                      Map<String, Object> context, Duration totalTimeout) throws Exception {
        List<ProbeResult> results = new ArrayList<>();
        long start = System.nanoTime();

        for (Probe probe : probes) {
            Duration timeout = null;
            if (totalTimeout != null) {
                double elapsed = elapsedSeconds(start);
                double remaining = seconds(totalTimeout) - elapsed;
                if (remaining <= 0) {
                    results.add(createTimeoutResult(probe.getName(), target, 0, elapsed));
                    continue;
                }
                Duration probeTimeout = getProbeTimeout(probe.getName());
                timeout = toDuration(Math.min(remaining, seconds(probeTimeout)));
            }
            results.add(executeWithTimeout(probe, target, context, timeout));
        }
        return results;
    }

    /**
     * Synthesized result for an execution that exceeded its limit
     */
    public ProbeResult createTimeoutResult(String probeName, String target, double limitSeconds, double actualSeconds) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timeout_limit", limitSeconds);
        data.put("actual_execution_time", actualSeconds);
        data.put("timeout_exceeded_by", Math.max(0, actualSeconds - limitSeconds));
        data.put("timeout_type", strategy.getType());

        return ProbeResult.builder()
            .probeName(probeName)
            .status(ResultStatus.TIMEOUT)
            .message(String.format(Locale.ROOT, "Probe timed out after %.2fs (limit: %.2fs)", actualSeconds, limitSeconds))
            .data(data)
            .executionTime(actualSeconds)
            .target(target)
            .build();
    }

    public void setProbeTimeout(String probeName, Duration timeout) {
        probeTimeouts.put(probeName, clamp(timeout));
    }

    public boolean hasProbeTimeout(String probeName) {
        return probeName != null && probeTimeouts.containsKey(probeName);
    }

    public Duration getProbeTimeout(String probeName) {
        Duration custom = probeName != null ? probeTimeouts.get(probeName) : null;
        return custom != null ? custom : config.getDefaultTimeout();
    }

    /**
     * Clamp a timeout into [min, max]; null means the default timeout
     */
    public Duration clamp(Duration timeout) {
        Duration value = timeout != null ? timeout : config.getDefaultTimeout();
        if (value.compareTo(config.getMinTimeout()) < 0) {
            return config.getMinTimeout();
        }
        if (value.compareTo(config.getMaxTimeout()) > 0) {
            return config.getMaxTimeout();
        }
        return value;
    }

    public String getStrategyType() {
        return strategy.getType();
    }

    public TimeoutStatistics getStatistics() {
        long total = executions.sum();
        long timedOut = timeouts.sum();

        Map<String, Long> buckets = new LinkedHashMap<>();
        for (String bucket : DURATION_BUCKETS) {
            LongAdder count = distribution.get(bucket);
            buckets.put(bucket, count != null ? count.sum() : 0L);
        }

        return TimeoutStatistics.builder()
            .totalExecutions(total)
            .timeoutsOccurred(timedOut)
            .averageExecutionTime(total > 0 ? totalSeconds.sum() / total : 0.0)
            .timeoutRate(total > 0 ? (timedOut * 100.0) / total : 0.0)
            .durationDistribution(buckets)
            .build();
    }

    public void resetStatistics() {
        executions.reset();
        timeouts.reset();
        totalSeconds.reset();
        distribution.clear();
    }

    @PreDestroy
    public void shutdown() {
        strategy.close();
        log.info("TimeoutController shut down");
    }

    private void record(double elapsed, boolean timedOut) {
        executions.increment();
        totalSeconds.add(elapsed);
        if (timedOut) {
            timeouts.increment();
        }
        distribution.computeIfAbsent(bucketOf(elapsed), key -> new LongAdder()).increment();
    }

    private static String bucketOf(double seconds) {
        if (seconds < 5) {
            return "< 5s";
        } else if (seconds < 15) {
            return "5-15s";
        } else if (seconds < 30) {
            return "15-30s";
        } else if (seconds < 60) {
            return "30-60s";
        }
        return "> 60s";
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }

    private static String format(double seconds) {
        return String.format(Locale.ROOT, "%.2f", seconds);
    }
}

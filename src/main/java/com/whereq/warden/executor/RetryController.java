package com.whereq.warden.executor;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.model.FailureRecord;
import com.whereq.warden.model.ProbeResult;
import com.whereq.warden.model.ResultStatus;
import com.whereq.warden.model.RetryAttempt;
import com.whereq.warden.probe.Probe;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Re-runs failed probe attempts with exponential backoff and jitter.
 *
 * A retried execution still produces one logical result, enriched with the
 * attempt history. Retryable faults never escape; a non-retryable fault ends
 * the execution with an ERROR result.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class RetryController {

    private static final int SMART_RETRY_WINDOW = 10;
    private static final int SMART_RETRY_CEILING = 8;
    private static final Duration SMART_DELAY_CEILING = Duration.ofSeconds(10);

    private final WardenProperties.RetryConfig config;
    private final Counter retryAttemptCounter;

    private final Set<ResultStatus> retryableStatuses = ConcurrentHashMap.newKeySet();
    private final List<Class<? extends Throwable>> retryableFaults = new CopyOnWriteArrayList<>();
    private final List<Predicate<ProbeResult>> retryConditions = new CopyOnWriteArrayList<>();

    private final Map<String, ProbeCounters> statistics = new ConcurrentHashMap<>();

    @Autowired
    public RetryController(WardenProperties properties, MeterRegistry meterRegistry) {
        this(properties.getRetry(), meterRegistry);
    }

    public RetryController(WardenProperties.RetryConfig config, MeterRegistry meterRegistry) {
        this.config = config;
        this.retryableStatuses.addAll(config.getRetryableStatuses());
        this.retryableFaults.add(Exception.class);
        this.retryAttemptCounter = Counter.builder("warden.retry.attempts")
            .description("Probe attempts beyond the first")
            .register(meterRegistry);

        log.info("RetryController initialized: maxRetries={}, delay={}, backoff={}x, retryableStatuses={}",
            config.getMaxRetries(), config.getRetryDelay(), config.getBackoffMultiplier(), retryableStatuses);
    }

    /**
     * Execute a probe with retries
     *
     * @param maxRetries retries after the first attempt, null for the configured default
     * @param baseDelay  delay before the first retry, null for the configured default
     */
    public ProbeResult executeWithRetry(Probe probe, String target, Map<String, Object> context,
                                        Integer maxRetries, Duration baseDelay) {
        return execute(probe.getName(), target, () -> probe.run(target, context), maxRetries, baseDelay);
    }

    public ProbeResult execute(String probeName, String target, ProbeInvocation invocation,
                               Integer maxRetries, Duration baseDelay) {
        RetryPolicy policy = getDefaultPolicy();
        if (maxRetries != null || baseDelay != null) {
            policy = policy.toBuilder()
                .maxRetries(maxRetries != null ? maxRetries : policy.getMaxRetries())
                .initialDelay(baseDelay != null ? baseDelay : policy.getInitialDelay())
                .build();
        }
        return execute(probeName, target, invocation, policy);
    }

    /**
     * Execute an invocation under a retry policy
     *
     * @return one logical result; never throws for faults raised by the invocation
     */
    public ProbeResult execute(String probeName, String target, ProbeInvocation invocation, RetryPolicy policy) {
        List<RetryAttempt> attempts = new ArrayList<>();
        ProbeResult lastResult = null;
        int maxAttempts = Math.max(1, policy.getMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                retryAttemptCounter.increment();
            }

            long start = System.nanoTime();
            try {
                ProbeResult result = invocation.invoke();
                if (result == null) {
                    result = ProbeResult.noResult(probeName, target);
                }
                attempts.add(RetryAttempt.ofResult(attempt, result, elapsedSeconds(start)));

                if (!shouldRetry(result)) {
                    return finalizeResult(probeName, result, attempts);
                }
                log.debug("Probe {} attempt {}/{} returned {}, retrying", probeName, attempt, maxAttempts, result.getStatus());
                lastResult = result;
            } catch (InterruptedException e) {
                attempts.add(RetryAttempt.ofError(attempt, e, elapsedSeconds(start)));
                Thread.currentThread().interrupt();
                return createInterruptedResult(probeName, target, attempts);
            } catch (Exception e) {
                attempts.add(RetryAttempt.ofError(attempt, e, elapsedSeconds(start)));

                if (!isRetryableFault(e)) {
                    log.warn("Probe {} raised non-retryable {}: {}", probeName, e.getClass().getSimpleName(), e.getMessage());
                    ProbeResult error = createErrorResult(probeName, target, e, attempts);
                    recordStatistics(probeName, attempts, false);
                    return error;
                }
                log.debug("Probe {} attempt {}/{} raised {}, retrying", probeName, attempt, maxAttempts, e.toString());
                lastResult = createErrorResult(probeName, target, e, List.of());
            }

            if (attempt < maxAttempts) {
                Duration delay = policy.calculateBackoff(attempt, ThreadLocalRandom.current().nextDouble());
                if (!pause(delay)) {
                    return createInterruptedResult(probeName, target, attempts);
                }
            }
        }

        if (attempts.size() == 1) {
            // nothing was retried
            recordStatistics(probeName, attempts, false);
            return lastResult;
        }
        return createRetriesExhaustedResult(probeName, target, lastResult, attempts);
    }

    /**
     * Derive retry settings from recent failures of the same probe and target.
     * Error-prone targets get more retries; timeout-prone targets get longer delays.
     */
    public RetryPolicy calculateSmartRetryConfig(List<FailureRecord> failureHistory) {
        RetryPolicy base = getDefaultPolicy();
        if (failureHistory == null || failureHistory.isEmpty()) {
            return base;
        }

        List<FailureRecord> recent = failureHistory.subList(
            Math.max(0, failureHistory.size() - SMART_RETRY_WINDOW), failureHistory.size());

        int timeoutCount = 0;
        int errorCount = 0;
        double recoveryTotal = 0;
        for (FailureRecord failure : recent) {
            if (failure.getStatus() == ResultStatus.TIMEOUT) {
                timeoutCount++;
            } else if (failure.getStatus() == ResultStatus.ERROR) {
                errorCount++;
            }
            if (failure.getRecoveryTime() != null) {
                recoveryTotal += failure.getRecoveryTime();
            }
        }
        double averageRecovery = recoveryTotal / recent.size();

        int maxRetries = base.getMaxRetries();
        if (errorCount > timeoutCount) {
            maxRetries = Math.min(base.getMaxRetries() + 2, SMART_RETRY_CEILING);
        }

        Duration delay = base.getInitialDelay();
        if (timeoutCount > recent.size() * 0.5) {
            Duration doubled = delay.multipliedBy(2);
            delay = doubled.compareTo(SMART_DELAY_CEILING) < 0 ? doubled : SMART_DELAY_CEILING;
        }
        if (averageRecovery > 0) {
            Duration recoveryFloor = Duration.ofMillis((long) (averageRecovery * 0.1 * 1000));
            if (recoveryFloor.compareTo(delay) > 0) {
                delay = recoveryFloor;
            }
        }

        log.debug("Smart retry config from {} failures (errors={}, timeouts={}): maxRetries={}, delay={}",
            recent.size(), errorCount, timeoutCount, maxRetries, delay);

        return base.toBuilder()
            .maxRetries(maxRetries)
            .initialDelay(delay)
            .build();
    }

    public ProbeResult executeWithSmartRetry(Probe probe, String target, Map<String, Object> context,
                                             List<FailureRecord> failureHistory) {
        return execute(probe.getName(), target, () -> probe.run(target, context),
            calculateSmartRetryConfig(failureHistory));
    }

    /**
     * Retry policy built from the current configuration
     */
    public RetryPolicy getDefaultPolicy() {
        return RetryPolicy.from(config);
    }

    public void addRetryCondition(Predicate<ProbeResult> condition) {
        retryConditions.add(condition);
    }

    public void clearRetryConditions() {
        retryConditions.clear();
    }

    public void addRetryableStatus(ResultStatus status) {
        retryableStatuses.add(status);
    }

    public void removeRetryableStatus(ResultStatus status) {
        retryableStatuses.remove(status);
    }

    public Set<ResultStatus> getRetryableStatuses() {
        return retryableStatuses.isEmpty() ? EnumSet.noneOf(ResultStatus.class) : EnumSet.copyOf(retryableStatuses);
    }

    public void addRetryableFault(Class<? extends Throwable> faultType) {
        if (!retryableFaults.contains(faultType)) {
            retryableFaults.add(faultType);
        }
    }

    /**
     * Restrict retries to the given fault types
     */
    public void setRetryableFaults(List<Class<? extends Throwable>> faultTypes) {
        retryableFaults.clear();
        retryableFaults.addAll(faultTypes);
    }

    public RetryStatistics getStatistics() {
        Map<String, RetryStatistics.ProbeRetryStats> perProbe = new LinkedHashMap<>();
        long executions = 0;
        long attempts = 0;
        long successful = 0;
        long failed = 0;

        for (Map.Entry<String, ProbeCounters> entry : statistics.entrySet()) {
            RetryStatistics.ProbeRetryStats stats = entry.getValue().snapshot();
            perProbe.put(entry.getKey(), stats);
            executions += stats.getTotalExecutions();
            attempts += stats.getTotalAttempts();
            successful += stats.getSuccessfulRetries();
            failed += stats.getFailedRetries();
        }

        long retried = successful + failed;
        return RetryStatistics.builder()
            .probesWithRetries(perProbe.size())
            .totalExecutions(executions)
            .totalAttempts(attempts)
            .successfulRetries(successful)
            .failedRetries(failed)
            .overallRetryRate(executions > 0 ? (retried * 100.0) / executions : 0.0)
            .overallSuccessRate(retried > 0 ? (successful * 100.0) / retried : 0.0)
            .perProbe(perProbe)
            .build();
    }

    public void resetStatistics() {
        statistics.clear();
    }

    private boolean shouldRetry(ProbeResult result) {
        if (result.isNoResult()) {
            return false;
        }
        if (retryableStatuses.contains(result.getStatus())) {
            return true;
        }
        return retryConditions.stream().anyMatch(condition -> condition.test(result));
    }

    private boolean isRetryableFault(Exception e) {
        return retryableFaults.stream().anyMatch(type -> type.isInstance(e));
    }

    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ProbeResult finalizeResult(String probeName, ProbeResult result, List<RetryAttempt> attempts) {
        if (attempts.size() > 1) {
            result.addData("retry_attempts", attempts.size());
            result.addData("retry_history", summarize(attempts));
            result.setMessage(result.getMessage() + " (succeeded after " + attempts.size() + " attempts)");
            log.info("Probe {} completed with {} after {} attempts", probeName, result.getStatus(), attempts.size());
        }
        recordStatistics(probeName, attempts, true);
        return result;
    }

    private ProbeResult createErrorResult(String probeName, String target, Exception e, List<RetryAttempt> attempts) {
        ProbeResult result = ProbeResult.builder()
            .probeName(probeName)
            .status(ResultStatus.ERROR)
            .message("Probe failed: " + e.getMessage())
            .target(target)
            .executionTime(totalSeconds(attempts))
            .build()
            .addData("exception_class", e.getClass().getName())
            .addData("exception_message", e.getMessage());

        if (attempts.size() > 1) {
            result.addData("retry_attempts", attempts.size());
            result.addData("retry_history", summarize(attempts));
        }
        return result;
    }

    private ProbeResult createInterruptedResult(String probeName, String target, List<RetryAttempt> attempts) {
        log.warn("Retries of probe {} interrupted after {} attempts", probeName, attempts.size());
        recordStatistics(probeName, attempts, false);

        return ProbeResult.builder()
            .probeName(probeName)
            .status(ResultStatus.ERROR)
            .message("Probe interrupted after " + attempts.size() + " attempts")
            .target(target)
            .executionTime(totalSeconds(attempts))
            .build()
            .addData("retry_attempts", attempts.size())
            .addData("retry_history", summarize(attempts))
            .addData("interrupted", true);
    }

    private ProbeResult createRetriesExhaustedResult(String probeName, String target, ProbeResult lastResult,
                                                     List<RetryAttempt> attempts) {
        String message = "Probe failed after " + attempts.size() + " attempts";
        if (lastResult != null) {
            message += ": " + lastResult.getMessage();
        }

        ProbeResult result = ProbeResult.builder()
            .probeName(probeName)
            .status(ResultStatus.FAIL)
            .message(message)
            .target(target)
            .executionTime(totalSeconds(attempts))
            .build()
            .addData("retry_attempts", attempts.size())
            .addData("retry_history", summarize(attempts))
            .addData("retries_exhausted", true);

        if (lastResult != null) {
            result.addData("last_result_data", new LinkedHashMap<>(lastResult.getData()));
            result.setScore(lastResult.getScore());
        }

        log.warn("Probe {} failed after {} attempts on {}", probeName, attempts.size(), target);
        recordStatistics(probeName, attempts, false);
        return result;
    }

    private static List<Map<String, Object>> summarize(List<RetryAttempt> attempts) {
        return attempts.stream()
            .map(RetryAttempt::summarize)
            .collect(Collectors.toList());
    }

    private void recordStatistics(String probeName, List<RetryAttempt> attempts, boolean succeeded) {
        ProbeCounters counters = statistics.computeIfAbsent(String.valueOf(probeName), key -> new ProbeCounters());
        counters.executions.increment();
        counters.attempts.add(attempts.size());
        if (attempts.size() > 1) {
            if (succeeded) {
                counters.successfulRetries.increment();
            } else {
                counters.failedRetries.increment();
            }
        }
    }

    private static double totalSeconds(List<RetryAttempt> attempts) {
        return attempts.stream().mapToDouble(RetryAttempt::getExecutionTime).sum();
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static class ProbeCounters {
        private final LongAdder executions = new LongAdder();
        private final LongAdder attempts = new LongAdder();
        private final LongAdder successfulRetries = new LongAdder();
        private final LongAdder failedRetries = new LongAdder();

        RetryStatistics.ProbeRetryStats snapshot() {
            long total = executions.sum();
            long attemptCount = attempts.sum();
            return RetryStatistics.ProbeRetryStats.builder()
                .totalExecutions(total)
                .totalAttempts(attemptCount)
                .successfulRetries(successfulRetries.sum())
                .failedRetries(failedRetries.sum())
                .averageAttempts(total > 0 ? (double) attemptCount / total : 0.0)
                .build();
        }
    }
}

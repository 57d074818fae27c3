package com.whereq.warden.service;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.exception.WardenException;
import com.whereq.warden.executor.ProbeInvocation;
import com.whereq.warden.executor.RetryController;
import com.whereq.warden.executor.RetryPolicy;
import com.whereq.warden.executor.TimeoutController;
import com.whereq.warden.graph.DependencyGraph;
import com.whereq.warden.inversion.ResultInverter;
import com.whereq.warden.model.BatchResult;
import com.whereq.warden.model.DependencyAnalysis;
import com.whereq.warden.model.ProbeJob;
import com.whereq.warden.model.ProbeResult;
import com.whereq.warden.model.ProbeSuite;
import com.whereq.warden.model.ResourceHandle;
import com.whereq.warden.model.ResultStatus;
import com.whereq.warden.probe.Probe;
import com.whereq.warden.probe.ProbeRegistry;
import com.whereq.warden.resource.ConnectionPool;
import com.whereq.warden.scheduler.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs batches of probe jobs.
 *
 * A batch is validated, analyzed for dependencies, reordered by the scheduler and
 * then executed sequentially or on a bounded worker pool. Every job goes through
 * the configured retry and timeout controllers, borrows a pooled connection for
 * each attempt and has its inversion rule applied to the final result.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class ExecutionEngine {

    public static final String CONNECTION_CONTEXT_KEY = "connection";
    public static final String DEFAULT_BATCH_NAME = "Probe Batch";

    private final WardenProperties.ExecutionConfig config;
    private final ProbeRegistry probeRegistry;
    private final DependencyGraph dependencyGraph;
    private final JobScheduler scheduler;
    private final ConnectionPool connectionPool;
    private final TimeoutController timeoutController;
    private final RetryController retryController;
    private final ResultInverter resultInverter;
    private final ExecutionStatistics statistics;
    private final ExecutionHistory history;

    private final ThreadPoolExecutor workers;
    private final List<ProgressListener> progressListeners = new ArrayList<>();

    @Autowired
    public ExecutionEngine(WardenProperties properties,
                           ProbeRegistry probeRegistry,
                           DependencyGraph dependencyGraph,
                           JobScheduler scheduler,
                           ConnectionPool connectionPool,
                           TimeoutController timeoutController,
                           RetryController retryController,
                           ResultInverter resultInverter,
                           ExecutionStatistics statistics,
                           ExecutionHistory history) {
        this.config = properties.getExecution();
        this.probeRegistry = probeRegistry;
        this.dependencyGraph = dependencyGraph;
        this.scheduler = scheduler;
        this.connectionPool = connectionPool;
        this.timeoutController = timeoutController;
        this.retryController = retryController;
        this.resultInverter = resultInverter;
        this.statistics = statistics;
        this.history = history;

        int poolSize = config.getMaxParallelTests();
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(), runnable -> {
                Thread thread = new Thread(runnable, "warden-worker-" + threadCount.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        this.workers.allowCoreThreadTimeOut(true);

        log.info("ExecutionEngine initialized: parallel={}, maxParallelTests={}, timeouts={}, retries={}, inversion={}, failFast={}",
            config.isParallelExecution(), poolSize, config.isEnableTimeouts(), config.isEnableRetries(),
            config.isEnableResultInversion(), config.isFailFast());
    }

    public void addProgressListener(ProgressListener listener) {
        synchronized (progressListeners) {
            progressListeners.add(listener);
        }
    }

    public void removeProgressListener(ProgressListener listener) {
        synchronized (progressListeners) {
            progressListeners.remove(listener);
        }
    }

    public BatchResult executeBatch(List<ProbeJob> jobs) {
        return executeBatch(DEFAULT_BATCH_NAME, jobs, Map.of());
    }

    /**
     * Execute a batch of jobs
     *
     * @param name    batch name
     * @param jobs    jobs with batch-unique ids
     * @param context values handed to every probe; job context entries take precedence
     * @return results keyed by job id in the order they were recorded
     * @throws IllegalArgumentException if two jobs share an id
     * @throws com.whereq.warden.exception.CyclicDependencyException if the dependencies form a cycle
     * @throws com.whereq.warden.exception.UnknownInversionRuleException if a job names an unknown inversion rule
     */
    public BatchResult executeBatch(String name, List<ProbeJob> jobs, Map<String, Object> context) {
        long start = System.nanoTime();
        validate(jobs);

        DependencyAnalysis analysis = dependencyGraph.analyze(jobs);
        List<ProbeJob> ordered = scheduler.optimize(jobs, analysis);

        log.info("Executing batch '{}' with {} jobs ({} mode, critical path {})", name, jobs.size(),
            config.isParallelExecution() ? "parallel" : "sequential", analysis.getCriticalPath().getLength());

        Map<String, ProbeResult> results = config.isParallelExecution()
            ? executeParallel(ordered, context)
            : executeSequential(ordered, context);

        return completeBatch(name, jobs, context, results, start);
    }

    /**
     * Execute the jobs that fit into a time budget.
     * Jobs dropped by the scheduler are not part of the result; jobs reached too late are reported as timed out.
     */
    public BatchResult executeBatch(List<ProbeJob> jobs, Duration deadline) {
        long start = System.nanoTime();
        validate(jobs);

        double budget = seconds(deadline);
        DependencyAnalysis analysis = dependencyGraph.analyze(jobs);
        List<ProbeJob> admitted = scheduler.optimizeForDeadline(jobs, budget);
        List<ProbeJob> ordered = scheduler.enforceDependencyOrder(admitted, analysis);

        log.info("Executing {} of {} jobs within deadline {}", ordered.size(), jobs.size(), deadline);

        Map<String, ProbeResult> results = new LinkedHashMap<>();
        int index = 0;
        for (ProbeJob job : ordered) {
            notifyProgress(++index, ordered.size(), job.getId());

            double remaining = budget - elapsedSeconds(start);
            ProbeResult result;
            if (!canExecute(job, results)) {
                result = createDependencySkip(job, results);
            } else if (remaining <= 0 || remaining < job.getEstimatedDuration()) {
                result = createDeadlineTimeout(job, remaining);
            } else {
                result = executeJob(job, Map.of(), Duration.ofNanos((long) (remaining * 1_000_000_000L)));
            }
            results.put(job.getId(), result);
        }

        return completeBatch("Deadline Batch", jobs, Map.of(), results, start);
    }

    /**
     * Execute a batch on Reactor's bounded elastic scheduler
     */
    public Mono<BatchResult> executeBatchAsync(List<ProbeJob> jobs) {
        return executeBatchAsync(DEFAULT_BATCH_NAME, jobs, Map.of());
    }

    public Mono<BatchResult> executeBatchAsync(String name, List<ProbeJob> jobs, Map<String, Object> context) {
        return Mono.fromCallable(() -> executeBatch(name, jobs, context))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(e -> log.error("Batch '{}' failed: {}", name, e.getMessage(), e));
    }

    /**
     * Execute a single job outside of any batch. Dependencies are not checked.
     */
    public ProbeResult executeJob(ProbeJob job) {
        if (config.isEnableResultInversion() && job.getOptions().hasInversion()) {
            resultInverter.validateRule(job.getOptions().getInversionMode());
        }
        return executeJob(job, Map.of(), null);
    }

    /**
     * Run the enabled probes of a category against a target
     */
    public BatchResult executeByCategory(String category, String target, Map<String, Object> context) {
        return executeSuite(ProbeSuite.builder()
            .name("Category: " + category)
            .target(target)
            .context(context)
            .category(category)
            .build());
    }

    /**
     * Run the enabled probes carrying at least one of the tags against a target
     */
    public BatchResult executeByTags(Collection<String> tags, String target, Map<String, Object> context) {
        return executeSuite(ProbeSuite.builder()
            .name("Tags: " + String.join(", ", tags))
            .target(target)
            .context(context)
            .tags(tags)
            .build());
    }

    /**
     * Run every enabled probe against a target
     */
    public BatchResult executeAll(String target, Map<String, Object> context) {
        return executeSuite(ProbeSuite.builder()
            .name("All Probes")
            .target(target)
            .context(context)
            .build());
    }

    /**
     * Execute a suite as one batch, one job per selected probe with the probe name as job id.
     * Probes named explicitly run even when disabled; selection by category, tags or nothing takes enabled probes only.
     */
    public BatchResult executeSuite(ProbeSuite suite) {
        List<String> selected = selectProbes(suite);
        log.info("Suite '{}' selected {} probe(s): {}", suite.getName(), selected.size(), selected);

        List<ProbeJob> jobs = selected.stream()
            .map(probeName -> ProbeJob.builder()
                .id(probeName)
                .probeName(probeName)
                .target(suite.getTarget())
                .options(suite.getOptions())
                .build())
            .collect(Collectors.toList());
        return executeBatch(suite.getName() != null ? suite.getName() : DEFAULT_BATCH_NAME, jobs, suite.getContext());
    }

    /**
     * A job may run when every dependency has a result that is neither problematic nor skipped.
     * Dependencies outside the batch never have a result.
     */
    public boolean canExecute(ProbeJob job, Map<String, ProbeResult> completed) {
        return unmetDependencies(job, completed).isEmpty();
    }

    public ExecutionStatistics getStatistics() {
        return statistics;
    }

    public void resetStatistics() {
        statistics.reset();
        timeoutController.resetStatistics();
        retryController.resetStatistics();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down execution engine");
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private List<String> selectProbes(ProbeSuite suite) {
        if (!suite.getProbes().isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(suite.getProbes()));
        }

        Set<String> candidates = new TreeSet<>();
        if (!suite.getCategories().isEmpty()) {
            suite.getCategories().forEach(category -> candidates.addAll(probeRegistry.getByCategory(category)));
        } else if (!suite.getTags().isEmpty()) {
            candidates.addAll(probeRegistry.getByTags(suite.getTags()));
        } else {
            candidates.addAll(probeRegistry.names());
        }
        return candidates.stream()
            .filter(probeRegistry::isEnabled)
            .collect(Collectors.toList());
    }

    private void validate(List<ProbeJob> jobs) {
        Set<String> ids = new HashSet<>();
        for (ProbeJob job : jobs) {
            if (job.getId() == null || job.getId().isBlank()) {
                throw new IllegalArgumentException("Job id must not be blank");
            }
            if (!ids.add(job.getId())) {
                throw new IllegalArgumentException("Duplicate job id in batch: " + job.getId());
            }
            if (config.isEnableResultInversion() && job.getOptions().hasInversion()) {
                resultInverter.validateRule(job.getOptions().getInversionMode());
            }
        }
    }

    private Map<String, ProbeResult> executeSequential(List<ProbeJob> jobs, Map<String, Object> context) {
        Map<String, ProbeResult> results = new LinkedHashMap<>();
        int index = 0;
        for (ProbeJob job : jobs) {
            notifyProgress(++index, jobs.size(), job.getId());

            ProbeResult result = canExecute(job, results)
                ? executeJob(job, context, null)
                : createDependencySkip(job, results);
            results.put(job.getId(), result);

            if (config.isFailFast() && result.hasProblems()) {
                log.warn("Stopping batch after job {} returned {} (fail fast), {} jobs not run",
                    job.getId(), result.getStatus(), jobs.size() - index);
                break;
            }
        }
        return results;
    }

    /**
     * Coordinator loop: launch jobs whose in-batch dependencies are terminal, requeue the rest,
     * and record results as workers finish. Only this thread touches the result map.
     */
    private Map<String, ProbeResult> executeParallel(List<ProbeJob> jobs, Map<String, Object> context) {
        Map<String, ProbeResult> results = new LinkedHashMap<>();
        Set<String> batchIds = jobs.stream().map(ProbeJob::getId).collect(Collectors.toSet());
        Deque<ProbeJob> pending = new ArrayDeque<>(jobs);
        CompletionService<ProbeResult> completion = new ExecutorCompletionService<>(workers);
        Map<Future<ProbeResult>, ProbeJob> running = new HashMap<>();
        int maxInFlight = config.getMaxParallelTests();
        int started = 0;
        boolean stopLaunching = false;

        try {
            while ((!pending.isEmpty() && !stopLaunching) || !running.isEmpty()) {
                boolean progressed = false;
                int scanned = 0;
                int waiting = pending.size();

                while (!stopLaunching && running.size() < maxInFlight && scanned < waiting) {
                    ProbeJob job = pending.pollFirst();
                    scanned++;

                    if (!dependenciesTerminal(job, results, batchIds)) {
                        pending.addLast(job);
                        continue;
                    }

                    progressed = true;
                    notifyProgress(++started, jobs.size(), job.getId());
                    if (!canExecute(job, results)) {
                        results.put(job.getId(), createDependencySkip(job, results));
                        continue;
                    }
                    running.put(completion.submit(() -> executeJob(job, context, null)), job);
                }

                if (!running.isEmpty()) {
                    Future<ProbeResult> done = completion.take();
                    ProbeJob job = running.remove(done);
                    ProbeResult result = collect(job, done);
                    results.put(job.getId(), result);

                    if (config.isFailFast() && result.hasProblems() && !stopLaunching) {
                        stopLaunching = true;
                        log.warn("Job {} returned {} (fail fast), no further jobs will be launched",
                            job.getId(), result.getStatus());
                    }
                } else if (!progressed && !pending.isEmpty()) {
                    // only possible when dependencies can never resolve
                    while (!pending.isEmpty()) {
                        ProbeJob job = pending.pollFirst();
                        results.put(job.getId(), createDependencySkip(job, results));
                    }
                }
            }
        } catch (InterruptedException e) {
            running.keySet().forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new WardenException("Interrupted while executing batch", e);
        }
        return results;
    }

    private ProbeResult collect(ProbeJob job, Future<ProbeResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Worker failed while executing job {}", job.getId(), e.getCause());
            return createErrorResult(job, e.getCause() != null ? e.getCause() : e);
        }
    }

    private boolean dependenciesTerminal(ProbeJob job, Map<String, ProbeResult> results, Set<String> batchIds) {
        for (String dependency : job.getDependencies()) {
            if (batchIds.contains(dependency) && !results.containsKey(dependency)) {
                return false;
            }
        }
        return true;
    }

    private List<String> unmetDependencies(ProbeJob job, Map<String, ProbeResult> completed) {
        List<String> unmet = new ArrayList<>();
        for (String dependency : job.getDependencies()) {
            ProbeResult result = completed.get(dependency);
            if (result == null || result.hasProblems() || result.isSkipped()) {
                unmet.add(dependency);
            }
        }
        return unmet;
    }

    private ProbeResult executeJob(ProbeJob job, Map<String, Object> batchContext, Duration timeLimit) {
        long start = System.nanoTime();
        Map<String, Object> context = new LinkedHashMap<>(batchContext);
        context.putAll(job.getContext());

        ProbeResult result;
        try {
            Optional<Probe> probe = probeRegistry.find(job.getProbeName());
            if (probe.isEmpty()) {
                log.error("Probe not found for job {}: {}", job.getId(), job.getProbeName());
                result = createResult(job, ResultStatus.ERROR, "Probe not found: " + job.getProbeName());
            } else if (probe.get().shouldSkip(job.getTarget(), context)) {
                result = createResult(job, ResultStatus.SKIP, "Probe was skipped");
            } else {
                result = executeWithHandlers(probe.get(), job, context, timeLimit);
            }

            if (config.isEnableResultInversion() && job.getOptions().hasInversion()) {
                result = resultInverter.applyInversion(result, job.getOptions().getInversionMode());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = createErrorResult(job, e);
        } catch (Exception e) {
            log.error("Job {} ({}) failed: {}", job.getId(), job.getProbeName(), e.getMessage(), e);
            result = createErrorResult(job, e);
        }

        double elapsed = elapsedSeconds(start);
        if (result.getProbeName() == null) {
            result.setProbeName(job.getProbeName());
        }
        if (result.getTarget() == null) {
            result.setTarget(job.getTarget());
        }
        if (result.getExecutionTime() <= 0) {
            result.setExecutionTime(elapsed);
        }
        result.addContext("job_id", job.getId());
        result.addContext("target", job.getTarget());

        statistics.recordJob(job.getProbeName(), result, elapsed);
        history.record(job.getProbeName(), job.getTarget(), result);

        log.debug("Job {} finished: {}", job.getId(), result.getSummary());
        return result;
    }

    /**
     * Retries wrap timeout-bounded attempts; each attempt borrows its own pooled connection
     */
    private ProbeResult executeWithHandlers(Probe probe, ProbeJob job, Map<String, Object> context,
                                            Duration timeLimit) throws Exception {
        boolean useTimeout = config.isEnableTimeouts() && job.getOptions().isTimeoutEnabled();
        boolean useRetries = config.isEnableRetries() && job.getOptions().isRetriesEnabled();
        String probeName = job.getProbeName();
        String target = job.getTarget();

        ProbeInvocation pooled = () -> runWithConnection(probe, probeName, target, context);
        ProbeInvocation attempt = pooled;
        if (timeLimit != null) {
            // the batch deadline bounds every attempt, even with timeouts disabled
            Duration timeout = useTimeout ? resolveTimeout(job) : timeLimit;
            long deadline = System.nanoTime() + timeLimit.toNanos();
            attempt = () -> {
                Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
                if (remaining.isZero() || remaining.isNegative()) {
                    return timeoutController.createTimeoutResult(probeName, target, 0, 0);
                }
                return timeoutController.execute(probeName, target, pooled, timeout, remaining);
            };
        } else if (useTimeout) {
            Duration timeout = resolveTimeout(job);
            attempt = () -> timeoutController.execute(probeName, target, pooled, timeout);
        }

        if (useRetries) {
            return retryController.execute(probeName, target, attempt, resolveRetryPolicy(job));
        }
        return attempt.invoke();
    }

    private ProbeResult runWithConnection(Probe probe, String probeName, String target, Map<String, Object> context)
            throws Exception {
        ResourceHandle connection = connectionPool.acquire();
        try {
            Map<String, Object> attemptContext = new LinkedHashMap<>(context);
            attemptContext.put(CONNECTION_CONTEXT_KEY, connection);
            ProbeResult result = probe.run(target, attemptContext);
            if (result == null) {
                log.warn("Probe {} returned no result for {}", probeName, target);
                return ProbeResult.noResult(probeName, target);
            }
            return result;
        } catch (IOException e) {
            connection.markUnhealthy();
            throw e;
        } finally {
            connectionPool.release(connection);
        }
    }

    private Duration resolveTimeout(ProbeJob job) {
        Duration timeout;
        if (job.getOptions().getTimeout() != null) {
            timeout = job.getOptions().getTimeout();
        } else if (timeoutController.hasProbeTimeout(job.getProbeName())) {
            timeout = timeoutController.getProbeTimeout(job.getProbeName());
        } else if (config.isAdaptiveTimeouts()) {
            List<Double> times = history.getExecutionTimes(job.getProbeName(), job.getTarget());
            timeout = times.isEmpty()
                ? config.getExecutionTimeout()
                : timeoutController.calculateAdaptiveTimeout(job.getProbeName(), times);
        } else {
            timeout = config.getExecutionTimeout();
        }

        return timeout;
    }

    private RetryPolicy resolveRetryPolicy(ProbeJob job) {
        RetryPolicy policy = config.isSmartRetries()
            ? retryController.calculateSmartRetryConfig(history.getFailures(job.getProbeName(), job.getTarget()))
            : retryController.getDefaultPolicy();

        if (job.getOptions().getMaxRetries() != null || job.getOptions().getRetryDelay() != null) {
            policy = policy.toBuilder()
                .maxRetries(job.getOptions().getMaxRetries() != null
                    ? job.getOptions().getMaxRetries() : policy.getMaxRetries())
                .initialDelay(job.getOptions().getRetryDelay() != null
                    ? job.getOptions().getRetryDelay() : policy.getInitialDelay())
                .build();
        }
        return policy;
    }

    private BatchResult completeBatch(String name, List<ProbeJob> jobs, Map<String, Object> context,
                                      Map<String, ProbeResult> results, long start) {
        BatchResult batch = BatchResult.builder()
            .name(name)
            .target(commonTarget(jobs))
            .results(results)
            .executionTime(elapsedSeconds(start))
            .context(new LinkedHashMap<>(context))
            .build();

        ExecutionStatistics.BatchMetrics metrics = statistics.recordBatch(batch);
        log.info("Batch '{}' completed in {}s: {} results, {} passed, {} failed, success rate {}%",
            name, String.format(Locale.ROOT, "%.2f", batch.getExecutionTime()), batch.getTotalCount(),
            metrics.getPassedJobs(), metrics.getFailedJobs(), String.format(Locale.ROOT, "%.1f", metrics.getSuccessRate()));
        return batch;
    }

    private void notifyProgress(int current, int total, String jobId) {
        List<ProgressListener> listeners;
        synchronized (progressListeners) {
            listeners = new ArrayList<>(progressListeners);
        }
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(current, total, jobId);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for job {}: {}", jobId, e.getMessage(), e);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Progress: {}% ({}/{}) - {}",
                String.format(Locale.ROOT, "%.1f", current * 100.0 / total), current, total, jobId);
        }
    }

    private ProbeResult createDependencySkip(ProbeJob job, Map<String, ProbeResult> completed) {
        List<String> unmet = unmetDependencies(job, completed);
        log.info("Skipping job {}: dependencies not met {}", job.getId(), unmet);
        return createResult(job, ResultStatus.SKIP, "Dependencies not met")
            .addData("reason", "dependencies not met")
            .addData("unmet_dependencies", unmet)
            .addContext("job_id", job.getId())
            .addContext("target", job.getTarget());
    }

    private ProbeResult createDeadlineTimeout(ProbeJob job, double remaining) {
        log.warn("Job {} not started: {}s left before deadline, {}s estimated", job.getId(),
            String.format(Locale.ROOT, "%.2f", Math.max(0, remaining)), job.getEstimatedDuration());
        return createResult(job, ResultStatus.TIMEOUT, String.format(Locale.ROOT,
                "Deadline reached before execution (remaining: %.2fs, estimated: %.2fs)",
                Math.max(0, remaining), job.getEstimatedDuration()))
            .addData("deadline_exceeded", true)
            .addData("remaining_time", Math.max(0, remaining))
            .addData("estimated_duration", job.getEstimatedDuration())
            .addContext("job_id", job.getId())
            .addContext("target", job.getTarget());
    }

    private ProbeResult createErrorResult(ProbeJob job, Throwable error) {
        return createResult(job, ResultStatus.ERROR, "Probe execution failed: " + error.getMessage())
            .addData("exception_class", error.getClass().getName())
            .addData("exception_message", error.getMessage());
    }

    private static ProbeResult createResult(ProbeJob job, ResultStatus status, String message) {
        return ProbeResult.builder()
            .probeName(job.getProbeName())
            .status(status)
            .message(message)
            .target(job.getTarget())
            .build();
    }

    private static String commonTarget(List<ProbeJob> jobs) {
        Set<String> targets = jobs.stream()
            .map(ProbeJob::getTarget)
            .collect(Collectors.toSet());
        return targets.size() == 1 ? targets.iterator().next() : null;
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}

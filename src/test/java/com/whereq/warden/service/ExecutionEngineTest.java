package com.whereq.warden.service;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.exception.CyclicDependencyException;
import com.whereq.warden.exception.UnknownInversionRuleException;
import com.whereq.warden.executor.RetryController;
import com.whereq.warden.executor.TimeoutController;
import com.whereq.warden.graph.DependencyGraph;
import com.whereq.warden.inversion.ResultInverter;
import com.whereq.warden.model.BatchResult;
import com.whereq.warden.model.JobOptions;
import com.whereq.warden.model.ProbeJob;
import com.whereq.warden.model.ProbeResult;
import com.whereq.warden.model.ProbeSuite;
import com.whereq.warden.model.ResourceHandle;
import com.whereq.warden.model.ResultStatus;
import com.whereq.warden.probe.Probe;
import com.whereq.warden.probe.ProbeDescriptor;
import com.whereq.warden.probe.ProbeRegistry;
import com.whereq.warden.probe.ScriptedProbe;
import com.whereq.warden.resource.ConnectionPool;
import com.whereq.warden.scheduler.JobScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionEngineTest {

    private static final String TARGET = "https://example.com";

    private WardenProperties properties;
    private ProbeRegistry registry;
    private SimpleMeterRegistry meterRegistry;
    private ConnectionPool pool;
    private TimeoutController timeoutController;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new WardenProperties();
        properties.getRetry().setRetryDelay(Duration.ZERO);
        properties.getRetry().setJitter(false);
        properties.getTimeout().setMinTimeout(Duration.ofMillis(100));
        properties.getPool().setPoolSize(2);
        registry = new ProbeRegistry();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
            timeoutController.shutdown();
            pool.close();
        }
    }

    private ExecutionEngine engine() {
        pool = new ConnectionPool(properties, meterRegistry);
        timeoutController = new TimeoutController(properties, meterRegistry);
        engine = new ExecutionEngine(properties, registry, new DependencyGraph(), new JobScheduler(properties),
            pool, timeoutController, new RetryController(properties, meterRegistry), new ResultInverter(),
            new ExecutionStatistics(meterRegistry), new ExecutionHistory(properties));
        return engine;
    }

    private ScriptedProbe register(ScriptedProbe probe) {
        registry.register(probe.getName(), () -> probe);
        return probe;
    }

    private static ProbeJob.ProbeJobBuilder job(String id, String probeName) {
        return ProbeJob.builder().id(id).probeName(probeName).target(TARGET);
    }

    @Test
    void executeBatch_shouldSkipJobWhoseDependencyFailed() {
        register(ScriptedProbe.returning("ssl_certificate", ResultStatus.FAIL));
        ScriptedProbe headers = register(ScriptedProbe.passing("security_headers"));

        BatchResult batch = engine().executeBatch(List.of(
            job("A", "ssl_certificate").build(),
            job("B", "security_headers").dependency("A").build()));

        ProbeResult skipped = batch.getResult("B");
        assertEquals(ResultStatus.FAIL, batch.getResult("A").getStatus());
        assertEquals(ResultStatus.SKIP, skipped.getStatus());
        assertEquals("Dependencies not met", skipped.getMessage());
        assertEquals("dependencies not met", skipped.getData().get("reason"));
        assertEquals(List.of("A"), skipped.getData().get("unmet_dependencies"));
        assertEquals(0, headers.getInvocations());
    }

    @Test
    void executeBatch_shouldCascadeSkips() {
        register(ScriptedProbe.returning("dns_lookup", ResultStatus.ERROR));
        ScriptedProbe downstream = register(ScriptedProbe.passing("http_status"));
        properties.getRetry().setMaxRetries(0);

        BatchResult batch = engine().executeBatch(List.of(
            job("dns", "dns_lookup").build(),
            job("status", "http_status").dependency("dns").build(),
            job("content", "http_status").dependency("status").build()));

        assertEquals(ResultStatus.SKIP, batch.getResult("status").getStatus());
        assertEquals(ResultStatus.SKIP, batch.getResult("content").getStatus());
        assertEquals(0, downstream.getInvocations());
    }

    @Test
    void executeBatch_shouldRunDependenciesFirstAndRecordAllResults() {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        for (String name : List.of("first", "second", "third")) {
            registry.register(name, () -> new RecordingProbe(name, calls));
        }

        BatchResult batch = engine().executeBatch(List.of(
            job("3", "third").priority(1000).dependency("2").build(),
            job("2", "second").priority(500).dependency("1").build(),
            job("1", "first").priority(1).build()));

        assertEquals(List.of("first", "second", "third"), calls);
        assertEquals(3, batch.getTotalCount());
        assertEquals(100.0, batch.getSuccessRate(), 1e-9);
        assertEquals(TARGET, batch.getTarget());
    }

    @Test
    void executeBatch_shouldTreatExternalDependencyAsUnmet() {
        ScriptedProbe probe = register(ScriptedProbe.passing("http_status"));

        BatchResult batch = engine().executeBatch(List.of(job("A", "http_status").dependency("elsewhere").build()));

        assertEquals(ResultStatus.SKIP, batch.getResult("A").getStatus());
        assertEquals(0, probe.getInvocations());
    }

    @Test
    void executeBatch_shouldRejectCyclesBeforeRunningAnything() {
        ScriptedProbe probe = register(ScriptedProbe.passing("http_status"));
        ExecutionEngine executionEngine = engine();

        assertThrows(CyclicDependencyException.class, () -> executionEngine.executeBatch(List.of(
            job("A", "http_status").dependency("B").build(),
            job("B", "http_status").dependency("A").build())));
        assertEquals(0, probe.getInvocations());
    }

    @Test
    void executeBatch_shouldRejectDuplicateIdsAndUnknownInversions() {
        ScriptedProbe probe = register(ScriptedProbe.passing("http_status"));
        ExecutionEngine executionEngine = engine();

        assertThrows(IllegalArgumentException.class, () -> executionEngine.executeBatch(List.of(
            job("A", "http_status").build(),
            job("A", "http_status").build())));
        assertThrows(UnknownInversionRuleException.class, () -> executionEngine.executeBatch(List.of(
            job("A", "http_status").build(),
            job("B", "http_status").options(JobOptions.builder().inversionMode("sideways").build()).build())));
        assertEquals(0, probe.getInvocations());
    }

    @Test
    void executeBatch_shouldReportUnknownProbeAsError() {
        BatchResult batch = engine().executeBatch(List.of(job("A", "does_not_exist").build()));

        ProbeResult result = batch.getResult("A");
        assertEquals(ResultStatus.ERROR, result.getStatus());
        assertEquals("Probe not found: does_not_exist", result.getMessage());
    }

    @Test
    void executeBatch_shouldApplyInversion() {
        register(ScriptedProbe.passing("admin_panel"));

        BatchResult batch = engine().executeBatch(List.of(job("A", "admin_panel")
            .options(JobOptions.builder().inversionMode(ResultInverter.EXPECT_FAILURE).build())
            .build()));

        ProbeResult result = batch.getResult("A");
        assertEquals(ResultStatus.FAIL, result.getStatus());
        assertEquals("pass", result.getData().get("original_status"));
    }

    @Test
    void executeBatch_shouldSkipInversionWhenDisabled() {
        properties.getExecution().setEnableResultInversion(false);
        register(ScriptedProbe.passing("admin_panel"));

        BatchResult batch = engine().executeBatch(List.of(job("A", "admin_panel")
            .options(JobOptions.builder().inversionMode("unregistered").build())
            .build()));

        assertEquals(ResultStatus.PASS, batch.getResult("A").getStatus());
    }

    @Test
    void executeBatch_shouldRetryTransientErrors() {
        ScriptedProbe probe = register(ScriptedProbe.returning("flaky_api",
            ResultStatus.ERROR, ResultStatus.ERROR, ResultStatus.PASS));

        BatchResult batch = engine().executeBatch(List.of(job("A", "flaky_api").build()));

        ProbeResult result = batch.getResult("A");
        assertEquals(ResultStatus.PASS, result.getStatus());
        assertEquals(3, result.getData().get("retry_attempts"));
        assertEquals(3, probe.getInvocations());
    }

    @Test
    void executeBatch_shouldHonorPerJobRetryOverride() {
        ScriptedProbe probe = register(ScriptedProbe.returning("flaky_api", ResultStatus.ERROR));

        BatchResult batch = engine().executeBatch(List.of(job("A", "flaky_api")
            .options(JobOptions.builder().maxRetries(1).build())
            .build()));

        assertEquals(ResultStatus.FAIL, batch.getResult("A").getStatus());
        assertEquals(true, batch.getResult("A").getData().get("retries_exhausted"));
        assertEquals(2, probe.getInvocations());
    }

    @Test
    void executeBatch_shouldTimeOutSlowProbe() {
        register(ScriptedProbe.sleeping("slow_page", Duration.ofSeconds(3)));

        BatchResult batch = engine().executeBatch(List.of(job("A", "slow_page")
            .options(JobOptions.builder().timeout(Duration.ofMillis(200)).retriesEnabled(false).build())
            .build()));

        ProbeResult result = batch.getResult("A");
        assertEquals(ResultStatus.TIMEOUT, result.getStatus());
        assertEquals(0.2, (double) result.getData().get("timeout_limit"), 1e-9);
        assertTrue((double) result.getData().get("actual_execution_time") >= 0.2);
        assertTrue(batch.getExecutionTime() < 2.0);
    }

    @Test
    void executeBatch_shouldTurnUnretriedFaultIntoError() {
        properties.getExecution().setEnableRetries(false);
        register(ScriptedProbe.scripted("tls_handshake", new IOException("connection reset")));

        BatchResult batch = engine().executeBatch(List.of(job("A", "tls_handshake").build()));

        ProbeResult result = batch.getResult("A");
        assertEquals(ResultStatus.ERROR, result.getStatus());
        assertEquals(IOException.class.getName(), result.getData().get("exception_class"));
        assertEquals("connection reset", result.getData().get("exception_message"));
    }

    @Test
    void executeBatch_shouldLendConnectionForEachAttempt() {
        ScriptedProbe probe = register(ScriptedProbe.passing("http_status"));

        engine().executeBatch(List.of(job("A", "http_status").contextValue("method", "HEAD").build()));

        Map<String, Object> context = probe.getContexts().get(0);
        assertTrue(context.get(ExecutionEngine.CONNECTION_CONTEXT_KEY) instanceof ResourceHandle);
        assertEquals("HEAD", context.get("method"));
        assertEquals(0, pool.getInUseCount());
    }

    @Test
    void executeBatch_shouldAnnotateResultsWithJobContext() {
        register(ScriptedProbe.passing("http_status"));

        BatchResult batch = engine().executeBatch(List.of(job("A", "http_status").build()));

        ProbeResult result = batch.getResult("A");
        assertEquals("A", result.getContext().get("job_id"));
        assertEquals(TARGET, result.getContext().get("target"));
        assertTrue(result.getExecutionTime() > 0);
    }

    @Test
    void executeBatch_shouldHonorProbeSkip() {
        registry.register("robots_txt", () -> new Probe() {
            @Override
            public String getName() {
                return "robots_txt";
            }

            @Override
            public ProbeResult run(String target, Map<String, Object> context) {
                throw new AssertionError("skipped probe must not run");
            }

            @Override
            public boolean shouldSkip(String target, Map<String, Object> context) {
                return true;
            }
        });

        BatchResult batch = engine().executeBatch(List.of(job("A", "robots_txt").build()));

        assertEquals(ResultStatus.SKIP, batch.getResult("A").getStatus());
    }

    @Test
    void executeBatch_shouldStopAtFirstProblemWhenFailingFast() {
        properties.getExecution().setFailFast(true);
        register(ScriptedProbe.returning("ssl_certificate", ResultStatus.FAIL));
        ScriptedProbe later = register(ScriptedProbe.passing("http_status"));

        BatchResult batch = engine().executeBatch(List.of(
            job("A", "ssl_certificate").priority(900).build(),
            job("B", "http_status").priority(1).build()));

        assertEquals(1, batch.getTotalCount());
        assertNull(batch.getResult("B"));
        assertEquals(0, later.getInvocations());
    }

    @Test
    void executeBatch_shouldRunIndependentJobsInParallel() {
        properties.getExecution().setParallelExecution(true);
        properties.getExecution().setMaxParallelTests(4);
        List<ProbeJob> jobs = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            register(ScriptedProbe.sleeping("slow_" + i, Duration.ofMillis(500)));
            jobs.add(job("job" + i, "slow_" + i).build());
        }

        BatchResult batch = engine().executeBatch(jobs);

        assertEquals(4, batch.getPassedCount());
        assertTrue(batch.getExecutionTime() < 1.5, "took " + batch.getExecutionTime() + "s");
    }

    @Test
    void executeBatch_shouldRespectDependenciesInParallel() {
        properties.getExecution().setParallelExecution(true);
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        for (String name : List.of("first", "second", "independent")) {
            registry.register(name, () -> new RecordingProbe(name, calls));
        }
        register(ScriptedProbe.returning("broken", ResultStatus.FAIL));
        ScriptedProbe unreachable = register(ScriptedProbe.passing("unreachable"));

        BatchResult batch = engine().executeBatch(List.of(
            job("2", "second").dependency("1").build(),
            job("1", "first").build(),
            job("x", "independent").build(),
            job("bad", "broken").build(),
            job("after_bad", "unreachable").dependency("bad").build()));

        assertEquals(5, batch.getTotalCount());
        assertTrue(calls.indexOf("first") < calls.indexOf("second"));
        assertEquals(ResultStatus.SKIP, batch.getResult("after_bad").getStatus());
        assertEquals(0, unreachable.getInvocations());
    }

    @Test
    void executeBatch_shouldNotifyProgressListeners() {
        register(ScriptedProbe.passing("http_status"));
        List<String> progress = new ArrayList<>();
        ExecutionEngine executionEngine = engine();
        executionEngine.addProgressListener((current, total, jobId) -> {
            throw new IllegalStateException("listener failure");
        });
        executionEngine.addProgressListener((current, total, jobId) -> progress.add(current + "/" + total + ":" + jobId));

        executionEngine.executeBatch(List.of(job("A", "http_status").build(), job("B", "http_status").build()));

        assertEquals(List.of("1/2:A", "2/2:B"), progress);
    }

    @Test
    void executeBatchWithDeadline_shouldTimeOutJobsReachedTooLate() {
        register(ScriptedProbe.sleeping("slow_page", Duration.ofMillis(400)));
        ScriptedProbe late = register(ScriptedProbe.passing("late_probe"));
        ScriptedProbe dropped = register(ScriptedProbe.passing("huge_probe"));

        BatchResult batch = engine().executeBatch(List.of(
            job("slow", "slow_page").estimatedDuration(0.1).build(),
            job("late", "late_probe").estimatedDuration(0.5).build(),
            job("huge", "huge_probe").estimatedDuration(5.0).build()), Duration.ofMillis(700));

        assertEquals(ResultStatus.PASS, batch.getResult("slow").getStatus());
        ProbeResult timedOut = batch.getResult("late");
        assertEquals(ResultStatus.TIMEOUT, timedOut.getStatus());
        assertEquals(true, timedOut.getData().get("deadline_exceeded"));
        assertTrue(timedOut.getMessage().startsWith("Deadline reached before execution"));
        assertNull(batch.getResult("huge"));
        assertEquals(0, late.getInvocations());
        assertEquals(0, dropped.getInvocations());
    }

    @ParameterizedTest
    @CsvSource({"true", "false"})
    void executeBatchWithDeadline_shouldStopJobsAtTheDeadline(boolean timeouts) {
        properties.getTimeout().setMinTimeout(Duration.ofSeconds(2));
        properties.getExecution().setEnableTimeouts(timeouts);
        properties.getExecution().setEnableRetries(false);
        register(ScriptedProbe.sleeping("slow_page", Duration.ofSeconds(5)));
        ExecutionEngine executionEngine = engine();

        long start = System.nanoTime();
        BatchResult batch = executionEngine.executeBatch(List.of(
            job("slow", "slow_page").estimatedDuration(0.05).build()), Duration.ofMillis(300));
        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;

        ProbeResult result = batch.getResult("slow");
        assertEquals(ResultStatus.TIMEOUT, result.getStatus());
        assertTrue((double) result.getData().get("timeout_limit") <= 0.3);
        assertTrue(elapsed < 1.5, "deadline overrun, took " + elapsed + "s");
    }

    @Test
    void executeBatchAsync_shouldEmitBatchResult() {
        register(ScriptedProbe.passing("http_status"));
        ExecutionEngine executionEngine = engine();

        StepVerifier.create(executionEngine.executeBatchAsync(List.of(job("A", "http_status").build())))
            .assertNext(batch -> assertEquals(ResultStatus.PASS, batch.getResult("A").getStatus()))
            .verifyComplete();
    }

    @Test
    void executeBatchAsync_shouldSignalBatchErrors() {
        register(ScriptedProbe.passing("http_status"));
        ExecutionEngine executionEngine = engine();

        StepVerifier.create(executionEngine.executeBatchAsync(List.of(
                job("A", "http_status").dependency("A").build())))
            .expectError(CyclicDependencyException.class)
            .verify();
    }

    @Test
    void executeJob_shouldRunSingleJobWithoutDependencyCheck() {
        register(ScriptedProbe.passing("http_status"));

        ProbeResult result = engine().executeJob(job("A", "http_status").dependency("elsewhere").build());

        assertEquals(ResultStatus.PASS, result.getStatus());
    }

    @Test
    void statistics_shouldRecordJobsAndBatches() {
        register(ScriptedProbe.passing("http_status"));
        register(ScriptedProbe.returning("headers", ResultStatus.FAIL));
        ExecutionEngine executionEngine = engine();

        executionEngine.executeBatch(List.of(job("A", "http_status").build(), job("B", "headers").build()));

        ExecutionStatistics.BatchMetrics metrics = executionEngine.getStatistics().getLastBatch();
        assertEquals(2, metrics.getTotalJobs());
        assertEquals(1, metrics.getPassedJobs());
        assertEquals(1, metrics.getFailedJobs());
        assertEquals(50.0, metrics.getSuccessRate(), 1e-9);
        assertTrue(metrics.getBatchId().startsWith("batch_"));
        assertEquals(1, executionEngine.getStatistics().getProbeStatistics("headers").getTotalExecutions());
        assertEquals(1.0, meterRegistry.get("warden.jobs.executed").tag("status", "fail").counter().count());
        assertEquals(1.0, meterRegistry.get("warden.batches.executed").counter().count());
    }

    @Test
    void canExecute_shouldRequireSuccessfulDependencies() {
        ProbeJob dependent = job("B", "http_status").dependency("A").build();
        ExecutionEngine executionEngine = engine();

        assertFalse(executionEngine.canExecute(dependent, Map.of()));
        assertFalse(executionEngine.canExecute(dependent, Map.of("A", ProbeResult.of("x", ResultStatus.SKIP, ""))));
        assertFalse(executionEngine.canExecute(dependent, Map.of("A", ProbeResult.of("x", ResultStatus.TIMEOUT, ""))));
        assertTrue(executionEngine.canExecute(dependent, Map.of("A", ProbeResult.of("x", ResultStatus.WARNING, ""))));
    }

    @ParameterizedTest
    @CsvSource({"true, true", "true, false", "false, true", "false, false"})
    void executeBatch_shouldReportMissingResultAsErrorUnderEveryPipeline(boolean timeouts, boolean retries) {
        properties.getExecution().setEnableTimeouts(timeouts);
        properties.getExecution().setEnableRetries(retries);
        AtomicInteger calls = new AtomicInteger();
        registry.register("silent", () -> new Probe() {
            @Override
            public String getName() {
                return "silent";
            }

            @Override
            public ProbeResult run(String target, Map<String, Object> context) {
                calls.incrementAndGet();
                return null;
            }
        });

        BatchResult batch = engine().executeBatch(List.of(job("quiet", "silent").build()));

        ProbeResult result = batch.getResult("quiet");
        assertEquals(ResultStatus.ERROR, result.getStatus());
        assertEquals("Probe returned no result", result.getMessage());
        assertTrue(result.isNoResult());
        assertEquals("silent", result.getProbeName());
        assertEquals(1, calls.get());
        assertEquals(0, pool.getInUseCount());
    }

    @Test
    void executeByCategory_shouldRunEnabledProbesOfTheCategory() {
        ScriptedProbe status = registerIn("http_status", "network");
        ScriptedProbe dns = registerIn("dns_lookup", "network");
        ScriptedProbe certificate = registerIn("ssl_certificate", "security");
        registry.disable("dns_lookup");

        BatchResult batch = engine().executeByCategory("network", TARGET, Map.of("user_agent", "warden"));

        assertEquals("Category: network", batch.getName());
        assertEquals(List.of("http_status"), List.copyOf(batch.getResults().keySet()));
        assertEquals(ResultStatus.PASS, batch.getResult("http_status").getStatus());
        assertEquals("warden", status.getContexts().get(0).get("user_agent"));
        assertEquals(0, dns.getInvocations());
        assertEquals(0, certificate.getInvocations());
    }

    @Test
    void executeByTags_shouldRunProbesCarryingAnyTag() {
        registry.register(ProbeDescriptor.builder().name("ssl_certificate").tag("tls").build(),
            () -> ScriptedProbe.passing("ssl_certificate"));
        registry.register(ProbeDescriptor.builder().name("dns_lookup").tag("fast").build(),
            () -> ScriptedProbe.passing("dns_lookup"));
        registerIn("http_status", "network");

        BatchResult batch = engine().executeByTags(List.of("tls", "fast"), TARGET, Map.of());

        assertEquals(List.of("dns_lookup", "ssl_certificate"), List.copyOf(batch.getResults().keySet()));
    }

    @Test
    void executeAll_shouldSkipDisabledProbes() {
        registerIn("http_status", "network");
        registerIn("dns_lookup", "network");
        ScriptedProbe certificate = registerIn("ssl_certificate", "security");
        registry.disableCategory("security");

        BatchResult batch = engine().executeAll(TARGET, Map.of());

        assertEquals(List.of("dns_lookup", "http_status"), List.copyOf(batch.getResults().keySet()));
        assertEquals(0, certificate.getInvocations());
    }

    @Test
    void executeSuite_shouldPreferExplicitProbesAndApplyOptions() {
        registerIn("http_status", "network");
        registerIn("dns_lookup", "network");
        ScriptedProbe certificate = registerIn("ssl_certificate", "security");
        registry.disable("ssl_certificate");

        BatchResult batch = engine().executeSuite(ProbeSuite.builder()
            .name("Release checks")
            .target(TARGET)
            .probe("ssl_certificate")
            .probe("http_status")
            .category("network")
            .options(JobOptions.builder().inversionMode(ResultInverter.EXPECT_FAILURE).build())
            .build());

        assertEquals("Release checks", batch.getName());
        assertEquals(2, batch.getResults().size());
        assertEquals(ResultStatus.FAIL, batch.getResult("ssl_certificate").getStatus());
        assertEquals(ResultStatus.FAIL, batch.getResult("http_status").getStatus());
        assertEquals(1, certificate.getInvocations());
    }

    @Test
    void executeSuite_shouldReturnEmptyBatchWhenNothingIsSelected() {
        registerIn("http_status", "network");

        BatchResult batch = engine().executeSuite(ProbeSuite.builder()
            .name("Empty")
            .target(TARGET)
            .category("security")
            .build());

        assertTrue(batch.getResults().isEmpty());
    }

    private ScriptedProbe registerIn(String name, String category) {
        ScriptedProbe probe = ScriptedProbe.passing(name);
        registry.register(ProbeDescriptor.builder().name(name).category(category).build(), () -> probe);
        return probe;
    }

    private static class RecordingProbe implements Probe {
        private static final AtomicInteger SEQUENCE = new AtomicInteger();

        private final String name;
        private final List<String> calls;

        RecordingProbe(String name, List<String> calls) {
            this.name = name;
            this.calls = calls;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public ProbeResult run(String target, Map<String, Object> context) throws Exception {
            Thread.sleep(20);
            calls.add(name);
            return ProbeResult.of(name, ResultStatus.PASS, "call " + SEQUENCE.incrementAndGet());
        }
    }
}

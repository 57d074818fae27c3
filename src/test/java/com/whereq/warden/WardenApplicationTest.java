package com.whereq.warden;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.model.BatchResult;
import com.whereq.warden.model.ProbeJob;
import com.whereq.warden.model.ResultStatus;
import com.whereq.warden.probe.ProbeRegistry;
import com.whereq.warden.probe.ScriptedProbe;
import com.whereq.warden.service.AggregatedResult;
import com.whereq.warden.service.ExecutionEngine;
import com.whereq.warden.service.ResultAggregator;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
    "warden.retry.retry-delay=0s",
    "warden.pool.pool-size=2"
})
class WardenApplicationTest {

    @Autowired
    private WardenProperties properties;

    @Autowired
    private ProbeRegistry probeRegistry;

    @Autowired
    private ExecutionEngine executionEngine;

    @Autowired
    private ResultAggregator resultAggregator;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void contextLoads_shouldBindConfiguration() {
        assertEquals(Duration.ZERO, properties.getRetry().getRetryDelay());
        assertEquals(2, properties.getPool().getPoolSize());
        assertEquals(Duration.ofSeconds(300), properties.getExecution().getExecutionTimeout());
        assertEquals(0.4, properties.getAggregation().getScoreWeights().get("security"), 1e-9);
        assertTrue(properties.getRetry().getRetryableStatuses().contains(ResultStatus.TIMEOUT));
        assertEquals(WardenProperties.TimeoutStrategyType.INTERRUPT, properties.getTimeout().getStrategy());
    }

    @Test
    void executeBatch_shouldRunThroughWiredComponents() {
        probeRegistry.register("status_check", () -> ScriptedProbe.passing("status_check"));

        BatchResult batch = executionEngine.executeBatch(List.of(
            ProbeJob.builder().id("status").probeName("status_check").target("https://example.com").build()));
        AggregatedResult aggregated = resultAggregator.aggregate(batch);

        assertEquals(ResultStatus.PASS, batch.getResult("status").getStatus());
        assertEquals(100.0, aggregated.getSummary().getSuccessRate(), 1e-9);
        assertNotNull(meterRegistry.find("warden.pool.available").gauge());
    }
}

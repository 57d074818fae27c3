package com.whereq.warden.resource;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.exception.ResourceExhaustedException;
import com.whereq.warden.model.ResourceHandle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionPoolTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ConnectionPool pool;

    private ConnectionPool createPool(int poolSize, int maxConnections, Duration acquireTimeout) {
        WardenProperties.PoolConfig config = new WardenProperties.PoolConfig();
        config.setPoolSize(poolSize);
        config.setMaxConnections(maxConnections);
        config.setAcquireTimeout(acquireTimeout);
        config.setPollInterval(Duration.ofMillis(10));
        pool = new ConnectionPool(config, meterRegistry);
        return pool;
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    @Test
    void constructor_shouldWarmPool() {
        createPool(3, 5, Duration.ofSeconds(1));

        assertEquals(3, pool.getAvailableCount());
        assertEquals(0, pool.getInUseCount());
        assertEquals(3.0, meterRegistry.get("warden.pool.available").gauge().value());
    }

    @Test
    void acquire_shouldFailOnceMaxConnectionsAreBorrowed() {
        createPool(2, 5, Duration.ofMillis(200));
        List<ResourceHandle> borrowed = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            borrowed.add(pool.acquire());
        }

        long start = System.nanoTime();
        ResourceExhaustedException error = assertThrows(ResourceExhaustedException.class, pool::acquire);
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(waitedMillis >= 150, "waited " + waitedMillis + "ms");
        assertTrue(error.getMessage().contains("Timeout waiting for available connection"));
        assertEquals(5, pool.getInUseCount());
        assertEquals(1.0, meterRegistry.get("warden.pool.exhausted").counter().count());
        assertEquals(5, borrowed.stream().map(ResourceHandle::getId).distinct().count());
    }

    @Test
    void release_shouldUnblockWaiter() throws Exception {
        createPool(1, 1, Duration.ofSeconds(5));
        ResourceHandle first = pool.acquire();

        CompletableFuture<ResourceHandle> waiter = CompletableFuture.supplyAsync(pool::acquire);
        Thread.sleep(100);
        assertFalse(waiter.isDone());

        pool.release(first);
        ResourceHandle second = waiter.get(2, TimeUnit.SECONDS);

        assertSame(first, second);
        assertEquals(2, second.getUsageCount());
    }

    @Test
    void release_shouldIgnoreHandleNotInUse() {
        createPool(1, 2, Duration.ofSeconds(1));
        ResourceHandle handle = pool.acquire();
        pool.release(handle);

        pool.release(handle);

        assertEquals(1, pool.getAvailableCount());
        assertEquals(0, pool.getInUseCount());
    }

    @Test
    void release_shouldDestroyUnhealthyHandle() {
        createPool(1, 2, Duration.ofSeconds(1));
        ResourceHandle handle = pool.acquire();
        handle.markUnhealthy();

        pool.release(handle);
        ResourceHandle replacement = pool.acquire();

        assertNotEquals(handle.getId(), replacement.getId());
        assertTrue(replacement.isHealthy());
        assertTrue(pool.getHandle(handle.getId()).isEmpty());
    }

    @Test
    void release_shouldDestroyHandlesBeyondPoolSize() {
        createPool(1, 3, Duration.ofSeconds(1));
        ResourceHandle a = pool.acquire();
        ResourceHandle b = pool.acquire();

        pool.release(a);
        pool.release(b);

        assertEquals(1, pool.getAvailableCount());
        assertEquals(1, pool.getTotalCount());
    }

    @Test
    void cleanup_shouldRemoveUnhealthyAvailableHandles() {
        createPool(3, 3, Duration.ofSeconds(1));
        pool.getHandle(1).orElseThrow().markUnhealthy();

        int cleaned = pool.cleanup();

        assertEquals(1, cleaned);
        assertEquals(2, pool.getAvailableCount());
    }

    @Test
    void healthCheck_shouldReportCounts() {
        createPool(2, 4, Duration.ofSeconds(1));
        ResourceHandle borrowed = pool.acquire();
        borrowed.markUnhealthy();

        PoolHealth health = pool.healthCheck();

        assertEquals(1, health.getHealthy());
        assertEquals(1, health.getUnhealthy());
        assertEquals(1, health.getInUse());
        assertFalse(health.isAllHealthy());
    }

    @Test
    void resize_shouldGrowAndShrinkAvailableHandles() {
        createPool(2, 4, Duration.ofSeconds(1));

        pool.resize(4);
        assertEquals(4, pool.getAvailableCount());

        pool.resize(1);
        assertEquals(1, pool.getAvailableCount());
        assertEquals(1, pool.getPoolSize());

        assertThrows(IllegalArgumentException.class, () -> pool.resize(-1));
    }

    @Test
    void forceReleaseAll_shouldReclaimBorrowedHandles() {
        createPool(2, 4, Duration.ofSeconds(1));
        pool.acquire();
        pool.acquire();

        assertEquals(2, pool.forceReleaseAll());
        assertEquals(0, pool.getInUseCount());
        assertEquals(2, pool.getAvailableCount());
    }

    @Test
    void stats_shouldReflectUsage() {
        createPool(2, 4, Duration.ofSeconds(1));
        pool.acquire();

        PoolStats stats = pool.getStats();

        assertEquals(1, stats.getInUse());
        assertEquals(1, stats.getAvailable());
        assertEquals(2, stats.getTotal());
        assertEquals(50.0, stats.getUtilizationRate(), 1e-9);
        assertEquals(0.5, stats.getAverageUsage(), 1e-9);
    }

    @Test
    void close_shouldFailFurtherAcquires() {
        createPool(1, 1, Duration.ofSeconds(1));

        pool.close();

        assertThrows(ResourceExhaustedException.class, pool::acquire);
        assertEquals(0, pool.getTotalCount());
    }
}

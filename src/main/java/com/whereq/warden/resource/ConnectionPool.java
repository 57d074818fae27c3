package com.whereq.warden.resource;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.exception.ResourceExhaustedException;
import com.whereq.warden.model.ConnectionConfig;
import com.whereq.warden.model.ResourceHandle;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of reusable outbound-connection handles.
 *
 * A handle is always in exactly one of the "available" or "in-use" sets.
 * At most {@code maxConnections} handles are borrowed at once; callers beyond
 * that wait until a handle is released or the acquire timeout passes.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class ConnectionPool implements AutoCloseable {

    private final WardenProperties.PoolConfig config;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();

    private final LinkedList<ResourceHandle> available = new LinkedList<>();
    private final Map<Long, ResourceHandle> inUse = new LinkedHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    private final Counter exhaustedCounter;

    private volatile int poolSize;
    private volatile boolean closed;

    @Autowired
    public ConnectionPool(WardenProperties properties, MeterRegistry meterRegistry) {
        this(properties.getPool(), meterRegistry);
    }

    public ConnectionPool(WardenProperties.PoolConfig config, MeterRegistry meterRegistry) {
        this.config = config;
        this.poolSize = config.getPoolSize();

        Gauge.builder("warden.pool.available", this::getAvailableCount)
            .description("Idle connection handles ready for reuse")
            .register(meterRegistry);

        Gauge.builder("warden.pool.in_use", this::getInUseCount)
            .description("Connection handles currently borrowed")
            .register(meterRegistry);

        Gauge.builder("warden.pool.total", this::getTotalCount)
            .description("All connection handles owned by the pool")
            .register(meterRegistry);

        exhaustedCounter = Counter.builder("warden.pool.exhausted")
            .description("Acquire calls that gave up waiting for a connection")
            .register(meterRegistry);

        lock.lock();
        try {
            for (int i = 0; i < poolSize; i++) {
                available.add(createHandle());
            }
        } finally {
            lock.unlock();
        }

        log.info("ConnectionPool initialized: poolSize={}, maxConnections={}, idleTimeout={}, acquireTimeout={}",
            poolSize, config.getMaxConnections(), config.getIdleTimeout(), config.getAcquireTimeout());
    }

    /**
     * Borrow a handle, waiting up to the acquire timeout for one to be released
     *
     * @return a handle now owned by the caller; hand it back with {@link #release(ResourceHandle)}
     * @throws ResourceExhaustedException if no handle could be obtained in time or the wait was interrupted
     */
    public ResourceHandle acquire() {
        long waitNanos = config.getAcquireTimeout().toNanos();
        long pollNanos = Math.max(1, config.getPollInterval().toNanos());
        long deadline = System.nanoTime() + waitNanos;

        lock.lock();
        try {
            while (true) {
                if (closed) {
                    throw new ResourceExhaustedException("Connection pool is closed");
                }

                if (inUse.size() < config.getMaxConnections()) {
                    ResourceHandle handle = takeReusable();
                    boolean reused = handle != null;
                    if (!reused) {
                        handle = createHandle();
                    }
                    handle.recordUse();
                    inUse.put(handle.getId(), handle);

                    log.debug("Acquired connection {} (reused={}, usageCount={}, inUse={})",
                        handle.getId(), reused, handle.getUsageCount(), inUse.size());
                    return handle;
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    exhaustedCounter.increment();
                    throw new ResourceExhaustedException(String.format(
                        "Timeout waiting for available connection after %dms (maxConnections=%d)",
                        TimeUnit.NANOSECONDS.toMillis(waitNanos), config.getMaxConnections()));
                }

                released.awaitNanos(Math.min(remaining, pollNanos));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceExhaustedException("Interrupted while waiting for available connection", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return a borrowed handle. Releasing a handle that is not in use is a no-op.
     */
    public void release(ResourceHandle handle) {
        if (handle == null) {
            return;
        }

        lock.lock();
        try {
            if (inUse.remove(handle.getId()) == null) {
                log.warn("Attempted to release connection that is not in use: {}", handle.getId());
                return;
            }

            boolean returned = shouldReturnToPool(handle);
            handle.touch();
            if (returned) {
                available.addLast(handle);
            } else {
                destroy(handle);
            }

            log.debug("Released connection {} (returnedToPool={})", handle.getId(), returned);
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark handles older than the maximum age unhealthy and report the pool's health
     */
    public PoolHealth healthCheck() {
        lock.lock();
        try {
            int healthy = 0;
            int unhealthy = 0;
            for (ResourceHandle handle : allHandles()) {
                if (handle.isHealthy() && handle.age().compareTo(config.getMaxAge()) > 0) {
                    handle.markUnhealthy();
                    log.debug("Connection {} exceeded max age {}, marked unhealthy", handle.getId(), config.getMaxAge());
                }
                if (handle.isHealthy()) {
                    healthy++;
                } else {
                    unhealthy++;
                }
            }

            return PoolHealth.builder()
                .healthy(healthy)
                .unhealthy(unhealthy)
                .total(healthy + unhealthy)
                .available(available.size())
                .inUse(inUse.size())
                .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Destroy unhealthy or idle-expired handles that are not borrowed
     *
     * @return number of destroyed handles
     */
    public int cleanup() {
        lock.lock();
        try {
            int cleaned = 0;
            Iterator<ResourceHandle> iterator = available.iterator();
            while (iterator.hasNext()) {
                ResourceHandle handle = iterator.next();
                if (!handle.isHealthy() || isIdleExpired(handle)) {
                    iterator.remove();
                    destroy(handle);
                    cleaned++;
                }
            }

            if (cleaned > 0) {
                log.info("Pool cleanup completed: cleaned={}, available={}", cleaned, available.size());
            }
            return cleaned;
        } finally {
            lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "#{@wardenProperties.pool.healthCheckInterval.toMillis()}")
    public void maintain() {
        if (closed) {
            return;
        }
        PoolHealth health = healthCheck();
        if (!health.isAllHealthy()) {
            log.warn("Connection pool has {} unhealthy handles out of {}", health.getUnhealthy(), health.getTotal());
        }
        cleanup();
    }

    /**
     * Grow or shrink the set of available handles. Borrowed handles are never revoked.
     */
    public void resize(int newPoolSize) {
        if (newPoolSize < 0) {
            throw new IllegalArgumentException("Pool size must not be negative: " + newPoolSize);
        }

        lock.lock();
        try {
            int oldSize = available.size();
            while (available.size() < newPoolSize) {
                available.addLast(createHandle());
            }
            while (available.size() > newPoolSize) {
                destroy(available.removeFirst());
            }
            this.poolSize = newPoolSize;
            released.signalAll();

            log.info("Pool resized: newSize={}, oldSize={}, available={}", newPoolSize, oldSize, available.size());
        } finally {
            lock.unlock();
        }
    }

    public PoolStats getStats() {
        lock.lock();
        try {
            List<ResourceHandle> handles = allHandles();
            int total = handles.size();
            long totalUsage = 0;
            Duration oldest = Duration.ZERO;
            Duration newest = null;
            for (ResourceHandle handle : handles) {
                totalUsage += handle.getUsageCount();
                Duration age = handle.age();
                if (age.compareTo(oldest) > 0) {
                    oldest = age;
                }
                if (newest == null || age.compareTo(newest) < 0) {
                    newest = age;
                }
            }

            return PoolStats.builder()
                .available(available.size())
                .inUse(inUse.size())
                .total(total)
                .poolSize(poolSize)
                .maxConnections(config.getMaxConnections())
                .utilizationRate(total > 0 ? (inUse.size() * 100.0) / total : 0.0)
                .averageUsage(total > 0 ? (double) totalUsage / total : 0.0)
                .oldestAge(oldest)
                .newestAge(newest != null ? newest : Duration.ZERO)
                .build();
        } finally {
            lock.unlock();
        }
    }

    public Optional<ResourceHandle> getHandle(long id) {
        lock.lock();
        try {
            ResourceHandle handle = inUse.get(id);
            if (handle == null) {
                handle = available.stream().filter(h -> h.getId() == id).findFirst().orElse(null);
            }
            return Optional.ofNullable(handle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take every borrowed handle back, whether or not its borrower is done with it
     *
     * @return number of handles taken back
     */
    public int forceReleaseAll() {
        lock.lock();
        try {
            int count = inUse.size();
            for (ResourceHandle handle : new ArrayList<>(inUse.values())) {
                if (shouldReturnToPool(handle)) {
                    available.addLast(handle);
                } else {
                    destroy(handle);
                }
            }
            inUse.clear();
            released.signalAll();

            log.warn("Force released all connections: releasedCount={}", count);
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int getAvailableCount() {
        lock.lock();
        try {
            return available.size();
        } finally {
            lock.unlock();
        }
    }

    public int getInUseCount() {
        lock.lock();
        try {
            return inUse.size();
        } finally {
            lock.unlock();
        }
    }

    public int getTotalCount() {
        lock.lock();
        try {
            return available.size() + inUse.size();
        } finally {
            lock.unlock();
        }
    }

    public int getPoolSize() {
        return poolSize;
    }

    /**
     * Destroy every handle and fail further acquires
     */
    @PreDestroy
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            allHandles().forEach(this::destroy);
            available.clear();
            inUse.clear();
            released.signalAll();
            log.info("ConnectionPool closed");
        } finally {
            lock.unlock();
        }
    }

    private ResourceHandle takeReusable() {
        Iterator<ResourceHandle> iterator = available.iterator();
        while (iterator.hasNext()) {
            ResourceHandle handle = iterator.next();
            if (handle.isHealthy() && !isIdleExpired(handle)) {
                iterator.remove();
                return handle;
            }
        }
        return null;
    }

    private boolean shouldReturnToPool(ResourceHandle handle) {
        return handle.isHealthy()
            && !isIdleExpired(handle)
            && available.size() < poolSize
            && !closed;
    }

    private boolean isIdleExpired(ResourceHandle handle) {
        return handle.idleTime().compareTo(config.getIdleTimeout()) > 0;
    }

    private ResourceHandle createHandle() {
        ConnectionConfig connectionConfig = ConnectionConfig.builder()
            .userAgent(config.getUserAgent())
            .connectTimeout(config.getConnectTimeout())
            .maxRedirects(config.getMaxRedirects())
            .build();
        ResourceHandle handle = new ResourceHandle(nextId.getAndIncrement(), connectionConfig);
        log.debug("Created connection {}", handle.getId());
        return handle;
    }

    private void destroy(ResourceHandle handle) {
        handle.markUnhealthy();
        log.debug("Destroyed connection {} after {} uses", handle.getId(), handle.getUsageCount());
    }

    private List<ResourceHandle> allHandles() {
        List<ResourceHandle> handles = new ArrayList<>(available);
        handles.addAll(inUse.values());
        return handles;
    }
}

package com.whereq.warden.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A reusable outbound-connection handle managed by the connection pool.
 *
 * <p>Owned by the pool while available and exclusively by the borrower while in use.
 * Mutable state is only touched under the pool lock or by the current borrower.
 */
public class ResourceHandle {

    private final long id;
    private final Instant createdAt;
    private final ConnectionConfig connectionConfig;
    private volatile Instant lastUsed;
    private volatile int usageCount;
    private volatile boolean healthy = true;

    public ResourceHandle(long id, ConnectionConfig connectionConfig) {
        this.id = id;
        this.connectionConfig = connectionConfig;
        this.createdAt = Instant.now();
        this.lastUsed = createdAt;
    }

    public long getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUsed() {
        return lastUsed;
    }

    public int getUsageCount() {
        return usageCount;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public ConnectionConfig getConnectionConfig() {
        return connectionConfig;
    }

    /**
     * Mark the handle as broken; the pool destroys it on release or cleanup
     */
    public void markUnhealthy() {
        this.healthy = false;
    }

    public void touch() {
        this.lastUsed = Instant.now();
    }

    public void recordUse() {
        this.usageCount++;
        touch();
    }

    public Duration age() {
        return Duration.between(createdAt, Instant.now());
    }

    public Duration idleTime() {
        return Duration.between(lastUsed, Instant.now());
    }

    @Override
    public String toString() {
        return "ResourceHandle{id=" + id + ", usageCount=" + usageCount + ", healthy=" + healthy + "}";
    }
}

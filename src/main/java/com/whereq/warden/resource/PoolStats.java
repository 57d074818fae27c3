package com.whereq.warden.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Point-in-time view of the connection pool
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStats {
    private int available;
    private int inUse;
    private int total;

    /**
     * Configured number of warm handles
     */
    private int poolSize;

    private int maxConnections;

    /**
     * In-use handles as a percentage of all handles
     */
    private double utilizationRate;

    /**
     * Average number of borrows per handle
     */
    private double averageUsage;

    private Duration oldestAge;
    private Duration newestAge;
}

package com.whereq.warden.resource;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a connection pool health check
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolHealth {
    private int healthy;
    private int unhealthy;
    private int total;
    private int available;
    private int inUse;

    public boolean isAllHealthy() {
        return unhealthy == 0;
    }
}

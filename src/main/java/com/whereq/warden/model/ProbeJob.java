package com.whereq.warden.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * One scheduled probe execution against one target within a batch.
 * Immutable once built; identified by an id unique within its batch.
 */
@Value
@Builder(toBuilder = true)
public class ProbeJob {
    /**
     * Identifier, unique within a batch
     */
    String id;

    /**
     * Name of the registered probe to run
     */
    String probeName;

    /**
     * Target URL, host or address
     */
    String target;

    /**
     * Ids of jobs that must finish without problems before this one runs
     */
    @Singular
    Set<String> dependencies;

    /**
     * Higher runs earlier
     */
    @Builder.Default
    int priority = 100;

    /**
     * Relative resource weight used for load balancing
     */
    @Builder.Default
    double complexity = 1.0;

    /**
     * Expected duration in seconds
     */
    @Builder.Default
    double estimatedDuration = 1.0;

    /**
     * Extra values handed to the probe
     */
    @Singular("contextValue")
    Map<String, Object> context;

    /**
     * Per-job execution overrides
     */
    @Builder.Default
    JobOptions options = JobOptions.defaults();
}

package com.whereq.warden.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of analyzing a batch's dependency graph
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyAnalysis {
    /**
     * Job id to the ids it depends on
     */
    private Map<String, Set<String>> dependencies;

    /**
     * Job id to the ids depending on it
     */
    private Map<String, Set<String>> reverseDependencies;

    /**
     * Dependency-safe order of job ids
     */
    private List<String> order;

    private CriticalPath criticalPath;

    /**
     * Groups of jobs with no dependency path between members
     */
    private List<List<String>> parallelGroups;

    private GraphStats stats;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GraphStats {
        private int totalNodes;
        private int totalEdges;
        private int maxDepth;

        /**
         * Largest parallel group size divided by node count
         */
        private double parallelizationFactor;

        /**
         * Edges divided by n(n-1)
         */
        private double dependencyDensity;
    }
}

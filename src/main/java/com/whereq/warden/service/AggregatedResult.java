package com.whereq.warden.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary statistics derived from a set of probe results
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregatedResult {

    public static final String STABLE = "stable";

    private Summary summary;

    @Builder.Default
    private Map<String, CategoryStats> categoryStats = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, CategoryScore> scoreBreakdown = new LinkedHashMap<>();

    /**
     * Weighted sum of category averages, null when no result carries a score
     */
    private Double overallScore;

    private Trends trends;

    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private double aggregationTime;

    @Builder.Default
    private Instant aggregatedAt = Instant.now();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalTests;
        private int passed;
        private int failed;
        private int warnings;
        private int errors;
        private int skipped;
        private int timeouts;

        /**
         * Percentage of passed results, two decimals
         */
        private double successRate;

        private Double averageScore;
        private double totalExecutionTime;
        private double averageExecutionTime;
        private long totalMemoryUsage;
        private long averageMemoryUsage;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryStats {
        private int total;
        private int passed;
        private int failed;
        private int warnings;
        private int errors;
        private double successRate;
        private Double averageScore;
        private double averageExecutionTime;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryScore {
        private double averageScore;
        private int testCount;
        private double weight;
        private double weightedScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Trends {
        @Builder.Default
        private String executionTimeTrend = STABLE;

        @Builder.Default
        private String successRateTrend = STABLE;

        @Builder.Default
        private String scoreTrend = STABLE;

        /**
         * Population variance of execution times, null for fewer than two results
         */
        private Double executionTimeVariance;

        /**
         * "stable" or "variable", null for fewer than two results
         */
        private String executionTimeStability;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Recommendation {
        private String type;
        private String category;
        private String message;
        private String priority;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetricComparison {
        private double current;
        private double historicalAverage;
        private double change;
        private double percentChange;

        /**
         * improved, declined or stable
         */
        private String trend;
    }

}

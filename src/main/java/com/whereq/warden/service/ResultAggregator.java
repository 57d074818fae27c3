package com.whereq.warden.service;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.model.BatchResult;
import com.whereq.warden.model.ProbeResult;
import com.whereq.warden.model.ResultStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Turns probe results into summary, per-category and weighted score statistics
 * plus recommendations.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class ResultAggregator {

    public static final String SECURITY = "security";
    public static final String PERFORMANCE = "performance";
    public static final String AVAILABILITY = "availability";
    public static final String GENERAL = "general";

    private static final double UNKNOWN_CATEGORY_WEIGHT = 0.1;
    private static final double STABLE_VARIANCE = 0.1;
    private static final double SUCCESS_RATE_THRESHOLD = 80.0;
    private static final double SLOW_AVERAGE_SECONDS = 10.0;

    private final WardenProperties.AggregationConfig config;

    @Autowired
    public ResultAggregator(WardenProperties properties) {
        this(properties.getAggregation());
    }

    public ResultAggregator(WardenProperties.AggregationConfig config) {
        this.config = config;
    }

    public AggregatedResult aggregate(BatchResult batch) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("batch_name", batch.getName());
        if (batch.getTarget() != null) {
            metadata.put("target", batch.getTarget());
        }
        metadata.put("batch_execution_time", batch.getExecutionTime());
        return aggregate(batch.getResults().values(), metadata);
    }

    /**
     * Aggregate results
     *
     * @param results  results to aggregate, null entries are ignored
     * @param metadata caller supplied values copied into the aggregated result
     */
    public AggregatedResult aggregate(Collection<ProbeResult> results, Map<String, Object> metadata) {
        long start = System.nanoTime();
        List<ProbeResult> valid = results.stream().filter(Objects::nonNull).toList();

        AggregatedResult.Summary summary = calculateSummary(valid);
        Map<String, AggregatedResult.CategoryScore> breakdown = calculateScoreBreakdown(valid);

        AggregatedResult aggregated = AggregatedResult.builder()
            .summary(summary)
            .categoryStats(calculateCategoryStats(valid))
            .scoreBreakdown(breakdown)
            .overallScore(calculateOverallScore(breakdown))
            .trends(config.isCalculateTrends() ? calculateTrends(valid) : null)
            .recommendations(generateRecommendations(summary))
            .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
            .aggregationTime((System.nanoTime() - start) / 1_000_000_000.0)
            .build();

        log.debug("Aggregated {} results: success rate {}%, overall score {}",
            summary.getTotalTests(), summary.getSuccessRate(), aggregated.getOverallScore());
        return aggregated;
    }

    /**
     * Category of a result, derived from substrings of the probe name
     */
    public String categorize(ProbeResult result) {
        String name = result.getProbeName() != null ? result.getProbeName() : "";
        if (name.contains("ssl") || name.contains(SECURITY)) {
            return SECURITY;
        } else if (name.contains("response_time") || name.contains(PERFORMANCE)) {
            return PERFORMANCE;
        } else if (name.contains("status") || name.contains(AVAILABILITY)) {
            return AVAILABILITY;
        }
        return GENERAL;
    }

    /**
     * Compare the success rate, average score and average execution time with
     * the averages of earlier aggregations. Metrics missing on either side are left out.
     */
    public Map<String, AggregatedResult.MetricComparison> compareWithHistorical(AggregatedResult current,
                                                                               List<AggregatedResult> history) {
        Map<String, AggregatedResult.MetricComparison> comparison = new LinkedHashMap<>();
        if (history == null || history.isEmpty()) {
            log.debug("No historical data available for comparison");
            return comparison;
        }

        Map<String, Function<AggregatedResult.Summary, Double>> metrics = new LinkedHashMap<>();
        metrics.put("success_rate", AggregatedResult.Summary::getSuccessRate);
        metrics.put("average_score", AggregatedResult.Summary::getAverageScore);
        metrics.put("average_execution_time", AggregatedResult.Summary::getAverageExecutionTime);

        metrics.forEach((metric, extractor) -> {
            Double currentValue = current.getSummary() != null ? extractor.apply(current.getSummary()) : null;
            Double historical = historicalAverage(history, extractor);
            if (currentValue == null || historical == null) {
                return;
            }

            double change = currentValue - historical;
            double percentChange = historical != 0 ? (change / historical) * 100 : 0;
            comparison.put(metric, AggregatedResult.MetricComparison.builder()
                .current(currentValue)
                .historicalAverage(historical)
                .change(round(change, 3))
                .percentChange(round(percentChange, 2))
                .trend(change > 0 ? "improved" : change < 0 ? "declined" : AggregatedResult.STABLE)
                .build());
        });
        return comparison;
    }

    private AggregatedResult.Summary calculateSummary(List<ProbeResult> results) {
        int total = results.size();
        double totalTime = 0;
        long totalMemory = 0;
        List<Integer> scores = new ArrayList<>();

        for (ProbeResult result : results) {
            totalTime += result.getExecutionTime();
            totalMemory += result.getMemoryUsage();
            if (result.getScore() != null) {
                scores.add(result.getScore());
            }
        }

        int passed = count(results, ResultStatus.PASS);
        return AggregatedResult.Summary.builder()
            .totalTests(total)
            .passed(passed)
            .failed(count(results, ResultStatus.FAIL))
            .warnings(count(results, ResultStatus.WARNING))
            .errors(count(results, ResultStatus.ERROR))
            .skipped(count(results, ResultStatus.SKIP))
            .timeouts(count(results, ResultStatus.TIMEOUT))
            .successRate(total > 0 ? round(passed * 100.0 / total, 2) : 0.0)
            .averageScore(scores.isEmpty() ? null : round(average(scores), 2))
            .totalExecutionTime(round(totalTime, 3))
            .averageExecutionTime(total > 0 ? round(totalTime / total, 3) : 0.0)
            .totalMemoryUsage(totalMemory)
            .averageMemoryUsage(total > 0 ? Math.round((double) totalMemory / total) : 0L)
            .build();
    }

    private Map<String, AggregatedResult.CategoryStats> calculateCategoryStats(List<ProbeResult> results) {
        Map<String, List<ProbeResult>> byCategory = groupByCategory(results);
        Map<String, AggregatedResult.CategoryStats> stats = new LinkedHashMap<>();

        byCategory.forEach((category, members) -> {
            List<Integer> scores = members.stream()
                .map(ProbeResult::getScore)
                .filter(Objects::nonNull)
                .toList();
            double totalTime = members.stream().mapToDouble(ProbeResult::getExecutionTime).sum();
            int passed = count(members, ResultStatus.PASS);

            stats.put(category, AggregatedResult.CategoryStats.builder()
                .total(members.size())
                .passed(passed)
                .failed(count(members, ResultStatus.FAIL))
                .warnings(count(members, ResultStatus.WARNING))
                .errors(count(members, ResultStatus.ERROR))
                .successRate(round(passed * 100.0 / members.size(), 2))
                .averageScore(scores.isEmpty() ? null : round(average(scores), 2))
                .averageExecutionTime(round(totalTime / members.size(), 3))
                .build());
        });
        return stats;
    }

    private Map<String, AggregatedResult.CategoryScore> calculateScoreBreakdown(List<ProbeResult> results) {
        List<ProbeResult> scored = results.stream().filter(result -> result.getScore() != null).toList();
        Map<String, AggregatedResult.CategoryScore> breakdown = new LinkedHashMap<>();

        groupByCategory(scored).forEach((category, members) -> {
            double averageScore = average(members.stream().map(ProbeResult::getScore).toList());
            double weight = weightOf(category);
            breakdown.put(category, AggregatedResult.CategoryScore.builder()
                .averageScore(round(averageScore, 2))
                .testCount(members.size())
                .weight(weight)
                .weightedScore(round(averageScore * weight, 2))
                .build());
        });
        return breakdown;
    }

    private Double calculateOverallScore(Map<String, AggregatedResult.CategoryScore> breakdown) {
        if (breakdown.isEmpty()) {
            return null;
        }
        double overall = 0;
        for (AggregatedResult.CategoryScore score : breakdown.values()) {
            overall += score.getAverageScore() * score.getWeight();
        }
        return round(overall, 2);
    }

    private AggregatedResult.Trends calculateTrends(List<ProbeResult> results) {
        AggregatedResult.Trends trends = AggregatedResult.Trends.builder().build();
        if (results.size() > 1) {
            double variance = variance(results.stream().mapToDouble(ProbeResult::getExecutionTime).toArray());
            trends.setExecutionTimeVariance(round(variance, 4));
            trends.setExecutionTimeStability(variance < STABLE_VARIANCE ? AggregatedResult.STABLE : "variable");
        }
        return trends;
    }

    private List<AggregatedResult.Recommendation> generateRecommendations(AggregatedResult.Summary summary) {
        List<AggregatedResult.Recommendation> recommendations = new ArrayList<>();
        if (summary.getTotalTests() == 0) {
            return recommendations;
        }

        if (summary.getSuccessRate() < SUCCESS_RATE_THRESHOLD) {
            recommendations.add(recommendation("critical", "reliability", "high",
                "Low success rate detected. Review failing probes and address underlying issues."));
        }
        if (summary.getAverageExecutionTime() > SLOW_AVERAGE_SECONDS) {
            recommendations.add(recommendation("warning", PERFORMANCE, "medium",
                "High average execution time. Consider optimizing slow probes or infrastructure."));
        }
        if (summary.getErrors() > 0) {
            recommendations.add(recommendation("warning", "stability", "medium",
                "Probe execution errors detected. Review probe implementations and dependencies."));
        }
        if (summary.getTimeouts() > 0) {
            recommendations.add(recommendation("warning", PERFORMANCE, "medium",
                "Probe timeouts detected. Consider increasing timeout values or optimizing probe performance."));
        }
        return recommendations;
    }

    private Map<String, List<ProbeResult>> groupByCategory(List<ProbeResult> results) {
        Map<String, List<ProbeResult>> groups = new LinkedHashMap<>();
        for (ProbeResult result : results) {
            groups.computeIfAbsent(categorize(result), key -> new ArrayList<>()).add(result);
        }
        return groups;
    }

    private double weightOf(String category) {
        Double weight = config.getScoreWeights().get(category);
        return weight != null ? weight : UNKNOWN_CATEGORY_WEIGHT;
    }

    private static Double historicalAverage(List<AggregatedResult> history,
                                            Function<AggregatedResult.Summary, Double> extractor) {
        double total = 0;
        int count = 0;
        for (AggregatedResult result : history) {
            Double value = result.getSummary() != null ? extractor.apply(result.getSummary()) : null;
            if (value != null) {
                total += value;
                count++;
            }
        }
        return count > 0 ? total / count : null;
    }

    private static AggregatedResult.Recommendation recommendation(String type, String category, String priority,
                                                                  String message) {
        return AggregatedResult.Recommendation.builder()
            .type(type)
            .category(category)
            .priority(priority)
            .message(message)
            .build();
    }

    private static int count(List<ProbeResult> results, ResultStatus status) {
        return (int) results.stream().filter(result -> result.getStatus() == status).count();
    }

    private static double average(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    }

    private static double variance(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = 0;
        for (double value : values) {
            mean += value;
        }
        mean /= values.length;

        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return squares / values.length;
    }

    private static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}

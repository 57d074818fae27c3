package com.whereq.warden.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one probe execution against one target.
 *
 * Retries produce one logical result enriched with retry metadata,
 * never one result per attempt.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class ProbeResult {

    /**
     * Data flag set on results standing in for a probe that returned nothing
     */
    public static final String NO_RESULT = "no_result";

    /**
     * Name of the probe that produced this result
     */
    private String probeName;

    /**
     * Final status
     */
    @NonNull
    private ResultStatus status;

    /**
     * Human readable outcome
     */
    private String message = "";

    /**
     * Structured probe output and engine metadata (retry, timeout, inversion)
     */
    private Map<String, Object> data = new LinkedHashMap<>();

    /**
     * Execution time in seconds
     */
    private double executionTime;

    /**
     * Memory used in bytes
     */
    private long memoryUsage;

    private Instant timestamp = Instant.now();

    private String target;

    private Map<String, Object> context = new LinkedHashMap<>();

    /**
     * Score in [0, 100], null when the probe does not score
     */
    private Integer score;

    private List<String> recommendations = new ArrayList<>();

    @Builder
    private ProbeResult(String probeName,
                        @NonNull ResultStatus status,
                        String message,
                        Map<String, Object> data,
                        double executionTime,
                        long memoryUsage,
                        Instant timestamp,
                        String target,
                        Map<String, Object> context,
                        Integer score,
                        List<String> recommendations) {
        this.probeName = probeName;
        this.status = status;
        this.message = message != null ? message : "";
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        this.executionTime = executionTime;
        this.memoryUsage = memoryUsage;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.target = target;
        this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        this.recommendations = recommendations != null ? new ArrayList<>(recommendations) : new ArrayList<>();
        setScore(score);
    }

    public static ProbeResult of(String probeName, ResultStatus status, String message) {
        return ProbeResult.builder()
            .probeName(probeName)
            .status(status)
            .message(message)
            .build();
    }

    /**
     * ERROR result for a probe that returned null instead of a result. It is never retried.
     */
    public static ProbeResult noResult(String probeName, String target) {
        return ProbeResult.builder()
            .probeName(probeName)
            .status(ResultStatus.ERROR)
            .message("Probe returned no result")
            .target(target)
            .build()
            .addData(NO_RESULT, true);
    }

    /**
     * Set score
     *
     * @throws IllegalArgumentException if the score is outside [0, 100]
     */
    public void setScore(Integer score) {
        if (score != null && (score < 0 || score > 100)) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got: " + score);
        }
        this.score = score;
    }

    public ProbeResult addData(String key, Object value) {
        data.put(key, value);
        return this;
    }

    public ProbeResult addContext(String key, Object value) {
        context.put(key, value);
        return this;
    }

    public ProbeResult addRecommendation(String recommendation) {
        recommendations.add(recommendation);
        return this;
    }

    public boolean isPassed() {
        return status == ResultStatus.PASS;
    }

    public boolean isFailed() {
        return status == ResultStatus.FAIL;
    }

    public boolean isWarning() {
        return status == ResultStatus.WARNING;
    }

    public boolean isError() {
        return status == ResultStatus.ERROR;
    }

    public boolean isSkipped() {
        return status == ResultStatus.SKIP;
    }

    public boolean isTimeout() {
        return status == ResultStatus.TIMEOUT;
    }

    public boolean isNoResult() {
        return Boolean.TRUE.equals(data.get(NO_RESULT));
    }

    /**
     * Pass or warning
     */
    public boolean isSuccessful() {
        return status.isSuccessful();
    }

    /**
     * Fail, error or timeout
     */
    public boolean hasProblems() {
        return status.isProblematic();
    }

    public int getSeverityLevel() {
        return status.getSeverity();
    }

    /**
     * Copy with independent data, context and recommendation collections
     */
    public ProbeResult copy() {
        return ProbeResult.builder()
            .probeName(probeName)
            .status(status)
            .message(message)
            .data(data)
            .executionTime(executionTime)
            .memoryUsage(memoryUsage)
            .timestamp(timestamp)
            .target(target)
            .context(context)
            .score(score)
            .recommendations(recommendations)
            .build();
    }

    /**
     * Merge another result into this one. The worst status wins and brings its message along.
     */
    public ProbeResult mergeWith(ProbeResult other) {
        if (other.getSeverityLevel() > getSeverityLevel()) {
            this.status = other.getStatus();
            this.message = other.getMessage();
        }

        data.putAll(other.getData());
        executionTime += other.getExecutionTime();
        memoryUsage += other.getMemoryUsage();
        recommendations.addAll(other.getRecommendations());

        if (score != null && other.getScore() != null) {
            score = Math.min(score, other.getScore());
        } else if (other.getScore() != null) {
            score = other.getScore();
        }
        return this;
    }

    /**
     * One-line summary for logs and consoles
     */
    public String getSummary() {
        StringBuilder summary = new StringBuilder()
            .append(status.name()).append(": ").append(probeName);

        if (message != null && !message.isEmpty()) {
            summary.append(" - ").append(message);
        }

        summary.append(String.format(Locale.ROOT, " [%.2fms, %s]", executionTime * 1000, formatBytes(memoryUsage)));

        if (score != null) {
            summary.append(" [Score: ").append(score).append("/100]");
        }
        return summary.toString();
    }

    private static String formatBytes(long bytes) {
        if (bytes >= 1024 * 1024) {
            return String.format(Locale.ROOT, "%.2fMB", bytes / (1024.0 * 1024.0));
        } else if (bytes >= 1024) {
            return String.format(Locale.ROOT, "%.2fKB", bytes / 1024.0);
        }
        return bytes + "B";
    }
}

package com.whereq.warden.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a single probe execution
 *
 * Severity ordering (used for "worst status wins" merges):
 * PASS(0) < WARNING(1) = SKIP(1) < FAIL(2) < TIMEOUT(3) < ERROR(4)
 */
public enum ResultStatus {
    /**
     * Check succeeded
     */
    PASS(0),

    /**
     * Check failed
     */
    FAIL(2),

    /**
     * Check succeeded with reservations
     */
    WARNING(1),

    /**
     * Probe could not complete (fault or misconfiguration)
     */
    ERROR(4),

    /**
     * Probe was not executed
     */
    SKIP(1),

    /**
     * Probe exceeded its time budget
     */
    TIMEOUT(3);

    private final int severity;

    ResultStatus(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * Check if this status counts as success (pass or warning)
     */
    public boolean isSuccessful() {
        return this == PASS || this == WARNING;
    }

    /**
     * Check if this status indicates a problem (fail, error, timeout)
     */
    public boolean isProblematic() {
        return this == FAIL || this == ERROR || this == TIMEOUT;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse the external lower-case representation
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static ResultStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Invalid probe result status: null");
        }
        for (ResultStatus status : values()) {
            if (status.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid probe result status: " + value);
    }
}

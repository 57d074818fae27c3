package com.whereq.warden.inversion;

import com.whereq.warden.model.ResultStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pure mapping from a probe's raw status to the status that counts.
 * Statuses the rule does not mention map to themselves.
 */
@FunctionalInterface
public interface InversionRule {

    ResultStatus apply(ResultStatus status);

    /**
     * Exchange two statuses
     */
    static InversionRule swap(ResultStatus first, ResultStatus second) {
        return status -> {
            if (status == first) {
                return second;
            }
            if (status == second) {
                return first;
            }
            return status;
        };
    }

    /**
     * Replace one status with another
     */
    static InversionRule replace(ResultStatus from, ResultStatus to) {
        return status -> status == from ? to : status;
    }

    /**
     * Lookup-table rule
     */
    static InversionRule mapping(Map<ResultStatus, ResultStatus> table) {
        Map<ResultStatus, ResultStatus> copy = table.isEmpty()
            ? new EnumMap<>(ResultStatus.class)
            : new EnumMap<>(table);
        return status -> copy.getOrDefault(status, status);
    }

    /**
     * Apply this rule, then another
     */
    default InversionRule andThen(InversionRule next) {
        return status -> next.apply(apply(status));
    }
}

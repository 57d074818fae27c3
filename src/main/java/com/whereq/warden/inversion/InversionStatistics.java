package com.whereq.warden.inversion;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * How often inversions were applied to a set of results
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InversionStatistics {
    private int totalResults;
    private int inversionsApplied;

    /**
     * Counts keyed {@code <original>_to_<current>}, e.g. {@code pass_to_fail}
     */
    private Map<String, Long> statusChanges;

    private Map<String, Long> modesUsed;
}

package com.whereq.warden.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A past problematic outcome for one probe and target, used to tune retries
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureRecord {
    private ResultStatus status;

    /**
     * Seconds until the target answered successfully again, null if unknown
     */
    private Double recoveryTime;

    @Builder.Default
    private Instant timestamp = Instant.now();
}

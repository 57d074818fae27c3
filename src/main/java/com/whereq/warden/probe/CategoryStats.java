package com.whereq.warden.probe;

import lombok.Builder;
import lombok.Value;

/**
 * Registered probes of one category
 */
@Value
@Builder
public class CategoryStats {
    int total;
    int enabled;
    int disabled;
}

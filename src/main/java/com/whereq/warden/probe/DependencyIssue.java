package com.whereq.warden.probe;

import lombok.Builder;
import lombok.Value;

/**
 * A registered probe whose requirements are not met or that conflicts with an enabled probe
 */
@Value
@Builder
public class DependencyIssue {

    public enum Type {
        MISSING_REQUIREMENT,
        CONFLICT
    }

    String probeName;

    Type type;

    /**
     * The unmet requirement or the conflicting probe
     */
    String detail;
}

package com.whereq.warden.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named selection of registered probes run against one target.
 * Explicit probe names win over categories, categories over tags; an empty selection means every enabled probe.
 */
@Value
@Builder(toBuilder = true)
public class ProbeSuite {
    String name;

    String target;

    @Singular("contextValue")
    Map<String, Object> context;

    @Singular
    List<String> probes;

    @Singular
    Set<String> categories;

    @Singular
    Set<String> tags;

    /**
     * Options applied to every job of the suite
     */
    @Builder.Default
    JobOptions options = JobOptions.defaults();
}

package com.whereq.warden.probe;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Registry metadata of a probe: how it is grouped and what it needs to run.
 *
 * Requirements use a {@code kind:value} form:
 * {@code probe:<name>} needs another registered and enabled probe,
 * {@code class:<fqcn>} needs a class on the classpath,
 * {@code java:<feature>} needs at least that Java feature release.
 * Requirements of other kinds are not checked.
 */
@Value
@Builder(toBuilder = true)
public class ProbeDescriptor {
    public static final String DEFAULT_CATEGORY = "general";

    String name;

    @Builder.Default
    String category = DEFAULT_CATEGORY;

    @Singular("tag")
    Set<String> tags;

    @Builder.Default
    String description = "";

    @Singular("require")
    Set<String> requires;

    /**
     * Probes that must not be enabled alongside this one
     */
    @Singular("conflict")
    Set<String> conflicts;

    public static ProbeDescriptor of(String name) {
        return ProbeDescriptor.builder().name(name).build();
    }

    public boolean hasAnyTag(Iterable<String> wanted) {
        for (String tag : wanted) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}

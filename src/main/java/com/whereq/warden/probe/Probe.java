package com.whereq.warden.probe;

import com.whereq.warden.model.ProbeResult;

import java.util.Map;

/**
 * A single check executed against a remote target.
 *
 * Implementations should be side-effect free apart from the network calls they
 * make and should honour thread interruption, which is how timeouts abort them.
 */
public interface Probe {

    /**
     * Registry name of this probe
     */
    String getName();

    /**
     * Run the probe synchronously (blocking)
     *
     * @param target  URL or host the probe checks
     * @param context job context; holds the borrowed pool handle under {@code connection}
     * @return probe result
     * @throws Exception if the probe cannot complete
     */
    ProbeResult run(String target, Map<String, Object> context) throws Exception;

    /**
     * Registry metadata used when the probe is registered as a bean
     */
    default ProbeDescriptor getDescriptor() {
        return ProbeDescriptor.of(getName());
    }

    /**
     * Decide whether the probe should not run for this target
     */
    default boolean shouldSkip(String target, Map<String, Object> context) {
        return false;
    }
}

package com.whereq.warden.executor;

import com.whereq.warden.model.ProbeResult;

/**
 * One attempt at running a probe. Controllers stack on top of each other by
 * wrapping invocations, e.g. retries around timeout-bounded attempts.
 */
@FunctionalInterface
public interface ProbeInvocation {

    /**
     * Run the attempt synchronously (blocking)
     *
     * @return probe result
     * @throws Exception if the attempt fails
     */
    ProbeResult invoke() throws Exception;
}

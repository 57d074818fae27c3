package com.whereq.warden.executor;

import com.whereq.warden.model.ProbeResult;

import java.time.Duration;
import java.util.Optional;

/**
 * Interface for timeout enforcement strategies
 */
public interface TimeoutStrategy extends AutoCloseable {

    /**
     * Value reported as {@code timeout_type} on synthesized timeout results
     */
    String getType();

    /**
     * Run an invocation bounded by a timeout
     *
     * @param invocation the attempt to run, must not return null
     * @param timeout    time budget
     * @return the result, or empty if the budget was exceeded
     * @throws Exception the fault raised by the invocation
     */
    Optional<ProbeResult> execute(ProbeInvocation invocation, Duration timeout) throws Exception;

    @Override
    default void close() {
        // Default: nothing to release
    }
}

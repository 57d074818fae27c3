package com.whereq.warden.executor;

import com.whereq.warden.model.ProbeResult;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs the invocation in the calling thread and compares the elapsed time afterwards.
 *
 * <p>This strategy cannot abort a probe that blocks: the caller waits for the probe
 * to return and only then learns that the budget was exceeded. A probe that fails
 * after its budget ran out is reported as a timeout, not as a fault.
 */
public class PollingTimeoutStrategy implements TimeoutStrategy {

    @Override
    public String getType() {
        return "polling";
    }

    @Override
    public Optional<ProbeResult> execute(ProbeInvocation invocation, Duration timeout) throws Exception {
        long start = System.nanoTime();
        ProbeResult result;
        try {
            result = invocation.invoke();
        } catch (Exception e) {
            if (System.nanoTime() - start > timeout.toNanos()) {
                return Optional.empty();
            }
            throw e;
        }

        if (System.nanoTime() - start > timeout.toNanos()) {
            return Optional.empty();
        }
        if (result == null) {
            throw new IllegalStateException("Invocation returned no result");
        }
        return Optional.of(result);
    }
}

package com.whereq.warden.executor;

import com.whereq.warden.model.ProbeResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the invocation on a worker thread and interrupts it once the timeout passes.
 * Aborting is cooperative: a probe that ignores interruption keeps its worker busy
 * until it returns, but the caller is released at the deadline.
 */
@Slf4j
public class InterruptTimeoutStrategy implements TimeoutStrategy {

    private final ExecutorService workers;

    public InterruptTimeoutStrategy() {
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "warden-timeout-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String getType() {
        return "interrupt";
    }

    @Override
    public Optional<ProbeResult> execute(ProbeInvocation invocation, Duration timeout) throws Exception {
        Future<ProbeResult> future = workers.submit(invocation::invoke);
        try {
            ProbeResult result = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (result == null) {
                throw new IllegalStateException("Invocation returned no result");
            }
            return Optional.of(result);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Invocation exceeded {} and was interrupted", timeout);
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}

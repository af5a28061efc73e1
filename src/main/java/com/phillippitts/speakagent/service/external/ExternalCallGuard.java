package com.phillippitts.speakagent.service.external;

import com.phillippitts.speakagent.exception.ExternalCallException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls into external collaborators with an upper bound on how long a turn waits.
 *
 * <p>The call runs on the bounded {@code dialogueExecutor}; the calling thread waits at most
 * the configured timeout. A timeout interrupts the worker running the call and raises
 * {@link ExternalCallException}, as does an executor that rejects the call because it is
 * saturated. Runtime exceptions thrown by the call itself are rethrown unchanged so callers
 * can still tell a parse failure from a transport failure.
 *
 * <p>A timeout of zero or less disables the bound: the call then runs on the calling thread.
 */
public class ExternalCallGuard {
    private static final Logger LOG = LogManager.getLogger(ExternalCallGuard.class);

    /** Guard without a time bound; calls run inline. Used by unit tests. */
    public static final ExternalCallGuard DIRECT = new ExternalCallGuard(null, 0);

    private final Executor executor;
    private final long timeoutMs;

    public ExternalCallGuard(Executor executor, long timeoutMs) {
        if (timeoutMs > 0) {
            Objects.requireNonNull(executor, "executor is required when a timeout is configured");
        }
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Invokes {@code call} and returns its result.
     *
     * @param callName short name used in logs and in the exception, e.g. {@code classify}
     * @throws ExternalCallException on timeout, interruption or rejection by the executor
     */
    public <T> T call(String callName, Supplier<T> call) {
        Objects.requireNonNull(call, "call");
        if (timeoutMs <= 0) {
            return call.get();
        }
        FutureTask<T> task = new FutureTask<>(call::get);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ree) {
            LOG.warn("External call '{}' rejected: executor saturated", callName);
            throw new ExternalCallException("Rejected by saturated executor", callName, ree);
        }
        try {
            return task.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            task.cancel(true);
            LOG.warn("External call '{}' timed out after {} ms", callName, timeoutMs);
            throw new ExternalCallException("Timed out after " + timeoutMs + " ms", callName, te);
        } catch (InterruptedException ie) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalCallException("Interrupted while waiting", callName, ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new ExternalCallException("Call failed", callName, cause);
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}

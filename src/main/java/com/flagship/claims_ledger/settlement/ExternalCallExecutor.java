package com.flagship.claims_ledger.settlement;

import com.flagship.claims_ledger.exception.TransportException;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a blocking collaborator call with a deadline on a bounded pool.
 *
 * A timeout interrupts the worker and becomes a {@link TransportException}, as
 * does a call the saturated pool refuses.
 */
public class ExternalCallExecutor {

    private final AsyncTaskExecutor executor;
    private final Duration timeout;

    public ExternalCallExecutor(AsyncTaskExecutor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public <T> T call(String operation, Supplier<T> action) {
        Callable<T> task = action::get;
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (TaskRejectedException e) {
            throw new TransportException(operation + " rejected: call pool is saturated", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransportException(operation + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException(operation + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TransportException(operation + " failed", cause);
        }
    }
}

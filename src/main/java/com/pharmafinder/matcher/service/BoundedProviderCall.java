package com.pharmafinder.matcher.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one provider call on the provider pool and waits for it with a timeout.
 * Each call owns its {@link Future}: a timeout, or interruption of the waiting thread,
 * cancels only that call.
 */
@Component
public class BoundedProviderCall {

    private static final Logger logger = LoggerFactory.getLogger(BoundedProviderCall.class);

    private final AsyncTaskExecutor executor;
    private final Duration defaultTimeout;

    public BoundedProviderCall(@Qualifier("providerCallExecutor") AsyncTaskExecutor executor,
                               @Value("${matcher.provider.timeout-ms:5000}") long timeoutMs) {
        this.executor = executor;
        this.defaultTimeout = Duration.ofMillis(Math.max(1, timeoutMs));
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public <T> T call(String label, Callable<T> task) {
        return call(label, task, defaultTimeout);
    }

    /**
     * @throws SignalUnavailableException on timeout, cancellation, rejection or provider failure
     */
    public <T> T call(String label, Callable<T> task, Duration timeout) {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new SignalUnavailableException(label + " rejected: provider pool saturated", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.debug("{} timed out after {} ms; call cancelled", label, timeout.toMillis());
            throw new SignalUnavailableException(label + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SignalUnavailableException(label + " cancelled by caller", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SignalUnavailableException signal) {
                throw signal;
            }
            throw new SignalUnavailableException(label + " failed: " + cause.getMessage(), cause);
        }
    }
}

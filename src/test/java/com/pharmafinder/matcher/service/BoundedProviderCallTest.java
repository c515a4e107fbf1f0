package com.pharmafinder.matcher.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BoundedProviderCallTest {

    private ThreadPoolTaskExecutor executor;
    private BoundedProviderCall boundedCall;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setThreadNamePrefix("ProviderCallTest-");
        executor.initialize();
        boundedCall = new BoundedProviderCall(executor, 1_000);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void returnsProviderResult() {
        assertThat(boundedCall.call("echo", () -> "La Florida")).isEqualTo("La Florida");
        assertThat(boundedCall.defaultTimeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void timeoutCancelsTheRunningCall() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> boundedCall.call("slow", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        }, Duration.ofMillis(50)))
                .isInstanceOf(SignalUnavailableException.class)
                .hasMessageContaining("timed out");

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void interruptedCallerCancelsOnlyItsCall() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch providerInterrupted = new CountDownLatch(1);
        AtomicReference<Throwable> callerError = new AtomicReference<>();

        Thread caller = new Thread(() -> {
            try {
                boundedCall.call("cancellable", () -> {
                    started.countDown();
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        providerInterrupted.countDown();
                        throw e;
                    }
                    return "late";
                }, Duration.ofSeconds(30));
            } catch (RuntimeException e) {
                callerError.set(e);
            }
        });
        caller.start();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(2_000);

        assertThat(callerError.get()).isInstanceOf(SignalUnavailableException.class)
                .hasMessageContaining("cancelled");
        assertThat(providerInterrupted.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(boundedCall.call("other", () -> 42)).isEqualTo(42);
    }

    @Test
    void providerFailureIsWrapped() {
        assertThatThrownBy(() -> boundedCall.call("broken", () -> {
            throw new IOException("connection reset");
        }))
                .isInstanceOf(SignalUnavailableException.class)
                .hasMessageContaining("connection reset")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void signalFailureIsRethrownAsIs() {
        SignalUnavailableException failure = new SignalUnavailableException("not configured");

        assertThatThrownBy(() -> boundedCall.call("unconfigured", () -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    @SuppressWarnings("unchecked")
    void saturatedPoolIsReportedAsUnavailable() {
        AsyncTaskExecutor saturated = mock(AsyncTaskExecutor.class);
        when(saturated.submit(any(Callable.class))).thenThrow(new TaskRejectedException("pool full"));
        BoundedProviderCall call = new BoundedProviderCall(saturated, 1_000);

        assertThatThrownBy(() -> call.call("embedding", () -> "x"))
                .isInstanceOf(SignalUnavailableException.class)
                .hasMessageContaining("saturated");
    }
}

package com.example.policy.analyzer.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class RetrySpecsTest {

    private final RetryBackoffSpec spec = RetrySpecs.backoff("test", 3, Duration.ofMillis(1), Duration.ofMillis(5), 0,
            error -> error instanceof IOException);

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void retriesTransientErrorsUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = Mono.fromCallable(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("timeout");
            }
            return "ok";
        }).retryWhen(spec).block();

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void exhaustionKeepsLastFailure() {
        AtomicInteger calls = new AtomicInteger();

        Throwable thrown = catchThrowable(() -> Mono.fromCallable(() -> {
            calls.incrementAndGet();
            throw new IOException("reset " + calls.get());
        }).retryWhen(spec).block());

        assertThat(Exceptions.isRetryExhausted(thrown)).isTrue();
        assertThat(RetrySpecs.rootFailure(thrown)).isInstanceOf(IOException.class).hasMessage("reset 3");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void permanentErrorStopsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        Throwable thrown = catchThrowable(() -> Mono.fromCallable(() -> {
            calls.incrementAndGet();
            throw new LlmCallException("bad request", 400, false);
        }).retryWhen(spec).block());

        assertThat(Exceptions.isRetryExhausted(thrown)).isFalse();
        assertThat(RetrySpecs.rootFailure(thrown)).isInstanceOf(LlmCallException.class).hasMessage("bad request");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void singleAttemptNeverRetries() {
        RetryBackoffSpec once = RetrySpecs.backoff("once", 1, Duration.ofMillis(1), Duration.ofMillis(1), 0,
                error -> true);
        AtomicInteger calls = new AtomicInteger();

        Throwable thrown = catchThrowable(() -> Mono.fromCallable(() -> {
            calls.incrementAndGet();
            throw new IOException("down");
        }).retryWhen(once).block());

        assertThat(Exceptions.isRetryExhausted(thrown)).isTrue();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void backoffSettingsAreApplied() {
        RetryBackoffSpec backoff = RetrySpecs.backoff("llm", 3, Duration.ofSeconds(2), Duration.ofSeconds(30), 0.5,
                error -> true);

        assertThat(backoff.maxAttempts).isEqualTo(2);
        assertThat(backoff.minBackoff).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.maxBackoff).isEqualTo(Duration.ofSeconds(30));
        assertThat(backoff.jitterFactor).isEqualTo(0.5);
    }

    @Test
    void retriedCallsSeeCallerMdc() {
        MDC.put(ConcurrentAnalysisRunner.MDC_KEY, "42");
        AtomicInteger calls = new AtomicInteger();

        String seen = Mono.fromCallable(RetrySpecs.withCallerMdc(() -> {
            if (calls.incrementAndGet() < 2) {
                throw new IOException("timeout");
            }
            return MDC.get(ConcurrentAnalysisRunner.MDC_KEY);
        })).retryWhen(spec).block();

        assertThat(seen).isEqualTo("42");
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThatThrownBy(() -> RetrySpecs.backoff("bad", 0, Duration.ZERO, Duration.ZERO, 0, error -> true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

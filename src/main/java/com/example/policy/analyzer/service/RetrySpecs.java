package com.example.policy.analyzer.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Builds the Reactor backoff specs used at each external call site and unwraps what
 * {@code Mono#block()} throws when a retried call gives up.
 */
@Slf4j
public final class RetrySpecs {

    private RetrySpecs() {
    }

    /**
     * Exponential backoff: {@code maxAttempts} counts the first call, so at most
     * {@code maxAttempts - 1} retries follow. Errors rejected by {@code retryable} are not retried.
     */
    public static RetryBackoffSpec backoff(String operation, int maxAttempts, Duration baseDelay, Duration maxDelay,
            double jitterFactor, Predicate<Throwable> retryable) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
        return Retry.backoff(maxAttempts - 1L, baseDelay)
                .maxBackoff(maxDelay)
                .jitter(jitterFactor)
                .filter(retryable)
                .doBeforeRetry(signal -> log.warn("{} failed, retry {}/{}: {}", operation,
                        signal.totalRetries() + 1, maxAttempts - 1, signal.failure().getMessage()));
    }

    /**
     * The failure that ended a blocked, retried call: the last attempt's error when retries ran
     * out, the checked exception Reactor wrapped, or the error itself.
     */
    public static Throwable rootFailure(Throwable error) {
        Throwable failure = error;
        if (Exceptions.isRetryExhausted(failure) && failure.getCause() != null) {
            failure = failure.getCause();
        }
        failure = Exceptions.unwrap(failure);
        if (failure instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return failure;
    }

    /**
     * Retries resubscribe on a Reactor timer thread; this carries the caller's MDC over to it.
     */
    public static <T> Callable<T> withCallerMdc(Callable<T> call) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return call.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}

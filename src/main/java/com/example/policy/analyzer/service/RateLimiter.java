package com.example.policy.analyzer.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window admission control: at most {@code maxCalls} admissions in any window of
 * {@code window}. One instance is shared by every LLM caller; the check-and-record step runs
 * under a lock, so a caller that has to wait holds up the callers queued behind it.
 */
@Slf4j
public class RateLimiter {

    private final int maxCalls;
    private final long windowNanos;
    private final Deque<Long> admissions = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);

    public RateLimiter(int maxCalls, Duration window) {
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be positive: " + maxCalls);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.maxCalls = maxCalls;
        this.windowNanos = window.toNanos();
    }

    /**
     * Blocks until the window has capacity, then records the admission.
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = System.nanoTime();
                evictExpired(now);
                if (admissions.size() < maxCalls) {
                    admissions.addLast(now);
                    return;
                }
                long waitNanos = admissions.peekFirst() + windowNanos - now;
                if (waitNanos > 0) {
                    log.info("Rate limit reached ({} calls per {} ms), waiting {} ms", maxCalls,
                            TimeUnit.NANOSECONDS.toMillis(windowNanos), TimeUnit.NANOSECONDS.toMillis(waitNanos));
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public int getMaxCalls() {
        return maxCalls;
    }

    public Duration getWindow() {
        return Duration.ofNanos(windowNanos);
    }

    private void evictExpired(long now) {
        while (!admissions.isEmpty() && now - admissions.peekFirst() >= windowNanos) {
            admissions.pollFirst();
        }
    }
}

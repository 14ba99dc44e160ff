package com.example.policy.analyzer.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs a task over a list of items with a fixed number of worker threads pulling from a shared
 * queue. Workers inherit the caller's MDC and tag each item with {@code policyId}. Once the
 * deadline has passed no new item is taken; items already running are allowed to finish.
 */
@Component
@Slf4j
public class ConcurrentAnalysisRunner {

    public static final String MDC_KEY = "policyId";
    public static final Duration MAX_DEADLINE = Duration.ofDays(1);

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    @Getter
    @AllArgsConstructor
    public static class Report<R> {
        private final List<R> results;
        private final int skipped;
        private final int errors;
    }

    public <T, R> CompletableFuture<Report<R>> run(List<T> items, int maxConcurrent, Duration deadline,
            Function<T, R> task, Function<T, String> itemKey) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        checkDeadline(deadline);
        if (items.isEmpty()) {
            return CompletableFuture.completedFuture(new Report<>(List.of(), 0, 0));
        }

        BlockingQueue<T> queue = new LinkedBlockingQueue<>(items);
        List<R> results = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger skipped = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();
        long deadlineNanos = deadline == null ? 0 : System.nanoTime() + deadline.toNanos();
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();

        int workers = Math.min(maxConcurrent, items.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, namedThreads());
        log.info("Processing {} items with {} workers{}", items.size(), workers,
                deadline == null ? "" : ", deadline " + deadline);

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            futures.add(CompletableFuture.runAsync(() -> withMdc(callerMdc, () -> {
                T item;
                while ((item = queue.poll()) != null) {
                    if (deadline != null && System.nanoTime() - deadlineNanos >= 0) {
                        List<T> remaining = new ArrayList<>();
                        queue.drainTo(remaining);
                        int count = 1 + remaining.size();
                        skipped.addAndGet(count);
                        log.warn("Deadline reached, {} items left unprocessed", count);
                        return;
                    }
                    MDC.put(MDC_KEY, itemKey.apply(item));
                    try {
                        results.add(task.apply(item));
                    } catch (RuntimeException e) {
                        errors.incrementAndGet();
                        log.error("Unexpected error processing item", e);
                    } finally {
                        MDC.remove(MDC_KEY);
                    }
                }
            }), pool));
        }
        pool.shutdown();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(done -> {
                    synchronized (results) {
                        return new Report<>(new ArrayList<>(results), skipped.get(), errors.get());
                    }
                });
    }

    /**
     * A batch deadline must be null (none) or between zero and {@link #MAX_DEADLINE}.
     */
    public static void checkDeadline(Duration deadline) {
        if (deadline != null && (deadline.isNegative() || deadline.compareTo(MAX_DEADLINE) > 0)) {
            throw new IllegalArgumentException("deadline must be between 0 and " + MAX_DEADLINE + ": " + deadline);
        }
    }

    private static void withMdc(Map<String, String> context, Runnable body) {
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            body.run();
        } finally {
            MDC.clear();
        }
    }

    private static ThreadFactory namedThreads() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "policy-analysis-" + pool + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

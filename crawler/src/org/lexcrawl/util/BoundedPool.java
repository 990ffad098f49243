package org.lexcrawl.util;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of named daemon threads. Used for probing the proxy fleet and for running crawl workers.
 */
public class BoundedPool implements AutoCloseable {
    private final String name;
    private final int concurrency;
    private final ExecutorService executor;

    public BoundedPool(String name, int concurrency) {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be at least 1");
        this.name = name;
        this.concurrency = concurrency;
        this.executor = Executors.newFixedThreadPool(concurrency, new NamedThreadFactory(name));
    }

    public int concurrency() {
        return concurrency;
    }

    public Future<?> submit(Runnable task) {
        return executor.submit(task);
    }

    /**
     * Runs every task with at most {@link #concurrency()} in flight and returns the results in input order.
     */
    public <T> List<T> invokeAll(List<? extends Callable<T>> tasks) throws InterruptedException {
        var futures = executor.invokeAll(tasks);
        var results = new ArrayList<T>(futures.size());
        for (var future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                throw new CompletionException(name + " task failed", e.getCause());
            }
        }
        return results;
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        executor.shutdown();
        return executor.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static class NamedThreadFactory implements ThreadFactory {
        private final String name;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(@NotNull Runnable r) {
            Thread thread = new Thread(r, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

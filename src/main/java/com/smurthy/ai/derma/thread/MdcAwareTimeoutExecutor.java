package com.smurthy.ai.derma.thread;

import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs blocking calls (vector store, web search, chat model) on a worker pool with a hard
 * timeout, carrying the caller's MDC into the worker thread.
 *
 * On timeout or when the calling thread is interrupted the worker is cancelled with
 * {@code mayInterruptIfRunning = true}. Cancellation only interrupts: a call blocked in I/O that
 * ignores interrupts keeps its thread until the client's own timeout fires, which is why every
 * backend gets a {@link #dedicated} pool of its own.
 */
public class MdcAwareTimeoutExecutor {

    private final ExecutorService delegate;

    public MdcAwareTimeoutExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    /**
     * Executor over its own fixed pool of daemon threads named {@code <name>-worker-N}.
     */
    public static MdcAwareTimeoutExecutor dedicated(String name, int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, name + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new MdcAwareTimeoutExecutor(Executors.newFixedThreadPool(threads, threadFactory));
    }

    public <T> T call(Callable<T> task, Duration timeout)
            throws TimeoutException, ExecutionException, InterruptedException {
        // Capture MDC context from the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        Future<T> future = delegate.submit(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    public void shutdown() {
        delegate.shutdownNow();
    }
}

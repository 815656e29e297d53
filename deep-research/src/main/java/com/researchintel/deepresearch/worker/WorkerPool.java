package com.researchintel.deepresearch.worker;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Bounded fan-out/fan-in executor.
 *
 * At most {@code maxWorkers} invocations run at once. {@link #run} returns results index-aligned
 * with the input regardless of completion order. Failures are fail-fast: once a task throws,
 * tasks that have not started yet are skipped, tasks already running finish, and the first
 * failure is rethrown as a {@link WorkerTaskFault}. Nothing is retried.
 *
 * The submitting thread's MDC is copied onto each task.
 */
@Slf4j
public class WorkerPool implements AutoCloseable {

    private final ThreadPoolExecutor executor;

    public WorkerPool(int maxWorkers) {
        requirePositive(maxWorkers);
        this.executor = new ThreadPoolExecutor(
                maxWorkers, maxWorkers,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new CustomizableThreadFactory("research-worker-"));
        this.executor.allowCoreThreadTimeOut(true);
    }

    public int getMaxWorkers() {
        return executor.getMaximumPoolSize();
    }

    /**
     * Change the concurrency bound. Only call between dispatches.
     */
    public void setMaxWorkers(int maxWorkers) {
        requirePositive(maxWorkers);
        if (maxWorkers >= executor.getMaximumPoolSize()) {
            executor.setMaximumPoolSize(maxWorkers);
            executor.setCorePoolSize(maxWorkers);
        } else {
            executor.setCorePoolSize(maxWorkers);
            executor.setMaximumPoolSize(maxWorkers);
        }
        log.debug("Worker pool resized to {}", maxWorkers);
    }

    /**
     * Apply {@code fn} to every item concurrently; {@code results.get(i) == fn(items.get(i))}.
     */
    public <T, R> List<R> run(Function<? super T, ? extends R> fn, List<? extends T> items) {
        if (items.isEmpty()) return List.of();

        Batch<T, R> batch = new Batch<>(fn, items);
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            futures.add(executor.submit(batch.task(i)));
        }

        List<R> results = new ArrayList<>(Collections.nCopies(items.size(), null));
        for (int i = 0; i < futures.size(); i++) {
            results.set(i, batch.await(futures.get(i), i));
        }
        batch.throwIfFailed();
        return results;
    }

    /**
     * Like {@link #run} but results arrive in completion order.
     */
    public <T, R> List<R> mapUnordered(Function<? super T, ? extends R> fn, List<? extends T> items) {
        if (items.isEmpty()) return List.of();

        Batch<T, R> batch = new Batch<>(fn, items);
        CompletionService<R> completion = new ExecutorCompletionService<>(executor);
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            futures.add(completion.submit(batch.task(i)));
        }

        List<R> results = new ArrayList<>(items.size());
        for (int n = 0; n < items.size(); n++) {
            Future<R> done;
            try {
                done = completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                batch.aborted.set(true);
                throw new IllegalStateException("Interrupted while waiting for worker tasks", e);
            }
            results.add(batch.await(done, futures.indexOf(done)));
        }
        batch.throwIfFailed();
        return results;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not drain within 30s, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void requirePositive(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Shared failure state for one dispatch.
     */
    private static final class Batch<T, R> {

        private final Function<? super T, ? extends R> fn;
        private final List<? extends T> items;
        private final Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        private final AtomicBoolean aborted = new AtomicBoolean();
        private final AtomicReference<WorkerTaskFault> firstFault = new AtomicReference<>();

        Batch(Function<? super T, ? extends R> fn, List<? extends T> items) {
            this.fn = fn;
            this.items = items;
        }

        Callable<R> task(int index) {
            T item = items.get(index);
            return () -> {
                if (aborted.get()) {
                    log.debug("Skipping worker task {} after an earlier failure", index);
                    return null;
                }
                if (parentMdc != null) {
                    MDC.setContextMap(parentMdc);
                }
                try {
                    return fn.apply(item);
                } catch (RuntimeException e) {
                    fail(index, e);
                    throw e;
                } finally {
                    MDC.clear();
                }
            };
        }

        R await(Future<R> future, int index) {
            try {
                return future.get();
            } catch (ExecutionException e) {
                fail(index, e.getCause());
                return null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                aborted.set(true);
                throw new IllegalStateException("Interrupted while waiting for worker task " + index, e);
            }
        }

        void fail(int index, Throwable cause) {
            aborted.set(true);
            if (firstFault.compareAndSet(null, new WorkerTaskFault(index, items.get(index), cause))) {
                log.warn("Worker task {} failed: {}", index, cause.getMessage());
            }
        }

        void throwIfFailed() {
            WorkerTaskFault fault = firstFault.get();
            if (fault != null) {
                throw fault;
            }
        }
    }
}

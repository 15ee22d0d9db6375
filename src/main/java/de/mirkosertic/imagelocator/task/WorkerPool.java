package de.mirkosertic.imagelocator.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed size thread pool with named threads.
 * Used once for background tasks and once for the parallel filtering and scoring work they fan out.
 */
public class WorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final String name;
    private final ThreadPoolExecutor executor;

    public WorkerPool(final String name, final int poolSize) {
        this.name = name;
        final int threads = Math.max(1, poolSize);
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, name + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("WorkerPool '{}' initialized with {} threads", name, threads);
    }

    public int getPoolSize() {
        return executor.getCorePoolSize();
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    /**
     * Run all tasks on the pool and wait for their results, in submission order.
     * The first failing task aborts the wait; remaining tasks are cancelled.
     */
    public <T> List<T> invokeAll(final List<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
        final List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (final Callable<T> task : tasks) {
            futures.add(executor.submit(task));
        }
        final List<T> results = new ArrayList<>(futures.size());
        try {
            for (final Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (final InterruptedException | ExecutionException e) {
            for (final Future<T> future : futures) {
                future.cancel(true);
            }
            throw e;
        }
        return results;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Shutdown the pool. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down WorkerPool '{}'", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("WorkerPool '{}' did not terminate in time, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for WorkerPool '{}' to terminate", name, e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

package com.assetloom.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Dispatcher backed by one dedicated daemon thread.
 *
 * Completions delivered from I/O threads are queued here and applied in order
 * on the dispatch thread.
 */
public final class ExecutorAssetDispatcher implements AssetDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorAssetDispatcher.class);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final ThreadPoolExecutor executor;
    private final Duration shutdownTimeout;
    private volatile Thread dispatchThread;

    public ExecutorAssetDispatcher(String threadName) {
        this(threadName, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public ExecutorAssetDispatcher(String threadName, Duration shutdownTimeout) {
        Objects.requireNonNull(threadName, "threadName");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), runnable -> {
                Thread t = new Thread(runnable, threadName);
                t.setDaemon(true);
                dispatchThread = t;
                return t;
            });
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        try {
            executor.execute(() -> InlineAssetDispatcher.runTask(task));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Dispatcher is closed", e);
        }
    }

    @Override
    public boolean isDispatchThread() {
        return Thread.currentThread() == dispatchThread;
    }

    @Override
    public int queuedTaskCount() {
        return executor.getQueue().size();
    }

    /**
     * Stops accepting tasks, lets queued tasks finish and waits for the thread.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Dispatcher did not drain within {}; {} task(s) dropped",
                    shutdownTimeout, executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}

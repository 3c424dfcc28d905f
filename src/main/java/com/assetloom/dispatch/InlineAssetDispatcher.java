package com.assetloom.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dispatcher that runs tasks on the submitting thread.
 *
 * The first thread to submit becomes the drainer and runs queued tasks until
 * the queue is empty. A task submitted while another one is running, from the
 * running task itself or from another thread, is queued and picked up by the
 * active drainer. A cross-thread submitter may therefore return before its task ran.
 */
public final class InlineAssetDispatcher implements AssetDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(InlineAssetDispatcher.class);

    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicReference<Thread> drainer = new AtomicReference<>();

    @Override
    public void execute(Runnable task) {
        queue.add(Objects.requireNonNull(task, "task"));
        drain();
    }

    @Override
    public boolean isDispatchThread() {
        return drainer.get() == Thread.currentThread();
    }

    @Override
    public int queuedTaskCount() {
        return queue.size();
    }

    private void drain() {
        Thread current = Thread.currentThread();
        // Re-check after releasing: a task may have been queued while the drainer was finishing.
        while (!queue.isEmpty() && drainer.compareAndSet(null, current)) {
            try {
                Runnable task;
                while ((task = queue.poll()) != null) {
                    runTask(task);
                }
            } finally {
                drainer.set(null);
            }
        }
    }

    static void runTask(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOGGER.error("Dispatcher task failed", e);
        }
    }
}

package com.assetloom.dispatch;

/**
 * Serial executor that owns all asset state.
 *
 * Tasks run one at a time in submission order. Every asset state transition
 * and every listener invocation is submitted here, so asset code never needs
 * locks and a listener never runs in the middle of a dependency scan.
 */
public interface AssetDispatcher extends AutoCloseable {

    /**
     * Submits a task. It runs after every task submitted before it.
     *
     * @param task the task to run
     */
    void execute(Runnable task);

    /**
     * Returns true if the calling thread is currently running a dispatcher task.
     *
     * @return true on the dispatch thread
     */
    boolean isDispatchThread();

    /**
     * Gets the number of submitted tasks that have not started yet.
     *
     * @return queued task count
     */
    int queuedTaskCount();

    /**
     * Releases threads owned by the dispatcher. Does nothing by default.
     */
    @Override
    default void close() {
    }
}

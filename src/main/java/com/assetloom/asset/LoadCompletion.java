package com.assetloom.asset;

/**
 * Completion sink handed to {@link Asset#beginContentLoad}.
 *
 * May be called from any thread. Only the first call counts; later calls,
 * including ones arriving after a timeout, are ignored.
 */
public interface LoadCompletion {

    /**
     * Reports that the content is ready.
     *
     * @param content the loaded content, must not be null
     */
    void complete(Object content);

    /**
     * Reports that the content could not be loaded.
     *
     * @param cause what went wrong
     */
    void fail(Throwable cause);
}

package com.assetloom.asset;

/**
 * Completion sink handed to {@link Asset#beginContentUnload}.
 *
 * May be called from any thread. Only the first call counts.
 */
public interface UnloadCompletion {

    /**
     * Reports that the content has been released.
     */
    void complete();

    /**
     * Reports that the content could not be released. The asset stays loaded.
     *
     * @param cause what went wrong
     */
    void fail(Throwable cause);
}

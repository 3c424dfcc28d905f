package com.assetloom.asset;

/**
 * Handle for a single load or unload request.
 */
public interface AssetRequest {

    /**
     * Gets the id of the requested asset.
     *
     * @return the asset id
     */
    long assetId();

    /**
     * Returns true once the callback has fired or the request was cancelled.
     *
     * @return true if settled
     */
    boolean isDone();

    /**
     * Withdraws the caller's interest. The callback will not fire afterwards.
     *
     * The underlying operation keeps running since other requests or dependent
     * assets may still need it. Cancelling a load does not release the asset;
     * use an unload request for that.
     *
     * @return true if the request was still pending
     */
    boolean cancel();
}

package com.assetloom.asset;

/**
 * Completion listener for a load or unload request.
 *
 * Invoked on the registry's dispatcher, never in the middle of another
 * asset's state transition.
 */
@FunctionalInterface
public interface AssetCallback {

    /**
     * Called once when the request settles.
     *
     * @param outcome success, or the failure that ended the request
     */
    void onComplete(AssetOutcome outcome);
}

package com.assetloom.asset;

import java.util.Objects;

/**
 * Result handed to an {@link AssetCallback}.
 *
 * @param assetId the asset the request targeted
 * @param failure the failure, or null on success
 */
public record AssetOutcome(long assetId, AssetException failure) {

    public static AssetOutcome success(long assetId) {
        return new AssetOutcome(assetId, null);
    }

    public static AssetOutcome failure(long assetId, AssetException failure) {
        return new AssetOutcome(assetId, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Throws the failure if there is one.
     *
     * @throws AssetException the failure carried by this outcome
     */
    public void orThrow() {
        if (failure != null) {
            throw failure;
        }
    }
}

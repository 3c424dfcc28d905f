package com.assetloom.asset;

/**
 * Base class for every failure an asset operation can report.
 *
 * Carries the id of the asset the failure belongs to so callers can
 * tell which part of a dependency chain broke.
 */
public class AssetException extends RuntimeException {

    private final long assetId;

    public AssetException(long assetId, String message) {
        super(message);
        this.assetId = assetId;
    }

    public AssetException(long assetId, String message, Throwable cause) {
        super(message, cause);
        this.assetId = assetId;
    }

    public long getAssetId() {
        return assetId;
    }
}

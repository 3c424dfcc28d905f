package com.assetloom.asset;

/**
 * Thrown or reported when an id is not present in the registry.
 */
public class UnknownAssetException extends AssetException {

    public UnknownAssetException(long assetId) {
        super(assetId, String.format("Unknown asset id %d", assetId));
    }
}

package com.assetloom.asset;

/**
 * Reported when an asset could not be loaded: its own content load failed
 * or timed out, or one of its dependencies failed to load.
 *
 * The asset is back in {@link AssetState#UNLOADED} when listeners see this.
 */
public class ContentLoadException extends AssetException {

    public ContentLoadException(long assetId, String message, Throwable cause) {
        super(assetId, message, cause);
    }
}

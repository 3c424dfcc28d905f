package com.assetloom.asset;

/**
 * Reported when an asset's content unload failed or timed out.
 *
 * The asset is back in {@link AssetState#LOADED} with its content and
 * dependency references intact.
 */
public class ContentUnloadException extends AssetException {

    public ContentUnloadException(long assetId, String message, Throwable cause) {
        super(assetId, message, cause);
    }
}

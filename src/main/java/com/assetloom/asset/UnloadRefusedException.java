package com.assetloom.asset;

/**
 * Reported to an unload listener when the asset is still in use.
 *
 * The asset keeps its state. It is unloaded later once the last dependent
 * releases it and no external holder remains.
 */
public class UnloadRefusedException extends AssetException {

    private final int internalRefCount;
    private final boolean externallyHeld;

    public UnloadRefusedException(long assetId, int internalRefCount, boolean externallyHeld) {
        super(assetId, String.format(
            "Unload of asset %d refused: %d dependent(s), externally held=%s",
            assetId, internalRefCount, externallyHeld));
        this.internalRefCount = internalRefCount;
        this.externallyHeld = externallyHeld;
    }

    public int getInternalRefCount() {
        return internalRefCount;
    }

    public boolean isExternallyHeld() {
        return externallyHeld;
    }
}

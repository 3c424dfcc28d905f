package com.assetloom.asset;

/**
 * Load state of a single {@link Asset}.
 *
 * An asset starts and rests in {@link #UNLOADED}. Every state other than
 * {@link #UNLOADED} and {@link #LOADED} has an operation in flight.
 */
public enum AssetState {

    /**
     * No content is held. Initial state and resting state after an unload.
     */
    UNLOADED,

    /**
     * A load was requested and at least one dependency is not loaded yet.
     */
    WAITING,

    /**
     * All dependencies are loaded and the asset's own content load is in flight.
     */
    LOADING,

    /**
     * Content is available.
     */
    LOADED,

    /**
     * The asset's own content unload is in flight.
     */
    UNLOADING;

    /**
     * Returns true if an operation is in flight for an asset in this state.
     *
     * @return true for WAITING, LOADING and UNLOADING
     */
    public boolean isInFlight() {
        return this == WAITING || this == LOADING || this == UNLOADING;
    }

    /**
     * Returns true if this state belongs to a load sequence that has not finished.
     *
     * @return true for WAITING and LOADING
     */
    public boolean isLoadPending() {
        return this == WAITING || this == LOADING;
    }

    /**
     * Returns true if content may be read in this state.
     *
     * @return true if loaded
     */
    public boolean hasContent() {
        return this == LOADED;
    }
}

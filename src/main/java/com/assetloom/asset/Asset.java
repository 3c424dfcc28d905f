package com.assetloom.asset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single loadable unit tracked by id.
 *
 * Owns its load state machine, the count of dependents holding it and the
 * listeners waiting on the operation in flight. Dependencies are referenced by
 * id and resolved through the owning {@link AssetRegistry} each time they are
 * needed. Subclasses supply the actual content load and unload.
 *
 * All state transitions run on the registry's dispatcher. The accessors may
 * be called from any thread and return the latest published values.
 */
public abstract class Asset {

    private static final Logger LOGGER = LoggerFactory.getLogger(Asset.class);

    private final long id;
    private final List<Long> dependencyIds;

    private volatile AssetState state = AssetState.UNLOADED;
    private volatile Object content;
    private volatile int internalRefCount;
    private volatile boolean externallyHeld;

    // Incremented each time a load sequence starts from UNLOADED
    private long loadGeneration;

    // True while a load re-issue waits among the unload listeners
    private boolean loadQueuedBehindUnload;

    private final List<PendingListener> loadListeners = new ArrayList<>();
    private final List<PendingListener> unloadListeners = new ArrayList<>();

    private AssetRegistry registry;

    /**
     * Creates an asset.
     *
     * @param id unique asset id
     * @param dependencyIds ids of the assets that must be loaded first, in resolution order
     */
    protected Asset(long id, List<Long> dependencyIds) {
        this.id = id;
        this.dependencyIds = List.copyOf(Objects.requireNonNull(dependencyIds, "dependencyIds"));
    }

    /**
     * Starts loading this asset's own content.
     *
     * Called on the dispatcher once every dependency is loaded. Implementations
     * must not block; long work belongs on another thread, which reports back
     * through the completion. A runtime exception thrown from here counts as a failure.
     *
     * @param completion sink to report the result to
     */
    protected abstract void beginContentLoad(LoadCompletion completion);

    /**
     * Starts releasing this asset's content.
     *
     * @param content the content being released
     * @param completion sink to report the result to
     */
    protected abstract void beginContentUnload(Object content, UnloadCompletion completion);

    public long getId() {
        return id;
    }

    public List<Long> getDependencyIds() {
        return dependencyIds;
    }

    public AssetState getState() {
        return state;
    }

    /**
     * Gets the loaded content.
     *
     * @return the content, or null unless the asset is loaded
     */
    public Object getContent() {
        return content;
    }

    /**
     * Gets the loaded content cast to the expected type.
     *
     * @param type the expected content type
     * @return the content, or null unless the asset is loaded
     * @throws ClassCastException if the content has another type
     */
    public <T> T getContent(Class<T> type) {
        return type.cast(content);
    }

    /**
     * Gets the number of dependent assets currently holding this one.
     *
     * @return the internal reference count
     */
    public int getInternalRefCount() {
        return internalRefCount;
    }

    /**
     * Returns true while an external load has not been matched by an external unload.
     *
     * @return true if externally held
     */
    public boolean isExternallyHeld() {
        return externallyHeld;
    }

    /**
     * Returns true if an unload request would be honored right now.
     *
     * @return true if loaded and neither referenced nor externally held
     */
    public boolean isUnloadEligible() {
        return state == AssetState.LOADED && internalRefCount == 0 && !externallyHeld;
    }

    boolean isAttached() {
        return registry != null;
    }

    void attach(AssetRegistry owner) {
        if (registry != null && registry != owner) {
            throw new IllegalStateException("Asset " + id + " already belongs to another registry");
        }
        registry = owner;
    }

    void setExternallyHeld(boolean held) {
        externallyHeld = held;
    }

    void retain() {
        internalRefCount++;
    }

    void release() {
        if (internalRefCount <= 0) {
            throw new IllegalStateException("Release without matching retain for asset " + id);
        }
        internalRefCount--;
    }

    /**
     * Handles a load request. Runs on the dispatcher.
     */
    void requestLoad(PendingListener listener) {
        switch (state) {
            case LOADED -> registry.notify(listener, AssetOutcome.success(id));
            case WAITING, LOADING -> loadListeners.add(listener);
            case UNLOADING -> {
                loadQueuedBehindUnload = true;
                unloadListeners.add(new PendingListener(id, outcome -> {
                    if (!listener.isDone()) {
                        requestLoad(listener);
                    }
                }));
            }
            case UNLOADED -> {
                loadListeners.add(listener);
                resolveDependencies();
            }
        }
    }

    /**
     * Handles an unload request. Runs on the dispatcher.
     */
    void requestUnload(PendingListener listener) {
        // Re-issued once the pending load settles; the gate is checked again then
        if (state.isLoadPending()) {
            loadListeners.add(reissueUnload(listener));
            return;
        }
        switch (state) {
            case UNLOADED -> registry.notify(listener, AssetOutcome.success(id));
            // A load queued behind this unload runs first, so this unload has to follow it
            case UNLOADING -> unloadListeners.add(loadQueuedBehindUnload ? reissueUnload(listener) : listener);
            case LOADED -> {
                if (internalRefCount > 0 || externallyHeld) {
                    LOGGER.debug("Unload of asset {} refused (refs: {}, externally held: {})",
                        id, internalRefCount, externallyHeld);
                    registry.notify(listener, AssetOutcome.failure(id,
                        new UnloadRefusedException(id, internalRefCount, externallyHeld)));
                    return;
                }
                unloadListeners.add(listener);
                beginUnloading();
            }
        }
    }

    private PendingListener reissueUnload(PendingListener listener) {
        return new PendingListener(id, outcome -> {
            if (!listener.isDone()) {
                requestUnload(listener);
            }
        });
    }

    private void resolveDependencies() {
        long generation = ++loadGeneration;
        boolean ready = true;

        for (long dependencyId : dependencyIds) {
            Asset dependency = registry.findAsset(dependencyId);
            if (dependency == null) {
                LOGGER.warn("Asset {} depends on missing asset {}, skipping it", id, dependencyId);
                continue;
            }

            dependency.retain();
            if (!dependency.state.hasContent()) {
                ready = false;
                dependency.requestLoad(new PendingListener(dependencyId,
                    outcome -> onDependencySettled(generation, outcome)));
            }
        }

        if (ready) {
            beginLoading();
        } else {
            transition(AssetState.WAITING);
        }
    }

    private void onDependencySettled(long generation, AssetOutcome outcome) {
        if (generation != loadGeneration || state != AssetState.WAITING) {
            return;
        }
        if (!outcome.isSuccess()) {
            failLoad(new ContentLoadException(id,
                String.format("Dependency %d of asset %d failed to load", outcome.assetId(), id),
                outcome.failure()));
            return;
        }
        checkDependencies();
    }

    /**
     * Re-scans every dependency; any one of them finishing may complete the set.
     */
    private void checkDependencies() {
        for (long dependencyId : dependencyIds) {
            Asset dependency = registry.findAsset(dependencyId);
            if (dependency != null && !dependency.state.hasContent()) {
                return;
            }
        }
        beginLoading();
    }

    private void beginLoading() {
        transition(AssetState.LOADING);
        registry.recordLoadStarted();

        ContentLoad completion = new ContentLoad(loadGeneration);
        completion.timeout = registry.scheduleTimeout(registry.getLoadTimeout(),
            () -> completion.fail(new TimeoutException(
                "Content load of asset " + id + " timed out after " + registry.getLoadTimeout())));
        try {
            beginContentLoad(completion);
        } catch (RuntimeException e) {
            completion.fail(e);
        }
    }

    private void onContentLoaded(long generation, Object loaded) {
        if (generation != loadGeneration || state != AssetState.LOADING) {
            LOGGER.warn("Ignoring stale content for asset {} in state {}", id, state);
            return;
        }
        content = loaded;
        transition(AssetState.LOADED);
        drain(loadListeners, AssetOutcome.success(id));
    }

    private void onContentLoadFailed(long generation, Throwable cause) {
        if (generation != loadGeneration || state != AssetState.LOADING) {
            return;
        }
        failLoad(new ContentLoadException(id, "Content load of asset " + id + " failed", cause));
    }

    private void failLoad(ContentLoadException failure) {
        LOGGER.error("Loading asset {} failed: {}", id, failure.getMessage(), failure.getCause());
        registry.recordLoadFailed();

        content = null;
        externallyHeld = false;
        transition(AssetState.UNLOADED);
        releaseDependencies();
        drain(loadListeners, AssetOutcome.failure(id, failure));
    }

    private void beginUnloading() {
        transition(AssetState.UNLOADING);
        registry.recordUnloadStarted();

        ContentUnload completion = new ContentUnload();
        completion.timeout = registry.scheduleTimeout(registry.getUnloadTimeout(),
            () -> completion.fail(new TimeoutException(
                "Content unload of asset " + id + " timed out after " + registry.getUnloadTimeout())));
        try {
            beginContentUnload(content, completion);
        } catch (RuntimeException e) {
            completion.fail(e);
        }
    }

    private void onContentUnloaded() {
        if (state != AssetState.UNLOADING) {
            return;
        }
        content = null;
        transition(AssetState.UNLOADED);
        releaseDependencies();
        loadQueuedBehindUnload = false;
        drain(unloadListeners, AssetOutcome.success(id));
    }

    private void onContentUnloadFailed(Throwable cause) {
        if (state != AssetState.UNLOADING) {
            return;
        }
        LOGGER.error("Unloading asset {} failed, keeping it loaded", id, cause);
        registry.recordUnloadFailed();

        transition(AssetState.LOADED);
        loadQueuedBehindUnload = false;
        drain(unloadListeners, AssetOutcome.failure(id,
            new ContentUnloadException(id, "Content unload of asset " + id + " failed", cause)));
    }

    /**
     * Drops the reference this asset holds on each dependency and offers each one an unload.
     */
    private void releaseDependencies() {
        for (long dependencyId : dependencyIds) {
            Asset dependency = registry.findAsset(dependencyId);
            if (dependency == null) {
                continue;
            }
            dependency.release();
            dependency.requestUnload(new PendingListener(dependencyId, null));
        }
    }

    private void drain(List<PendingListener> listeners, AssetOutcome outcome) {
        List<PendingListener> settled = new ArrayList<>(listeners);
        listeners.clear();
        for (PendingListener listener : settled) {
            registry.notify(listener, outcome);
        }
    }

    private void transition(AssetState next) {
        LOGGER.debug("Asset {} transitioning from {} to {}", id, state, next);
        state = next;
    }

    @Override
    public String toString() {
        return String.format("%s{id=%d, state=%s, refs=%d, externallyHeld=%s, dependencies=%s}",
            getClass().getSimpleName(), id, state, internalRefCount, externallyHeld, dependencyIds);
    }

    /**
     * Base for the one-shot completion sinks; settles at most once and cancels its timeout.
     */
    private abstract class OneShot {
        private final AtomicBoolean settled = new AtomicBoolean(false);
        volatile ScheduledFuture<?> timeout;

        boolean settle(String operation) {
            if (!settled.compareAndSet(false, true)) {
                LOGGER.warn("Ignoring repeated or late {} completion for asset {}", operation, id);
                return false;
            }
            ScheduledFuture<?> pending = timeout;
            if (pending != null) {
                pending.cancel(false);
            }
            return true;
        }
    }

    private final class ContentLoad extends OneShot implements LoadCompletion {
        private final long generation;

        ContentLoad(long generation) {
            this.generation = generation;
        }

        @Override
        public void complete(Object loaded) {
            if (loaded == null) {
                fail(new IllegalStateException("Content load of asset " + id + " produced no content"));
                return;
            }
            if (settle("load")) {
                registry.dispatch(() -> onContentLoaded(generation, loaded));
            }
        }

        @Override
        public void fail(Throwable cause) {
            if (settle("load")) {
                registry.dispatch(() -> onContentLoadFailed(generation, cause));
            }
        }
    }

    private final class ContentUnload extends OneShot implements UnloadCompletion {

        @Override
        public void complete() {
            if (settle("unload")) {
                registry.dispatch(Asset.this::onContentUnloaded);
            }
        }

        @Override
        public void fail(Throwable cause) {
            if (settle("unload")) {
                registry.dispatch(() -> onContentUnloadFailed(cause));
            }
        }
    }
}

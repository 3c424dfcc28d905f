package com.assetloom.asset;

import com.assetloom.dispatch.AssetDispatcher;
import com.assetloom.dispatch.InlineAssetDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lookup from asset id to {@link Asset} and entry point for external callers.
 *
 * The registry is populated once through {@link #builder()} and never gains or
 * loses assets afterwards. It routes load and unload requests to the right asset,
 * tracks whether an outside caller holds each asset, and owns the dispatcher
 * every state transition runs on.
 */
public class AssetRegistry implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssetRegistry.class);

    private final Map<Long, Asset> assets;
    private final AssetDispatcher dispatcher;
    private final Duration loadTimeout;
    private final Duration unloadTimeout;
    private final ScheduledExecutorService timeoutScheduler;

    private final AtomicLong loadsStarted = new AtomicLong();
    private final AtomicLong loadsFailed = new AtomicLong();
    private final AtomicLong unloadsStarted = new AtomicLong();
    private final AtomicLong unloadsFailed = new AtomicLong();

    private AssetRegistry(Builder builder) {
        this.assets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.assets));
        this.dispatcher = builder.dispatcher != null ? builder.dispatcher : new InlineAssetDispatcher();
        this.loadTimeout = builder.loadTimeout;
        this.unloadTimeout = builder.unloadTimeout;

        for (Asset asset : assets.values()) {
            asset.attach(this);
        }

        this.timeoutScheduler = isEnabled(loadTimeout) || isEnabled(unloadTimeout)
            ? Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread t = new Thread(runnable, "assetloom-timeouts");
                t.setDaemon(true);
                return t;
            })
            : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Requests that an asset and its dependencies be loaded.
     *
     * Marks the asset as externally held. If it is already loaded the callback
     * fires without touching the state machine; otherwise the request joins or
     * starts the asset's load sequence.
     *
     * @param id the asset id
     * @param callback fired once when the load settles, may be null
     * @return handle that can withdraw the callback
     */
    public AssetRequest loadAsync(long id, AssetCallback callback) {
        PendingListener listener = new PendingListener(id, callback);
        Asset asset = assets.get(id);
        if (asset == null) {
            LOGGER.warn("Load requested for unknown asset {}", id);
            notify(listener, AssetOutcome.failure(id, new UnknownAssetException(id)));
            return listener;
        }

        dispatcher.execute(() -> {
            asset.setExternallyHeld(true);
            if (asset.getState().hasContent()) {
                notify(listener, AssetOutcome.success(id));
            } else {
                asset.requestLoad(listener);
            }
        });
        return listener;
    }

    /**
     * Requests that an asset be unloaded, together with any dependency no longer in use.
     *
     * Clears the external hold first. The unload only proceeds when no loaded
     * asset depends on this one; otherwise the callback receives an
     * {@link UnloadRefusedException} and the asset stays loaded.
     *
     * @param id the asset id
     * @param callback fired once when the unload settles, may be null
     * @return handle that can withdraw the callback
     */
    public AssetRequest unloadAsync(long id, AssetCallback callback) {
        PendingListener listener = new PendingListener(id, callback);
        Asset asset = assets.get(id);
        if (asset == null) {
            LOGGER.warn("Unload requested for unknown asset {}", id);
            notify(listener, AssetOutcome.failure(id, new UnknownAssetException(id)));
            return listener;
        }

        dispatcher.execute(() -> {
            asset.setExternallyHeld(false);
            if (asset.getState() == AssetState.UNLOADED) {
                notify(listener, AssetOutcome.success(id));
            } else {
                asset.requestUnload(listener);
            }
        });
        return listener;
    }

    /**
     * Future-returning form of {@link #loadAsync}. Cancelling the future withdraws the request.
     *
     * @param id the asset id
     * @return future completed with the loaded asset, or exceptionally with an {@link AssetException}
     */
    public CompletableFuture<Asset> load(long id) {
        CompletableFuture<Asset> future = new CompletableFuture<>();
        AssetRequest request = loadAsync(id, outcome -> {
            if (outcome.isSuccess()) {
                future.complete(assets.get(id));
            } else {
                future.completeExceptionally(outcome.failure());
            }
        });
        future.whenComplete((asset, error) -> {
            if (future.isCancelled()) {
                request.cancel();
            }
        });
        return future;
    }

    /**
     * Future-returning form of {@link #unloadAsync}.
     *
     * @param id the asset id
     * @return future completed once the asset is unloaded
     */
    public CompletableFuture<Void> unload(long id) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        AssetRequest request = unloadAsync(id, outcome -> {
            if (outcome.isSuccess()) {
                future.complete(null);
            } else {
                future.completeExceptionally(outcome.failure());
            }
        });
        future.whenComplete((ignored, error) -> {
            if (future.isCancelled()) {
                request.cancel();
            }
        });
        return future;
    }

    /**
     * Gets an asset by id.
     *
     * @param id the asset id
     * @return the asset, or empty if not registered
     */
    public Optional<Asset> getAsset(long id) {
        return Optional.ofNullable(assets.get(id));
    }

    /**
     * Gets an asset by id.
     *
     * @param id the asset id
     * @return the asset
     * @throws UnknownAssetException if not registered
     */
    public Asset requireAsset(long id) {
        Asset asset = assets.get(id);
        if (asset == null) {
            throw new UnknownAssetException(id);
        }
        return asset;
    }

    /**
     * Gets all registered assets in registration order.
     *
     * @return immutable view of the assets
     */
    public Collection<Asset> getAllAssets() {
        return assets.values();
    }

    public AssetDispatcher getDispatcher() {
        return dispatcher;
    }

    public Duration getLoadTimeout() {
        return loadTimeout;
    }

    public Duration getUnloadTimeout() {
        return unloadTimeout;
    }

    /**
     * Gets a snapshot of the registry's counters and per-state asset counts.
     *
     * @return registry statistics
     */
    public RegistryStats getStats() {
        Map<AssetState, Integer> stateCounts = new EnumMap<>(AssetState.class);
        for (AssetState state : AssetState.values()) {
            stateCounts.put(state, 0);
        }
        for (Asset asset : assets.values()) {
            stateCounts.merge(asset.getState(), 1, Integer::sum);
        }

        return new RegistryStats(
            assets.size(),
            Collections.unmodifiableMap(stateCounts),
            loadsStarted.get(),
            loadsFailed.get(),
            unloadsStarted.get(),
            unloadsFailed.get()
        );
    }

    /**
     * Stops the timeout scheduler and closes the dispatcher.
     */
    @Override
    public void close() {
        long inFlight = assets.values().stream().filter(asset -> asset.getState().isInFlight()).count();
        if (inFlight > 0) {
            LOGGER.warn("Closing asset registry with {} operation(s) in flight; their callbacks may never fire",
                inFlight);
        }
        if (timeoutScheduler != null) {
            timeoutScheduler.shutdownNow();
        }
        dispatcher.close();
        LOGGER.info("Asset registry closed");
    }

    Asset findAsset(long id) {
        return assets.get(id);
    }

    void dispatch(Runnable task) {
        dispatcher.execute(task);
    }

    void notify(PendingListener listener, AssetOutcome outcome) {
        dispatcher.execute(() -> listener.fire(outcome));
    }

    ScheduledFuture<?> scheduleTimeout(Duration timeout, Runnable onTimeout) {
        if (timeoutScheduler == null || !isEnabled(timeout)) {
            return null;
        }
        return timeoutScheduler.schedule(onTimeout, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void recordLoadStarted() {
        loadsStarted.incrementAndGet();
    }

    void recordLoadFailed() {
        loadsFailed.incrementAndGet();
    }

    void recordUnloadStarted() {
        unloadsStarted.incrementAndGet();
    }

    void recordUnloadFailed() {
        unloadsFailed.incrementAndGet();
    }

    private static boolean isEnabled(Duration timeout) {
        return !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * Statistics for the asset registry.
     */
    public record RegistryStats(
        int assetCount,
        Map<AssetState, Integer> stateCounts,
        long loadsStarted,
        long loadsFailed,
        long unloadsStarted,
        long unloadsFailed
    ) {
        public int count(AssetState state) {
            return stateCounts.getOrDefault(state, 0);
        }
    }

    /**
     * Collects assets and settings, validates the dependency graph and builds the registry.
     */
    public static final class Builder {

        private final Map<Long, Asset> assets = new LinkedHashMap<>();
        private AssetDispatcher dispatcher;
        private Duration loadTimeout = Duration.ZERO;
        private Duration unloadTimeout = Duration.ZERO;

        private Builder() {}

        /**
         * Adds an asset.
         *
         * @param asset the asset
         * @return this builder
         * @throws IllegalArgumentException if the id is taken or the asset depends on itself
         */
        public Builder register(Asset asset) {
            Objects.requireNonNull(asset, "asset");
            long id = asset.getId();

            if (assets.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate asset id: " + id);
            }
            if (asset.getDependencyIds().contains(id)) {
                throw new IllegalArgumentException("Asset " + id + " cannot depend on itself");
            }

            assets.put(id, asset);
            LOGGER.debug("Registered asset {} (dependencies: {})", id, asset.getDependencyIds());
            return this;
        }

        public Builder registerAll(Collection<? extends Asset> toRegister) {
            toRegister.forEach(this::register);
            return this;
        }

        /**
         * Sets the dispatcher. Defaults to an {@link InlineAssetDispatcher}.
         * The registry closes it on {@link AssetRegistry#close()}.
         *
         * @param dispatcher the dispatcher
         * @return this builder
         */
        public Builder dispatcher(AssetDispatcher dispatcher) {
            this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
            return this;
        }

        /**
         * Sets the content load timeout. {@link Duration#ZERO} disables it.
         *
         * @param timeout the timeout
         * @return this builder
         */
        public Builder loadTimeout(Duration timeout) {
            this.loadTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        /**
         * Sets the content unload timeout. {@link Duration#ZERO} disables it.
         *
         * @param timeout the timeout
         * @return this builder
         */
        public Builder unloadTimeout(Duration timeout) {
            this.unloadTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        /**
         * Validates the dependency graph and builds the registry.
         *
         * @return the registry
         * @throws CircularDependencyException if the dependency graph has a cycle
         * @throws IllegalStateException if an asset already belongs to another registry
         */
        public AssetRegistry build() {
            for (Asset asset : assets.values()) {
                if (asset.isAttached()) {
                    throw new IllegalStateException("Asset " + asset.getId() + " already belongs to another registry");
                }
            }

            for (Asset asset : assets.values()) {
                for (long dependencyId : asset.getDependencyIds()) {
                    if (!assets.containsKey(dependencyId)) {
                        LOGGER.warn("Asset {} depends on unregistered asset {}; it will be skipped on load",
                            asset.getId(), dependencyId);
                    }
                }
            }

            detectCircularDependencies();

            AssetRegistry registry = new AssetRegistry(this);
            LOGGER.info("Asset registry built with {} assets", assets.size());
            return registry;
        }

        private void detectCircularDependencies() {
            Set<Long> visited = new HashSet<>();
            LinkedHashSet<Long> visiting = new LinkedHashSet<>();

            for (Long id : assets.keySet()) {
                if (!visited.contains(id)) {
                    visit(id, visiting, visited);
                }
            }
        }

        private void visit(long id, LinkedHashSet<Long> visiting, Set<Long> visited) {
            if (visiting.contains(id)) {
                List<Long> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (Long onPath : visiting) {
                    inCycle |= onPath == id;
                    if (inCycle) {
                        cycle.add(onPath);
                    }
                }
                cycle.add(id);
                throw new CircularDependencyException(cycle);
            }

            Asset asset = assets.get(id);
            if (visited.contains(id) || asset == null) {
                return;
            }

            visiting.add(id);
            for (long dependencyId : asset.getDependencyIds()) {
                visit(dependencyId, visiting, visited);
            }
            visiting.remove(id);
            visited.add(id);
        }
    }
}

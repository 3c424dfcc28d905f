package com.assetloom;

import com.assetloom.asset.AssetRegistry;
import com.assetloom.config.ConfigLoadException;
import com.assetloom.config.ConfigService;
import com.assetloom.config.ConfigValidationException;
import com.assetloom.config.LoaderConfig;
import com.assetloom.dispatch.AssetDispatcher;
import com.assetloom.dispatch.ExecutorAssetDispatcher;
import com.assetloom.dispatch.InlineAssetDispatcher;
import com.assetloom.manifest.AssetManifest;
import com.assetloom.manifest.ManifestLoadException;
import com.assetloom.manifest.ManifestReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires configuration, manifest and registry into a running loader.
 *
 * Owns the I/O pool file reads run on and the registry built from the
 * manifest; closing it shuts both down.
 */
public final class Assetloom implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Assetloom.class);

    private final LoaderConfig config;
    private final ExecutorService ioExecutor;
    private final AssetRegistry registry;

    private Assetloom(LoaderConfig config, ExecutorService ioExecutor, AssetRegistry registry) {
        this.config = config;
        this.ioExecutor = ioExecutor;
        this.registry = registry;
    }

    /**
     * Loads the configuration file and starts the loader.
     *
     * @param configFile path of the JSON configuration, defaults apply if absent
     * @return the running loader
     */
    public static Assetloom start(Path configFile)
            throws ConfigLoadException, ConfigValidationException, ManifestLoadException {
        return start(new ConfigService().load(configFile));
    }

    /**
     * Reads the manifest named by the configuration and builds the registry.
     *
     * @param config validated settings
     * @return the running loader
     * @throws ManifestLoadException if the manifest cannot be read
     */
    public static Assetloom start(LoaderConfig config) throws ManifestLoadException {
        LOGGER.info("Starting asset loader");

        AssetManifest manifest = new ManifestReader().read(config.manifest());

        ExecutorService ioExecutor = Executors.newFixedThreadPool(config.ioThreads(), ioThreadFactory());
        AssetDispatcher dispatcher = config.dispatcher() == LoaderConfig.DispatcherMode.THREAD
            ? new ExecutorAssetDispatcher("assetloom-dispatch")
            : new InlineAssetDispatcher();

        try {
            AssetRegistry registry = AssetRegistry.builder()
                .dispatcher(dispatcher)
                .loadTimeout(config.loadTimeout())
                .unloadTimeout(config.unloadTimeout())
                .registerAll(manifest.toAssets(config.assetRoot(), ioExecutor))
                .build();

            LOGGER.info("Asset loader started with {} assets from {}",
                registry.getAllAssets().size(), config.manifest());
            return new Assetloom(config, ioExecutor, registry);

        } catch (RuntimeException e) {
            LOGGER.error("Asset loader failed to start", e);
            dispatcher.close();
            ioExecutor.shutdownNow();
            throw e;
        }
    }

    public LoaderConfig config() {
        return config;
    }

    public AssetRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("I/O pool did not stop within 5 seconds");
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ioExecutor.shutdownNow();
        }
        LOGGER.info("Asset loader stopped");
    }

    private static ThreadFactory ioThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "assetloom-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

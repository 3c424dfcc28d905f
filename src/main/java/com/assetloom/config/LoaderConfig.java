package com.assetloom.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Validated loader settings.
 *
 * @param loadTimeout content load timeout, zero disables it
 * @param unloadTimeout content unload timeout, zero disables it
 * @param dispatcher which dispatcher owns asset state
 * @param ioThreads threads reading file content
 * @param manifest path of the asset manifest
 * @param assetRoot directory manifest paths are resolved against
 */
public record LoaderConfig(
    Duration loadTimeout,
    Duration unloadTimeout,
    DispatcherMode dispatcher,
    int ioThreads,
    Path manifest,
    Path assetRoot
) {

    public static final long DEFAULT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_IO_THREADS = 2;
    public static final String DEFAULT_MANIFEST = "assets.json";

    public LoaderConfig {
        Objects.requireNonNull(loadTimeout, "loadTimeout");
        Objects.requireNonNull(unloadTimeout, "unloadTimeout");
        Objects.requireNonNull(dispatcher, "dispatcher");
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(assetRoot, "assetRoot");
        if (ioThreads < 1) {
            throw new IllegalArgumentException("ioThreads must be positive: " + ioThreads);
        }
    }

    /**
     * Dispatcher choices.
     */
    public enum DispatcherMode {
        /** Tasks run on the calling thread, queued while another task runs. */
        INLINE,
        /** Tasks run on one dedicated thread. */
        THREAD
    }
}

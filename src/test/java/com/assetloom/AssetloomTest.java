package com.assetloom;

import com.assetloom.asset.Asset;
import com.assetloom.asset.AssetRegistry;
import com.assetloom.asset.AssetState;
import com.assetloom.asset.CircularDependencyException;
import com.assetloom.asset.UnloadRefusedException;
import com.assetloom.config.LoaderConfig;
import com.assetloom.dispatch.ExecutorAssetDispatcher;
import com.assetloom.dispatch.InlineAssetDispatcher;
import com.assetloom.manifest.FileAsset;
import com.assetloom.manifest.ManifestLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests starting the loader from configuration files.
 */
public class AssetloomTest {

    @TempDir
    Path tempDir;

    private void writeAssets() throws Exception {
        Path files = Files.createDirectories(tempDir.resolve("files"));
        Files.writeString(files.resolve("scene.json"), "{\"scene\":true}");
        Files.writeString(files.resolve("mesh.bin"), "mesh");
        Files.writeString(files.resolve("texture.png"), "texture");
        Files.writeString(tempDir.resolve("manifest.json"), """
            { "assets": [
                { "id": 1, "path": "scene.json", "dependsOn": [2, 3] },
                { "id": 2, "path": "mesh.bin", "dependsOn": [3] },
                { "id": 3, "path": "texture.png" }
            ] }
            """);
    }

    @Test
    @DisplayName("Loader started from config loads and unloads a dependency chain")
    void testStartFromConfig() throws Exception {
        writeAssets();
        Path configFile = tempDir.resolve("assetloom.json");
        Files.writeString(configFile, """
            {
              "dispatcher": "thread",
              "ioThreads": 2,
              "loadTimeoutMs": 5000,
              "manifest": "manifest.json",
              "assetRoot": "files"
            }
            """);

        try (Assetloom loader = Assetloom.start(configFile)) {
            AssetRegistry registry = loader.registry();
            assertInstanceOf(ExecutorAssetDispatcher.class, registry.getDispatcher());
            assertEquals(Duration.ofMillis(5000), registry.getLoadTimeout());
            assertEquals(3, registry.getAllAssets().size());

            Asset scene = registry.load(1).get(5, TimeUnit.SECONDS);

            FileAsset sceneFile = assertInstanceOf(FileAsset.class, scene);
            assertEquals("{\"scene\":true}", new String(sceneFile.getBytes(), StandardCharsets.UTF_8));
            Asset texture = registry.requireAsset(3);
            assertEquals(AssetState.LOADED, texture.getState());
            assertEquals(2, texture.getInternalRefCount());

            ExecutionException refused = assertThrows(ExecutionException.class,
                () -> registry.unload(3).get(5, TimeUnit.SECONDS));
            assertInstanceOf(UnloadRefusedException.class, refused.getCause());

            registry.unload(1).get(5, TimeUnit.SECONDS);

            // Releases further down the chain run on the dispatch thread after the callback
            awaitUnloaded(registry);
            for (Asset asset : registry.getAllAssets()) {
                assertEquals(0, asset.getInternalRefCount());
            }
            assertEquals(3, registry.getStats().loadsStarted());
        }
    }

    @Test
    @DisplayName("Defaults use the inline dispatcher")
    void testStartWithDefaults() throws Exception {
        writeAssets();
        LoaderConfig config = new LoaderConfig(
            Duration.ZERO, Duration.ZERO, LoaderConfig.DispatcherMode.INLINE, 1,
            tempDir.resolve("manifest.json"), tempDir.resolve("files"));

        try (Assetloom loader = Assetloom.start(config)) {
            assertSame(config, loader.config());
            assertInstanceOf(InlineAssetDispatcher.class, loader.registry().getDispatcher());

            loader.registry().load(2).get(5, TimeUnit.SECONDS);

            assertEquals(AssetState.LOADED, loader.registry().requireAsset(3).getState());
            assertEquals(AssetState.UNLOADED, loader.registry().requireAsset(1).getState());
        }
    }

    @Test
    @DisplayName("Missing manifest prevents startup")
    void testMissingManifest() {
        LoaderConfig config = new LoaderConfig(
            Duration.ZERO, Duration.ZERO, LoaderConfig.DispatcherMode.INLINE, 1,
            tempDir.resolve("missing.json"), tempDir);

        assertThrows(ManifestLoadException.class, () -> Assetloom.start(config));
    }

    @Test
    @DisplayName("Cyclic manifest prevents startup")
    void testCyclicManifest() throws Exception {
        Files.writeString(tempDir.resolve("manifest.json"), """
            { "assets": [
                { "id": 1, "path": "a.bin", "dependsOn": [2] },
                { "id": 2, "path": "b.bin", "dependsOn": [1] }
            ] }
            """);
        LoaderConfig config = new LoaderConfig(
            Duration.ZERO, Duration.ZERO, LoaderConfig.DispatcherMode.THREAD, 1,
            tempDir.resolve("manifest.json"), tempDir);

        CircularDependencyException error = assertThrows(CircularDependencyException.class,
            () -> Assetloom.start(config));
        assertEquals(3, error.getCycle().size());
    }

    private static void awaitUnloaded(AssetRegistry registry) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (registry.getStats().count(AssetState.UNLOADED) < registry.getAllAssets().size()
                && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(registry.getAllAssets().size(), registry.getStats().count(AssetState.UNLOADED));
    }
}

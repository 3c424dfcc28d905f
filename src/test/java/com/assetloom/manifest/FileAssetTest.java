package com.assetloom.manifest;

import com.assetloom.asset.AssetRegistry;
import com.assetloom.asset.AssetState;
import com.assetloom.asset.ContentLoadException;
import com.assetloom.dispatch.ExecutorAssetDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests FileAsset loading through a registry with real I/O and dispatch threads.
 */
public class FileAssetTest {

    @TempDir
    Path tempDir;

    private ExecutorService io;
    private AssetRegistry registry;

    @BeforeEach
    void setUp() {
        io = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.close();
        }
        io.shutdownNow();
    }

    @Test
    @DisplayName("File content is read off-thread and exposed once loaded")
    void testLoadsFileBytes() throws Exception {
        Files.writeString(tempDir.resolve("base.txt"), "base");
        Files.writeString(tempDir.resolve("top.txt"), "top");
        FileAsset base = new FileAsset(2, List.of(), tempDir.resolve("base.txt"), io);
        FileAsset top = new FileAsset(1, List.of(2L), tempDir.resolve("top.txt"), io);
        registry = AssetRegistry.builder()
            .dispatcher(new ExecutorAssetDispatcher("file-asset-test"))
            .registerAll(List.of(top, base))
            .build();

        registry.load(1).get(5, TimeUnit.SECONDS);

        assertEquals(AssetState.LOADED, top.getState());
        assertEquals(AssetState.LOADED, base.getState());
        assertArrayEquals("top".getBytes(StandardCharsets.UTF_8), top.getBytes());
        assertArrayEquals("base".getBytes(StandardCharsets.UTF_8), base.getBytes());
        assertEquals(1, base.getInternalRefCount());

        top.getBytes()[0] = 'X';
        assertArrayEquals("top".getBytes(StandardCharsets.UTF_8), top.getBytes());

        registry.unload(1).get(5, TimeUnit.SECONDS);

        assertEquals(AssetState.UNLOADED, top.getState());
        assertNull(top.getBytes());
        assertEquals(AssetState.UNLOADED, base.getState());
        assertEquals(0, base.getInternalRefCount());
    }

    @Test
    @DisplayName("Missing file fails the load with the I/O error as cause")
    void testMissingFile() {
        FileAsset missing = new FileAsset(1, List.of(), tempDir.resolve("nope.bin"), io);
        registry = AssetRegistry.builder().register(missing).build();

        ExecutionException error = assertThrows(ExecutionException.class,
            () -> registry.load(1).get(5, TimeUnit.SECONDS));

        ContentLoadException failure = assertInstanceOf(ContentLoadException.class, error.getCause());
        assertInstanceOf(NoSuchFileException.class, failure.getCause());
        assertEquals(AssetState.UNLOADED, missing.getState());
    }
}

package com.assetloom.asset;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for failure propagation, timeouts and late completions.
 */
public class AssetFailureTest {

    private final List<String> events = new ArrayList<>();
    private final List<AssetOutcome> outcomes = new ArrayList<>();
    private AssetRegistry registry;

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.close();
        }
    }

    @Test
    @DisplayName("Failed content load returns the asset to UNLOADED")
    void testContentLoadFailure() {
        ManualAsset a = ManualAsset.manual(1);
        registry = AssetRegistry.builder().register(a).build();
        IOException cause = new IOException("disk gone");

        registry.loadAsync(1, outcomes::add);
        a.failLoad(cause);

        assertEquals(AssetState.UNLOADED, a.getState());
        assertFalse(a.isExternallyHeld());
        assertNull(a.getContent());
        ContentLoadException failure = assertInstanceOf(ContentLoadException.class, outcomes.get(0).failure());
        assertSame(cause, failure.getCause());
        assertEquals(1, registry.getStats().loadsFailed());
    }

    @Test
    @DisplayName("Dependency failure fails the dependent and releases its references")
    void testDependencyFailurePropagates() {
        ManualAsset b = ManualAsset.manual(2);
        ManualAsset a = ManualAsset.manual(1, 2L);
        registry = AssetRegistry.builder().register(a).register(b).build();

        registry.loadAsync(1, outcomes::add);
        assertEquals(1, b.getInternalRefCount());
        b.failLoad(new IOException("corrupt"));

        assertEquals(AssetState.UNLOADED, a.getState());
        assertEquals(AssetState.UNLOADED, b.getState());
        assertEquals(0, b.getInternalRefCount());
        assertEquals(0, a.contentLoads);

        ContentLoadException failure = assertInstanceOf(ContentLoadException.class, outcomes.get(0).failure());
        assertEquals(1, failure.getAssetId());
        ContentLoadException dependencyFailure = assertInstanceOf(ContentLoadException.class, failure.getCause());
        assertEquals(2, dependencyFailure.getAssetId());
    }

    @Test
    @DisplayName("Sibling dependency still loading is unloaded once it settles")
    void testSiblingDependencyReleasedAfterFailure() {
        ManualAsset b = ManualAsset.manual(2);
        ManualAsset c = ManualAsset.manual(3);
        ManualAsset a = ManualAsset.manual(1, 2L, 3L);
        registry = AssetRegistry.builder().registerAll(List.of(a, b, c)).build();

        registry.loadAsync(1, outcomes::add);
        b.failLoad(new IOException("corrupt"));

        assertEquals(AssetState.UNLOADED, a.getState());
        assertEquals(0, c.getInternalRefCount());
        assertEquals(AssetState.LOADING, c.getState());

        c.completeLoad();
        assertEquals(AssetState.UNLOADING, c.getState());

        c.completeUnload();
        assertEquals(AssetState.UNLOADED, c.getState());
        assertEquals(1, outcomes.size());
        assertFalse(outcomes.get(0).isSuccess());
    }

    @Test
    @DisplayName("A failed asset can be loaded again")
    void testRetryAfterFailure() {
        ManualAsset a = ManualAsset.manual(1);
        registry = AssetRegistry.builder().register(a).build();

        registry.loadAsync(1, outcomes::add);
        a.failLoad(new IOException("transient"));
        registry.loadAsync(1, outcomes::add);
        a.completeLoad();

        assertEquals(AssetState.LOADED, a.getState());
        assertEquals(2, a.contentLoads);
        assertFalse(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(1).isSuccess());
    }

    @Test
    @DisplayName("Exception thrown from beginContentLoad fails the load")
    void testSynchronousThrow() {
        ManualAsset a = ManualAsset.manual(1);
        IllegalStateException boom = new IllegalStateException("boom");
        a.throwOnLoad = boom;
        registry = AssetRegistry.builder().register(a).build();

        registry.loadAsync(1, outcomes::add);

        assertEquals(AssetState.UNLOADED, a.getState());
        assertSame(boom, outcomes.get(0).failure().getCause());
    }

    @Test
    @DisplayName("Completing a load with null content fails it")
    void testNullContentFails() {
        ManualAsset a = ManualAsset.manual(1);
        registry = AssetRegistry.builder().register(a).build();

        registry.loadAsync(1, outcomes::add);
        a.takeLoadCompletion().complete(null);

        assertEquals(AssetState.UNLOADED, a.getState());
        assertInstanceOf(IllegalStateException.class, outcomes.get(0).failure().getCause());
    }

    @Test
    @DisplayName("Failed unload keeps the asset and its dependencies loaded")
    void testUnloadFailure() {
        ManualAsset b = ManualAsset.auto(2, events);
        ManualAsset a = ManualAsset.manual(1, 2L);
        registry = AssetRegistry.builder().register(a).register(b).build();
        registry.loadAsync(1, null);
        a.completeLoad();

        registry.unloadAsync(1, outcomes::add);
        a.failUnload(new IOException("busy"));

        assertEquals(AssetState.LOADED, a.getState());
        assertEquals("content-1", a.getContent());
        assertEquals(AssetState.LOADED, b.getState());
        assertEquals(1, b.getInternalRefCount());
        assertInstanceOf(ContentUnloadException.class, outcomes.get(0).failure());
        assertEquals(1, registry.getStats().unloadsFailed());

        assertTrue(a.isUnloadEligible());
        registry.unloadAsync(1, outcomes::add);
        a.completeUnload();

        assertEquals(AssetState.UNLOADED, a.getState());
        assertEquals(AssetState.UNLOADED, b.getState());
        assertTrue(outcomes.get(1).isSuccess());
    }

    @Test
    @DisplayName("Load that never completes times out and ignores the late completion")
    void testLoadTimeout() throws Exception {
        ManualAsset a = ManualAsset.manual(1);
        registry = AssetRegistry.builder()
            .register(a)
            .loadTimeout(Duration.ofMillis(50))
            .build();

        ExecutionException error = assertThrows(ExecutionException.class,
            () -> registry.load(1).get(5, TimeUnit.SECONDS));

        ContentLoadException failure = assertInstanceOf(ContentLoadException.class, error.getCause());
        assertInstanceOf(TimeoutException.class, failure.getCause());
        assertEquals(AssetState.UNLOADED, a.getState());

        a.completeLoad();

        assertEquals(AssetState.UNLOADED, a.getState());
        assertNull(a.getContent());
    }

    @Test
    @DisplayName("Unload that never completes times out and keeps the asset loaded")
    void testUnloadTimeout() throws Exception {
        ManualAsset a = ManualAsset.manual(1);
        registry = AssetRegistry.builder()
            .register(a)
            .unloadTimeout(Duration.ofMillis(50))
            .build();
        registry.loadAsync(1, null);
        a.completeLoad();

        ExecutionException error = assertThrows(ExecutionException.class,
            () -> registry.unload(1).get(5, TimeUnit.SECONDS));

        ContentUnloadException failure = assertInstanceOf(ContentUnloadException.class, error.getCause());
        assertInstanceOf(TimeoutException.class, failure.getCause());
        assertEquals(AssetState.LOADED, a.getState());
    }

    @Test
    @DisplayName("Load completed in time is not failed by its timeout")
    void testTimeoutCancelledOnCompletion() throws Exception {
        ManualAsset a = ManualAsset.manual(1);
        registry = AssetRegistry.builder()
            .register(a)
            .loadTimeout(Duration.ofMillis(100))
            .build();

        registry.loadAsync(1, outcomes::add);
        a.completeLoad();
        Thread.sleep(250);

        assertEquals(AssetState.LOADED, a.getState());
        assertEquals(1, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertEquals(0, registry.getStats().loadsFailed());
    }

    @Test
    @DisplayName("A throwing callback does not stop other callbacks")
    void testThrowingCallbackIsIsolated() {
        ManualAsset a = ManualAsset.manual(1);
        registry = AssetRegistry.builder().register(a).build();

        registry.loadAsync(1, outcome -> {
            throw new IllegalStateException("listener bug");
        });
        registry.loadAsync(1, outcomes::add);
        a.completeLoad();

        assertEquals(AssetState.LOADED, a.getState());
        assertEquals(1, outcomes.size());
    }

    @Test
    @DisplayName("Outcome orThrow rethrows the failure")
    void testOutcomeOrThrow() {
        AssetOutcome.success(1).orThrow();

        AssetOutcome failed = AssetOutcome.failure(2, new UnknownAssetException(2));
        UnknownAssetException error = assertThrows(UnknownAssetException.class, failed::orThrow);
        assertEquals(2, error.getAssetId());
    }
}

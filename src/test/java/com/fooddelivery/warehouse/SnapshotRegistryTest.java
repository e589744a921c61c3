package com.fooddelivery.warehouse;

import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SnapshotRegistry
 */
public class SnapshotRegistryTest {

    private SnapshotRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = new SnapshotRegistry();
    }

    private static WarehouseSnapshot snapshot(long version) {
        return new WarehouseSnapshot(version, Instant.now(), null, null, null);
    }

    @Test
    public void testCurrent_EmptyBeforeFirstRebuild() {
        assertFalse(registry.current().isPresent());
        assertFalse(registry.isRebuilding());
    }

    @Test
    public void testRebuild_VersionsIncreaseByOne() {
        WarehouseSnapshot first = registry.rebuild(SnapshotRegistryTest::snapshot);
        WarehouseSnapshot second = registry.rebuild(SnapshotRegistryTest::snapshot);

        assertEquals(1, first.getVersion());
        assertEquals(2, second.getVersion());
        assertSame(second, registry.current().orElseThrow(IllegalStateException::new));
    }

    @Test
    public void testRebuild_FailureKeepsPreviousSnapshot() {
        WarehouseSnapshot first = registry.rebuild(SnapshotRegistryTest::snapshot);

        IllegalArgumentException failure = assertThrows(IllegalArgumentException.class,
            () -> registry.rebuild(version -> {
                throw new IllegalArgumentException("bad input");
            }));

        assertEquals("bad input", failure.getMessage());
        assertSame(first, registry.current().orElseThrow(IllegalStateException::new));
        assertFalse(registry.isRebuilding(), "Lock must be released after a failed rebuild");

        assertEquals(2, registry.rebuild(SnapshotRegistryTest::snapshot).getVersion(),
            "A failed attempt does not consume a version");
    }

    @Test
    public void testRebuild_FollowsPersistedVersion() {
        assertEquals(4, registry.rebuild(3, SnapshotRegistryTest::snapshot).getVersion());
        assertEquals(5, registry.rebuild(2, SnapshotRegistryTest::snapshot).getVersion(),
            "An older persisted version does not move the sequence back");
    }

    @Test
    public void testRebuild_RejectsSnapshotWithWrongVersion() {
        assertThrows(IllegalStateException.class, () -> registry.rebuild(version -> snapshot(version + 5)));
        assertFalse(registry.current().isPresent());
    }

    @Test
    public void testCurrent_ReadersSeePreviousSnapshotDuringRebuild() throws Exception {
        WarehouseSnapshot first = registry.rebuild(SnapshotRegistryTest::snapshot);
        CountDownLatch building = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<WarehouseSnapshot> rebuild = CompletableFuture.supplyAsync(() ->
            registry.rebuild(version -> {
                building.countDown();
                try {
                    assertTrue(release.await(10, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return snapshot(version);
            }));

        assertTrue(building.await(10, TimeUnit.SECONDS));
        assertTrue(registry.isRebuilding());
        assertSame(first, registry.current().orElseThrow(IllegalStateException::new));

        release.countDown();
        WarehouseSnapshot second = rebuild.get(10, TimeUnit.SECONDS);

        assertEquals(2, second.getVersion());
        assertSame(second, registry.current().orElseThrow(IllegalStateException::new));
    }
}

package com.fooddelivery.warehouse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;

/**
 * Holds the currently published warehouse snapshot.
 *
 * <p>Rebuilds are serialized; readers never wait and always see a complete snapshot,
 * because a new one only becomes visible through a single reference swap once it is fully built.
 */
public class SnapshotRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotRegistry.class);

    private final AtomicReference<WarehouseSnapshot> current = new AtomicReference<>();
    private final ReentrantLock rebuildLock = new ReentrantLock();

    public Optional<WarehouseSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Builds the next snapshot while holding the rebuild lock and publishes it.
     * If the builder throws, nothing is published and the exception propagates.
     */
    public WarehouseSnapshot rebuild(LongFunction<WarehouseSnapshot> builder) {
        return rebuild(0, builder);
    }

    /**
     * Like {@link #rebuild(LongFunction)}, but the new version also follows {@code persistedVersion},
     * the highest version already written by an earlier process.
     */
    public WarehouseSnapshot rebuild(long persistedVersion, LongFunction<WarehouseSnapshot> builder) {
        rebuildLock.lock();
        try {
            WarehouseSnapshot previous = current.get();
            long version = Math.max(previous == null ? 0 : previous.getVersion(), persistedVersion) + 1;
            WarehouseSnapshot next = builder.apply(version);
            if (next.getVersion() != version) {
                throw new IllegalStateException("Builder returned version " + next.getVersion()
                    + ", expected " + version);
            }
            current.set(next);
            logger.info("Published warehouse snapshot v{}", version);
            return next;
        } finally {
            rebuildLock.unlock();
        }
    }

    public boolean isRebuilding() {
        return rebuildLock.isLocked();
    }
}

package com.flagship.bridge_ledger.lock;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held lock. Closing releases it; closing twice is a no-op.
 */
public final class LockHandle implements AutoCloseable {

    private final LockCoordinator coordinator;
    private final String key;
    private final String ownerValue;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockHandle(LockCoordinator coordinator, String key, String ownerValue) {
        this.coordinator = coordinator;
        this.key = key;
        this.ownerValue = ownerValue;
    }

    public String getKey() {
        return key;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            coordinator.release(key, ownerValue);
        }
    }
}

package com.flagship.bridge_ledger.lock;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Coordination service holding named locks with a time-to-live.
 *
 * A lock is held under an owner value; only the owner value releases it.
 */
public interface LockBackend {

    /**
     * Tries to take {@code key}, waiting up to {@code blockingTimeout}.
     *
     * @return true if the lock is now held under {@code ownerValue}
     */
    boolean acquire(String key, String ownerValue, Duration ttl, Duration blockingTimeout)
        throws InterruptedException;

    /**
     * Releases {@code key} if it is still held under {@code ownerValue}.
     *
     * @return false if the lock had expired or belongs to someone else
     */
    boolean release(String key, String ownerValue);

    boolean exists(String key);

    /**
     * Owner value of the current holder, if the lock is held.
     */
    Optional<String> holder(String key);

    /**
     * Held locks matching {@code pattern} (glob) with their remaining time-to-live.
     */
    Map<String, Duration> activeLocks(String pattern);

    /**
     * Removes every lock matching {@code pattern} regardless of owner.
     *
     * @return number of locks removed
     */
    long clear(String pattern);
}

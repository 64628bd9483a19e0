package com.device.registry.lock;

import java.util.function.Supplier;

/**
 * Keyed mutual exclusion used by the registry to serialize read-modify-write cycles on a
 * single device row. A persistent registry would back this with a row lock or an
 * advisory lock in its database.
 */
public interface DistributedLock {

    /**
     * Acquires the lock for the given key, waiting up to the configured timeout.
     *
     * @param key the lock key (typically {@code device:<deviceRef>})
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases the lock for the given key if held by the caller.
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}

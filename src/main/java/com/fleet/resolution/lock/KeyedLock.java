package com.fleet.resolution.lock;

/**
 * Per-key mutual exclusion for operations that must not run concurrently
 * against the same target, e.g. refreshing the scale-set inventory or
 * resolving a node.
 *
 * <p>Intended usage is scoped:</p>
 * <pre>
 * try (LockHandle handle = keyedLock.acquire(key)) {
 *     // critical section
 * }
 * </pre>
 */
public interface KeyedLock {

    /**
     * Blocks until the lock for the given key is held by the calling thread.
     *
     * @param key the lock key
     * @return a handle that releases the lock when closed
     * @throws LockAcquisitionException if the thread is interrupted while waiting
     */
    LockHandle acquire(String key);

    /**
     * Releases a lock previously obtained through {@link #acquire(String)}.
     *
     * @param handle the handle returned by {@code acquire}
     */
    void release(LockHandle handle);
}

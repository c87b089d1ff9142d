package com.fleet.resolution.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process keyed lock backed by one {@link ReentrantLock} per key.
 * Locks are created on first use and never removed; the key space is bounded
 * by the number of nodes and operation families.
 */
public class LocalKeyedLock implements KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalKeyedLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public LockHandle acquire(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
        log.trace("Lock acquired: {}", key);
        return new LockHandle(this, key);
    }

    /**
     * Releases the key held by the handle. Releasing an already released
     * handle is a no-op.
     *
     * @throws IllegalArgumentException     if the handle was issued by another lock
     * @throws IllegalMonitorStateException if the calling thread does not hold the key
     */
    @Override
    public void release(LockHandle handle) {
        if (handle == null || handle.isReleased()) {
            return;
        }
        if (handle.owner() != this) {
            throw new IllegalArgumentException("Lock handle for key " + handle.key() + " was issued by another lock");
        }
        ReentrantLock lock = locks.get(handle.key());
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("Current thread does not hold lock for key: " + handle.key());
        }
        lock.unlock();
        handle.markReleased();
        log.trace("Lock released: {}", handle.key());
    }

    /**
     * Returns whether any thread currently holds the lock for the key.
     */
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }

    /**
     * Returns the number of keys that have been locked at least once.
     */
    public int keyCount() {
        return locks.size();
    }
}

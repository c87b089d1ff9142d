package com.fleet.resolution.lock;

/**
 * Scoped ownership of a key held through a {@link KeyedLock}.
 * Closing the handle releases the key; closing it twice is a no-op.
 */
public final class LockHandle implements AutoCloseable {

    private final KeyedLock owner;
    private final String key;
    private volatile boolean released;

    LockHandle(KeyedLock owner, String key) {
        this.owner = owner;
        this.key = key;
    }

    public String key() {
        return key;
    }

    KeyedLock owner() {
        return owner;
    }

    boolean isReleased() {
        return released;
    }

    void markReleased() {
        released = true;
    }

    @Override
    public void close() {
        owner.release(this);
    }
}

package com.fleet.resolution.lock;

/**
 * Runtime exception thrown when a keyed lock cannot be acquired, which for
 * the blocking in-process lock means the waiting thread was interrupted.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}

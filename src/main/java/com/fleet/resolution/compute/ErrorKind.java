package com.fleet.resolution.compute;

/**
 * Classification of failures reported by the compute inventory.
 */
public enum ErrorKind {
    /** The queried node, VM or scale set does not exist in the inventory. */
    NOT_FOUND,
    /** Any other upstream failure: throttling, network, malformed response. */
    UPSTREAM
}

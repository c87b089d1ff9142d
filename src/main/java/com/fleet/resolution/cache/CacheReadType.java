package com.fleet.resolution.cache;

/**
 * Read semantics for {@link ResourceCache#get(String, CacheReadType)}.
 */
public enum CacheReadType {
    /** Serve a fresh entry from memory, loading only when absent or expired. */
    DEFAULT,
    /** Ignore freshness and always reload. */
    FORCE_REFRESH
}

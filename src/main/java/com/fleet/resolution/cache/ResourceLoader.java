package com.fleet.resolution.cache;

/**
 * Produces the current value for a cache key. Implementations must be
 * idempotent and return a complete value; partial results are not cached.
 *
 * @param <V> the cached value type
 */
@FunctionalInterface
public interface ResourceLoader<V> {

    /**
     * Loads the value for the given key.
     *
     * @param key the cache key
     * @return the loaded value, never null
     * @throws com.fleet.resolution.compute.CloudProviderException if the upstream call fails
     */
    V load(String key);
}

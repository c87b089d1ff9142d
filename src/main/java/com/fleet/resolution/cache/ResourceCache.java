package com.fleet.resolution.cache;

/**
 * Time-bounded cache of values produced by a {@link ResourceLoader}.
 *
 * @param <V> the cached value type
 */
public interface ResourceCache<V> {

    /**
     * Returns the value for the key.
     *
     * @param key      the cache key
     * @param readType {@link CacheReadType#DEFAULT} to serve a fresh entry,
     *                 {@link CacheReadType#FORCE_REFRESH} to always reload
     * @return the cached or freshly loaded value
     * @throws RuntimeException whatever the loader throws; the stored entry is left untouched
     */
    V get(String key, CacheReadType readType);

    /**
     * Removes the entry for the key, forcing the next read to load.
     */
    void delete(String key);

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}

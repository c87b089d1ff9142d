package com.fleet.resolution.cache;

/**
 * Cache metrics.
 *
 * @param hitCount         reads served from memory
 * @param missCount        reads that had to load, including forced refreshes
 * @param loadSuccessCount loader invocations that returned a value
 * @param loadFailureCount loader invocations that threw
 * @param size             number of unexpired entries
 * @param lastLoadFailed   whether the most recent loader invocation threw
 */
public record CacheStats(long hitCount, long missCount, long loadSuccessCount,
                         long loadFailureCount, long size, boolean lastLoadFailed) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public long loadCount() {
        return loadSuccessCount + loadFailureCount;
    }

    /**
     * Returns empty stats.
     */
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, false);
    }
}

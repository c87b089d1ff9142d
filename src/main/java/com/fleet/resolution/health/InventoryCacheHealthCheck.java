package com.fleet.resolution.health;

import com.fleet.resolution.cache.CacheStats;
import com.fleet.resolution.cache.ResourceCache;

/**
 * Reports whether the scale-set inventory can be served.
 *
 * <ul>
 *   <li>UP: caching disabled, nothing loaded yet, or the last load succeeded</li>
 *   <li>DEGRADED: the last load failed but an earlier snapshot is still held</li>
 *   <li>DOWN: the last load failed and no snapshot is available</li>
 * </ul>
 */
public class InventoryCacheHealthCheck implements HealthCheck {

    private final ResourceCache<?> cache;
    private final boolean cachingEnabled;

    public InventoryCacheHealthCheck(ResourceCache<?> cache, boolean cachingEnabled) {
        this.cache = cache;
        this.cachingEnabled = cachingEnabled;
    }

    @Override
    public String getName() {
        return "scaleset-inventory";
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = cache.getStats();
        HealthStatus status;
        if (!cachingEnabled) {
            status = HealthStatus.of(HealthStatus.Status.UP, "cache disabled");
        } else if (stats.loadCount() == 0) {
            status = HealthStatus.of(HealthStatus.Status.UP, "inventory not loaded yet");
        } else if (!stats.lastLoadFailed()) {
            status = HealthStatus.of(HealthStatus.Status.UP, "OK");
        } else if (stats.size() > 0) {
            status = HealthStatus.of(HealthStatus.Status.DEGRADED, "last inventory refresh failed");
        } else {
            status = HealthStatus.of(HealthStatus.Status.DOWN, "no inventory snapshot available");
        }
        return status
                .withDetail("loadSuccessCount", stats.loadSuccessCount())
                .withDetail("loadFailureCount", stats.loadFailureCount())
                .withDetail("hitRate", stats.hitRate());
    }
}

package com.fleet.resolution.metrics;

import java.time.Duration;

/**
 * Interface for recording scale-set resolution metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCacheHit(String cacheName);

    void recordCacheMiss(String cacheName);

    void recordCacheLoad(String cacheName, Duration duration, boolean success);

    void incrementForcedRefresh(String operation);

    void incrementIndexInvalidation();
}

package com.fleet.resolution.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit(String cacheName) {
    }

    @Override
    public void recordCacheMiss(String cacheName) {
    }

    @Override
    public void recordCacheLoad(String cacheName, Duration duration, boolean success) {
    }

    @Override
    public void incrementForcedRefresh(String operation) {
    }

    @Override
    public void incrementIndexInvalidation() {
    }
}

package com.fleet.resolution.cache;

import com.fleet.resolution.metrics.MetricsService;
import com.fleet.resolution.metrics.NoOpMetricsService;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache implementation that stores nothing: every read calls the loader.
 * Used when API-call caching is disabled.
 *
 * @param <V> the value type
 */
public class PassThroughResourceCache<V> implements ResourceCache<V> {

    private final String name;
    private final ResourceLoader<V> loader;
    private final MetricsService metricsService;
    private final AtomicLong loadSuccesses = new AtomicLong();
    private final AtomicLong loadFailures = new AtomicLong();
    private volatile boolean lastLoadFailed;

    public PassThroughResourceCache(String name, ResourceLoader<V> loader) {
        this(name, loader, new NoOpMetricsService());
    }

    public PassThroughResourceCache(String name, ResourceLoader<V> loader, MetricsService metricsService) {
        this.name = Objects.requireNonNull(name, "name");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    @Override
    public V get(String key, CacheReadType readType) {
        long start = System.nanoTime();
        try {
            V value = loader.load(key);
            loadSuccesses.incrementAndGet();
            lastLoadFailed = false;
            metricsService.recordCacheLoad(name, Duration.ofNanos(System.nanoTime() - start), true);
            return value;
        } catch (RuntimeException e) {
            loadFailures.incrementAndGet();
            lastLoadFailed = true;
            metricsService.recordCacheLoad(name, Duration.ofNanos(System.nanoTime() - start), false);
            throw e;
        }
    }

    @Override
    public void delete(String key) {
        // nothing stored
    }

    @Override
    public CacheStats getStats() {
        long loads = loadSuccesses.get() + loadFailures.get();
        return new CacheStats(0, loads, loadSuccesses.get(), loadFailures.get(), 0, lastLoadFailed);
    }
}

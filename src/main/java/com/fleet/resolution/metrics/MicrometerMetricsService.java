package com.fleet.resolution.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code scaleset.cache.hit} - Counter (tag: cache)</li>
 *   <li>{@code scaleset.cache.miss} - Counter (tag: cache)</li>
 *   <li>{@code scaleset.cache.load} - Timer (tags: cache, outcome)</li>
 *   <li>{@code scaleset.resolution.forced_refresh} - Counter (tag: operation)</li>
 *   <li>{@code scaleset.index.invalidation} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter invalidationCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.invalidationCounter = Counter.builder("scaleset.index.invalidation")
                .description("Number of node entries removed from the identity index")
                .register(registry);
    }

    @Override
    public void recordCacheHit(String cacheName) {
        counter("hit:" + cacheName, "scaleset.cache.hit", "Number of cache reads served from memory",
                "cache", cacheName).increment();
    }

    @Override
    public void recordCacheMiss(String cacheName) {
        counter("miss:" + cacheName, "scaleset.cache.miss", "Number of cache reads that required a load",
                "cache", cacheName).increment();
    }

    @Override
    public void recordCacheLoad(String cacheName, Duration duration, boolean success) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(cacheName + ":" + outcome, k ->
                Timer.builder("scaleset.cache.load")
                        .description("Duration of cache loader invocations")
                        .tag("cache", cacheName)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementForcedRefresh(String operation) {
        counter("forced:" + operation, "scaleset.resolution.forced_refresh",
                "Number of lookups retried with a forced refresh", "operation", operation).increment();
    }

    @Override
    public void incrementIndexInvalidation() {
        invalidationCounter.increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}

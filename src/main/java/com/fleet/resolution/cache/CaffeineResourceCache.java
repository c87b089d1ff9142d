package com.fleet.resolution.cache;

import com.fleet.resolution.lock.KeyedLock;
import com.fleet.resolution.lock.LocalKeyedLock;
import com.fleet.resolution.lock.LockHandle;
import com.fleet.resolution.metrics.MetricsService;
import com.fleet.resolution.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed {@link ResourceCache} with expire-after-write TTL.
 *
 * <p>Loads are serialised per key through a cache-scoped {@link KeyedLock}:
 * concurrent {@link CacheReadType#DEFAULT} readers of an expired key wait for
 * the first loader call and then read its result. A failed load leaves the
 * stored entry as it was.</p>
 *
 * @param <V> the cached value type
 */
public class CaffeineResourceCache<V> implements ResourceCache<V> {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResourceCache.class);

    private final String name;
    private final Cache<String, V> cache;
    private final ResourceLoader<V> loader;
    private final KeyedLock refreshLock = new LocalKeyedLock();
    private final MetricsService metricsService;
    private final Ticker ticker;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong loadSuccesses = new AtomicLong();
    private final AtomicLong loadFailures = new AtomicLong();
    private volatile boolean lastLoadFailed;

    public CaffeineResourceCache(String name, CacheConfig config, ResourceLoader<V> loader) {
        this(name, config, loader, new NoOpMetricsService(), Ticker.systemTicker());
    }

    public CaffeineResourceCache(String name, CacheConfig config, ResourceLoader<V> loader,
                                 MetricsService metricsService, Ticker ticker) {
        this.name = Objects.requireNonNull(name, "name");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.ticker = ticker != null ? ticker : Ticker.systemTicker();
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .ticker(this.ticker)
                .executor(Runnable::run)
                .build();
        log.info("CaffeineResourceCache '{}' initialized: ttl={}s", name, config.ttlSeconds());
    }

    @Override
    public V get(String key, CacheReadType readType) {
        if (readType == CacheReadType.DEFAULT) {
            V cached = cache.getIfPresent(key);
            if (cached != null) {
                recordHit();
                return cached;
            }
        }

        try (LockHandle ignored = refreshLock.acquire(key)) {
            if (readType == CacheReadType.DEFAULT) {
                // Another caller may have loaded while we waited
                V cached = cache.getIfPresent(key);
                if (cached != null) {
                    recordHit();
                    return cached;
                }
            }
            misses.incrementAndGet();
            metricsService.recordCacheMiss(name);
            V value = load(key, readType);
            cache.put(key, value);
            return value;
        }
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
        log.debug("Cache '{}' entry deleted: {}", name, key);
    }

    @Override
    public CacheStats getStats() {
        // evict expired entries so that size reflects what can still be served
        cache.cleanUp();
        return new CacheStats(hits.get(), misses.get(), loadSuccesses.get(), loadFailures.get(),
                cache.estimatedSize(), lastLoadFailed);
    }

    private V load(String key, CacheReadType readType) {
        long start = ticker.read();
        try {
            V value = Objects.requireNonNull(loader.load(key),
                    () -> "loader for cache '" + name + "' returned null for key " + key);
            loadSuccesses.incrementAndGet();
            lastLoadFailed = false;
            metricsService.recordCacheLoad(name, Duration.ofNanos(ticker.read() - start), true);
            log.debug("Cache '{}' loaded key {} (readType={})", name, key, readType);
            return value;
        } catch (RuntimeException e) {
            loadFailures.incrementAndGet();
            lastLoadFailed = true;
            metricsService.recordCacheLoad(name, Duration.ofNanos(ticker.read() - start), false);
            log.warn("Cache '{}' failed to load key {}: {}", name, key, e.getMessage());
            throw e;
        }
    }

    private void recordHit() {
        hits.incrementAndGet();
        metricsService.recordCacheHit(name);
    }
}

package com.fleet.resolution.cache;

/**
 * Configuration for a {@link ResourceCache}.
 *
 * @param ttlSeconds time-to-live of a loaded entry; values {@code <= 0} fall back
 *                   to {@link #DEFAULT_TTL_SECONDS}
 * @param enabled    whether caching is enabled; when false every read calls the loader
 */
public record CacheConfig(int ttlSeconds, boolean enabled) {

    public static final int DEFAULT_TTL_SECONDS = 600;

    public CacheConfig {
        if (ttlSeconds <= 0) {
            ttlSeconds = DEFAULT_TTL_SECONDS;
        }
    }

    /**
     * Default cache configuration: 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_TTL_SECONDS, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(DEFAULT_TTL_SECONDS, false);
    }
}

package com.fleet.resolution.api;

import com.fleet.resolution.cache.CacheConfig;

import java.util.Objects;

/**
 * Options for scale-set resolution.
 * Configures the inventory cache TTL, whether API-call caching is disabled,
 * and the resource group used for computer-name lookups.
 */
public class ResolverOptions {

    private final String resourceGroup;
    private final int cacheTtlSeconds;
    private final boolean disableApiCallCache;

    private ResolverOptions(Builder builder) {
        this.resourceGroup = builder.resourceGroup;
        this.cacheTtlSeconds = builder.cacheTtlSeconds;
        this.disableApiCallCache = builder.disableApiCallCache;
    }

    public String getResourceGroup() {
        return resourceGroup;
    }

    /**
     * Returns the configured TTL; {@code 0} means the cache default applies.
     */
    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public boolean isDisableApiCallCache() {
        return disableApiCallCache;
    }

    /**
     * Returns the configuration of the scale-set inventory cache.
     */
    public CacheConfig toCacheConfig() {
        return new CacheConfig(cacheTtlSeconds, !disableApiCallCache);
    }

    /**
     * Creates default options: default TTL, caching enabled, empty resource group.
     */
    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String resourceGroup = "";
        private int cacheTtlSeconds = 0;
        private boolean disableApiCallCache = false;

        public Builder resourceGroup(String resourceGroup) {
            this.resourceGroup = Objects.requireNonNull(resourceGroup, "resourceGroup");
            return this;
        }

        public Builder cacheTtlSeconds(int cacheTtlSeconds) {
            if (cacheTtlSeconds < 0) {
                throw new IllegalArgumentException("cacheTtlSeconds must be >= 0");
            }
            this.cacheTtlSeconds = cacheTtlSeconds;
            return this;
        }

        public Builder disableApiCallCache(boolean disableApiCallCache) {
            this.disableApiCallCache = disableApiCallCache;
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }
    }
}

package com.fleet.resolution.api;

import com.fleet.resolution.cache.CacheConfig;
import com.fleet.resolution.cache.CacheReadType;
import com.fleet.resolution.cache.CacheStats;
import com.fleet.resolution.cache.CaffeineResourceCache;
import com.fleet.resolution.cache.PassThroughResourceCache;
import com.fleet.resolution.cache.ResourceCache;
import com.fleet.resolution.compute.ComputeClient;
import com.fleet.resolution.compute.ScaleSetInventoryLoader;
import com.fleet.resolution.core.model.InventorySnapshot;
import com.fleet.resolution.core.model.ScaleSet;
import com.fleet.resolution.core.model.VirtualMachine;
import com.fleet.resolution.health.HealthStatus;
import com.fleet.resolution.health.InventoryCacheHealthCheck;
import com.fleet.resolution.index.IdentityIndexStore;
import com.fleet.resolution.lock.KeyedLock;
import com.fleet.resolution.lock.LocalKeyedLock;
import com.fleet.resolution.metrics.MetricsService;
import com.fleet.resolution.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for resolving cluster nodes to their VMs and flexible scale sets.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * NodeResolver resolver = NodeResolver.builder()
 *     .computeClient(client)
 *     .options(ResolverOptions.builder()
 *         .resourceGroup("cluster-rg")
 *         .cacheTtlSeconds(600)
 *         .build())
 *     .build();
 *
 * String scaleSetId = resolver.getNodeScaleSetId("aks-nodepool1-12345678-vmss000000");
 *
 * // on confirmed node deletion
 * resolver.invalidateNode("aks-nodepool1-12345678-vmss000000");
 * </pre>
 */
public class NodeResolver {
    private static final Logger log = LoggerFactory.getLogger(NodeResolver.class);

    private static final String INVENTORY_CACHE_NAME = "scaleSetInventory";

    private final ScaleSetResolutionService service;
    private final ResourceCache<InventorySnapshot> inventoryCache;
    private final IdentityIndexStore indexStore;
    private final InventoryCacheHealthCheck healthCheck;

    private NodeResolver(Builder builder) {
        Objects.requireNonNull(builder.computeClient, "computeClient is required");
        ResolverOptions options = builder.options;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        KeyedLock keyedLock = builder.keyedLock != null
                ? builder.keyedLock : new LocalKeyedLock();

        CacheConfig cacheConfig = options.toCacheConfig();
        ScaleSetInventoryLoader loader = new ScaleSetInventoryLoader(builder.computeClient);
        if (cacheConfig.enabled()) {
            this.inventoryCache = new CaffeineResourceCache<>(INVENTORY_CACHE_NAME, cacheConfig, loader,
                    metricsService, builder.ticker);
        } else {
            this.inventoryCache = new PassThroughResourceCache<>(INVENTORY_CACHE_NAME, loader, metricsService);
        }

        this.indexStore = new IdentityIndexStore();
        this.healthCheck = new InventoryCacheHealthCheck(inventoryCache, cacheConfig.enabled());
        this.service = new ScaleSetResolutionService(builder.computeClient, inventoryCache, indexStore,
                keyedLock, options, metricsService);

        log.info("NodeResolver initialized: resourceGroup={}, cacheEnabled={}, ttl={}s",
                options.getResourceGroup(), cacheConfig.enabled(), cacheConfig.ttlSeconds());
    }

    // ========== Node resolution ==========

    /**
     * Returns the ID of the scale set owning the node.
     */
    public String getNodeScaleSetId(String nodeName) {
        return service.getNodeScaleSetId(nodeName);
    }

    /**
     * Returns the node name backed by the VM.
     */
    public String getNodeNameByVmName(String vmName) {
        return service.getNodeNameByVmName(vmName);
    }

    public VirtualMachine getVirtualMachine(String nodeName, CacheReadType readType) {
        return service.getVirtualMachine(nodeName, readType);
    }

    public VirtualMachine getVirtualMachineByVmName(String vmName, CacheReadType readType) {
        return service.getVirtualMachineByVmName(vmName, readType);
    }

    // ========== Scale-set lookup ==========

    public ScaleSet getScaleSetById(String scaleSetId, CacheReadType readType) {
        return service.getScaleSetById(scaleSetId, readType);
    }

    public ScaleSet getScaleSetByNodeName(String nodeName, CacheReadType readType) {
        return service.getScaleSetByNodeName(nodeName, readType);
    }

    public ScaleSet getScaleSetByName(String scaleSetName) {
        return service.getScaleSetByName(scaleSetName);
    }

    public String getScaleSetIdByName(String scaleSetName) {
        return service.getScaleSetIdByName(scaleSetName);
    }

    // ========== Invalidation ==========

    /**
     * Drops the cached identities of a deleted node. Must be called whenever a
     * node is confirmed deleted, since the identity index has no expiry.
     */
    public void invalidateNode(String nodeName) {
        service.invalidateNode(nodeName);
    }

    // ========== Introspection ==========

    public CacheStats getInventoryCacheStats() {
        return inventoryCache.getStats();
    }

    public IdentityIndexStore.IndexSizes getIndexSizes() {
        return indexStore.sizes();
    }

    public HealthStatus checkHealth() {
        return healthCheck.check()
                .withDetail("indexedNodes", indexStore.sizes().nodeNameToVmName());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ComputeClient computeClient;
        private ResolverOptions options = ResolverOptions.defaults();
        private MetricsService metricsService;
        private KeyedLock keyedLock;
        private Ticker ticker = Ticker.systemTicker();

        public Builder computeClient(ComputeClient computeClient) {
            this.computeClient = computeClient;
            return this;
        }

        public Builder options(ResolverOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder keyedLock(KeyedLock keyedLock) {
            this.keyedLock = keyedLock;
            return this;
        }

        /**
         * Sets the time source of the inventory cache.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public NodeResolver build() {
            return new NodeResolver(this);
        }
    }
}

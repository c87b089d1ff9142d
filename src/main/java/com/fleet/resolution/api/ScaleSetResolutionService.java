package com.fleet.resolution.api;

import com.fleet.resolution.cache.CacheReadType;
import com.fleet.resolution.cache.ResourceCache;
import com.fleet.resolution.compute.CloudProviderException;
import com.fleet.resolution.compute.ComputeClient;
import com.fleet.resolution.core.model.InventorySnapshot;
import com.fleet.resolution.core.model.ScaleSet;
import com.fleet.resolution.core.model.VirtualMachine;
import com.fleet.resolution.index.IdentityIndexStore;
import com.fleet.resolution.lock.KeyedLock;
import com.fleet.resolution.lock.LockHandle;
import com.fleet.resolution.logging.LogContext;
import com.fleet.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * Core service that maps nodes to VMs and flexible scale sets.
 *
 * <p>Lookups go to the {@link IdentityIndexStore} first, then to the compute
 * inventory. Composite lookups run under {@link #GET_NODE_SCALE_SET_ID_LOCK_KEY}
 * so that concurrent cold-start callers do not each hit the inventory. A
 * lookup that fails with NOT_FOUND is retried exactly once with
 * {@link CacheReadType#FORCE_REFRESH}; other failures are propagated as-is.</p>
 */
public class ScaleSetResolutionService {
    private static final Logger log = LoggerFactory.getLogger(ScaleSetResolutionService.class);

    /** Cache key of the scale-set inventory snapshot. */
    public static final String INVENTORY_CACHE_KEY = "scaleSetInventory";

    /** Lock key serialising node/VM identity resolution. */
    public static final String GET_NODE_SCALE_SET_ID_LOCK_KEY = "getNodeScaleSetId";

    private final ComputeClient computeClient;
    private final ResourceCache<InventorySnapshot> inventoryCache;
    private final IdentityIndexStore indexStore;
    private final KeyedLock keyedLock;
    private final ResolverOptions options;
    private final MetricsService metricsService;

    public ScaleSetResolutionService(ComputeClient computeClient,
                                     ResourceCache<InventorySnapshot> inventoryCache,
                                     IdentityIndexStore indexStore,
                                     KeyedLock keyedLock,
                                     ResolverOptions options,
                                     MetricsService metricsService) {
        this.computeClient = computeClient;
        this.inventoryCache = inventoryCache;
        this.indexStore = indexStore;
        this.keyedLock = keyedLock;
        this.options = options;
        this.metricsService = metricsService;
    }

    /**
     * Returns the ID of the flexible scale set owning the node's VM.
     *
     * @throws CloudProviderException NOT_FOUND if the node is unknown or its VM
     *                                has no scale set, UPSTREAM on inventory failure
     */
    public String getNodeScaleSetId(String nodeName) {
        try (LogContext ctx = LogContext.forResolution("getNodeScaleSetId", nodeName);
             LockHandle ignored = keyedLock.acquire(GET_NODE_SCALE_SET_ID_LOCK_KEY)) {
            Optional<String> cached = indexStore.getScaleSetId(nodeName);
            if (cached.isPresent()) {
                return cached.get();
            }

            return withForcedRetry("getNodeScaleSetId", nodeName, readType -> {
                VirtualMachine vm = getVirtualMachine(nodeName, readType);
                return vm.scaleSet().orElseThrow(() -> CloudProviderException.notFound(
                        "VM " + vm.name() + " backing node " + nodeName + " has no scale set"));
            });
        }
    }

    /**
     * Returns the node name (the lower-cased computer name) of the VM.
     *
     * @throws CloudProviderException NOT_FOUND if the VM is unknown or has no computer name
     */
    public String getNodeNameByVmName(String vmName) {
        try (LogContext ctx = LogContext.forResolution("getNodeNameByVmName", vmName);
             LockHandle ignored = keyedLock.acquire(GET_NODE_SCALE_SET_ID_LOCK_KEY)) {
            Optional<String> cached = indexStore.getNodeName(vmName);
            if (cached.isPresent()) {
                return cached.get();
            }

            return withForcedRetry("getNodeNameByVmName", vmName, readType -> {
                VirtualMachine vm = getVirtualMachineByVmName(vmName, readType);
                return vm.nodeName().orElseThrow(() -> CloudProviderException.notFound(
                        "VM " + vmName + " has no computer name"));
            });
        }
    }

    /**
     * Returns the VM backing the node, resolving the VM name through the
     * index or, on a miss, through a computer-name lookup.
     */
    public VirtualMachine getVirtualMachine(String nodeName, CacheReadType readType) {
        Optional<String> cachedVmName = indexStore.getVmName(nodeName);
        if (cachedVmName.isPresent()) {
            return getVirtualMachineByVmName(cachedVmName.get(), readType);
        }

        String vmName = computeClient.getVmNameByComputerName(options.getResourceGroup(), nodeName);
        return getVirtualMachineByVmName(vmName, readType);
    }

    /**
     * Fetches the VM and records its identities in the index.
     */
    public VirtualMachine getVirtualMachineByVmName(String vmName, CacheReadType readType) {
        VirtualMachine vm = computeClient.getVirtualMachine(vmName, readType);
        indexStore.cacheVirtualMachine(vm);
        return vm;
    }

    /**
     * Returns the scale set with the given ID, forcing one inventory refresh
     * if the current snapshot does not contain it.
     */
    public ScaleSet getScaleSetById(String scaleSetId, CacheReadType readType) {
        InventorySnapshot snapshot = inventoryCache.get(INVENTORY_CACHE_KEY, readType);
        Optional<ScaleSet> found = snapshot.findById(scaleSetId);
        if (found.isPresent()) {
            return found.get();
        }

        log.debug("Couldn't find scale set with ID {}, refreshing the cache", scaleSetId);
        metricsService.incrementForcedRefresh("getScaleSetById");
        snapshot = inventoryCache.get(INVENTORY_CACHE_KEY, CacheReadType.FORCE_REFRESH);
        return snapshot.findById(scaleSetId)
                .orElseThrow(() -> CloudProviderException.notFound("scale set " + scaleSetId + " not found"));
    }

    /**
     * Returns the scale set owning the node's VM.
     */
    public ScaleSet getScaleSetByNodeName(String nodeName, CacheReadType readType) {
        String scaleSetId = getNodeScaleSetId(nodeName);
        return getScaleSetById(scaleSetId, readType);
    }

    /**
     * Returns the ID of the first scale set whose short name matches, ignoring case.
     * Reads the current snapshot only; no refresh is forced.
     */
    public String getScaleSetIdByName(String scaleSetName) {
        return findByName(scaleSetName).id();
    }

    /**
     * Returns the first scale set whose short name matches, ignoring case.
     * Reads the current snapshot only; no refresh is forced.
     */
    public ScaleSet getScaleSetByName(String scaleSetName) {
        return findByName(scaleSetName);
    }

    /**
     * Drops every index entry derived from the node. A no-op when caching is disabled.
     */
    public void invalidateNode(String nodeName) {
        if (options.isDisableApiCallCache()) {
            return;
        }
        try (LogContext ctx = LogContext.forInvalidation(nodeName)) {
            indexStore.deleteNode(nodeName);
            metricsService.incrementIndexInvalidation();
            log.info("Deleted cached identities for node {}", nodeName);
        }
    }

    private ScaleSet findByName(String scaleSetName) {
        InventorySnapshot snapshot = inventoryCache.get(INVENTORY_CACHE_KEY, CacheReadType.DEFAULT);
        return snapshot.findByShortName(scaleSetName)
                .orElseThrow(() -> CloudProviderException.notFound("scale set named " + scaleSetName + " not found"));
    }

    private <T> T withForcedRetry(String operation, String target, Function<CacheReadType, T> getter) {
        try {
            return getter.apply(CacheReadType.DEFAULT);
        } catch (CloudProviderException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.debug("Could not find {} in the existing cache, forcing a refresh to check again", target);
            metricsService.incrementForcedRefresh(operation);
            return getter.apply(CacheReadType.FORCE_REFRESH);
        }
    }
}

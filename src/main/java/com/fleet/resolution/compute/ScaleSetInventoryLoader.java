package com.fleet.resolution.compute;

import com.fleet.resolution.cache.ResourceLoader;
import com.fleet.resolution.core.model.InventorySnapshot;
import com.fleet.resolution.core.model.ScaleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a complete {@link InventorySnapshot} of flexible scale sets by
 * listing every resource group.
 *
 * <p>A resource group that reports NOT_FOUND is skipped with a warning (it may
 * have been deleted between the two listings); any other failure aborts the
 * load so that no partial snapshot is cached.</p>
 */
public class ScaleSetInventoryLoader implements ResourceLoader<InventorySnapshot> {
    private static final Logger log = LoggerFactory.getLogger(ScaleSetInventoryLoader.class);

    private final ComputeClient computeClient;
    private final Clock clock;

    public ScaleSetInventoryLoader(ComputeClient computeClient) {
        this(computeClient, Clock.systemUTC());
    }

    public ScaleSetInventoryLoader(ComputeClient computeClient, Clock clock) {
        this.computeClient = Objects.requireNonNull(computeClient, "computeClient");
        this.clock = clock;
    }

    @Override
    public InventorySnapshot load(String key) {
        Set<String> resourceGroups = computeClient.listResourceGroups();
        InventorySnapshot.Builder builder = InventorySnapshot.builder();
        int skipped = 0;

        for (String resourceGroup : resourceGroups) {
            List<ScaleSet> scaleSets;
            try {
                scaleSets = computeClient.listScaleSets(resourceGroup);
            } catch (CloudProviderException e) {
                if (e.isNotFound()) {
                    log.warn("Skip caching scale sets for resource group {}: {}", resourceGroup, e.getMessage());
                    continue;
                }
                log.error("Listing scale sets in resource group {} failed: {}", resourceGroup, e.getMessage());
                throw e;
            }

            for (ScaleSet scaleSet : scaleSets) {
                if (!scaleSet.hasId()) {
                    log.warn("Ignoring scale set without ID in resource group {}", resourceGroup);
                    continue;
                }
                if (!builder.add(scaleSet)) {
                    skipped++;
                }
            }
        }

        InventorySnapshot snapshot = builder.loadedAt(clock.instant()).build();
        log.info("Loaded scale-set inventory: {} flexible scale sets from {} resource groups ({} non-flexible skipped)",
                snapshot.size(), resourceGroups.size(), skipped);
        return snapshot;
    }
}

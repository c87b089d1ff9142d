package com.fleet.resolution.core.model;

import java.util.Optional;

/**
 * Scale-set resource as listed by the compute inventory.
 *
 * @param id                full resource ID; may be null for malformed listings
 * @param orchestrationMode orchestration mode, null when the inventory omits it
 */
public record ScaleSet(String id, OrchestrationMode orchestrationMode) {

    public static ScaleSet flexible(String id) {
        return new ScaleSet(id, OrchestrationMode.FLEXIBLE);
    }

    public static ScaleSet uniform(String id) {
        return new ScaleSet(id, OrchestrationMode.UNIFORM);
    }

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    public boolean isFlexible() {
        return orchestrationMode == OrchestrationMode.FLEXIBLE;
    }

    /**
     * Returns the short name, i.e. the last segment of the resource ID.
     */
    public Optional<String> shortName() {
        return ResourceIds.lastSegment(id);
    }
}

package com.fleet.resolution.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Virtual machine record returned by the compute inventory.
 * Only the fields consumed by resolution are modelled.
 *
 * @param name         VM resource name
 * @param computerName OS-level computer name, i.e. the node identity; may be null
 *                     while the VM is still provisioning
 * @param scaleSetId   ID of the owning scale set, null for standalone VMs
 */
public record VirtualMachine(String name, String computerName, String scaleSetId) {

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    public boolean hasComputerName() {
        return computerName != null && !computerName.isEmpty();
    }

    public boolean hasScaleSet() {
        return scaleSetId != null && !scaleSetId.isEmpty();
    }

    /**
     * Returns the node name this VM backs: the lower-cased computer name.
     */
    public Optional<String> nodeName() {
        return hasComputerName()
                ? Optional.of(computerName.toLowerCase(Locale.ROOT))
                : Optional.empty();
    }

    public Optional<String> scaleSet() {
        return hasScaleSet() ? Optional.of(scaleSetId) : Optional.empty();
    }
}

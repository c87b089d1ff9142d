package com.fleet.resolution.index;

import com.fleet.resolution.core.model.VirtualMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Lazily built identity lookups between nodes, VMs and their scale sets.
 *
 * <p>Three independent tables are kept:</p>
 * <ul>
 *   <li>VM name to node name</li>
 *   <li>node name to VM name</li>
 *   <li>node name to owning scale-set ID</li>
 * </ul>
 *
 * <p>Entries are added whenever a VM record is observed and stay until
 * {@link #deleteNode(String)} is called; there is no expiry. Node names are
 * stored lower-cased.</p>
 */
public class IdentityIndexStore {
    private static final Logger log = LoggerFactory.getLogger(IdentityIndexStore.class);

    private final ConcurrentIndex vmNameToNodeName = new ConcurrentIndex();
    private final ConcurrentIndex nodeNameToVmName = new ConcurrentIndex();
    private final ConcurrentIndex nodeNameToScaleSetId = new ConcurrentIndex();

    /**
     * Records the identities carried by a VM. VMs without a name or a computer
     * name are skipped.
     *
     * @return true if the VM was indexed
     */
    public boolean cacheVirtualMachine(VirtualMachine vm) {
        if (!vm.hasName()) {
            log.debug("Skipping VM without name (computerName={})", vm.computerName());
            return false;
        }
        Optional<String> nodeName = vm.nodeName();
        if (nodeName.isEmpty()) {
            log.debug("Skipping VM {} without computer name", vm.name());
            return false;
        }
        vmNameToNodeName.store(vm.name(), nodeName.get());
        nodeNameToVmName.store(nodeName.get(), vm.name());
        vm.scaleSet().ifPresent(scaleSetId -> nodeNameToScaleSetId.store(nodeName.get(), scaleSetId));
        return true;
    }

    public Optional<String> getNodeName(String vmName) {
        return vmNameToNodeName.load(vmName);
    }

    public Optional<String> getVmName(String nodeName) {
        return nodeNameToVmName.load(normalize(nodeName));
    }

    public Optional<String> getScaleSetId(String nodeName) {
        return nodeNameToScaleSetId.load(normalize(nodeName));
    }

    /**
     * Removes every entry derived from the node, including the reverse VM-name mapping.
     */
    public void deleteNode(String nodeName) {
        String key = normalize(nodeName);
        nodeNameToVmName.load(key).ifPresent(vmNameToNodeName::delete);
        nodeNameToScaleSetId.delete(key);
        nodeNameToVmName.delete(key);
    }

    private static String normalize(String nodeName) {
        return nodeName == null ? null : nodeName.toLowerCase(Locale.ROOT);
    }

    ConcurrentIndex vmNameToNodeName() {
        return vmNameToNodeName;
    }

    ConcurrentIndex nodeNameToVmName() {
        return nodeNameToVmName;
    }

    ConcurrentIndex nodeNameToScaleSetId() {
        return nodeNameToScaleSetId;
    }

    /**
     * Returns the number of entries in each table.
     */
    public IndexSizes sizes() {
        return new IndexSizes(vmNameToNodeName.size(), nodeNameToVmName.size(), nodeNameToScaleSetId.size());
    }

    /**
     * Entry counts of the three identity tables.
     */
    public record IndexSizes(int vmNameToNodeName, int nodeNameToVmName, int nodeNameToScaleSetId) {}
}

package com.fleet.resolution.compute;

import com.fleet.resolution.cache.CacheReadType;
import com.fleet.resolution.core.model.ScaleSet;
import com.fleet.resolution.core.model.VirtualMachine;

import java.util.List;
import java.util.Set;

/**
 * Read-only access to the cloud compute inventory.
 *
 * <p>Every method reports failures as {@link CloudProviderException}, using
 * {@link ErrorKind#NOT_FOUND} when the queried resource does not exist and
 * {@link ErrorKind#UPSTREAM} for anything else. Callers are expected to bound
 * the duration of these calls; no timeout is applied here.</p>
 */
public interface ComputeClient {

    /**
     * Lists the resource groups that may contain scale sets.
     */
    Set<String> listResourceGroups();

    /**
     * Lists every scale set in the resource group, regardless of orchestration mode.
     */
    List<ScaleSet> listScaleSets(String resourceGroup);

    /**
     * Looks up the name of the VM whose OS computer name equals {@code computerName}.
     */
    String getVmNameByComputerName(String resourceGroup, String computerName);

    /**
     * Fetches a VM by name. Implementations may serve it from their own cache
     * according to {@code readType}.
     */
    VirtualMachine getVirtualMachine(String vmName, CacheReadType readType);
}

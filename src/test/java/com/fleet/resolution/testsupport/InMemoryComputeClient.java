package com.fleet.resolution.testsupport;

import com.fleet.resolution.cache.CacheReadType;
import com.fleet.resolution.compute.CloudProviderException;
import com.fleet.resolution.compute.ComputeClient;
import com.fleet.resolution.core.model.ScaleSet;
import com.fleet.resolution.core.model.VirtualMachine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory compute inventory that counts every call, so tests can assert
 * which lookups reached the "network".
 */
public class InMemoryComputeClient implements ComputeClient {

    private final Map<String, List<ScaleSet>> scaleSetsByGroup = new ConcurrentHashMap<>();
    private final Map<String, VirtualMachine> vmsByName = new ConcurrentHashMap<>();
    private final AtomicBoolean failListing = new AtomicBoolean(false);

    private final AtomicInteger listResourceGroupsCalls = new AtomicInteger();
    private final AtomicInteger listScaleSetsCalls = new AtomicInteger();
    private final AtomicInteger computerNameLookups = new AtomicInteger();
    private final AtomicInteger getVmCalls = new AtomicInteger();

    public InMemoryComputeClient addScaleSet(String resourceGroup, ScaleSet scaleSet) {
        scaleSetsByGroup.computeIfAbsent(resourceGroup, k -> new ArrayList<>()).add(scaleSet);
        return this;
    }

    public InMemoryComputeClient addVm(VirtualMachine vm) {
        vmsByName.put(vm.name(), vm);
        return this;
    }

    public void removeVm(String vmName) {
        vmsByName.remove(vmName);
    }

    /**
     * When enabled, scale-set listings fail with an UPSTREAM error.
     */
    public void setFailListing(boolean fail) {
        failListing.set(fail);
    }

    @Override
    public Set<String> listResourceGroups() {
        listResourceGroupsCalls.incrementAndGet();
        return new LinkedHashSet<>(scaleSetsByGroup.keySet());
    }

    @Override
    public List<ScaleSet> listScaleSets(String resourceGroup) {
        listScaleSetsCalls.incrementAndGet();
        if (failListing.get()) {
            throw CloudProviderException.upstream("listing throttled");
        }
        List<ScaleSet> scaleSets = scaleSetsByGroup.get(resourceGroup);
        if (scaleSets == null) {
            throw CloudProviderException.notFound("resource group " + resourceGroup + " not found");
        }
        return List.copyOf(scaleSets);
    }

    @Override
    public String getVmNameByComputerName(String resourceGroup, String computerName) {
        computerNameLookups.incrementAndGet();
        return vmsByName.values().stream()
                .filter(VirtualMachine::hasComputerName)
                .filter(vm -> vm.computerName().toLowerCase(Locale.ROOT).equals(computerName.toLowerCase(Locale.ROOT)))
                .map(VirtualMachine::name)
                .findFirst()
                .orElseThrow(() -> CloudProviderException.notFound("no VM with computer name " + computerName));
    }

    @Override
    public VirtualMachine getVirtualMachine(String vmName, CacheReadType readType) {
        getVmCalls.incrementAndGet();
        VirtualMachine vm = vmsByName.get(vmName);
        if (vm == null) {
            throw CloudProviderException.notFound("VM " + vmName + " not found");
        }
        return vm;
    }

    /**
     * Returns the number of inventory listings performed (one per loader run).
     */
    public int getInventoryLoads() {
        return listResourceGroupsCalls.get();
    }

    public int getListScaleSetsCalls() {
        return listScaleSetsCalls.get();
    }

    public int getComputerNameLookups() {
        return computerNameLookups.get();
    }

    public int getVmCalls() {
        return getVmCalls.get();
    }

    public int totalCalls() {
        return listResourceGroupsCalls.get() + listScaleSetsCalls.get()
                + computerNameLookups.get() + getVmCalls.get();
    }
}

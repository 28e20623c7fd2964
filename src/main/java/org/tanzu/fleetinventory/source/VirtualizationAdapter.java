package org.tanzu.fleetinventory.source;

import org.tanzu.fleetinventory.model.VirtualizationGroup;

import java.util.List;

/**
 * Contract of the virtualization manager.
 */
public interface VirtualizationAdapter {

    String getName();

    /**
     * Lists VMs whose display name matches a glob pattern ({@code *} and {@code ?}).
     *
     * @param namePattern Glob over VM display names
     * @return Matching VMs with CPU, memory, power state and host filled in
     * @throws SourceUnavailableException if the manager cannot be reached
     */
    List<VmListing> listVms(String namePattern);

    /**
     * Completes a listed VM with its disk and NIC details. Called concurrently, one call per VM.
     *
     * @param listing A VM returned by {@link #listVms(String)}
     * @return The listing's group with disk and NIC fields added
     */
    VirtualizationGroup describeVm(VmListing listing);
}

package org.tanzu.fleetinventory.source;

import org.tanzu.fleetinventory.identity.DeviceIdentity;
import org.tanzu.fleetinventory.model.ProvisioningGroup;

import java.util.List;

/**
 * Contract of the primary inventory source: the provisioning service that streams devices.
 *
 * Every device it lists becomes a record in the run. Failure to list devices aborts the run.
 */
public interface ProvisioningAdapter {

    /**
     * Name of the source as it appears in provenance, warnings and the manifest.
     */
    String getName();

    /**
     * Lists the devices known to the provisioning service.
     *
     * @param filter Site/collection restriction
     * @return Device identities in the order the service reports them
     * @throws SourceUnavailableException if the service cannot be reached
     */
    List<DeviceIdentity> listDevices(DeviceFilter filter);

    /**
     * Fetches provisioning detail of one device. Called concurrently, one call per device.
     *
     * The returned group carries the raw disk and store names and the booted version; store
     * paths and newest production versions are resolved from the reference data afterwards.
     *
     * @param identity The device
     * @return The device's provisioning detail
     * @throws DeviceNotFoundException if the service no longer knows the device
     * @throws SourceUnavailableException if the service cannot be reached
     */
    ProvisioningGroup getDeviceDetail(DeviceIdentity identity);

    /**
     * Lists every version of every vDisk. Called once per run, before detail fan-out.
     */
    List<DiskVersion> listDiskVersions();

    /**
     * Lists the stores and their paths. Called once per run, before detail fan-out.
     */
    List<StoreInfo> listStores();
}

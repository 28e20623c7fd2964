package org.tanzu.fleetinventory.source;

import org.tanzu.fleetinventory.model.DirectoryGroup;

/**
 * Contract of the directory (computer accounts).
 */
public interface DirectoryAdapter {

    String getName();

    /**
     * Looks up the computer account of a device.
     *
     * @param shortName Short (NetBIOS) name of the device
     * @return The account data
     * @throws DeviceNotFoundException if no account exists
     * @throws SourceUnavailableException if the directory cannot be reached
     */
    DirectoryGroup lookup(String shortName);
}

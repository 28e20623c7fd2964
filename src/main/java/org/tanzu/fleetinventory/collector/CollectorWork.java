package org.tanzu.fleetinventory.collector;

import org.tanzu.fleetinventory.identity.DeviceIdentity;

/**
 * Blocking unit of remote work performed for one device.
 *
 * @param <T> Type of the value produced
 */
@FunctionalInterface
public interface CollectorWork<T> {

    T collect(DeviceIdentity identity) throws Exception;
}

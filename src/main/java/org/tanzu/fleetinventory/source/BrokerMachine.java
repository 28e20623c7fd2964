package org.tanzu.fleetinventory.source;

import org.tanzu.fleetinventory.identity.DeviceIdentity;
import org.tanzu.fleetinventory.model.OrchestrationGroup;

/**
 * A machine as listed by a broker, with a reference to its catalog.
 */
public class BrokerMachine {

    private final DeviceIdentity identity;
    private final OrchestrationGroup group;
    private final String catalogRef;

    public BrokerMachine(DeviceIdentity identity, OrchestrationGroup group, String catalogRef) {
        this.identity = identity;
        this.group = group;
        this.catalogRef = catalogRef;
    }

    public DeviceIdentity getIdentity() { return identity; }
    public OrchestrationGroup getGroup() { return group; }
    public String getCatalogRef() { return catalogRef; }
}

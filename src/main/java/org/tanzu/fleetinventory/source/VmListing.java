package org.tanzu.fleetinventory.source;

import org.tanzu.fleetinventory.model.VirtualizationGroup;

/**
 * A VM as listed by the virtualization manager: its display name and the data the listing carries.
 */
public class VmListing {

    private final String name;
    private final VirtualizationGroup group;

    public VmListing(String name, VirtualizationGroup group) {
        this.name = name;
        this.group = group;
    }

    public String getName() { return name; }
    public VirtualizationGroup getGroup() { return group; }

    @Override
    public String toString() {
        return "VmListing{" + name + ", " + group + '}';
    }
}

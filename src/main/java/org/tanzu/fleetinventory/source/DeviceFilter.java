package org.tanzu.fleetinventory.source;

/**
 * Restricts a provisioning listing to one site and/or device collection. Null means no restriction.
 */
public class DeviceFilter {

    private static final DeviceFilter NONE = new DeviceFilter(null, null);

    private final String site;
    private final String collection;

    public DeviceFilter(String site, String collection) {
        this.site = site;
        this.collection = collection;
    }

    public static DeviceFilter none() {
        return NONE;
    }

    public String getSite() { return site; }
    public String getCollection() { return collection; }

    @Override
    public String toString() {
        return "DeviceFilter{site='" + site + "', collection='" + collection + "'}";
    }
}

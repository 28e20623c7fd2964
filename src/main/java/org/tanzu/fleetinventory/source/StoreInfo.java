package org.tanzu.fleetinventory.source;

/**
 * Provisioning store and the path its vDisks live under.
 */
public class StoreInfo {

    private final String name;
    private final String path;

    public StoreInfo(String name, String path) {
        this.name = name;
        this.path = path;
    }

    public String getName() { return name; }
    public String getPath() { return path; }

    @Override
    public String toString() {
        return name + "=" + path;
    }
}

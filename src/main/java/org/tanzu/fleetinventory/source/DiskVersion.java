package org.tanzu.fleetinventory.source;

/**
 * One version of a provisioning vDisk. {@code access} is the version's access mode as reported
 * by the provisioning server (Production, Maintenance, Test).
 */
public class DiskVersion {

    public static final String PRODUCTION = "Production";

    private final String diskName;
    private final int version;
    private final String access;

    public DiskVersion(String diskName, int version, String access) {
        this.diskName = diskName;
        this.version = version;
        this.access = access;
    }

    public String getDiskName() { return diskName; }
    public int getVersion() { return version; }
    public String getAccess() { return access; }

    public boolean isProduction() {
        return PRODUCTION.equalsIgnoreCase(access);
    }

    @Override
    public String toString() {
        return diskName + "." + version + "(" + access + ")";
    }
}

package org.tanzu.fleetinventory.inventory;

import org.tanzu.fleetinventory.model.ProvisioningGroup;
import org.tanzu.fleetinventory.source.DiskVersion;
import org.tanzu.fleetinventory.source.StoreInfo;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only lookup tables built from the provisioning source before the per-device fan-out:
 * the newest production version of each disk and the path of each store.
 *
 * Built once on the run thread and shared with collector workers without locking.
 */
public final class ProvisioningReferenceData {

    private static final ProvisioningReferenceData EMPTY = new ProvisioningReferenceData(Map.of(), Map.of());

    private final Map<String, Integer> latestProductionVersions;
    private final Map<String, String> storePaths;

    private ProvisioningReferenceData(Map<String, Integer> latestProductionVersions, Map<String, String> storePaths) {
        this.latestProductionVersions = latestProductionVersions;
        this.storePaths = storePaths;
    }

    public static ProvisioningReferenceData empty() {
        return EMPTY;
    }

    /**
     * Builds the tables. Disk names and store names are matched case-insensitively.
     *
     * @param versions Every version of every disk, in any order
     * @param stores The store list
     * @return The reference data
     */
    public static ProvisioningReferenceData from(List<DiskVersion> versions, List<StoreInfo> stores) {
        Map<String, Integer> latest = new TreeMap<>();
        for (DiskVersion version : versions) {
            if (version.getDiskName() == null || !version.isProduction()) {
                continue;
            }
            latest.merge(key(version.getDiskName()), version.getVersion(), Math::max);
        }
        Map<String, String> paths = new TreeMap<>();
        for (StoreInfo store : stores) {
            if (store.getName() != null) {
                paths.putIfAbsent(key(store.getName()), store.getPath());
            }
        }
        return new ProvisioningReferenceData(Collections.unmodifiableMap(latest), Collections.unmodifiableMap(paths));
    }

    public Integer latestProductionVersion(String diskName) {
        return diskName == null ? null : latestProductionVersions.get(key(diskName));
    }

    public String storePath(String storeName) {
        return storeName == null ? null : storePaths.get(key(storeName));
    }

    /**
     * Fills the newest production version and the store path into a device's provisioning
     * group, where the device detail did not already carry them.
     *
     * @param group Device detail from the provisioning source
     * @return The completed group
     */
    public ProvisioningGroup complete(ProvisioningGroup group) {
        if (group == null) {
            return null;
        }
        ProvisioningGroup.Builder builder = group.toBuilder();
        if (group.getLatestProductionVersion() == null) {
            builder.latestProductionVersion(latestProductionVersion(group.getDiskName()));
        }
        if (group.getStorePath() == null) {
            builder.storePath(storePath(group.getStoreName()));
        }
        return builder.build();
    }

    public int diskCount() { return latestProductionVersions.size(); }
    public int storeCount() { return storePaths.size(); }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "ProvisioningReferenceData{disks=" + latestProductionVersions + ", stores=" + storePaths.keySet() + '}';
    }
}

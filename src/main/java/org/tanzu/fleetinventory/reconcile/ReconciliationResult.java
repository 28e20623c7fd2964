package org.tanzu.fleetinventory.reconcile;

import org.tanzu.fleetinventory.identity.DeviceIdentity;
import org.tanzu.fleetinventory.model.DeviceRecord;
import org.tanzu.fleetinventory.model.InventoryWarning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link CrossSourceReconciler}: merged records ordered by identity, orphan counts
 * per orphan-capable source, and the warnings raised while merging.
 */
public final class ReconciliationResult {

    private final Map<DeviceIdentity, DeviceRecord> records;
    private final Map<String, Integer> orphanCounts;
    private final List<InventoryWarning> warnings;

    ReconciliationResult(Map<DeviceIdentity, DeviceRecord> records, Map<String, Integer> orphanCounts,
                         List<InventoryWarning> warnings) {
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.orphanCounts = Collections.unmodifiableMap(new LinkedHashMap<>(orphanCounts));
        this.warnings = List.copyOf(warnings);
    }

    /** One record per device, ordered by short name and then domain */
    public Map<DeviceIdentity, DeviceRecord> getRecords() { return records; }

    /** Orphans introduced per orphan-capable source, zero included */
    public Map<String, Integer> getOrphanCounts() { return orphanCounts; }

    /** Duplicate and merge-conflict warnings, in the order they were raised */
    public List<InventoryWarning> getWarnings() { return warnings; }

    /**
     * Looks up the record for a device.
     *
     * @param identity The identity to look up; correlation equality applies
     * @return The record, or null if the device is not part of the result
     */
    public DeviceRecord get(DeviceIdentity identity) {
        return records.get(identity);
    }

    @Override
    public String toString() {
        return "ReconciliationResult{records=" + records.size() + ", orphans=" + orphanCounts +
                ", warnings=" + warnings.size() + '}';
    }
}

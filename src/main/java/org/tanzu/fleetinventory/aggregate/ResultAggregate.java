package org.tanzu.fleetinventory.aggregate;

import org.tanzu.fleetinventory.identity.DeviceIdentity;
import org.tanzu.fleetinventory.identity.DeviceIdentityNormalizer;
import org.tanzu.fleetinventory.model.DeviceRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Final, read-only snapshot of a run: one record per device plus the run manifest.
 *
 * Handed to {@link OutputSink}s and kept by the inventory service as the latest snapshot.
 */
public class ResultAggregate {

    private final Map<DeviceIdentity, DeviceRecord> records;
    private final RunManifest manifest;

    public ResultAggregate(Map<DeviceIdentity, DeviceRecord> records, RunManifest manifest) {
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.manifest = manifest;
    }

    public Map<DeviceIdentity, DeviceRecord> getRecords() { return records; }
    public RunManifest getManifest() { return manifest; }

    public Collection<DeviceRecord> getDevices() {
        return records.values();
    }

    /**
     * Finds a device by any of its name forms ({@code NAME}, {@code DOMAIN\NAME}, FQDN).
     *
     * @param name The device name
     * @return The record, or null if the device is not in the snapshot
     */
    public DeviceRecord findDevice(String name) {
        return records.get(DeviceIdentityNormalizer.normalize(name));
    }

    public List<DeviceRecord> getOrphans() {
        return records.values().stream().filter(DeviceRecord::isOrphan).collect(Collectors.toList());
    }

    public List<DeviceRecord> getDevicesWithTelemetryProblems() {
        return records.values().stream().filter(DeviceRecord::hasTelemetryProblem).collect(Collectors.toList());
    }

    public List<DeviceRecord> getDevicesWithCollectionIssues() {
        return records.values().stream()
                .filter(record -> !record.getCollectionIssues().isEmpty())
                .collect(Collectors.toList());
    }
}

package org.tanzu.fleetinventory.inventory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.fleetinventory.aggregate.ResultAggregate;
import org.tanzu.fleetinventory.aggregate.RunManifest;
import org.tanzu.fleetinventory.model.CollectionIssue;
import org.tanzu.fleetinventory.model.DeviceRecord;
import org.tanzu.fleetinventory.model.InventoryWarning;
import org.tanzu.fleetinventory.reconcile.OrphanInclusionPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * MCP tools over the fleet inventory.
 *
 * {@link #runFleetInventory} performs a run; the other tools read the snapshot of the most
 * recent run and fail with a clear message when no run has completed yet.
 */
@Service
public class InventoryTools {

    private static final Logger logger = LoggerFactory.getLogger(InventoryTools.class);

    private final FleetInventoryService inventoryService;

    public InventoryTools(FleetInventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    /**
     * MCP tool: runs a fleet inventory pass.
     *
     * @param orphanProvisioningTypes Provisioning types whose broker-only machines count as orphans; configured types when empty
     * @param includeAllOrphans Report every broker-only machine as an orphan
     * @return Summary of the run manifest
     * @throws RuntimeException if the run is aborted
     */
    @Tool(description = "Run a fleet inventory across provisioning, broker, vCenter, directory and telemetry sources, "
            + "reconcile the results per device and detect orphans. Returns the run summary.")
    public RunSummaryInfo runFleetInventory(
            @ToolParam(description = "Provisioning types (e.g. PVS, MCS, Manual) whose broker-only machines are reported as orphans. Leave empty for the configured default.", required = false)
            List<String> orphanProvisioningTypes,
            @ToolParam(description = "Report every broker-only machine as an orphan regardless of provisioning type", required = false)
            Boolean includeAllOrphans) {
        logger.info("=== MCP TOOL CALLED: runFleetInventory({}, {}) ===", orphanProvisioningTypes, includeAllOrphans);
        OrphanInclusionPolicy policy;
        if (Boolean.TRUE.equals(includeAllOrphans)) {
            policy = OrphanInclusionPolicy.includeAll();
        } else if (orphanProvisioningTypes != null && !orphanProvisioningTypes.isEmpty()) {
            policy = OrphanInclusionPolicy.matchingProvisioningTypes(orphanProvisioningTypes);
        } else {
            policy = inventoryService.configuredPolicy();
        }
        try {
            return new RunSummaryInfo(inventoryService.run(policy).getManifest());
        } catch (InventoryRunException e) {
            logger.error("Fleet inventory run failed: {}", e.getMessage(), e);
            throw new RuntimeException("Fleet inventory run failed: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: lists the orphans of the latest run.
     */
    @Tool(description = "List devices found in a broker but missing from the provisioning service in the latest inventory run")
    public List<DeviceSummaryInfo> listOrphanDevices() {
        logger.info("=== MCP TOOL CALLED: listOrphanDevices() ===");
        return latest().getOrphans().stream().map(DeviceSummaryInfo::new).collect(Collectors.toList());
    }

    /**
     * MCP tool: gets the full record of one device.
     *
     * @param name Device name as short name, DOMAIN\name or FQDN
     * @return The reconciled record
     * @throws RuntimeException if no run has completed or the device is unknown
     */
    @Tool(description = "Get the reconciled record of one device from the latest inventory run. "
            + "Parameter: name (String) - short name, DOMAIN\\name or FQDN of the device")
    public DeviceRecord getDeviceRecord(String name) {
        logger.info("=== MCP TOOL CALLED: getDeviceRecord({}) ===", name);
        DeviceRecord record = latest().findDevice(name);
        if (record == null) {
            throw new RuntimeException("Device not found in latest inventory: " + name);
        }
        return record;
    }

    /**
     * MCP tool: lists devices whose telemetry timed out or could not be collected.
     */
    @Tool(description = "List devices whose live telemetry timed out or was unreachable in the latest inventory run")
    public List<DeviceSummaryInfo> listDevicesWithTelemetryIssues() {
        logger.info("=== MCP TOOL CALLED: listDevicesWithTelemetryIssues() ===");
        return latest().getDevicesWithTelemetryProblems().stream().map(DeviceSummaryInfo::new).collect(Collectors.toList());
    }

    private ResultAggregate latest() {
        ResultAggregate aggregate = inventoryService.getLatest();
        if (aggregate == null) {
            throw new RuntimeException("No inventory run has completed yet; call runFleetInventory first");
        }
        return aggregate;
    }

    /**
     * Run manifest as returned to MCP clients.
     */
    public static class RunSummaryInfo {
        private final String runId;
        private final String startedAt;
        private final String completedAt;
        private final int totalRecords;
        private final int totalOrphans;
        private final Map<String, Integer> orphansPerSource;
        private final int timedOutCount;
        private final int failedCount;
        private final List<String> unavailableSources;
        private final String orphanPolicy;
        private final List<String> warnings;

        public RunSummaryInfo(RunManifest manifest) {
            this.runId = manifest.getRunId();
            this.startedAt = String.valueOf(manifest.getStartedAt());
            this.completedAt = String.valueOf(manifest.getCompletedAt());
            this.totalRecords = manifest.getTotalRecords();
            this.totalOrphans = manifest.getTotalOrphans();
            this.orphansPerSource = manifest.getPerSourceOrphanCounts();
            this.timedOutCount = manifest.getTimedOutCount();
            this.failedCount = manifest.getFailedCount();
            this.unavailableSources = manifest.getUnavailableSources();
            this.orphanPolicy = manifest.getOrphanPolicy();
            List<String> rendered = new ArrayList<>();
            for (InventoryWarning warning : manifest.getWarnings()) {
                rendered.add(warning.getType() + ": " + warning.getMessage());
            }
            this.warnings = rendered;
        }

        public String getRunId() { return runId; }
        public String getStartedAt() { return startedAt; }
        public String getCompletedAt() { return completedAt; }
        public int getTotalRecords() { return totalRecords; }
        public int getTotalOrphans() { return totalOrphans; }
        public Map<String, Integer> getOrphansPerSource() { return orphansPerSource; }
        public int getTimedOutCount() { return timedOutCount; }
        public int getFailedCount() { return failedCount; }
        public List<String> getUnavailableSources() { return unavailableSources; }
        public String getOrphanPolicy() { return orphanPolicy; }
        public List<String> getWarnings() { return warnings; }

        @Override
        public String toString() {
            return "RunSummaryInfo{runId='" + runId + "', totalRecords=" + totalRecords +
                    ", totalOrphans=" + totalOrphans + ", timedOut=" + timedOutCount + ", failed=" + failedCount + '}';
        }
    }

    /**
     * One-line view of a device for list tools.
     */
    public static class DeviceSummaryInfo {
        private final String name;
        private final String domain;
        private final boolean orphan;
        private final String provenance;
        private final String provisioningType;
        private final String telemetryStatus;
        private final List<String> sources;
        private final List<String> issues;

        public DeviceSummaryInfo(DeviceRecord record) {
            this.name = record.getDisplayName();
            this.domain = record.getDomain();
            this.orphan = record.isOrphan();
            this.provenance = record.getProvenance();
            this.provisioningType = record.getOrchestration() == null ? null : record.getOrchestration().getProvisioningType();
            this.telemetryStatus = record.getTelemetry() == null ? null : record.getTelemetry().getStatus().name();
            this.sources = record.getContributingSources();
            List<String> rendered = new ArrayList<>();
            for (CollectionIssue issue : record.getCollectionIssues()) {
                rendered.add(issue.getSourceName() + " " + issue.getKind());
            }
            this.issues = rendered;
        }

        public String getName() { return name; }
        public String getDomain() { return domain; }
        public boolean isOrphan() { return orphan; }
        public String getProvenance() { return provenance; }
        public String getProvisioningType() { return provisioningType; }
        public String getTelemetryStatus() { return telemetryStatus; }
        public List<String> getSources() { return sources; }
        public List<String> getIssues() { return issues; }

        @Override
        public String toString() {
            return "DeviceSummaryInfo{name='" + name + "', domain='" + domain + "', orphan=" + orphan +
                    ", telemetry=" + telemetryStatus + '}';
        }
    }
}

package org.tanzu.fleetinventory.model;

import org.tanzu.fleetinventory.identity.DeviceIdentity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unified, read-only view of one device after reconciliation.
 *
 * Each field group is null when no source had data for it. {@link #isOrphan()} is set when the
 * device was found only in a secondary source; {@link #getProvenance()} then names that source.
 * Instances are produced by the reconciler and never change afterwards.
 */
public final class DeviceRecord {

    private final DeviceIdentity identity;
    private final String displayName;
    private final String domain;
    private final ProvisioningGroup provisioning;
    private final OrchestrationGroup orchestration;
    private final DirectoryGroup directory;
    private final VirtualizationGroup virtualization;
    private final TelemetryGroup telemetry;
    private final boolean orphan;
    private final String provenance;
    private final List<String> contributingSources;
    private final List<CollectionIssue> collectionIssues;

    private DeviceRecord(Builder builder) {
        this.identity = Objects.requireNonNull(builder.identity, "identity");
        this.displayName = builder.displayName;
        this.domain = builder.domain;
        this.provisioning = builder.provisioning;
        this.orchestration = builder.orchestration;
        this.directory = builder.directory;
        this.virtualization = builder.virtualization;
        this.telemetry = builder.telemetry;
        this.orphan = builder.orphan;
        this.provenance = builder.provenance;
        this.contributingSources = List.copyOf(builder.contributingSources);
        this.collectionIssues = List.copyOf(builder.collectionIssues);
    }

    /**
     * Starts a record for a device.
     *
     * @param identity Correlation key; the reconciler passes the identity with the domain it resolved
     * @return A builder with every group unset
     */
    public static Builder builder(DeviceIdentity identity) {
        return new Builder(identity);
    }

    public DeviceIdentity getIdentity() { return identity; }
    /** Name as the first contributing source spelled it */
    public String getDisplayName() { return displayName; }
    public String getDomain() { return domain; }
    public ProvisioningGroup getProvisioning() { return provisioning; }
    public OrchestrationGroup getOrchestration() { return orchestration; }
    public DirectoryGroup getDirectory() { return directory; }
    public VirtualizationGroup getVirtualization() { return virtualization; }
    public TelemetryGroup getTelemetry() { return telemetry; }
    public boolean isOrphan() { return orphan; }

    /** Source that introduced an orphan; null for devices known to the primary source */
    public String getProvenance() { return provenance; }

    /** Sources that supplied data for this device, in precedence order */
    public List<String> getContributingSources() { return contributingSources; }

    /** Per-device fetches that timed out, failed or found nothing */
    public List<CollectionIssue> getCollectionIssues() { return collectionIssues; }

    /**
     * Tells whether telemetry was attempted but produced no values.
     *
     * @return true if the telemetry group carries a TIMED_OUT or UNREACHABLE marker
     */
    public boolean hasTelemetryProblem() {
        return telemetry != null && !telemetry.hasValues();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceRecord)) return false;
        DeviceRecord that = (DeviceRecord) o;
        return orphan == that.orphan
                && identity.qualifiedName().equals(that.identity.qualifiedName())
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(domain, that.domain)
                && Objects.equals(provisioning, that.provisioning)
                && Objects.equals(orchestration, that.orchestration)
                && Objects.equals(directory, that.directory)
                && Objects.equals(virtualization, that.virtualization)
                && Objects.equals(telemetry, that.telemetry)
                && Objects.equals(provenance, that.provenance)
                && contributingSources.equals(that.contributingSources)
                && collectionIssues.equals(that.collectionIssues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity.qualifiedName(), displayName, domain, provisioning, orchestration, directory,
                virtualization, telemetry, orphan, provenance, contributingSources, collectionIssues);
    }

    @Override
    public String toString() {
        return "DeviceRecord{" + identity.qualifiedName() +
                (orphan ? ", orphan from '" + provenance + "'" : "") +
                ", sources=" + contributingSources +
                (collectionIssues.isEmpty() ? "" : ", issues=" + collectionIssues) + '}';
    }

    public static final class Builder {
        private final DeviceIdentity identity;
        private String displayName;
        private String domain;
        private ProvisioningGroup provisioning;
        private OrchestrationGroup orchestration;
        private DirectoryGroup directory;
        private VirtualizationGroup virtualization;
        private TelemetryGroup telemetry;
        private boolean orphan;
        private String provenance;
        private final List<String> contributingSources = new ArrayList<>();
        private final List<CollectionIssue> collectionIssues = new ArrayList<>();

        private Builder(DeviceIdentity identity) {
            this.identity = identity;
        }

        public Builder displayName(String displayName) { this.displayName = displayName; return this; }
        public Builder domain(String domain) { this.domain = domain; return this; }
        public Builder provisioning(ProvisioningGroup provisioning) { this.provisioning = provisioning; return this; }
        public Builder orchestration(OrchestrationGroup orchestration) { this.orchestration = orchestration; return this; }
        public Builder directory(DirectoryGroup directory) { this.directory = directory; return this; }
        public Builder virtualization(VirtualizationGroup virtualization) { this.virtualization = virtualization; return this; }
        public Builder telemetry(TelemetryGroup telemetry) { this.telemetry = telemetry; return this; }
        /** Flags the record as an orphan introduced by the named source */
        public Builder orphan(String provenance) { this.orphan = true; this.provenance = provenance; return this; }
        public Builder contributingSources(List<String> sources) { this.contributingSources.addAll(sources); return this; }
        public Builder collectionIssues(List<CollectionIssue> issues) { this.collectionIssues.addAll(issues); return this; }

        public DeviceRecord build() {
            return new DeviceRecord(this);
        }
    }
}

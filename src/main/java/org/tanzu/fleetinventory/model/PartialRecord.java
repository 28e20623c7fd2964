package org.tanzu.fleetinventory.model;

import org.tanzu.fleetinventory.identity.DeviceIdentity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What one source knows about one device. Every group is optional.
 *
 * The classifier is the field orphan inclusion is judged on: the provisioning type of the
 * catalog the machine belongs to. It defaults to the orchestration group's provisioning type.
 */
public final class PartialRecord {

    private final DeviceIdentity identity;
    private final ProvisioningGroup provisioning;
    private final OrchestrationGroup orchestration;
    private final DirectoryGroup directory;
    private final VirtualizationGroup virtualization;
    private final TelemetryGroup telemetry;
    private final String classifier;
    private final List<CollectionIssue> issues;

    private PartialRecord(Builder builder) {
        this.identity = Objects.requireNonNull(builder.identity, "identity");
        this.provisioning = builder.provisioning;
        this.orchestration = builder.orchestration;
        this.directory = builder.directory;
        this.virtualization = builder.virtualization;
        this.telemetry = builder.telemetry;
        this.classifier = builder.classifier != null ? builder.classifier
                : orchestration != null ? orchestration.getProvisioningType() : null;
        this.issues = List.copyOf(builder.issues);
    }

    public static Builder builder(DeviceIdentity identity) {
        return new Builder(identity);
    }

    public DeviceIdentity getIdentity() { return identity; }
    public ProvisioningGroup getProvisioning() { return provisioning; }
    public OrchestrationGroup getOrchestration() { return orchestration; }
    public DirectoryGroup getDirectory() { return directory; }
    public VirtualizationGroup getVirtualization() { return virtualization; }
    public TelemetryGroup getTelemetry() { return telemetry; }
    /** Provisioning type the orphan policy is evaluated on, or null when the source has no catalog data */
    public String getClassifier() { return classifier; }

    /** Fetch problems this source ran into for the device */
    public List<CollectionIssue> getIssues() { return issues; }

    @Override
    public String toString() {
        return "PartialRecord{" + identity.qualifiedName() +
                (provisioning != null ? ", " + provisioning : "") +
                (orchestration != null ? ", " + orchestration : "") +
                (directory != null ? ", " + directory : "") +
                (virtualization != null ? ", " + virtualization : "") +
                (telemetry != null ? ", " + telemetry : "") +
                (issues.isEmpty() ? "" : ", issues=" + issues) + '}';
    }

    public static final class Builder {
        private final DeviceIdentity identity;
        private ProvisioningGroup provisioning;
        private OrchestrationGroup orchestration;
        private DirectoryGroup directory;
        private VirtualizationGroup virtualization;
        private TelemetryGroup telemetry;
        private String classifier;
        private final List<CollectionIssue> issues = new ArrayList<>();

        private Builder(DeviceIdentity identity) {
            this.identity = identity;
        }

        public Builder provisioning(ProvisioningGroup provisioning) { this.provisioning = provisioning; return this; }
        public Builder orchestration(OrchestrationGroup orchestration) { this.orchestration = orchestration; return this; }
        public Builder directory(DirectoryGroup directory) { this.directory = directory; return this; }
        public Builder virtualization(VirtualizationGroup virtualization) { this.virtualization = virtualization; return this; }
        public Builder telemetry(TelemetryGroup telemetry) { this.telemetry = telemetry; return this; }
        /** Overrides the classifier derived from the orchestration group */
        public Builder classifier(String classifier) { this.classifier = classifier; return this; }
        public Builder issue(CollectionIssue issue) { this.issues.add(issue); return this; }

        public PartialRecord build() {
            return new PartialRecord(this);
        }
    }
}

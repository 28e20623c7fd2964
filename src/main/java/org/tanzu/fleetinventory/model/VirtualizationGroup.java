package org.tanzu.fleetinventory.model;

import java.util.Objects;

/**
 * Fields contributed by the virtualization manager (vCenter).
 */
public final class VirtualizationGroup {

    private final String vmId;
    private final Integer cpuCount;
    private final Long memoryMiB;
    private final Integer diskCount;
    private final Long diskCapacityBytes;
    private final Integer nicCount;
    private final String host;
    private final String powerState;

    private VirtualizationGroup(Builder builder) {
        this.vmId = builder.vmId;
        this.cpuCount = builder.cpuCount;
        this.memoryMiB = builder.memoryMiB;
        this.diskCount = builder.diskCount;
        this.diskCapacityBytes = builder.diskCapacityBytes;
        this.nicCount = builder.nicCount;
        this.host = builder.host;
        this.powerState = builder.powerState;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .vmId(vmId)
                .cpuCount(cpuCount)
                .memoryMiB(memoryMiB)
                .diskCount(diskCount)
                .diskCapacityBytes(diskCapacityBytes)
                .nicCount(nicCount)
                .host(host)
                .powerState(powerState);
    }

    public String getVmId() { return vmId; }
    public Integer getCpuCount() { return cpuCount; }
    public Long getMemoryMiB() { return memoryMiB; }
    public Integer getDiskCount() { return diskCount; }
    public Long getDiskCapacityBytes() { return diskCapacityBytes; }
    public Integer getNicCount() { return nicCount; }
    public String getHost() { return host; }
    public String getPowerState() { return powerState; }

    /**
     * Merges with a group from a weaker source, typically detail over listing data.
     *
     * @param weaker Group from a lower-precedence source, may be null
     * @return The merged group
     */
    public VirtualizationGroup mergedWith(VirtualizationGroup weaker) {
        if (weaker == null) {
            return this;
        }
        return new Builder()
                .vmId(MergeSupport.first(vmId, weaker.vmId))
                .cpuCount(MergeSupport.first(cpuCount, weaker.cpuCount))
                .memoryMiB(MergeSupport.first(memoryMiB, weaker.memoryMiB))
                .diskCount(MergeSupport.first(diskCount, weaker.diskCount))
                .diskCapacityBytes(MergeSupport.first(diskCapacityBytes, weaker.diskCapacityBytes))
                .nicCount(MergeSupport.first(nicCount, weaker.nicCount))
                .host(MergeSupport.first(host, weaker.host))
                .powerState(MergeSupport.first(powerState, weaker.powerState))
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VirtualizationGroup)) return false;
        VirtualizationGroup that = (VirtualizationGroup) o;
        return Objects.equals(vmId, that.vmId)
                && Objects.equals(cpuCount, that.cpuCount)
                && Objects.equals(memoryMiB, that.memoryMiB)
                && Objects.equals(diskCount, that.diskCount)
                && Objects.equals(diskCapacityBytes, that.diskCapacityBytes)
                && Objects.equals(nicCount, that.nicCount)
                && Objects.equals(host, that.host)
                && Objects.equals(powerState, that.powerState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vmId, cpuCount, memoryMiB, diskCount, diskCapacityBytes, nicCount, host, powerState);
    }

    @Override
    public String toString() {
        return "VirtualizationGroup{vm='" + vmId + "', cpu=" + cpuCount + ", memoryMiB=" + memoryMiB +
                ", disks=" + diskCount + ", diskBytes=" + diskCapacityBytes + ", nics=" + nicCount +
                ", host='" + host + "', power='" + powerState + "'}";
    }

    public static final class Builder {
        private String vmId;
        private Integer cpuCount;
        private Long memoryMiB;
        private Integer diskCount;
        private Long diskCapacityBytes;
        private Integer nicCount;
        private String host;
        private String powerState;

        private Builder() {
        }

        public Builder vmId(String vmId) { this.vmId = vmId; return this; }
        public Builder cpuCount(Integer cpuCount) { this.cpuCount = cpuCount; return this; }
        public Builder memoryMiB(Long memoryMiB) { this.memoryMiB = memoryMiB; return this; }
        public Builder diskCount(Integer diskCount) { this.diskCount = diskCount; return this; }
        public Builder diskCapacityBytes(Long bytes) { this.diskCapacityBytes = bytes; return this; }
        public Builder nicCount(Integer nicCount) { this.nicCount = nicCount; return this; }
        public Builder host(String host) { this.host = host; return this; }
        public Builder powerState(String powerState) { this.powerState = powerState; return this; }

        public VirtualizationGroup build() {
            return new VirtualizationGroup(this);
        }
    }
}

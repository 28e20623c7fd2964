package org.tanzu.fleetinventory.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Live per-host telemetry, or a marker explaining why there is none.
 *
 * A group with status {@link Status#TIMED_OUT} or {@link Status#UNREACHABLE} carries no values.
 */
public final class TelemetryGroup {

    public enum Status {
        OK,
        TIMED_OUT,
        UNREACHABLE
    }

    private final Status status;
    private final Instant bootTime;
    private final Double freeMemoryPercent;
    private final Double cpuPercent;
    private final Double freeDiskPercent;
    private final Boolean domainTrustHealthy;
    private final String detail;

    private TelemetryGroup(Status status, Instant bootTime, Double freeMemoryPercent, Double cpuPercent,
                           Double freeDiskPercent, Boolean domainTrustHealthy, String detail) {
        this.status = status;
        this.bootTime = bootTime;
        this.freeMemoryPercent = freeMemoryPercent;
        this.cpuPercent = cpuPercent;
        this.freeDiskPercent = freeDiskPercent;
        this.domainTrustHealthy = domainTrustHealthy;
        this.detail = detail;
    }

    /**
     * Telemetry values read from a host. Any value may be null when the host did not report it.
     *
     * @param bootTime Last boot time
     * @param freeMemoryPercent Free physical memory in percent
     * @param cpuPercent CPU load in percent
     * @param freeDiskPercent Free space on the system drive in percent
     * @param domainTrustHealthy Whether the machine's secure channel to the domain works
     * @return A group with status {@link Status#OK}
     */
    public static TelemetryGroup of(Instant bootTime, Double freeMemoryPercent, Double cpuPercent,
                                    Double freeDiskPercent, Boolean domainTrustHealthy) {
        return new TelemetryGroup(Status.OK, bootTime, freeMemoryPercent, cpuPercent, freeDiskPercent,
                domainTrustHealthy, null);
    }

    /**
     * Marker for a host that did not answer within the telemetry timeout.
     */
    public static TelemetryGroup timedOut() {
        return new TelemetryGroup(Status.TIMED_OUT, null, null, null, null, null, null);
    }

    /**
     * Marker for a host that could not be queried.
     *
     * @param detail Reason reported by the telemetry call
     */
    public static TelemetryGroup unreachable(String detail) {
        return new TelemetryGroup(Status.UNREACHABLE, null, null, null, null, null, detail);
    }

    public Status getStatus() { return status; }
    public Instant getBootTime() { return bootTime; }
    public Double getFreeMemoryPercent() { return freeMemoryPercent; }
    public Double getCpuPercent() { return cpuPercent; }
    public Double getFreeDiskPercent() { return freeDiskPercent; }
    public Boolean getDomainTrustHealthy() { return domainTrustHealthy; }
    public String getDetail() { return detail; }

    public boolean hasValues() {
        return status == Status.OK;
    }

    /**
     * Merges with telemetry from a weaker source. A marker here stands; values only fill gaps of an OK group.
     */
    public TelemetryGroup mergedWith(TelemetryGroup weaker) {
        if (weaker == null || status != Status.OK || weaker.status != Status.OK) {
            return this;
        }
        return new TelemetryGroup(Status.OK,
                MergeSupport.first(bootTime, weaker.bootTime),
                MergeSupport.first(freeMemoryPercent, weaker.freeMemoryPercent),
                MergeSupport.first(cpuPercent, weaker.cpuPercent),
                MergeSupport.first(freeDiskPercent, weaker.freeDiskPercent),
                MergeSupport.first(domainTrustHealthy, weaker.domainTrustHealthy),
                MergeSupport.first(detail, weaker.detail));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TelemetryGroup)) return false;
        TelemetryGroup that = (TelemetryGroup) o;
        return status == that.status
                && Objects.equals(bootTime, that.bootTime)
                && Objects.equals(freeMemoryPercent, that.freeMemoryPercent)
                && Objects.equals(cpuPercent, that.cpuPercent)
                && Objects.equals(freeDiskPercent, that.freeDiskPercent)
                && Objects.equals(domainTrustHealthy, that.domainTrustHealthy)
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, bootTime, freeMemoryPercent, cpuPercent, freeDiskPercent, domainTrustHealthy, detail);
    }

    @Override
    public String toString() {
        if (status != Status.OK) {
            return "TelemetryGroup{" + status + (detail == null ? "" : ": " + detail) + '}';
        }
        return "TelemetryGroup{boot=" + bootTime + ", freeMem%=" + freeMemoryPercent + ", cpu%=" + cpuPercent +
                ", freeDisk%=" + freeDiskPercent + ", trust=" + domainTrustHealthy + '}';
    }
}

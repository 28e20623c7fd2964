package org.tanzu.fleetinventory.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the inventory run.
 *
 * Bound from the "inventory" prefix, so properties like "inventory.max-concurrency" or the
 * environment variable INVENTORY_MAXCONCURRENCY map to this class. Values left unset in the
 * environment can be supplied by a bound "inventory" service (see {@link ServiceBindingProcessor}).
 */
@Component
@Validated
@ConfigurationProperties(prefix = "inventory")
public class InventoryConfig {

    /** Maximum number of remote per-device calls running at once */
    @Min(1)
    private int maxConcurrency = 10;

    /** Deadline of each per-device detail fetch, counted from when it starts running */
    @NotNull
    private Duration perTaskTimeout = Duration.ofSeconds(30);

    /** Timeout handed to the telemetry probe; the collector deadline still applies on top */
    @NotNull
    private Duration telemetryTimeout = Duration.ofSeconds(20);

    /** Catalog provisioning types whose secondary-only machines are reported as orphans */
    private List<String> orphanProvisioningTypes = new ArrayList<>(List.of("PVS"));

    /** Report every secondary-only machine as an orphan, regardless of provisioning type */
    private boolean includeAllOrphans = false;

    /** Character after which hypervisor display names carry a suffix (e.g. VDA01_pool1) */
    private String vmNameSplitChar = "_";

    /** Glob over VM display names selecting the VMs to correlate */
    private String vmNamePattern = "*";

    /** Broker controllers to query, in precedence order (first listed wins on conflicts) */
    private List<String> brokerAdminAddresses = new ArrayList<>();

    /** Provisioning site to restrict the device listing to */
    private String deviceSite;

    /** Provisioning device collection to restrict the device listing to */
    private String deviceCollection;

    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public Duration getPerTaskTimeout() { return perTaskTimeout; }
    public void setPerTaskTimeout(Duration perTaskTimeout) { this.perTaskTimeout = perTaskTimeout; }

    public Duration getTelemetryTimeout() { return telemetryTimeout; }
    public void setTelemetryTimeout(Duration telemetryTimeout) { this.telemetryTimeout = telemetryTimeout; }

    public List<String> getOrphanProvisioningTypes() { return orphanProvisioningTypes; }
    public void setOrphanProvisioningTypes(List<String> types) { this.orphanProvisioningTypes = types; }

    public boolean isIncludeAllOrphans() { return includeAllOrphans; }
    public void setIncludeAllOrphans(boolean includeAllOrphans) { this.includeAllOrphans = includeAllOrphans; }

    public String getVmNameSplitChar() { return vmNameSplitChar; }
    public void setVmNameSplitChar(String vmNameSplitChar) { this.vmNameSplitChar = vmNameSplitChar; }

    /**
     * Gets the split character as a Character.
     * @return The first character of the configured value, or null if none is configured
     */
    public Character splitCharacter() {
        return vmNameSplitChar == null || vmNameSplitChar.isEmpty() ? null : vmNameSplitChar.charAt(0);
    }

    public String getVmNamePattern() { return vmNamePattern; }
    public void setVmNamePattern(String vmNamePattern) { this.vmNamePattern = vmNamePattern; }

    public List<String> getBrokerAdminAddresses() { return brokerAdminAddresses; }
    public void setBrokerAdminAddresses(List<String> addresses) { this.brokerAdminAddresses = addresses; }

    public String getDeviceSite() { return deviceSite; }
    public void setDeviceSite(String deviceSite) { this.deviceSite = deviceSite; }

    public String getDeviceCollection() { return deviceCollection; }
    public void setDeviceCollection(String deviceCollection) { this.deviceCollection = deviceCollection; }

    /**
     * Sets the concurrency limit from a string value, as found in service binding credentials.
     * @param maxConcurrency String representation of the limit
     */
    public void setMaxConcurrency(String maxConcurrency) {
        this.maxConcurrency = Integer.parseInt(maxConcurrency.trim());
    }

    @AssertTrue(message = "inventory timeouts must be positive")
    public boolean isTimeoutsPositive() {
        return perTaskTimeout != null && !perTaskTimeout.isNegative() && !perTaskTimeout.isZero()
                && telemetryTimeout != null && !telemetryTimeout.isNegative() && !telemetryTimeout.isZero();
    }

    @Override
    public String toString() {
        return "InventoryConfig{" +
                "maxConcurrency=" + maxConcurrency +
                ", perTaskTimeout=" + perTaskTimeout +
                ", telemetryTimeout=" + telemetryTimeout +
                ", orphanProvisioningTypes=" + orphanProvisioningTypes +
                ", includeAllOrphans=" + includeAllOrphans +
                ", vmNameSplitChar='" + vmNameSplitChar + '\'' +
                ", vmNamePattern='" + vmNamePattern + '\'' +
                ", brokerAdminAddresses=" + brokerAdminAddresses +
                ", deviceSite='" + deviceSite + '\'' +
                ", deviceCollection='" + deviceCollection + '\'' +
                '}';
    }
}

package org.tanzu.fleetinventory.model;

import java.util.List;
import java.util.Objects;

/**
 * Fields contributed by the broker/orchestration plane (Delivery Controller).
 */
public final class OrchestrationGroup {

    private final String catalogName;
    private final String provisioningType;
    private final String deliveryGroup;
    private final String registrationState;
    private final Boolean maintenanceMode;
    private final Integer sessionCount;
    private final Integer loadIndex;
    private final List<String> tags;
    private final String brokerAddress;

    private OrchestrationGroup(Builder builder) {
        this.catalogName = builder.catalogName;
        this.provisioningType = builder.provisioningType;
        this.deliveryGroup = builder.deliveryGroup;
        this.registrationState = builder.registrationState;
        this.maintenanceMode = builder.maintenanceMode;
        this.sessionCount = builder.sessionCount;
        this.loadIndex = builder.loadIndex;
        this.tags = MergeSupport.copyOf(builder.tags);
        this.brokerAddress = builder.brokerAddress;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .catalogName(catalogName)
                .provisioningType(provisioningType)
                .deliveryGroup(deliveryGroup)
                .registrationState(registrationState)
                .maintenanceMode(maintenanceMode)
                .sessionCount(sessionCount)
                .loadIndex(loadIndex)
                .tags(tags)
                .brokerAddress(brokerAddress);
    }

    public String getCatalogName() { return catalogName; }
    public String getProvisioningType() { return provisioningType; }
    public String getDeliveryGroup() { return deliveryGroup; }
    public String getRegistrationState() { return registrationState; }
    public Boolean getMaintenanceMode() { return maintenanceMode; }
    public Integer getSessionCount() { return sessionCount; }
    public Integer getLoadIndex() { return loadIndex; }
    public List<String> getTags() { return tags; }
    public String getBrokerAddress() { return brokerAddress; }

    /**
     * Merges with a group from a weaker source. Tags are taken as a whole from the first
     * source that has any.
     *
     * @param weaker Group from a lower-precedence source, may be null
     * @return The merged group
     */
    public OrchestrationGroup mergedWith(OrchestrationGroup weaker) {
        if (weaker == null) {
            return this;
        }
        return new Builder()
                .catalogName(MergeSupport.first(catalogName, weaker.catalogName))
                .provisioningType(MergeSupport.first(provisioningType, weaker.provisioningType))
                .deliveryGroup(MergeSupport.first(deliveryGroup, weaker.deliveryGroup))
                .registrationState(MergeSupport.first(registrationState, weaker.registrationState))
                .maintenanceMode(MergeSupport.first(maintenanceMode, weaker.maintenanceMode))
                .sessionCount(MergeSupport.first(sessionCount, weaker.sessionCount))
                .loadIndex(MergeSupport.first(loadIndex, weaker.loadIndex))
                .tags(MergeSupport.firstNonEmpty(tags, weaker.tags))
                .brokerAddress(MergeSupport.first(brokerAddress, weaker.brokerAddress))
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrchestrationGroup)) return false;
        OrchestrationGroup that = (OrchestrationGroup) o;
        return Objects.equals(catalogName, that.catalogName)
                && Objects.equals(provisioningType, that.provisioningType)
                && Objects.equals(deliveryGroup, that.deliveryGroup)
                && Objects.equals(registrationState, that.registrationState)
                && Objects.equals(maintenanceMode, that.maintenanceMode)
                && Objects.equals(sessionCount, that.sessionCount)
                && Objects.equals(loadIndex, that.loadIndex)
                && Objects.equals(tags, that.tags)
                && Objects.equals(brokerAddress, that.brokerAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(catalogName, provisioningType, deliveryGroup, registrationState, maintenanceMode,
                sessionCount, loadIndex, tags, brokerAddress);
    }

    @Override
    public String toString() {
        return "OrchestrationGroup{catalog='" + catalogName + "', type='" + provisioningType +
                "', deliveryGroup='" + deliveryGroup + "', registration='" + registrationState +
                "', maintenance=" + maintenanceMode + ", sessions=" + sessionCount + ", load=" + loadIndex +
                ", tags=" + tags + ", broker='" + brokerAddress + "'}";
    }

    public static final class Builder {
        private String catalogName;
        private String provisioningType;
        private String deliveryGroup;
        private String registrationState;
        private Boolean maintenanceMode;
        private Integer sessionCount;
        private Integer loadIndex;
        private List<String> tags;
        private String brokerAddress;

        private Builder() {
        }

        public Builder catalogName(String catalogName) { this.catalogName = catalogName; return this; }
        public Builder provisioningType(String provisioningType) { this.provisioningType = provisioningType; return this; }
        public Builder deliveryGroup(String deliveryGroup) { this.deliveryGroup = deliveryGroup; return this; }
        public Builder registrationState(String registrationState) { this.registrationState = registrationState; return this; }
        public Builder maintenanceMode(Boolean maintenanceMode) { this.maintenanceMode = maintenanceMode; return this; }
        public Builder sessionCount(Integer sessionCount) { this.sessionCount = sessionCount; return this; }
        public Builder loadIndex(Integer loadIndex) { this.loadIndex = loadIndex; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder brokerAddress(String brokerAddress) { this.brokerAddress = brokerAddress; return this; }

        public OrchestrationGroup build() {
            return new OrchestrationGroup(this);
        }
    }
}

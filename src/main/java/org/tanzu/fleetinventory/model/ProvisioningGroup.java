package org.tanzu.fleetinventory.model;

import java.util.Objects;

/**
 * Fields contributed by the provisioning (PVS) plane.
 */
public final class ProvisioningGroup {

    private final String diskName;
    private final String storeName;
    private final String storePath;
    private final Integer bootedVersion;
    private final Integer latestProductionVersion;
    private final Integer retries;
    private final String cacheType;
    private final String site;
    private final String collection;

    private ProvisioningGroup(Builder builder) {
        this.diskName = builder.diskName;
        this.storeName = builder.storeName;
        this.storePath = builder.storePath;
        this.bootedVersion = builder.bootedVersion;
        this.latestProductionVersion = builder.latestProductionVersion;
        this.retries = builder.retries;
        this.cacheType = builder.cacheType;
        this.site = builder.site;
        this.collection = builder.collection;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .diskName(diskName)
                .storeName(storeName)
                .storePath(storePath)
                .bootedVersion(bootedVersion)
                .latestProductionVersion(latestProductionVersion)
                .retries(retries)
                .cacheType(cacheType)
                .site(site)
                .collection(collection);
    }

    public String getDiskName() { return diskName; }
    public String getStoreName() { return storeName; }
    public String getStorePath() { return storePath; }
    /** Disk version the device booted from */
    public Integer getBootedVersion() { return bootedVersion; }

    /** Newest version of the disk in Production access, from the disk version listing */
    public Integer getLatestProductionVersion() { return latestProductionVersion; }
    public Integer getRetries() { return retries; }
    public String getCacheType() { return cacheType; }
    public String getSite() { return site; }
    public String getCollection() { return collection; }

    /**
     * Whether the device boots the newest production version of its disk.
     *
     * @return true or false, or null when either version is unknown
     */
    public Boolean getRunningLatestVersion() {
        if (bootedVersion == null || latestProductionVersion == null) {
            return null;
        }
        return bootedVersion >= latestProductionVersion;
    }

    /**
     * Merges with a group from a weaker source: fields set here win, gaps are filled from {@code weaker}.
     */
    public ProvisioningGroup mergedWith(ProvisioningGroup weaker) {
        if (weaker == null) {
            return this;
        }
        return new Builder()
                .diskName(MergeSupport.first(diskName, weaker.diskName))
                .storeName(MergeSupport.first(storeName, weaker.storeName))
                .storePath(MergeSupport.first(storePath, weaker.storePath))
                .bootedVersion(MergeSupport.first(bootedVersion, weaker.bootedVersion))
                .latestProductionVersion(MergeSupport.first(latestProductionVersion, weaker.latestProductionVersion))
                .retries(MergeSupport.first(retries, weaker.retries))
                .cacheType(MergeSupport.first(cacheType, weaker.cacheType))
                .site(MergeSupport.first(site, weaker.site))
                .collection(MergeSupport.first(collection, weaker.collection))
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProvisioningGroup)) return false;
        ProvisioningGroup that = (ProvisioningGroup) o;
        return Objects.equals(diskName, that.diskName)
                && Objects.equals(storeName, that.storeName)
                && Objects.equals(storePath, that.storePath)
                && Objects.equals(bootedVersion, that.bootedVersion)
                && Objects.equals(latestProductionVersion, that.latestProductionVersion)
                && Objects.equals(retries, that.retries)
                && Objects.equals(cacheType, that.cacheType)
                && Objects.equals(site, that.site)
                && Objects.equals(collection, that.collection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(diskName, storeName, storePath, bootedVersion, latestProductionVersion,
                retries, cacheType, site, collection);
    }

    @Override
    public String toString() {
        return "ProvisioningGroup{disk='" + diskName + "', store='" + storeName + "', booted=" + bootedVersion +
                ", latest=" + latestProductionVersion + ", retries=" + retries + ", cache='" + cacheType +
                "', site='" + site + "', collection='" + collection + "'}";
    }

    public static final class Builder {
        private String diskName;
        private String storeName;
        private String storePath;
        private Integer bootedVersion;
        private Integer latestProductionVersion;
        private Integer retries;
        private String cacheType;
        private String site;
        private String collection;

        private Builder() {
        }

        public Builder diskName(String diskName) { this.diskName = diskName; return this; }
        public Builder storeName(String storeName) { this.storeName = storeName; return this; }
        public Builder storePath(String storePath) { this.storePath = storePath; return this; }
        public Builder bootedVersion(Integer bootedVersion) { this.bootedVersion = bootedVersion; return this; }
        public Builder latestProductionVersion(Integer version) { this.latestProductionVersion = version; return this; }
        public Builder retries(Integer retries) { this.retries = retries; return this; }
        public Builder cacheType(String cacheType) { this.cacheType = cacheType; return this; }
        public Builder site(String site) { this.site = site; return this; }
        public Builder collection(String collection) { this.collection = collection; return this; }

        public ProvisioningGroup build() {
            return new ProvisioningGroup(this);
        }
    }
}

package org.tanzu.fleetinventory.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Fields contributed by the directory (computer account).
 */
public final class DirectoryGroup {

    private final Instant created;
    private final Instant lastLogon;
    private final String description;
    private final List<String> groupMemberships;
    private final String distinguishedName;
    private final Boolean enabled;

    private DirectoryGroup(Builder builder) {
        this.created = builder.created;
        this.lastLogon = builder.lastLogon;
        this.description = builder.description;
        this.groupMemberships = MergeSupport.copyOf(builder.groupMemberships);
        this.distinguishedName = builder.distinguishedName;
        this.enabled = builder.enabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Instant getCreated() { return created; }
    public Instant getLastLogon() { return lastLogon; }
    public String getDescription() { return description; }
    public List<String> getGroupMemberships() { return groupMemberships; }
    public String getDistinguishedName() { return distinguishedName; }
    public Boolean getEnabled() { return enabled; }

    /**
     * Merges with a group from a weaker source: fields set here win, gaps are filled from {@code weaker}.
     *
     * @param weaker Group from a lower-precedence source, may be null
     * @return The merged group
     */
    public DirectoryGroup mergedWith(DirectoryGroup weaker) {
        if (weaker == null) {
            return this;
        }
        return new Builder()
                .created(MergeSupport.first(created, weaker.created))
                .lastLogon(MergeSupport.first(lastLogon, weaker.lastLogon))
                .description(MergeSupport.first(description, weaker.description))
                .groupMemberships(MergeSupport.firstNonEmpty(groupMemberships, weaker.groupMemberships))
                .distinguishedName(MergeSupport.first(distinguishedName, weaker.distinguishedName))
                .enabled(MergeSupport.first(enabled, weaker.enabled))
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectoryGroup)) return false;
        DirectoryGroup that = (DirectoryGroup) o;
        return Objects.equals(created, that.created)
                && Objects.equals(lastLogon, that.lastLogon)
                && Objects.equals(description, that.description)
                && Objects.equals(groupMemberships, that.groupMemberships)
                && Objects.equals(distinguishedName, that.distinguishedName)
                && Objects.equals(enabled, that.enabled);
    }

    @Override
    public int hashCode() {
        return Objects.hash(created, lastLogon, description, groupMemberships, distinguishedName, enabled);
    }

    @Override
    public String toString() {
        return "DirectoryGroup{created=" + created + ", lastLogon=" + lastLogon + ", description='" + description +
                "', groups=" + groupMemberships + ", dn='" + distinguishedName + "', enabled=" + enabled + '}';
    }

    public static final class Builder {
        private Instant created;
        private Instant lastLogon;
        private String description;
        private List<String> groupMemberships;
        private String distinguishedName;
        private Boolean enabled;

        private Builder() {
        }

        public Builder created(Instant created) { this.created = created; return this; }
        public Builder lastLogon(Instant lastLogon) { this.lastLogon = lastLogon; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder groupMemberships(List<String> groups) { this.groupMemberships = groups; return this; }
        public Builder distinguishedName(String distinguishedName) { this.distinguishedName = distinguishedName; return this; }
        public Builder enabled(Boolean enabled) { this.enabled = enabled; return this; }

        public DirectoryGroup build() {
            return new DirectoryGroup(this);
        }
    }
}

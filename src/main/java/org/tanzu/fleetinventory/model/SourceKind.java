package org.tanzu.fleetinventory.model;

/**
 * Management planes that contribute device data, in precedence order.
 *
 * When two sources disagree on a field, the kind declared earlier wins.
 */
public enum SourceKind {
    PROVISIONING,
    ORCHESTRATION,
    VIRTUALIZATION,
    DIRECTORY,
    TELEMETRY;

    /**
     * Precedence rank, lower is stronger.
     *
     * @return The rank of this kind
     */
    public int rank() {
        return ordinal();
    }
}

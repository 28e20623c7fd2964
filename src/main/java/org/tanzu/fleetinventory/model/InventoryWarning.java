package org.tanzu.fleetinventory.model;

import java.util.Objects;

/**
 * Non-fatal condition encountered during a run. Surfaced in the run manifest.
 */
public final class InventoryWarning {

    public enum Type {
        /** A whole source could not be reached and contributed nothing. */
        SOURCE_UNAVAILABLE,
        /** A device fetch failed or the device could not be contacted. */
        DEVICE_UNREACHABLE,
        /** A device fetch exceeded its deadline and was abandoned. */
        TIMED_OUT,
        /** A source listed the same device twice; the first entry was kept. */
        DUPLICATE_IDENTITY,
        /** Two sources disagree on the domain of a short name; the weaker contribution was dropped. */
        MERGE_CONFLICT
    }

    private final Type type;
    private final String sourceName;
    private final String deviceName;
    private final String message;

    public InventoryWarning(Type type, String sourceName, String deviceName, String message) {
        this.type = Objects.requireNonNull(type, "type");
        this.sourceName = sourceName;
        this.deviceName = deviceName;
        this.message = message;
    }

    public Type getType() { return type; }
    public String getSourceName() { return sourceName; }
    public String getDeviceName() { return deviceName; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InventoryWarning)) return false;
        InventoryWarning that = (InventoryWarning) o;
        return type == that.type
                && Objects.equals(sourceName, that.sourceName)
                && Objects.equals(deviceName, that.deviceName)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, sourceName, deviceName, message);
    }

    @Override
    public String toString() {
        return type + "[" + sourceName + (deviceName == null ? "" : "/" + deviceName) + "]: " + message;
    }
}

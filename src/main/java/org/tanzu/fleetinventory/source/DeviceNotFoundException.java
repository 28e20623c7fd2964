package org.tanzu.fleetinventory.source;

/**
 * Thrown when a source has no entry for the requested device.
 */
public class DeviceNotFoundException extends RuntimeException {

    private final String sourceName;
    private final String deviceName;

    public DeviceNotFoundException(String sourceName, String deviceName) {
        super("Device '" + deviceName + "' not found in " + sourceName);
        this.sourceName = sourceName;
        this.deviceName = deviceName;
    }

    public String getSourceName() { return sourceName; }
    public String getDeviceName() { return deviceName; }
}

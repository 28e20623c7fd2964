package org.tanzu.fleetinventory.source;

import org.tanzu.fleetinventory.model.TelemetryGroup;

import java.time.Duration;

/**
 * Contract of the live host telemetry probe (remote OS queries against the device itself).
 */
public interface TelemetryAdapter {

    String getName();

    /**
     * Queries live telemetry of one host.
     *
     * Implementations should give up after {@code timeout} and return
     * {@link TelemetryGroup#timedOut()}; the collector enforces its own deadline regardless.
     *
     * @param hostname Host to query
     * @param timeout How long the remote call may take
     * @return Telemetry values, or a TIMED_OUT / UNREACHABLE marker
     */
    TelemetryGroup getTelemetry(String hostname, Duration timeout);
}

package org.tanzu.fleetinventory.aggregate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.fleetinventory.model.DeviceRecord;
import org.tanzu.fleetinventory.model.InventoryWarning;

/**
 * Writes the manifest of every run to the log, and each orphan and problem device at debug level.
 */
@Component
public class LoggingOutputSink implements OutputSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingOutputSink.class);

    @Override
    public void accept(ResultAggregate aggregate) {
        RunManifest manifest = aggregate.getManifest();
        logger.info("Run {}: {} devices, {} orphans {}, {} timed out, {} failed, unavailable sources {}",
                manifest.getRunId(), manifest.getTotalRecords(), manifest.getTotalOrphans(),
                manifest.getPerSourceOrphanCounts(), manifest.getTimedOutCount(), manifest.getFailedCount(),
                manifest.getUnavailableSources());
        for (InventoryWarning.Type type : InventoryWarning.Type.values()) {
            long count = manifest.countWarnings(type);
            if (count > 0) {
                logger.info("Run {}: {} warnings of type {}", manifest.getRunId(), count, type);
            }
        }
        if (logger.isDebugEnabled()) {
            for (DeviceRecord orphan : aggregate.getOrphans()) {
                logger.debug("Orphan {} from '{}'", orphan.getIdentity().qualifiedName(), orphan.getProvenance());
            }
            for (DeviceRecord device : aggregate.getDevicesWithTelemetryProblems()) {
                logger.debug("Telemetry {} for {}", device.getTelemetry().getStatus(), device.getIdentity().qualifiedName());
            }
        }
    }
}

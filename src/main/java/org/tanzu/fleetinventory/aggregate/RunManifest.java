package org.tanzu.fleetinventory.aggregate;

import org.tanzu.fleetinventory.collector.CollectorStats;
import org.tanzu.fleetinventory.model.InventoryWarning;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one inventory run: counts of every non-fatal condition, so that "no data because
 * unreachable" can be told apart from "confirmed absent".
 */
public class RunManifest {

    private final String runId;
    private final Instant startedAt;
    private final Instant completedAt;
    private final int totalRecords;
    private final Map<String, Integer> perSourceOrphanCounts;
    private final int timedOutCount;
    private final int failedCount;
    private final List<String> unavailableSources;
    private final List<InventoryWarning> warnings;
    private final String orphanPolicy;
    private final Map<String, CollectorStats> collectorStats;

    public RunManifest(String runId, Instant startedAt, Instant completedAt, int totalRecords,
                       Map<String, Integer> perSourceOrphanCounts, int timedOutCount, int failedCount,
                       List<String> unavailableSources, List<InventoryWarning> warnings, String orphanPolicy,
                       Map<String, CollectorStats> collectorStats) {
        this.runId = runId;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.totalRecords = totalRecords;
        this.perSourceOrphanCounts = Collections.unmodifiableMap(new LinkedHashMap<>(perSourceOrphanCounts));
        this.timedOutCount = timedOutCount;
        this.failedCount = failedCount;
        this.unavailableSources = List.copyOf(unavailableSources);
        this.warnings = List.copyOf(warnings);
        this.orphanPolicy = orphanPolicy;
        this.collectorStats = Collections.unmodifiableMap(new LinkedHashMap<>(collectorStats));
    }

    public String getRunId() { return runId; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public int getTotalRecords() { return totalRecords; }
    public Map<String, Integer> getPerSourceOrphanCounts() { return perSourceOrphanCounts; }
    public int getTimedOutCount() { return timedOutCount; }
    public int getFailedCount() { return failedCount; }
    public List<String> getUnavailableSources() { return unavailableSources; }
    public List<InventoryWarning> getWarnings() { return warnings; }
    public String getOrphanPolicy() { return orphanPolicy; }
    public Map<String, CollectorStats> getCollectorStats() { return collectorStats; }

    public int getTotalOrphans() {
        return perSourceOrphanCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Counts warnings of one type.
     *
     * @param type The warning type
     * @return Number of warnings of that type
     */
    public long countWarnings(InventoryWarning.Type type) {
        return warnings.stream().filter(w -> w.getType() == type).count();
    }

    @Override
    public String toString() {
        return "RunManifest{runId='" + runId + "', totalRecords=" + totalRecords +
                ", orphans=" + perSourceOrphanCounts + ", timedOut=" + timedOutCount + ", failed=" + failedCount +
                ", unavailable=" + unavailableSources + ", warnings=" + warnings.size() + '}';
    }
}

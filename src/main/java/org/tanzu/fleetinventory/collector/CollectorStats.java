package org.tanzu.fleetinventory.collector;

/**
 * Point-in-time counters of a {@link BoundedCollector}.
 *
 * Once the collector has drained, {@code completed + timedOut + failed == submitted}.
 * Rejected duplicates are not part of {@code submitted}.
 */
public class CollectorStats {
    private final int submitted;
    private final int completed;
    private final int timedOut;
    private final int failed;
    private final int peakConcurrency;
    private final int duplicatesRejected;

    public CollectorStats(int submitted, int completed, int timedOut, int failed,
                          int peakConcurrency, int duplicatesRejected) {
        this.submitted = submitted;
        this.completed = completed;
        this.timedOut = timedOut;
        this.failed = failed;
        this.peakConcurrency = peakConcurrency;
        this.duplicatesRejected = duplicatesRejected;
    }

    /** Tasks accepted by {@link BoundedCollector#submit} */
    public int getSubmitted() { return submitted; }
    public int getCompleted() { return completed; }
    public int getTimedOut() { return timedOut; }
    public int getFailed() { return failed; }
    /** Highest number of tasks that were running at the same time; never above the collector's limit */
    public int getPeakConcurrency() { return peakConcurrency; }
    /** Submissions rejected because the identity had already been submitted */
    public int getDuplicatesRejected() { return duplicatesRejected; }

    @Override
    public String toString() {
        return "CollectorStats{submitted=" + submitted +
                ", completed=" + completed +
                ", timedOut=" + timedOut +
                ", failed=" + failed +
                ", peakConcurrency=" + peakConcurrency +
                ", duplicatesRejected=" + duplicatesRejected + '}';
    }
}

package org.tanzu.fleetinventory.reconcile;

import org.tanzu.fleetinventory.model.PartialRecord;
import org.tanzu.fleetinventory.model.SourceKind;

import java.util.List;
import java.util.Objects;

/**
 * Immutable set of records one source produced during a run, in the order the source listed them.
 *
 * The list may contain the same identity more than once; the reconciler keeps the first.
 * {@code orphanCapable} sources may introduce devices the primary source does not know;
 * the others only enrich devices that are already known.
 */
public final class SourceSnapshot {

    private final String name;
    private final SourceKind kind;
    private final boolean orphanCapable;
    private final List<PartialRecord> records;

    private SourceSnapshot(String name, SourceKind kind, boolean orphanCapable, List<PartialRecord> records) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.orphanCapable = orphanCapable;
        this.records = List.copyOf(records);
    }

    /**
     * Snapshot of a source that only enriches known devices.
     */
    public static SourceSnapshot of(String name, SourceKind kind, List<PartialRecord> records) {
        return new SourceSnapshot(name, kind, false, records);
    }

    /**
     * Snapshot of a source whose unknown devices are orphan candidates.
     */
    public static SourceSnapshot orphanCapable(String name, SourceKind kind, List<PartialRecord> records) {
        return new SourceSnapshot(name, kind, true, records);
    }

    public String getName() { return name; }
    /** Kind of the source; its rank decides merge precedence */
    public SourceKind getKind() { return kind; }
    public boolean isOrphanCapable() { return orphanCapable; }
    public List<PartialRecord> getRecords() { return records; }

    @Override
    public String toString() {
        return "SourceSnapshot{" + name + ", " + kind + (orphanCapable ? ", orphan-capable" : "") +
                ", records=" + records.size() + '}';
    }
}

package org.tanzu.fleetinventory.aggregate;

/**
 * Consumer of a finished run, such as a report renderer. Receives the snapshot read-only.
 */
public interface OutputSink {

    void accept(ResultAggregate aggregate);
}

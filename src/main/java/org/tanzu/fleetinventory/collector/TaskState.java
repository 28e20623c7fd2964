package org.tanzu.fleetinventory.collector;

/**
 * Lifecycle of a task submitted to a {@link BoundedCollector}.
 *
 * PENDING → RUNNING → one of the terminal states. Terminal states are only reachable from RUNNING.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    COMPLETED,
    TIMED_OUT,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED;
    }
}

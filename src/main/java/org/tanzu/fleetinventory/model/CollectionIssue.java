package org.tanzu.fleetinventory.model;

import java.util.Objects;

/**
 * Marks a per-device fetch that did not complete, so missing fields can be told apart from
 * data that is confirmed absent.
 */
public final class CollectionIssue {

    public enum Kind {
        /** No answer before the per-task deadline */
        TIMED_OUT,
        /** The call failed for this device */
        UNREACHABLE,
        /** The source answered but has no entry for the device */
        NOT_FOUND
    }

    private final String sourceName;
    private final Kind kind;
    private final String message;

    /**
     * @param sourceName Source whose fetch did not complete
     * @param kind What went wrong
     * @param message Detail for operators, may be null
     */
    public CollectionIssue(String sourceName, Kind kind, String message) {
        this.sourceName = sourceName;
        this.kind = kind;
        this.message = message;
    }

    public String getSourceName() { return sourceName; }
    public Kind getKind() { return kind; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollectionIssue)) return false;
        CollectionIssue that = (CollectionIssue) o;
        return Objects.equals(sourceName, that.sourceName) && kind == that.kind && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, kind, message);
    }

    @Override
    public String toString() {
        return sourceName + ":" + kind + (message == null ? "" : "(" + message + ")");
    }
}

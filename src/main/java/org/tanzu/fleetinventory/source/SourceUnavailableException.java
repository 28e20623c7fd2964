package org.tanzu.fleetinventory.source;

/**
 * Thrown when a whole inventory source cannot be reached.
 *
 * For secondary sources this is a warning and the run continues without them. For the primary
 * source it aborts the run.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}

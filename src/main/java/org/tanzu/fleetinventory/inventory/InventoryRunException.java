package org.tanzu.fleetinventory.inventory;

/**
 * Aborts an inventory run. Raised only when the primary source cannot be listed; every
 * other failure is recorded as a warning and the run continues.
 */
public class InventoryRunException extends RuntimeException {

    public InventoryRunException(String message) {
        super(message);
    }

    public InventoryRunException(String message, Throwable cause) {
        super(message, cause);
    }
}

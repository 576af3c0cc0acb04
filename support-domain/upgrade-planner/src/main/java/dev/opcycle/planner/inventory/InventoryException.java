package dev.opcycle.planner.inventory;

/**
 * Raised when inventory data cannot be obtained or is unusable.
 */
public class InventoryException extends RuntimeException {

    public InventoryException(String message) {
        super(message);
    }

    public InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}

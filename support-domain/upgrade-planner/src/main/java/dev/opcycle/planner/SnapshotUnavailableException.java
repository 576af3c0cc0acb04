package dev.opcycle.planner;

/**
 * The platform's own version data could not be obtained, so no snapshot can be built.
 */
public class SnapshotUnavailableException extends RuntimeException {

    public SnapshotUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

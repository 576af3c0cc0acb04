package dev.opcycle.planner.lifecycle;

/**
 * Raised by a {@link LifecycleMetadataProvider} that cannot answer a lookup.
 */
public class LifecycleLookupException extends RuntimeException {

    public LifecycleLookupException(String message) {
        super(message);
    }

    public LifecycleLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}

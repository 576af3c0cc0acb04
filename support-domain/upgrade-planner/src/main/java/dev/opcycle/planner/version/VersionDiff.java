package dev.opcycle.planner.version;

/**
 * Magnitude of the highest version component that changed.
 */
public enum VersionDiff {
    NONE,
    PATCH,
    MINOR,
    MAJOR;

    public boolean atLeastMinor() {
        return this == MINOR || this == MAJOR;
    }
}

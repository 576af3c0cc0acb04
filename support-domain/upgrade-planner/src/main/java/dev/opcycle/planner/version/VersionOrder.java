package dev.opcycle.planner.version;

/**
 * Outcome of comparing two version strings. {@link #INCOMPARABLE} means at least one side could not be parsed.
 */
public enum VersionOrder {
    LESS,
    EQUAL,
    GREATER,
    INCOMPARABLE
}

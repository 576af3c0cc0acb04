package dev.opcycle.planner.version;

/**
 * Numeric {@code major.minor.patch} triple extracted from a version string.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    @Override
    public int compareTo(SemanticVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}

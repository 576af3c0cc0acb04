package dev.opcycle.planner.version;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Version comparison tolerant of vendor identifiers such as {@code openshift-gitops-operator.v1.10.0}.
 * <p>
 * The first dotted numeric triple in the string is the version; strings without one are opaque and
 * never compare with anything.
 */
public final class Versions {

    private static final Pattern TRIPLE = Pattern.compile("v?(\\d+\\.\\d+\\.\\d+)");

    private Versions() {
    }

    /**
     * Returns the embedded {@code N.N.N} token, or the input unchanged when there is none.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        var matcher = TRIPLE.matcher(raw);
        return matcher.find() ? matcher.group(1) : raw;
    }

    public static Optional<SemanticVersion> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        var matcher = TRIPLE.matcher(raw);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String[] parts = matcher.group(1).split("\\.");
        try {
            return Optional.of(new SemanticVersion(
                    Integer.parseInt(parts[0]),
                    Integer.parseInt(parts[1]),
                    Integer.parseInt(parts[2])));
        } catch (NumberFormatException e) {
            // numeric part too large for an int
            return Optional.empty();
        }
    }

    public static boolean isValid(String raw) {
        return parse(raw).isPresent();
    }

    public static VersionOrder compare(String a, String b) {
        var left = parse(a);
        var right = parse(b);
        if (left.isEmpty() || right.isEmpty()) {
            return VersionOrder.INCOMPARABLE;
        }
        int result = left.get().compareTo(right.get());
        if (result < 0) {
            return VersionOrder.LESS;
        }
        return result == 0 ? VersionOrder.EQUAL : VersionOrder.GREATER;
    }

    public static boolean isGreater(String a, String b) {
        return compare(a, b) == VersionOrder.GREATER;
    }

    public static boolean isLess(String a, String b) {
        return compare(a, b) == VersionOrder.LESS;
    }

    /**
     * Classifies the jump between two versions. Unparsable input yields {@link VersionDiff#NONE}.
     */
    public static VersionDiff diff(String a, String b) {
        var left = parse(a);
        var right = parse(b);
        if (left.isEmpty() || right.isEmpty()) {
            return VersionDiff.NONE;
        }
        var from = left.get();
        var to = right.get();
        if (from.major() != to.major()) {
            return VersionDiff.MAJOR;
        }
        if (from.minor() != to.minor()) {
            return VersionDiff.MINOR;
        }
        if (from.patch() != to.patch()) {
            return VersionDiff.PATCH;
        }
        return VersionDiff.NONE;
    }
}

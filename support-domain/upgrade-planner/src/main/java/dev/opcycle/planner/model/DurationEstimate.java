package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Pattern;

/**
 * Estimated duration of a step in minutes, either fixed ({@code 15 minutes}) or a range ({@code 10-20 minutes}).
 */
public record DurationEstimate(int minMinutes, int maxMinutes) {

    private static final Pattern FORMAT = Pattern.compile("(\\d+)(?:-(\\d+))?\\s*minutes?");

    public DurationEstimate {
        if (minMinutes < 0 || maxMinutes < minMinutes) {
            throw new IllegalArgumentException("Invalid duration range " + minMinutes + "-" + maxMinutes);
        }
    }

    public static DurationEstimate minutes(int minutes) {
        return new DurationEstimate(minutes, minutes);
    }

    public static DurationEstimate range(int minMinutes, int maxMinutes) {
        return new DurationEstimate(minMinutes, maxMinutes);
    }

    /**
     * Parses the text form; anything unrecognised counts as zero minutes.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DurationEstimate parse(String text) {
        if (text == null) {
            return minutes(0);
        }
        var matcher = FORMAT.matcher(text.trim());
        if (!matcher.find()) {
            return minutes(0);
        }
        try {
            int low = Integer.parseInt(matcher.group(1));
            int high = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : low;
            return new DurationEstimate(Math.min(low, high), Math.max(low, high));
        } catch (NumberFormatException e) {
            return minutes(0);
        }
    }

    public int upperBound() {
        return maxMinutes;
    }

    @JsonValue
    public String text() {
        return minMinutes == maxMinutes
                ? maxMinutes + " minutes"
                : minMinutes + "-" + maxMinutes + " minutes";
    }

    @Override
    public String toString() {
        return text();
    }
}

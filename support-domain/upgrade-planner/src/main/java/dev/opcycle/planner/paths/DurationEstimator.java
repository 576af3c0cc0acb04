package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.UpgradeStep;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

/**
 * Adds up the pessimistic end of every step estimate.
 */
@ApplicationScoped
public class DurationEstimator {

    public int totalMinutes(List<UpgradeStep> steps) {
        return steps.stream()
                .filter(step -> step.estimatedDuration() != null)
                .mapToInt(step -> step.estimatedDuration().upperBound())
                .sum();
    }

    /**
     * {@code "45 minutes"} below an hour, {@code "2h 5m"} from there on.
     */
    public String calculateTotalDuration(List<UpgradeStep> steps) {
        return format(totalMinutes(steps));
    }

    static String format(int totalMinutes) {
        if (totalMinutes < 60) {
            return totalMinutes + " minutes";
        }
        return (totalMinutes / 60) + "h " + (totalMinutes % 60) + "m";
    }
}

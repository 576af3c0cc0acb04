package dev.opcycle.planner.model;

import java.time.Instant;
import java.util.List;

/**
 * Ordered upgrade steps produced by one strategy, with total duration and expected support horizon.
 */
public record UpgradePath(
        String id,
        String description,
        String estimatedDuration,
        Confidence confidence,
        List<UpgradeStep> steps,
        List<String> benefits,
        List<String> risks,
        Instant supportedUntil) {

    /**
     * Targets of every step that changes something, in step order.
     */
    public List<String> affectedComponents() {
        return steps.stream()
                .filter(step -> step.kind() != StepKind.VERIFICATION)
                .map(UpgradeStep::target)
                .toList();
    }
}

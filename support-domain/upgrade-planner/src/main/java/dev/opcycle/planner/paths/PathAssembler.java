package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.Confidence;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradePath;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

/**
 * Turns a step sequence into an {@link UpgradePath} with its duration and support estimates.
 */
@ApplicationScoped
public class PathAssembler {

    private final DurationEstimator durationEstimator;
    private final SupportHorizonPolicy supportHorizon;

    @Inject
    public PathAssembler(DurationEstimator durationEstimator, SupportHorizonPolicy supportHorizon) {
        this.durationEstimator = durationEstimator;
        this.supportHorizon = supportHorizon;
    }

    /**
     * Empty when the sequence holds nothing but the verification step.
     */
    public Optional<UpgradePath> assemble(
            String id,
            String description,
            Confidence confidence,
            PlatformSnapshot snapshot,
            StepSequence sequence,
            List<String> benefits,
            List<String> risks) {
        if (!sequence.hasChanges()) {
            return Optional.empty();
        }
        var steps = sequence.steps();
        return Optional.of(new UpgradePath(
                id,
                description,
                durationEstimator.calculateTotalDuration(steps),
                confidence,
                steps,
                List.copyOf(benefits),
                List.copyOf(risks),
                supportHorizon.estimateSupportedUntil(snapshot, steps)));
    }
}

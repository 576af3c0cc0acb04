package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.AvailableUpgrade;
import dev.opcycle.planner.model.ComponentStatus;
import dev.opcycle.planner.model.DurationEstimate;
import dev.opcycle.planner.model.PlatformVersion;
import dev.opcycle.planner.model.StepKind;
import dev.opcycle.planner.model.UpgradeStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered steps of a path under construction. Orders are assigned on append, starting at 1 with the
 * verification step.
 */
public final class StepSequence {

    static final String VERIFICATION_TARGET = "cluster";
    static final String PLATFORM_TARGET = "OpenShift Cluster";
    static final String RESTORE_FROM_BACKUP = "Restore from backup";

    static final DurationEstimate VERIFICATION_DURATION = DurationEstimate.minutes(15);
    static final DurationEstimate COMPONENT_DURATION = DurationEstimate.range(10, 20);
    static final DurationEstimate PLATFORM_DURATION = DurationEstimate.range(45, 90);

    private final List<UpgradeStep> steps = new ArrayList<>();

    private StepSequence() {
    }

    public static StepSequence verifiedBy(String description, List<String> prerequisites) {
        var sequence = new StepSequence();
        sequence.steps.add(new UpgradeStep(1, StepKind.VERIFICATION, VERIFICATION_TARGET, null, null, null,
                description, VERIFICATION_DURATION, List.copyOf(prerequisites), RESTORE_FROM_BACKUP));
        return sequence;
    }

    public StepSequence component(
            ComponentStatus component,
            AvailableUpgrade upgrade,
            String description,
            List<String> prerequisites,
            String rollbackStrategy) {
        var installation = component.installation();
        steps.add(new UpgradeStep(nextOrder(), StepKind.COMPONENT, installation.name(),
                installation.currentVersion(), upgrade.targetVersion(), upgrade.channel(),
                description, COMPONENT_DURATION, List.copyOf(prerequisites), rollbackStrategy));
        return this;
    }

    public StepSequence platform(
            PlatformVersion platform,
            String targetVersion,
            String description,
            List<String> prerequisites,
            String rollbackStrategy) {
        steps.add(new UpgradeStep(nextOrder(), StepKind.PLATFORM, PLATFORM_TARGET,
                platform.currentVersion(), targetVersion, platform.channel(),
                description, PLATFORM_DURATION, List.copyOf(prerequisites), rollbackStrategy));
        return this;
    }

    /**
     * Whether anything beyond the verification step was added.
     */
    public boolean hasChanges() {
        return steps.size() > 1;
    }

    public List<UpgradeStep> steps() {
        return List.copyOf(steps);
    }

    private int nextOrder() {
        return steps.size() + 1;
    }
}

package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.ComponentStatus;
import dev.opcycle.planner.model.Confidence;
import dev.opcycle.planner.model.IssueSeverity;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradePath;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

/**
 * Fixes every component with a critical issue, then moves the platform to its next update.
 * <p>
 * Each component gets its first listed upgrade, in inventory order. This is a positional choice
 * (earliest known fix), not a ranking by version.
 */
@ApplicationScoped
public class CriticalIssuesStrategy implements PathStrategy {

    public static final String ID = "critical-issues-path";

    private final PathAssembler assembler;

    @Inject
    public CriticalIssuesStrategy(PathAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<UpgradePath> generate(PlatformSnapshot snapshot) {
        List<ComponentStatus> critical = snapshot.components().stream()
                .filter(component -> component.hasIssue(IssueSeverity.CRITICAL))
                .toList();
        if (critical.isEmpty()) {
            return Optional.empty();
        }

        var sequence = StepSequence.verifiedBy(
                "Verify cluster health and backup current state",
                List.of("Cluster backup", "etcd snapshot"));

        for (ComponentStatus component : critical) {
            if (!component.hasUpgrades()) {
                continue;
            }
            sequence.component(component, component.availableUpgrades().get(0),
                    "Upgrade " + component.installation().displayName() + " to resolve critical issues",
                    List.of("Review operator documentation", "Check for breaking changes"),
                    "Uninstall and reinstall previous version");
        }

        var platform = snapshot.platform();
        platform.nextUpdate().ifPresent(next -> sequence.platform(platform, next,
                "Upgrade OpenShift to " + next,
                List.of("All operators compatible", "Cluster health verified", "Backup completed"),
                "Not supported - ensure all prerequisites are met"));

        return assembler.assemble(ID,
                "Address critical issues that block cluster operations and upgrades",
                Confidence.HIGH,
                snapshot,
                sequence,
                List.of("Resolves blocking issues", "Enables cluster upgrade", "Reduces immediate risks"),
                List.of("May require multiple operator updates", "Some downtime expected"));
    }
}

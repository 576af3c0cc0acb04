package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.AvailableUpgrade;
import dev.opcycle.planner.model.ComponentStatus;
import dev.opcycle.planner.model.Confidence;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradePath;
import dev.opcycle.planner.version.Versions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

/**
 * Everything to the newest known version, platform included.
 */
@ApplicationScoped
public class AggressiveStrategy implements PathStrategy {

    public static final String ID = "aggressive-path";

    private final PathAssembler assembler;

    @Inject
    public AggressiveStrategy(PathAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<UpgradePath> generate(PlatformSnapshot snapshot) {
        var sequence = StepSequence.verifiedBy("Verify cluster health and backup", List.of("Cluster backup"));

        for (ComponentStatus component : snapshot.components()) {
            latestUpgrade(component).ifPresent(latest -> sequence.component(component, latest,
                    "Upgrade " + component.installation().displayName() + " to latest version",
                    List.of("Review all release notes", "Check for breaking changes"),
                    "Reinstall previous version"));
        }

        var platform = snapshot.platform();
        platform.latestUpdate().ifPresent(latest -> sequence.platform(platform, latest,
                "Upgrade OpenShift to latest version " + latest,
                List.of("All operators compatible", "Cluster health verified", "Backup completed"),
                "Not supported - ensure all prerequisites are met"));

        return assembler.assemble(ID,
                "Upgrade all components to latest versions for maximum support duration",
                Confidence.MEDIUM,
                snapshot,
                sequence,
                List.of("Maximum support duration", "Latest features and fixes", "Fewest future maintenance windows"),
                List.of("More potential for breaking changes", "Longer maintenance window", "More testing required"));
    }

    /**
     * Highest target version; on ties the first listed candidate wins.
     */
    static Optional<AvailableUpgrade> latestUpgrade(ComponentStatus component) {
        return component.availableUpgrades().stream()
                .reduce((latest, candidate) ->
                        Versions.isGreater(candidate.targetVersion(), latest.targetVersion()) ? candidate : latest);
    }
}

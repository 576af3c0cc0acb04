package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.AvailableUpgrade;
import dev.opcycle.planner.model.ComponentStatus;
import dev.opcycle.planner.model.Confidence;
import dev.opcycle.planner.model.IssueSeverity;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradePath;
import dev.opcycle.planner.version.VersionDiff;
import dev.opcycle.planner.version.Versions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Smallest possible upgrade for every component with a warning. The platform is left alone.
 */
@ApplicationScoped
public class ConservativeStrategy implements PathStrategy {

    public static final String ID = "conservative-path";

    private static final Comparator<AvailableUpgrade> BY_TARGET =
            Comparator.comparing(upgrade -> Versions.parse(upgrade.targetVersion()).orElseThrow());

    private final PathAssembler assembler;

    @Inject
    public ConservativeStrategy(PathAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<UpgradePath> generate(PlatformSnapshot snapshot) {
        List<ComponentStatus> withWarnings = snapshot.components().stream()
                .filter(component -> component.hasIssue(IssueSeverity.WARNING))
                .toList();
        if (withWarnings.isEmpty()) {
            return Optional.empty();
        }

        var sequence = StepSequence.verifiedBy("Verify cluster health and backup", List.of("Cluster backup"));
        for (ComponentStatus component : withWarnings) {
            findConservativeUpgrade(component).ifPresent(upgrade -> sequence.component(component, upgrade,
                    "Conservative upgrade of " + component.installation().displayName(),
                    List.of("Review release notes"),
                    "Reinstall previous version"));
        }

        return assembler.assemble(ID,
                "Minimal upgrades to extend support without major version changes",
                Confidence.HIGH,
                snapshot,
                sequence,
                List.of("Minimal risk", "Extends support period", "Small scope of changes"),
                List.of("May need another upgrade soon", "Not addressing all available updates"));
    }

    /**
     * Lowest patch-level upgrade if there is one, otherwise the lowest minor-level upgrade. Major jumps and
     * upgrades whose magnitude cannot be computed are never chosen.
     */
    Optional<AvailableUpgrade> findConservativeUpgrade(ComponentStatus component) {
        var current = component.installation().currentVersion();
        var patch = smallestWithDiff(component, current, VersionDiff.PATCH);
        return patch.isPresent() ? patch : smallestWithDiff(component, current, VersionDiff.MINOR);
    }

    private Optional<AvailableUpgrade> smallestWithDiff(ComponentStatus component, String current, VersionDiff diff) {
        return component.availableUpgrades().stream()
                .filter(upgrade -> Versions.diff(current, upgrade.targetVersion()) == diff)
                .min(BY_TARGET);
    }
}

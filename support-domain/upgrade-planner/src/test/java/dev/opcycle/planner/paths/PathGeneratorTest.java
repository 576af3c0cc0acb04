package dev.opcycle.planner.paths;

import static dev.opcycle.planner.Fixtures.component;
import static dev.opcycle.planner.Fixtures.issue;
import static dev.opcycle.planner.Fixtures.platform;
import static dev.opcycle.planner.Fixtures.snapshot;
import static dev.opcycle.planner.Fixtures.upgrade;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.opcycle.planner.Fixtures;
import dev.opcycle.planner.model.IssueKind;
import dev.opcycle.planner.model.IssueSeverity;
import dev.opcycle.planner.model.StepKind;
import dev.opcycle.planner.model.UpgradePath;
import dev.opcycle.planner.model.UpgradeStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

class PathGeneratorTest {

    private final PathAssembler assembler = Fixtures.assembler();
    private final PathGenerator generator = new PathGenerator(
            new CriticalIssuesStrategy(assembler),
            new ConservativeStrategy(assembler),
            new AggressiveStrategy(assembler),
            new BalancedStrategy(assembler));

    @Test
    void patchUpgradeWithoutIssuesOnlyYieldsAggressivePath() {
        var x = component("x", "1.2.0", List.of(upgrade("x", "1.2.0", "1.2.5", "stable")));

        var paths = generator.generate(snapshot(platform("4.15.0"), x));

        assertEquals(List.of(AggressiveStrategy.ID), ids(paths));
        var step = paths.get(0).steps().get(1);
        assertEquals("1.2.0", step.fromVersion());
        assertEquals("1.2.5", step.toVersion());
    }

    @Test
    void criticalPathTargetsFirstPlatformUpdate() {
        var y = component("y", "1.4.0", List.of(upgrade("y", "1.4.0", "2.0.0", "stable")),
                issue("y", IssueSeverity.CRITICAL, IssueKind.VERSION_CEILING));

        var paths = generator.generate(snapshot(platform("4.16.0", "4.16.1", "4.16.5"), y));

        assertEquals(List.of(CriticalIssuesStrategy.ID, AggressiveStrategy.ID, BalancedStrategy.ID), ids(paths));
        var critical = paths.get(0);
        assertEquals(List.of("cluster", "y", "OpenShift Cluster"),
                critical.steps().stream().map(UpgradeStep::target).toList());
        assertEquals("2.0.0", critical.steps().get(1).toVersion());
        assertEquals("4.16.1", critical.steps().get(2).toVersion());
        assertEquals("4.16.5", platformStep(paths.get(1)).toVersion());
        assertEquals("4.16.1", platformStep(paths.get(2)).toVersion());
    }

    @Test
    void issueWithoutRemediationNeverBecomesAStep() {
        var z = component("z", "1.0.0", List.of(), issue("z", IssueSeverity.WARNING, IssueKind.STALE_CHANNEL));

        var paths = generator.generate(snapshot(platform("4.15.0"), z));

        assertTrue(paths.isEmpty());
    }

    @Test
    void everyPathStartsWithVerificationAndHasContiguousOrders() {
        var snapshot = mixedSnapshot();

        for (UpgradePath path : generator.generate(snapshot)) {
            assertEquals(StepKind.VERIFICATION, path.steps().get(0).kind(), path.id());
            assertTrue(path.steps().size() > 1, path.id());
            assertEquals(IntStream.rangeClosed(1, path.steps().size()).boxed().toList(),
                    path.steps().stream().map(UpgradeStep::order).toList(), path.id());
        }
    }

    @Test
    void generationIsIdempotent() {
        var snapshot = mixedSnapshot();

        assertEquals(generator.generate(snapshot), generator.generate(snapshot));
    }

    @Test
    void criticalComponentsWithUpgradesAreAlwaysInCriticalPath() {
        var snapshot = mixedSnapshot();
        var critical = generator.generate(snapshot).stream()
                .filter(path -> path.id().equals(CriticalIssuesStrategy.ID))
                .findFirst()
                .orElseThrow();

        snapshot.components().stream()
                .filter(component -> component.hasIssue(IssueSeverity.CRITICAL) && component.hasUpgrades())
                .forEach(component -> assertTrue(
                        critical.affectedComponents().contains(component.installation().name())));
    }

    private static dev.opcycle.planner.model.PlatformSnapshot mixedSnapshot() {
        return snapshot(platform("4.15.0", "4.15.3", "4.16.0"),
                component("a", "1.0.0", List.of(upgrade("a", "1.0.0", "1.0.4", "stable"),
                                upgrade("a", "1.0.0", "2.0.0", "fast")),
                        issue("a", IssueSeverity.CRITICAL, IssueKind.LIFECYCLE_EXPIRING)),
                component("b", "2.1.0", List.of(upgrade("b", "2.1.0", "2.3.0", "stable")),
                        issue("b", IssueSeverity.WARNING, IssueKind.STALE_CHANNEL)),
                component("c", "3.0.0", List.of()),
                component("d", "0.9.0", List.of(),
                        issue("d", IssueSeverity.CRITICAL, IssueKind.VERSION_CEILING)));
    }

    private static UpgradeStep platformStep(UpgradePath path) {
        return path.steps().stream().filter(step -> step.kind() == StepKind.PLATFORM).findFirst().orElseThrow();
    }

    private static List<String> ids(List<UpgradePath> paths) {
        return paths.stream().map(UpgradePath::id).toList();
    }
}

package dev.opcycle.planner.paths;

import static dev.opcycle.planner.Fixtures.component;
import static dev.opcycle.planner.Fixtures.platform;
import static dev.opcycle.planner.Fixtures.snapshot;
import static dev.opcycle.planner.Fixtures.upgrade;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.opcycle.planner.Fixtures;
import dev.opcycle.planner.model.Confidence;
import dev.opcycle.planner.model.StepKind;
import org.junit.jupiter.api.Test;

import java.util.List;

class AggressiveStrategyTest {

    private final AggressiveStrategy strategy = new AggressiveStrategy(Fixtures.assembler());

    @Test
    void upgradesComponentWithoutIssuesToItsOnlyCandidate() {
        var x = component("x", "1.2.0", List.of(upgrade("x", "1.2.0", "1.2.5", "stable")));

        var path = strategy.generate(snapshot(platform("4.15.0"), x)).orElseThrow();

        assertEquals(Confidence.MEDIUM, path.confidence());
        assertEquals(2, path.steps().size());
        assertEquals("1.2.0", path.steps().get(1).fromVersion());
        assertEquals("1.2.5", path.steps().get(1).toVersion());
    }

    @Test
    void picksHighestTargetAndLatestPlatformUpdate() {
        var db = component("db", "operator.v1.0.0", List.of(
                upgrade("db", "operator.v1.0.0", "operator.v1.9.0", "fast"),
                upgrade("db", "operator.v1.0.0", "operator.v1.10.0", "stable"),
                upgrade("db", "operator.v1.0.0", "operator.v1.2.0", "candidate")));

        var path = strategy.generate(snapshot(platform("4.15.0", "4.15.3", "4.16.1", "4.16.4"), db)).orElseThrow();

        assertEquals("operator.v1.10.0", path.steps().get(1).toVersion());
        var platformStep = path.steps().get(path.steps().size() - 1);
        assertEquals(StepKind.PLATFORM, platformStep.kind());
        assertEquals("4.16.4", platformStep.toVersion());
    }

    @Test
    void platformOnlyPathWhenComponentsAreCurrent() {
        var current = component("current", "1.0.0", List.of());

        var path = strategy.generate(snapshot(platform("4.15.0", "4.15.3"), current)).orElseThrow();

        assertEquals(List.of("OpenShift Cluster"), path.affectedComponents());
    }

    @Test
    void absentWhenNothingIsUpgradable() {
        assertTrue(strategy.generate(snapshot(platform("4.15.0"), component("c", "1.0.0", List.of()))).isEmpty());
    }
}

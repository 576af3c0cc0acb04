package dev.opcycle.planner.lifecycle;

import dev.opcycle.planner.model.LifecycleInfo;
import dev.opcycle.planner.model.LifecycleModel;

import java.util.List;

/**
 * Lifecycle model guessed from well-known operator names when no metadata is published.
 */
final class LifecycleDefaults {

    // Operators shipped with OpenShift Platform Plus follow the platform release cadence.
    private static final List<String> PLATFORM_ALIGNED = List.of(
            "advanced-cluster-management",
            "multicluster-engine",
            "odf-operator",
            "quay-operator",
            "acs-operator");

    private static final List<String> ROLLING_RELEASE = List.of(
            "compliance-operator",
            "cost-management-metrics-operator");

    private LifecycleDefaults() {
    }

    static LifecycleModel modelFor(String componentName) {
        if (PLATFORM_ALIGNED.stream().anyMatch(componentName::contains)) {
            return LifecycleModel.PLATFORM_ALIGNED;
        }
        if (ROLLING_RELEASE.stream().anyMatch(componentName::contains)) {
            return LifecycleModel.ROLLING_RELEASE;
        }
        return LifecycleModel.PLATFORM_AGNOSTIC;
    }

    static LifecycleInfo forComponent(String componentName, String version) {
        return LifecycleInfo.defaults(componentName, version).withModel(modelFor(componentName));
    }
}

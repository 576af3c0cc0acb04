package dev.opcycle.planner.model;

import java.time.Instant;

/**
 * Support lifecycle facts for one component version. Dates and platform bounds are optional.
 */
public record LifecycleInfo(
        String componentName,
        String version,
        LifecycleModel lifecycleModel,
        SupportPhase supportPhase,
        Instant fullSupportEndsAt,
        Instant maintenanceSupportEndsAt,
        Instant endOfLifeAt,
        String minPlatformVersion,
        String maxPlatformVersion,
        String recommendedForPlatformVersion) {

    /**
     * Conservative fallback used when nothing is known about a version: full support, no dates, no bounds.
     */
    public static LifecycleInfo defaults(String componentName, String version) {
        return new LifecycleInfo(componentName, version, LifecycleModel.UNKNOWN, SupportPhase.FULL_SUPPORT,
                null, null, null, null, null, null);
    }

    public LifecycleInfo withModel(LifecycleModel model) {
        return new LifecycleInfo(componentName, version, model, supportPhase, fullSupportEndsAt,
                maintenanceSupportEndsAt, endOfLifeAt, minPlatformVersion, maxPlatformVersion,
                recommendedForPlatformVersion);
    }
}

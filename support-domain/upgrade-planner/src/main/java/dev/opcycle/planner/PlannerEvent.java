package dev.opcycle.planner;

import java.time.Instant;

/**
 * Event emitted whenever the planner reloads its sources, builds a snapshot or has to degrade.
 */
public record PlannerEvent(String type, Instant at, int componentCount, String detail) {

    public static PlannerEvent inventoryReloaded(int subscriptionCount) {
        var detail = "Inventory reloaded with " + subscriptionCount + " subscriptions";
        return new PlannerEvent("INVENTORY_RELOADED", Instant.now(), subscriptionCount, detail);
    }

    public static PlannerEvent snapshotAssembled(int componentCount, int omittedCount) {
        var detail = "Snapshot built for " + componentCount + " components, " + omittedCount + " omitted";
        return new PlannerEvent("SNAPSHOT_ASSEMBLED", Instant.now(), componentCount, detail);
    }

    public static PlannerEvent componentOmitted(String component, String reason) {
        return new PlannerEvent("COMPONENT_OMITTED", Instant.now(), 1, component + ": " + reason);
    }

    public static PlannerEvent warning(String message) {
        return new PlannerEvent("WARNING", Instant.now(), 0, message);
    }
}

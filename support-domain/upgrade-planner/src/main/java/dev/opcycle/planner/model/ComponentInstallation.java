package dev.opcycle.planner.model;

import java.time.Instant;

/**
 * A component installed on the platform, as reported by its subscription.
 *
 * @param packageName   catalog package the subscription follows
 * @param autoApproval  whether install plans are approved automatically
 */
public record ComponentInstallation(
        String name,
        String namespace,
        String displayName,
        String packageName,
        String currentVersion,
        String currentChannel,
        String catalogSource,
        String catalogNamespace,
        Instant installedAt,
        Instant updatedAt,
        boolean autoApproval) {

    public String qualifiedName() {
        return namespace + "/" + name;
    }
}

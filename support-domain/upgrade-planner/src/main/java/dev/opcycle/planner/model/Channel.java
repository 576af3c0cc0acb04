package dev.opcycle.planner.model;

import java.util.List;

/**
 * An update track published by a catalog for one component package.
 *
 * @param currentVersion             version currently recommended on the channel
 * @param availablePlatformVersions  platform versions the channel head declares support for, may be {@code null}
 */
public record Channel(
        String name,
        String currentVersion,
        List<String> availableVersions,
        boolean deprecated,
        String deprecationMessage,
        List<String> availablePlatformVersions) {

    public static Channel placeholder(String name, String currentVersion) {
        return new Channel(name, currentVersion, List.of(), false, null, null);
    }
}

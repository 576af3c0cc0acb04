package dev.opcycle.planner.inventory;

import dev.opcycle.planner.model.Channel;
import dev.opcycle.planner.model.ComponentInstallation;
import dev.opcycle.planner.model.PlatformVersion;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the installed-component inventory of a cluster.
 */
public interface InventoryProvider {

    /**
     * Version and update track of the platform, without lifecycle dates.
     *
     * @throws InventoryException when the platform version cannot be determined
     */
    PlatformVersion fetchPlatformVersion();

    List<ComponentInstallation> listInstallations();

    Optional<ComponentInstallation> findInstallation(String namespace, String name);

    /**
     * Channels published for the installation's package. An unknown package has no channels.
     *
     * @throws InventoryException when the package's catalog data is unreadable
     */
    List<Channel> fetchChannels(ComponentInstallation installation);
}

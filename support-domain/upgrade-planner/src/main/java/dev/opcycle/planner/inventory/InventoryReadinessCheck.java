package dev.opcycle.planner.inventory;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready once the inventory yields a platform version, since no recommendation can be made without it.
 */
@Readiness
@ApplicationScoped
public class InventoryReadinessCheck implements HealthCheck {

    static final String NAME = "inventory";

    private final InventoryProvider inventory;

    @Inject
    public InventoryReadinessCheck(InventoryProvider inventory) {
        this.inventory = inventory;
    }

    @Override
    public HealthCheckResponse call() {
        var response = HealthCheckResponse.named(NAME);
        try {
            var platform = inventory.fetchPlatformVersion();
            return response.up()
                    .withData("platformVersion", platform.currentVersion())
                    .withData("components", inventory.listInstallations().size())
                    .build();
        } catch (InventoryException e) {
            return response.down().withData("reason", e.getMessage()).build();
        }
    }
}

package dev.opcycle.planner.api;

import dev.opcycle.planner.UpgradePlannerService;
import dev.opcycle.planner.model.MaintenanceWindow;
import dev.opcycle.planner.model.RecommendationBundle;
import dev.opcycle.planner.model.UpgradePath;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/**
 * REST endpoints for upgrade recommendations.
 */
@Path("/api/v1/upgrade")
@Produces(MediaType.APPLICATION_JSON)
public class UpgradeResource {

    private final UpgradePlannerService planner;

    @Inject
    public UpgradeResource(UpgradePlannerService planner) {
        this.planner = planner;
    }

    @GET
    @Path("/recommendations")
    public RecommendationBundle getRecommendations() {
        return planner.recommend();
    }

    @GET
    @Path("/paths/{pathId}")
    public UpgradePath getPath(@PathParam("pathId") @NotBlank String pathId) {
        return planner.findPath(pathId)
                .orElseThrow(() -> new NotFoundException("Upgrade path not found: " + pathId));
    }

    @GET
    @Path("/maintenance-windows")
    public List<MaintenanceWindow> getMaintenanceWindows() {
        return planner.maintenanceWindows();
    }
}

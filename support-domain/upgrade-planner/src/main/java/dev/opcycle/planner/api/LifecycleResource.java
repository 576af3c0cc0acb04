package dev.opcycle.planner.api;

import dev.opcycle.planner.lifecycle.LifecycleService;
import dev.opcycle.planner.model.LifecycleInfo;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Lifecycle lookup for a single component version.
 */
@Path("/api/v1/lifecycle")
@Produces(MediaType.APPLICATION_JSON)
public class LifecycleResource {

    private final LifecycleService lifecycleService;

    @Inject
    public LifecycleResource(LifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @GET
    @Path("/{name}/{version}")
    public LifecycleInfo getLifecycle(
            @PathParam("name") @NotBlank String name,
            @PathParam("version") @NotBlank String version) {
        return lifecycleService.componentLifecycle(name, version);
    }
}

package dev.opcycle.planner.api;

import dev.opcycle.planner.PlatformStatusService;
import dev.opcycle.planner.model.ComponentStatus;
import dev.opcycle.planner.model.PlatformSnapshot;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * REST endpoints exposing the platform snapshot and individual component status.
 */
@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
public class PlatformStatusResource {

    private final PlatformStatusService service;

    @Inject
    public PlatformStatusResource(PlatformStatusService service) {
        this.service = service;
    }

    @GET
    @Path("/platform/status")
    public PlatformSnapshot getPlatformStatus() {
        return service.getPlatformStatus();
    }

    @GET
    @Path("/components/{namespace}/{name}")
    public ComponentStatus getComponent(
            @PathParam("namespace") @NotBlank String namespace,
            @PathParam("name") @NotBlank String name) {
        return service.componentStatus(namespace, name)
                .orElseThrow(() -> new NotFoundException("Component not found: " + namespace + "/" + name));
    }
}

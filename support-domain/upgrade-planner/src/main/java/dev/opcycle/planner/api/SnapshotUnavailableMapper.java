package dev.opcycle.planner.api;

import dev.opcycle.planner.SnapshotUnavailableException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Without platform data there is nothing to recommend; report it as a temporary outage.
 */
@Provider
public class SnapshotUnavailableMapper implements ExceptionMapper<SnapshotUnavailableException> {

    @Override
    public Response toResponse(SnapshotUnavailableException exception) {
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse("Platform status unavailable", exception.getMessage()))
                .build();
    }
}

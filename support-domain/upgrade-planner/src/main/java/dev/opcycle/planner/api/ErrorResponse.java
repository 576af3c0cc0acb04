package dev.opcycle.planner.api;

/**
 * JSON body returned when a request cannot be served.
 */
public record ErrorResponse(String error, String message) {
}

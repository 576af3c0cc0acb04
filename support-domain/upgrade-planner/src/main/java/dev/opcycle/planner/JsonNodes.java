package dev.opcycle.planner;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading loosely structured JSON exports into typed values.
 */
public final class JsonNodes {

    private JsonNodes() {
    }

    /**
     * Text of {@code node}, or {@code fallback} when the node is missing, null or blank.
     */
    public static String text(JsonNode node, String fallback) {
        if (node == null || node.isNull() || node.isMissingNode() || node.asText().isBlank()) {
            return fallback;
        }
        return node.asText();
    }

    /**
     * Parses an ISO instant or an ISO date (taken as start of day UTC). Missing values give {@code null}.
     *
     * @throws java.time.format.DateTimeParseException when the value is present but malformed
     */
    public static Instant instant(JsonNode node) {
        var value = text(node, null);
        if (value == null) {
            return null;
        }
        if (value.contains("T")) {
            return Instant.parse(value);
        }
        return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> result = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(result::add);
        }
        return result;
    }
}

package io.sokrates.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.sokrates.error.TaskCancelledException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * What a handler sees of the task it runs. Payload accessors throw {@link IllegalArgumentException}
 * for missing or mistyped fields, which the executor treats as a permanent failure.
 */
public record TaskContext(
        String taskId,
        String kind,
        JsonNode payload,
        int attempt,
        BooleanSupplier cancelRequested
) {
    public TaskContext {
        cancelRequested = cancelRequested == null ? () -> false : cancelRequested;
    }

    public String requireText(String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || node.isNull() || !node.isTextual() || node.asText().isBlank()) {
            throw new IllegalArgumentException("payload field '" + field + "' is required and must be a non-empty string");
        }
        return node.asText();
    }

    public String optionalText(String field, String fallback) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException("payload field '" + field + "' must be a string");
        }
        return node.asText().isBlank() ? fallback : node.asText();
    }

    public double optionalDouble(String field, double fallback) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException("payload field '" + field + "' must be a number");
        }
        return node.asDouble();
    }

    public int optionalInt(String field, int fallback) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException("payload field '" + field + "' must be an integer");
        }
        return node.asInt();
    }

    public List<String> optionalTextList(String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("payload field '" + field + "' must be an array of strings");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new IllegalArgumentException("payload field '" + field + "' must be an array of strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    public boolean isCancelRequested() {
        return cancelRequested.getAsBoolean();
    }

    /**
     * Cooperative stop point for long handlers.
     */
    public void throwIfCancelRequested() throws TaskCancelledException {
        if (isCancelRequested()) {
            throw new TaskCancelledException(taskId);
        }
    }
}

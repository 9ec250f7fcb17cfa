package io.sokrates.model;

import com.fasterxml.jackson.databind.JsonNode;

public record NewTask(
        String id,
        String kind,
        JsonNode payload,
        Priority priority,
        int maxAttempts,
        long createdAtMs
) {
}

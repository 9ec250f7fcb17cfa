package io.sokrates.config;

public record LlmSettings(
        String apiEndpoint,
        String apiKey,
        String defaultModel,
        double temperature,
        int maxTokens,
        long requestTimeoutMs
) {
    public LlmSettings {
        if (apiEndpoint == null || apiEndpoint.isBlank()) {
            throw new IllegalArgumentException("apiEndpoint must not be blank");
        }
        if (defaultModel == null || defaultModel.isBlank()) {
            throw new IllegalArgumentException("defaultModel must not be blank");
        }
        apiEndpoint = apiEndpoint.trim();
        apiKey = apiKey == null ? "" : apiKey.trim();
        maxTokens = Math.max(1, maxTokens);
        requestTimeoutMs = Math.max(1_000L, requestTimeoutMs);
    }

    public static LlmSettings defaults() {
        return new LlmSettings(
                SokratesConfig.DEFAULT_API_ENDPOINT,
                SokratesConfig.DEFAULT_API_KEY,
                SokratesConfig.DEFAULT_MODEL,
                SokratesConfig.DEFAULT_MODEL_TEMPERATURE,
                SokratesConfig.DEFAULT_MAX_TOKENS,
                SokratesConfig.DEFAULT_REQUEST_TIMEOUT_MS
        );
    }
}

package io.sokrates.llm;

import java.util.List;

/**
 * One chat completion call. {@code context} entries are sent as system messages ahead of the prompt.
 */
public record CompletionRequest(
        String model,
        String prompt,
        double temperature,
        int maxTokens,
        List<String> context
) {
    public CompletionRequest {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1, got " + maxTokens);
        }
        context = context == null ? List.of() : List.copyOf(context);
    }

    public static CompletionRequest of(String model, String prompt, double temperature, int maxTokens) {
        return new CompletionRequest(model, prompt, temperature, maxTokens, List.of());
    }
}

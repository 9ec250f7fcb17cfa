package io.sokrates.handler;

import io.sokrates.config.LlmSettings;
import io.sokrates.error.TaskFailureException;
import io.sokrates.llm.CompletionRequest;
import io.sokrates.llm.LlmClient;

import java.util.List;

abstract class AbstractLlmHandler implements TaskHandler {
    protected final LlmClient client;
    protected final LlmSettings settings;
    protected final PromptRefiner refiner;

    AbstractLlmHandler(LlmClient client, LlmSettings settings, PromptRefiner refiner) {
        this.client = client;
        this.settings = settings;
        this.refiner = refiner;
    }

    protected String modelFrom(TaskContext ctx, String field) {
        return ctx.optionalText(field, settings.defaultModel());
    }

    protected String send(String model, String prompt, double temperature, List<String> context) throws TaskFailureException {
        String raw = client.complete(new CompletionRequest(model, prompt, temperature, settings.maxTokens(), context));
        return refiner.cleanToMarkdown(raw);
    }

    /**
     * Runs {@code instructions} over {@code input} and returns the cleaned refinement.
     */
    protected String refine(String model, String input, String instructions, double temperature, List<String> context)
            throws TaskFailureException {
        return send(model, refiner.combine(input, instructions), temperature, context);
    }
}

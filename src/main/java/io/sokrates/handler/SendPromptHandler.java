package io.sokrates.handler;

import io.sokrates.config.LlmSettings;
import io.sokrates.llm.CompletionRequest;
import io.sokrates.llm.LlmClient;

/**
 * {@code send-prompt}: {@code {prompt, model?, temperature?, max_tokens?, context?[]}}.
 */
public final class SendPromptHandler extends AbstractLlmHandler {
    public static final String KIND = "send-prompt";

    public SendPromptHandler(LlmClient client, LlmSettings settings, PromptRefiner refiner) {
        super(client, settings, refiner);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String handle(TaskContext ctx) throws Exception {
        String prompt = ctx.requireText("prompt");
        String model = modelFrom(ctx, "model");
        double temperature = ctx.optionalDouble("temperature", settings.temperature());
        int maxTokens = ctx.optionalInt("max_tokens", settings.maxTokens());
        CompletionRequest request = new CompletionRequest(model, prompt, temperature, maxTokens, ctx.optionalTextList("context"));
        return refiner.cleanToMarkdown(client.complete(request));
    }
}

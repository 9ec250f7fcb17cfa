package io.sokrates.handler;

import io.sokrates.config.LlmSettings;
import io.sokrates.llm.LlmClient;

import java.util.List;

/**
 * {@code refine-and-send}: refines {@code prompt}, then sends the refined prompt for execution.
 * Refinement and execution may use different models.
 */
public final class RefineAndSendHandler extends AbstractLlmHandler {
    public static final String KIND = "refine-and-send";

    private final PromptTemplates templates;

    public RefineAndSendHandler(LlmClient client, LlmSettings settings, PromptRefiner refiner, PromptTemplates templates) {
        super(client, settings, refiner);
        this.templates = templates;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String handle(TaskContext ctx) throws Exception {
        String prompt = ctx.requireText("prompt");
        String instructions = ctx.optionalText("refinement_prompt", templates.get(PromptTemplates.REFINE_PROMPT));
        String fallbackModel = modelFrom(ctx, "model");
        String refinementModel = ctx.optionalText("refinement_model", fallbackModel);
        String executionModel = ctx.optionalText("execution_model", fallbackModel);
        double temperature = ctx.optionalDouble("temperature", settings.temperature());

        String refined = refine(refinementModel, prompt, instructions, temperature, List.of());
        ctx.throwIfCancelRequested();
        return send(executionModel, refined, temperature, List.of());
    }
}

package io.sokrates.handler;

import io.sokrates.config.LlmSettings;
import io.sokrates.llm.LlmClient;

/**
 * {@code refine}: rewrites {@code prompt} using {@code refinement_prompt} or the bundled refinement template.
 */
public final class RefineHandler extends AbstractLlmHandler {
    public static final String KIND = "refine";

    private final PromptTemplates templates;

    public RefineHandler(LlmClient client, LlmSettings settings, PromptRefiner refiner, PromptTemplates templates) {
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
        double temperature = ctx.optionalDouble("temperature", settings.temperature());
        return refine(modelFrom(ctx, "model"), prompt, instructions, temperature, ctx.optionalTextList("context"));
    }
}

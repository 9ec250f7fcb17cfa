package io.sokrates.handler;

import io.sokrates.config.LlmSettings;
import io.sokrates.llm.LlmClient;

/**
 * {@code breakdown}: splits {@code task} into subtasks using the breakdown template. The output is the JSON
 * document {@code execute-tasks} consumes.
 */
public final class BreakdownHandler extends AbstractLlmHandler {
    public static final String KIND = "breakdown";

    private final PromptTemplates templates;

    public BreakdownHandler(LlmClient client, LlmSettings settings, PromptRefiner refiner, PromptTemplates templates) {
        super(client, settings, refiner);
        this.templates = templates;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String handle(TaskContext ctx) throws Exception {
        String task = ctx.requireText("task");
        double temperature = ctx.optionalDouble("temperature", settings.temperature());
        return refine(modelFrom(ctx, "model"), task, templates.get(PromptTemplates.BREAKDOWN), temperature,
                ctx.optionalTextList("context"));
    }
}

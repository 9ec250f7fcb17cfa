package io.sokrates.handler;

import io.sokrates.config.LlmSettings;
import io.sokrates.llm.LlmClient;

import java.util.List;

/**
 * {@code idea-generation}: {@code {topic?, count?, model?}}.
 */
public final class IdeaGenerationHandler extends AbstractLlmHandler {
    public static final String KIND = "idea-generation";
    static final int DEFAULT_COUNT = 5;
    static final int MAX_COUNT = 50;

    private final PromptTemplates templates;

    public IdeaGenerationHandler(LlmClient client, LlmSettings settings, PromptRefiner refiner, PromptTemplates templates) {
        super(client, settings, refiner);
        this.templates = templates;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String handle(TaskContext ctx) throws Exception {
        int count = ctx.optionalInt("count", DEFAULT_COUNT);
        if (count < 1 || count > MAX_COUNT) {
            throw new IllegalArgumentException("payload field 'count' must be between 1 and " + MAX_COUNT + ", got " + count);
        }
        String topic = ctx.optionalText("topic", "a topic of your choice");
        String prompt = templates.get(PromptTemplates.GENERATE_IDEAS)
                .replace("{{count}}", Integer.toString(count))
                .replace("{{topic}}", topic);
        double temperature = ctx.optionalDouble("temperature", settings.temperature());
        return send(modelFrom(ctx, "model"), prompt, temperature, List.of());
    }
}

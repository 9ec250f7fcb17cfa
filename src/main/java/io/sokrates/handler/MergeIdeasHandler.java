package io.sokrates.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.sokrates.config.LlmSettings;
import io.sokrates.llm.LlmClient;

import java.util.List;

/**
 * {@code merge-ideas}: {@code {documents:[{identifier, content}], model?}}.
 */
public final class MergeIdeasHandler extends AbstractLlmHandler {
    public static final String KIND = "merge-ideas";

    private final PromptTemplates templates;

    public MergeIdeasHandler(LlmClient client, LlmSettings settings, PromptRefiner refiner, PromptTemplates templates) {
        super(client, settings, refiner);
        this.templates = templates;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String handle(TaskContext ctx) throws Exception {
        JsonNode documents = ctx.payload() == null ? null : ctx.payload().get("documents");
        if (documents == null || !documents.isArray() || documents.size() < 2) {
            throw new IllegalArgumentException("payload field 'documents' must be an array of at least two documents");
        }
        StringBuilder sources = new StringBuilder("# Source documents");
        for (JsonNode doc : documents) {
            String identifier = doc.path("identifier").asText("");
            String content = doc.path("content").asText("");
            if (identifier.isBlank() || content.isBlank()) {
                throw new IllegalArgumentException("every document needs a non-empty 'identifier' and 'content'");
            }
            sources.append("\n<document identifier=\"").append(identifier).append("\">")
                    .append(content).append("</document>\n");
        }
        String prompt = templates.get(PromptTemplates.MERGE_IDEAS) + "\n" + sources + "\n";
        double temperature = ctx.optionalDouble("temperature", settings.temperature());
        return send(modelFrom(ctx, "model"), prompt, temperature, List.of());
    }
}

package io.sokrates.handler;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt templates bundled under {@code prompts/} on the classpath.
 */
public final class PromptTemplates {
    public static final String REFINE_PROMPT = "refine-prompt";
    public static final String BREAKDOWN = "breakdown-v1";
    public static final String GENERATE_IDEAS = "generate-ideas-v1";
    public static final String MERGE_IDEAS = "merge-ideas-v1";

    private final String root;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public PromptTemplates() {
        this("prompts");
    }

    public PromptTemplates(String root) {
        this.root = root;
    }

    public String get(String name) {
        return cache.computeIfAbsent(name, this::load);
    }

    private String load(String name) {
        String resource = root + "/" + name + ".md";
        try (InputStream in = PromptTemplates.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Prompt template not found on classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt template " + resource, e);
        }
    }
}

package io.sokrates.handler;

import io.sokrates.config.LlmSettings;
import io.sokrates.llm.LlmClient;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public final class HandlerRegistry {
    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    public static HandlerRegistry withDefaults(LlmClient client, LlmSettings settings, PromptTemplates templates,
                                               Supplier<Path> resultsDir) {
        PromptRefiner refiner = new PromptRefiner();
        HandlerRegistry registry = new HandlerRegistry();
        registry.register(new SendPromptHandler(client, settings, refiner));
        registry.register(new RefineHandler(client, settings, refiner, templates));
        registry.register(new RefineAndSendHandler(client, settings, refiner, templates));
        registry.register(new BreakdownHandler(client, settings, refiner, templates));
        registry.register(new IdeaGenerationHandler(client, settings, refiner, templates));
        registry.register(new MergeIdeasHandler(client, settings, refiner, templates));
        registry.register(new ExecuteTasksHandler(client, settings, refiner, templates, resultsDir));
        return registry;
    }

    public HandlerRegistry register(TaskHandler handler) {
        handlers.put(handler.kind(), handler);
        return this;
    }

    public Optional<TaskHandler> find(String kind) {
        return kind == null ? Optional.empty() : Optional.ofNullable(handlers.get(kind));
    }

    public boolean supports(String kind) {
        return find(kind).isPresent();
    }

    public Collection<String> kinds() {
        return new TreeSet<>(handlers.keySet());
    }
}

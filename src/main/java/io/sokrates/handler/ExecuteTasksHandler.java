package io.sokrates.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sokrates.config.LlmSettings;
import io.sokrates.error.TaskCancelledException;
import io.sokrates.error.TransientTaskException;
import io.sokrates.llm.LlmClient;
import io.sokrates.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@code execute-tasks}: runs every subtask of a breakdown file ({@code {task, subtasks:[{id, description}]}})
 * through refine-and-send, in the context of the main task, and writes one {@code task_<id>_result.md} per subtask.
 *
 * <p>Subtask failures are counted, not propagated, unless every subtask failed.
 */
public final class ExecuteTasksHandler extends AbstractLlmHandler {
    public static final String KIND = "execute-tasks";
    private static final Logger log = LoggerFactory.getLogger(ExecuteTasksHandler.class);

    private final PromptTemplates templates;
    private final Supplier<Path> defaultOutputDir;

    public ExecuteTasksHandler(LlmClient client, LlmSettings settings, PromptRefiner refiner, PromptTemplates templates,
                               Supplier<Path> defaultOutputDir) {
        super(client, settings, refiner);
        this.templates = templates;
        this.defaultOutputDir = defaultOutputDir;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public String handle(TaskContext ctx) throws Exception {
        Path taskFile = Paths.get(ctx.requireText("task_file"));
        String outputDirRaw = ctx.optionalText("output_dir", null);
        Path outputDir = outputDirRaw == null ? defaultOutputDir.get() : Paths.get(outputDirRaw);
        String model = modelFrom(ctx, "model");
        double temperature = ctx.optionalDouble("temperature", settings.temperature());

        JsonNode tasks = readTaskFile(taskFile);
        String mainTask = tasks.path("task").isTextual() ? tasks.path("task").asText() : null;
        JsonNode subtasks = tasks.path("subtasks");
        if (!subtasks.isArray()) {
            throw new IllegalArgumentException("task file " + taskFile + " has no 'subtasks' array");
        }
        Files.createDirectories(outputDir);
        String instructions = templates.get(PromptTemplates.REFINE_PROMPT);

        ObjectNode summary = Jsons.mapper().createObjectNode();
        ArrayNode details = Jsons.mapper().createArrayNode();
        int ok = 0;
        int failed = 0;
        for (JsonNode subtask : subtasks) {
            ctx.throwIfCancelRequested();
            String id = subtask.path("id").asText("");
            String description = subtask.path("description").asText("");
            ObjectNode detail = details.addObject();
            detail.put("task_id", id);
            if (id.isBlank() || description.isBlank()) {
                detail.put("status", "skipped");
                detail.put("message", "Missing required fields");
                continue;
            }
            try {
                String prompt = subtaskPrompt(mainTask, id, description);
                String refined = refine(model, prompt, instructions, temperature, List.of());
                String result = send(model, refined, temperature, List.of());
                Path file = writeResult(outputDir, id, result);
                detail.put("status", "completed");
                detail.put("message", "Task executed successfully");
                detail.put("output_file", file.toString());
                ok++;
            } catch (TaskCancelledException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Subtask {} of task {} failed: {}", id, ctx.taskId(), e.getMessage());
                detail.put("status", "failed");
                detail.put("message", "Error executing task: " + e.getMessage());
                failed++;
            }
        }
        summary.put("total_tasks", subtasks.size());
        summary.put("successful_tasks", ok);
        summary.put("failed_tasks", failed);
        summary.put("output_dir", outputDir.toString());
        summary.set("details", details);
        if (ok == 0 && failed > 0) {
            throw new TransientTaskException("all " + failed + " subtasks failed; see " + outputDir);
        }
        return Jsons.toJson(summary);
    }

    static String subtaskPrompt(String mainTask, String id, String description) {
        String subTask = "Sub-Task " + id + ": " + description;
        if (mainTask == null || mainTask.isBlank()) {
            return subTask;
        }
        return """
                # Context description
                The task that should be executed is a sub-task of a bigger project or main objective.
                Handle the sub-task in the context of the main object.

                # Main objective / Project description
                %s

                %s""".formatted(mainTask.strip(), subTask);
    }

    private static JsonNode readTaskFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("task file not found: " + file);
        }
        try {
            JsonNode root = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("task file " + file + " must contain a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw new IllegalArgumentException("task file " + file + " is not valid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Never overwrites: an existing {@code task_<id>_result.md} gets a numeric postfix.
     */
    static Path writeResult(Path dir, String id, String content) throws IOException {
        String safeId = id.replaceAll("[^A-Za-z0-9_.-]", "_");
        Path target = dir.resolve("task_" + safeId + "_result.md");
        int n = 1;
        while (Files.exists(target)) {
            target = dir.resolve("task_" + safeId + "_result_" + n++ + ".md");
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target;
    }
}

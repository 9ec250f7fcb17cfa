package io.sokrates.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sokrates.config.LlmSettings;
import io.sokrates.error.PermanentTaskException;
import io.sokrates.error.TaskFailureException;
import io.sokrates.error.TransientTaskException;
import io.sokrates.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Client for {@code POST {endpoint}/chat/completions} as served by OpenAI, LM Studio, Ollama and friends.
 */
public final class OpenAiCompatibleClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleClient.class);
    private static final int MAX_ERROR_BODY = 500;

    private final LlmSettings settings;
    private final HttpClient http;

    public OpenAiCompatibleClient(LlmSettings settings) {
        this(settings, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public OpenAiCompatibleClient(LlmSettings settings, HttpClient http) {
        this.settings = settings;
        this.http = http;
    }

    @Override
    public String complete(CompletionRequest request) throws TaskFailureException {
        URI uri = URI.create(trimTrailingSlash(settings.apiEndpoint()) + "/chat/completions");
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMillis(settings.requestTimeoutMs()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body(request)), StandardCharsets.UTF_8));
        if (!settings.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + settings.apiKey());
        }

        long started = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransientTaskException("LLM request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientTaskException("LLM request to " + uri + " interrupted", e);
        }
        log.debug("LLM call model={} status={} tookMs={}", request.model(), response.statusCode(),
                Duration.ofNanos(System.nanoTime() - started).toMillis());

        int status = response.statusCode();
        if (status / 100 != 2) {
            String message = "LLM endpoint returned HTTP " + status + ": " + abbreviate(response.body());
            if (isRetryableStatus(status)) {
                throw new TransientTaskException(message);
            }
            throw new PermanentTaskException(message);
        }
        return extractContent(response.body());
    }

    static boolean isRetryableStatus(int status) {
        return status == 408 || status == 409 || status == 429 || status >= 500;
    }

    private ObjectNode body(CompletionRequest request) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("model", request.model());
        ArrayNode messages = root.putArray("messages");
        for (String ctx : request.context()) {
            messages.addObject().put("role", "system").put("content", ctx);
        }
        messages.addObject().put("role", "user").put("content", request.prompt());
        root.put("temperature", request.temperature());
        root.put("max_tokens", request.maxTokens());
        root.put("stream", false);
        return root;
    }

    static String extractContent(String body) throws PermanentTaskException {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new PermanentTaskException("LLM response is not valid JSON: " + abbreviate(body), e);
        }
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new PermanentTaskException("LLM response has no choices[0].message.content: " + abbreviate(body));
        }
        return content.asText();
    }

    private static String trimTrailingSlash(String url) {
        String out = url;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= MAX_ERROR_BODY ? s : s.substring(0, MAX_ERROR_BODY) + "...";
    }
}

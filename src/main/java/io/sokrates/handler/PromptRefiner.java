package io.sokrates.handler;

import java.util.regex.Pattern;

/**
 * Prompt assembly and response cleanup shared by the LLM-backed handlers.
 */
public final class PromptRefiner {
    private static final Pattern THINK_BLOCK = Pattern.compile("(?is)<think>.*?</think>");
    private static final Pattern UNCLOSED_THINK = Pattern.compile("(?is)^.*?</think>");
    private static final Pattern FENCED = Pattern.compile("(?s)^```[a-zA-Z0-9_-]*\\s*\\n(.*?)\\n?```$");

    public String combine(String input, String instructions) {
        if (instructions == null || instructions.isBlank()) {
            return input;
        }
        return instructions.strip() + "\n\n<original_prompt>\n" + input.strip() + "\n</original_prompt>\n";
    }

    /**
     * Strips reasoning blocks some local models emit and one level of surrounding code fence.
     */
    public String clean(String response) {
        if (response == null) {
            return "";
        }
        String out = THINK_BLOCK.matcher(response).replaceAll("");
        // Some servers drop the opening tag but keep the closing one.
        out = UNCLOSED_THINK.matcher(out).replaceFirst("");
        out = out.strip();
        var fenced = FENCED.matcher(out);
        if (fenced.matches()) {
            out = fenced.group(1).strip();
        }
        return out;
    }

    public String formatAsMarkdown(String content) {
        String body = content == null ? "" : content.strip();
        return body.isEmpty() ? "" : body + "\n";
    }

    public String cleanToMarkdown(String response) {
        return formatAsMarkdown(clean(response));
    }
}

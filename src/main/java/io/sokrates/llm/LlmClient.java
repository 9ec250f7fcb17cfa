package io.sokrates.llm;

import io.sokrates.error.TaskFailureException;

/**
 * Chat completion capability used by the task handlers.
 */
public interface LlmClient {
    /**
     * @return the assistant message content of the first choice
     * @throws io.sokrates.error.TransientTaskException on timeouts, rate limits and server errors
     * @throws io.sokrates.error.PermanentTaskException when the request itself is rejected
     */
    String complete(CompletionRequest request) throws TaskFailureException;
}

package io.sokrates.executor;

import io.sokrates.model.FailureKind;
import io.sokrates.model.TaskFailure;

/**
 * Result of one execution attempt: either the handler output or a classified failure.
 */
public record Outcome(boolean success, String output, TaskFailure failure) {
    public static Outcome ok(String output) {
        return new Outcome(true, output == null ? "" : output, null);
    }

    public static Outcome fail(String message, FailureKind kind) {
        return new Outcome(false, null, new TaskFailure(message, kind));
    }
}

package io.sokrates.error;

import io.sokrates.model.FailureKind;

public class TransientTaskException extends TaskFailureException {
    public TransientTaskException(String message) {
        super(message);
    }

    public TransientTaskException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TRANSIENT;
    }
}

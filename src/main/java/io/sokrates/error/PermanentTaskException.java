package io.sokrates.error;

import io.sokrates.model.FailureKind;

public class PermanentTaskException extends TaskFailureException {
    public PermanentTaskException(String message) {
        super(message);
    }

    public PermanentTaskException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PERMANENT;
    }
}

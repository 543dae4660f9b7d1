package io.sendflow.core.exception;

import java.util.Objects;

/**
 * Base exception for sendflow errors.
 */
public class SendFlowException extends RuntimeException {

    private final ErrorKind kind;

    public SendFlowException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public SendFlowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }
}

package io.sendflow.core.exception;

/**
 * Exception thrown when the send path itself is unreachable (e.g. the worker pool is shut down).
 */
public class SystemFailureException extends SendFlowException {

    public SystemFailureException(String message) {
        super(ErrorKind.SYSTEM_FAILURE, message);
    }

    public SystemFailureException(String message, Throwable cause) {
        super(ErrorKind.SYSTEM_FAILURE, message, cause);
    }
}

package io.sendflow.core.exception;

/**
 * Exception thrown for an illegal lifecycle transition (e.g. pausing a paused schedule).
 */
public class InvalidStateException extends SendFlowException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}

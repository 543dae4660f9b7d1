package io.sendflow.core.exception;

/**
 * Exception thrown when a request is malformed.
 */
public class InvalidInputException extends SendFlowException {

    private final String field;

    public InvalidInputException(String message) {
        this(null, message);
    }

    public InvalidInputException(String field, String message) {
        super(ErrorKind.INVALID_INPUT, message);
        this.field = field;
    }

    /**
     * Name of the offending request field, or null when the error is not tied to one field.
     */
    public String getField() {
        return field;
    }
}

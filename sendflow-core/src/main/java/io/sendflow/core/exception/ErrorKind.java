package io.sendflow.core.exception;

/**
 * Error taxonomy shared by every sendflow operation.
 */
public enum ErrorKind {
    /** Malformed request: missing field, bad timestamp, bad cron, ambiguous target. */
    INVALID_INPUT,
    /** Unknown contact, group, job or schedule id. */
    NOT_FOUND,
    /** Illegal lifecycle transition. */
    INVALID_STATE,
    /** One recipient could not be reached. Recorded per result, never thrown. */
    DELIVERY_FAILURE,
    /** The send path itself is unreachable. */
    SYSTEM_FAILURE
}

package io.sendflow.core.exception;

/**
 * Exception thrown when a contact, group, job or schedule id is unknown.
 */
public class NotFoundException extends SendFlowException {

    private final String resource;
    private final String id;

    public NotFoundException(String resource, String id) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}

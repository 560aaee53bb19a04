package com.tabflow.compiler.error;

/**
 * Base for fatal compilation failures. Carries the location of the offending node when known.
 */
public class WorkflowCompilationException extends RuntimeException {

    private final ErrorLocation location;

    public WorkflowCompilationException(String message, ErrorLocation location) {
        super(message);
        this.location = location != null ? location : ErrorLocation.UNKNOWN;
    }

    /** Never null; {@link ErrorLocation#UNKNOWN} when the failure is not tied to a node. */
    public ErrorLocation getLocation() {
        return location;
    }
}

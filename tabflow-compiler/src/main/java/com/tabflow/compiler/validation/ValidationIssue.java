package com.tabflow.compiler.validation;

import com.tabflow.compiler.error.ErrorLocation;

import java.util.Objects;

/**
 * One error or warning found by {@link WorkflowValidator}.
 */
public final class ValidationIssue {

    private final IssueKind kind;
    private final String message;
    private final ErrorLocation location;

    public ValidationIssue(IssueKind kind, String message, ErrorLocation location) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.location = location != null ? location : ErrorLocation.UNKNOWN;
    }

    public IssueKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /** Never null; {@link ErrorLocation#UNKNOWN} when the issue is not tied to a node. */
    public ErrorLocation getLocation() {
        return location;
    }

    public boolean isError() {
        return kind.isFatal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationIssue that = (ValidationIssue) o;
        return kind == that.kind && message.equals(that.message) && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, location);
    }

    @Override
    public String toString() {
        return (isError() ? "ERROR " : "WARNING ") + kind + ": " + message + " [" + location.describe() + "]";
    }
}

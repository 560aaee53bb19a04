package com.tabflow.compiler.validation;

/**
 * What a validation issue is about. Each kind is either always fatal or always a warning.
 */
public enum IssueKind {
    CYCLE(true),
    MISSING_REFERENCE(true),
    ISOLATED_TASK(false),
    UNUSED_CONTENT(false),
    MISSING_INSTRUCTION(false),
    EMPTY_COMPOSITE(false),
    INVALID_LOOP_BOUND(true),
    LOOP_BOUND_HIGH(false),
    MULTIPLE_START_NODES(true),
    DISCONNECTED_START(false),
    DUPLICATE_NAME(true),
    MISSING_OUTPUT_KEY(false),
    CONTEXT_CONFLICT(false);

    private final boolean fatal;

    IssueKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}

package com.tabflow.compiler.graph;

/**
 * Behavior a task declares through its config {@code type}. Absent or unrecognized values mean {@link #LLM}.
 */
public enum TaskBehavior {
    LLM,
    SEQUENTIAL,
    PARALLEL,
    LOOP,
    CUSTOM;

    public static TaskBehavior fromValue(Object value) {
        if (!(value instanceof String)) return LLM;
        String normalized = ((String) value).trim().toUpperCase();
        for (TaskBehavior b : values()) {
            if (b.name().equals(normalized)) return b;
        }
        return LLM;
    }

    /** Sequential, parallel-group and loop tasks wrap child tasks. */
    public boolean isComposite() {
        return this == SEQUENTIAL || this == PARALLEL || this == LOOP;
    }

    /** LLM tasks need instructions or context to run. */
    public boolean requiresInstructions() {
        return this == LLM;
    }
}

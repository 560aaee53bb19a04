package com.tabflow.compiler.graph;

import java.util.List;

/**
 * Closed set of node kinds. The raw canvas type string is mapped once, when the graph is built;
 * everything downstream switches over this enum.
 */
public enum NodeKind {
    /** Executable step (an agent). Composite and loop tasks are tasks with a composite {@link TaskBehavior}. */
    TASK("agent", "task"),
    PROMPT("prompt"),
    CONTEXT("context"),
    VARIABLE("variable"),
    TOOL("tool"),
    AGENT_TOOL("agentTool"),
    /** Outbound end of a named cross-region connection. */
    LINK_OUT("teleportOut", "linkOut"),
    /** Inbound end of a named cross-region connection. */
    LINK_IN("teleportIn", "linkIn"),
    /** Sink that receives task output. */
    OUTPUT_FILE("outputFile"),
    START("start"),
    END("end"),
    /** Used when the raw type is not recognized. */
    UNKNOWN;

    private final List<String> typeNames;

    NodeKind(String... typeNames) {
        this.typeNames = List.of(typeNames);
    }

    /**
     * Maps a raw type string; matching ignores case. Unknown, null or blank values give {@link #UNKNOWN}.
     */
    public static NodeKind fromType(String type) {
        if (type == null || type.isBlank()) return UNKNOWN;
        String trimmed = type.trim();
        for (NodeKind k : values()) {
            for (String name : k.typeNames) {
                if (name.equalsIgnoreCase(trimmed)) return k;
            }
        }
        return UNKNOWN;
    }

    public boolean isTask() {
        return this == TASK;
    }

    /** Nodes that supply instructions, context or tools to a task. */
    public boolean isContentProvider() {
        return switch (this) {
            case PROMPT, CONTEXT, VARIABLE, TOOL, AGENT_TOOL -> true;
            default -> false;
        };
    }

    /** Content providers whose content lives in an external file ({@code file_path} in config). */
    public boolean isFileBased() {
        return switch (this) {
            case PROMPT, CONTEXT, TOOL, AGENT_TOOL -> true;
            default -> false;
        };
    }

    public boolean isLink() {
        return this == LINK_OUT || this == LINK_IN;
    }
}

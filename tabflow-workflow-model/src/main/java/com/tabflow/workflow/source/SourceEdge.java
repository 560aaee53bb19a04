package com.tabflow.workflow.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Edge record as drawn on the canvas. Handles identify the port on each endpoint (e.g. "output", "input",
 * "link-top"); null when the edge is attached to the node body.
 */
public record SourceEdge(
        String id,
        String source,
        String target,
        String sourceHandle,
        String targetHandle
) {
    @JsonCreator
    public SourceEdge(
            @JsonProperty("id") String id,
            @JsonProperty("source") String source,
            @JsonProperty("target") String target,
            @JsonProperty("sourceHandle") String sourceHandle,
            @JsonProperty("targetHandle") String targetHandle) {
        this.id = id;
        this.source = source;
        this.target = target;
        this.sourceHandle = blankToNull(sourceHandle);
        this.targetHandle = blankToNull(targetHandle);
    }

    /** Convenience: edge without handles. */
    public static SourceEdge of(String id, String source, String target) {
        return new SourceEdge(id, source, target, null, null);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}

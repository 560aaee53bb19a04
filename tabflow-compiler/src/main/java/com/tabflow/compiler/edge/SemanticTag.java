package com.tabflow.compiler.edge;

/**
 * Resolved meaning of an edge.
 */
public enum SemanticTag {
    /** Source runs before target. */
    SEQUENTIAL,
    /** Source and target run concurrently. */
    PARALLEL,
    /** Target is a child of a composite source. */
    SUBTASK,
    /** Source feeds data into the target task; see {@link InputKind}. */
    INPUT_DATA,
    /** Task output is written to a sink. */
    OUTPUT_SINK,
    /** Part of a named connection between regions. */
    CROSS_REGION_LINK,
    /** No rule matched; ignored by the compiler. */
    UNKNOWN
}

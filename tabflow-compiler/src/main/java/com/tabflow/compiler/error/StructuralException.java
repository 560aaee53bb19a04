package com.tabflow.compiler.error;

/**
 * Thrown by the graph builder when the input cannot form a graph: an edge endpoint that names no node,
 * a node id used twice, or two link nodes of the same direction sharing a name in one region.
 * Compilation stops immediately; no partial graph is returned.
 */
public final class StructuralException extends WorkflowCompilationException {

    public StructuralException(String message, ErrorLocation location) {
        super(message, location);
    }
}

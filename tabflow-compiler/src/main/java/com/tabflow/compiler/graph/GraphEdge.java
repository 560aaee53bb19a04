package com.tabflow.compiler.graph;

import com.tabflow.compiler.edge.EdgeSemantics;
import com.tabflow.compiler.edge.SemanticTag;
import com.tabflow.workflow.source.SourceEdge;

import java.util.Objects;

/**
 * Edge of the workflow graph with resolved semantics. Virtual edges (bridging a link pair across regions)
 * have no original edge.
 */
public final class GraphEdge {

    private final String id;
    private final String sourceId;
    private final String targetId;
    private final String sourceHandle;
    private final String targetHandle;
    private final EdgeSemantics semantics;
    private final SourceEdge originalEdge;

    public GraphEdge(String id, String sourceId, String targetId, String sourceHandle, String targetHandle,
                     EdgeSemantics semantics, SourceEdge originalEdge) {
        this.id = Objects.requireNonNull(id, "id");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.sourceHandle = sourceHandle;
        this.targetHandle = targetHandle;
        this.semantics = Objects.requireNonNull(semantics, "semantics");
        this.originalEdge = originalEdge;
    }

    /** SEQUENTIAL edge synthesized for a link pair. */
    static GraphEdge virtualSequential(String id, String sourceId, String targetId) {
        return new GraphEdge(id, sourceId, targetId, null, null, EdgeSemantics.SEQUENTIAL, null);
    }

    public String getId() {
        return id;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getSourceHandle() {
        return sourceHandle;
    }

    public String getTargetHandle() {
        return targetHandle;
    }

    public EdgeSemantics getSemantics() {
        return semantics;
    }

    public SemanticTag getTag() {
        return semantics.tag();
    }

    public boolean is(SemanticTag tag) {
        return semantics.tag() == tag;
    }

    /** Raw edge this was built from; null for virtual edges. */
    public SourceEdge getOriginalEdge() {
        return originalEdge;
    }

    public boolean isVirtual() {
        return originalEdge == null;
    }

    @Override
    public String toString() {
        return "GraphEdge{" + id + ": " + sourceId + " -> " + targetId + " " + semantics + "}";
    }
}

package com.tabflow.compiler.edge;

import com.tabflow.compiler.graph.NodeKind;

import java.util.Objects;

/**
 * Rule for interpreting an edge based on endpoint kinds and handles. A null handle matches any handle
 * (including none). Higher priority rules are checked first.
 */
public record EdgeRule(
        NodeKind sourceKind,
        NodeKind targetKind,
        String sourceHandle,
        String targetHandle,
        EdgeSemantics semantics,
        int priority
) {
    public EdgeRule {
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(targetKind, "targetKind");
        Objects.requireNonNull(semantics, "semantics");
    }

    /** Rule matching any handles. */
    public static EdgeRule of(NodeKind sourceKind, NodeKind targetKind, EdgeSemantics semantics, int priority) {
        return new EdgeRule(sourceKind, targetKind, null, null, semantics, priority);
    }

    /** Rule restricted to the given source and target handles. */
    public static EdgeRule ofHandles(NodeKind sourceKind, NodeKind targetKind,
                                     String sourceHandle, String targetHandle,
                                     EdgeSemantics semantics, int priority) {
        return new EdgeRule(sourceKind, targetKind, sourceHandle, targetHandle, semantics, priority);
    }

    public boolean matches(NodeKind source, NodeKind target, String sourceHandle, String targetHandle) {
        if (sourceKind != source) return false;
        if (targetKind != target) return false;
        if (this.sourceHandle != null && !this.sourceHandle.equals(sourceHandle)) return false;
        return this.targetHandle == null || this.targetHandle.equals(targetHandle);
    }
}

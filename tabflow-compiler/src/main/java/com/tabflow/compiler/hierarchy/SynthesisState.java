package com.tabflow.compiler.hierarchy;

import com.tabflow.compiler.graph.GraphNode;
import com.tabflow.compiler.graph.WorkflowGraph;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable state of one synthesis pass: the nodes already placed in the tree and the counter for
 * wrapper ids. Created per {@link HierarchySynthesizer#synthesize} call and passed down every recursive
 * step; never shared between passes.
 */
final class SynthesisState {

    private final WorkflowGraph graph;
    private final Set<String> placed = new LinkedHashSet<>();
    private int wrapperCounter;

    SynthesisState(WorkflowGraph graph) {
        this.graph = graph;
    }

    boolean isPlaced(GraphNode node) {
        return placed.contains(node.getId());
    }

    /** Marks the node placed; false if it already was. */
    boolean place(GraphNode node) {
        return placed.add(node.getId());
    }

    int placedCount() {
        return placed.size();
    }

    /** Next wrapper id, e.g. {@code __seq_3__}; skips ids taken by source nodes. */
    String nextWrapperId(String prefix) {
        String id;
        do {
            wrapperCounter++;
            id = "__" + prefix + "_" + wrapperCounter + "__";
        } while (graph.containsNode(id));
        return id;
    }
}

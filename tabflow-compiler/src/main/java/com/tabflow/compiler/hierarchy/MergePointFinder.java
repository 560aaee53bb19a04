package com.tabflow.compiler.hierarchy;

import com.tabflow.compiler.graph.GraphNode;
import com.tabflow.compiler.graph.WorkflowGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds where the branches of a fork converge: a task reachable over SEQUENTIAL edges from every root.
 * Searches stay inside the unplaced part of the graph and do not cross the current boundary.
 * <p>
 * When several candidates exist, the one met first while walking breadth-first from the roots in
 * their given order wins. This is not necessarily the globally nearest candidate.
 */
final class MergePointFinder {

    private final WorkflowGraph graph;

    MergePointFinder(WorkflowGraph graph) {
        this.graph = graph;
    }

    /**
     * @param roots    two or more unplaced roots, in branch order
     * @param state    current pass (placed nodes are not entered)
     * @param boundary node ids the search must not enter
     * @return the merge point, or null when the branches never converge
     */
    GraphNode find(List<GraphNode> roots, SynthesisState state, Set<String> boundary) {
        if (roots.size() < 2) return null;

        Set<String> rootIds = new HashSet<>();
        for (GraphNode r : roots) rootIds.add(r.getId());

        Set<String> common = null;
        for (GraphNode root : roots) {
            Set<String> reachable = reachableFrom(root, rootIds, state, boundary);
            if (reachable.isEmpty()) return null;
            if (common == null) {
                common = reachable;
            } else {
                common.retainAll(reachable);
            }
            if (common.isEmpty()) return null;
        }

        for (GraphNode root : roots) {
            for (GraphNode node : breadthFirst(root, state, boundary)) {
                if (common.contains(node.getId())) return node;
            }
        }
        return null;
    }

    /** Ids reachable from root, excluding all roots. */
    private Set<String> reachableFrom(GraphNode root, Set<String> rootIds, SynthesisState state, Set<String> boundary) {
        Set<String> reachable = new LinkedHashSet<>();
        for (GraphNode node : breadthFirst(root, state, boundary)) {
            if (!rootIds.contains(node.getId())) reachable.add(node.getId());
        }
        return reachable;
    }

    /** Nodes in breadth-first order from root (root first), over task SEQUENTIAL edges. */
    private List<GraphNode> breadthFirst(GraphNode root, SynthesisState state, Set<String> boundary) {
        List<GraphNode> order = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<GraphNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            GraphNode node = queue.poll();
            if (!seen.add(node.getId())) continue;
            if (state.isPlaced(node) || (node != root && boundary.contains(node.getId()))) continue;
            order.add(node);
            queue.addAll(graph.getSequentialTaskSuccessors(node));
        }
        return order;
    }
}

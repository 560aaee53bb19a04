package com.tabflow.compiler.graph;

import com.tabflow.compiler.edge.SemanticTag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workflow graph with resolved edge semantics, link pairs and entry nodes. Built once per compilation by
 * {@link GraphBuilder}; read-only for every consumer afterwards. Node iteration follows source order
 * (regions in order, nodes in order within a region).
 */
public final class WorkflowGraph {

    private final Map<String, GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final List<LinkPair> linkPairs;
    private final List<GraphNode> entryNodes;

    WorkflowGraph(LinkedHashMap<String, GraphNode> nodes,
                  List<GraphEdge> edges,
                  List<LinkPair> linkPairs,
                  List<GraphNode> entryNodes) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = List.copyOf(edges);
        this.linkPairs = List.copyOf(linkPairs);
        this.entryNodes = List.copyOf(entryNodes);
    }

    /** Node by id, or null. */
    public GraphNode getNode(String nodeId) {
        return nodeId != null ? nodes.get(nodeId) : null;
    }

    public Map<String, GraphNode> getNodes() {
        return nodes;
    }

    public Collection<GraphNode> getNodeList() {
        return nodes.values();
    }

    public boolean containsNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /** All edges including virtual link-pair edges (appended after the source edges). */
    public List<GraphEdge> getEdges() {
        return edges;
    }

    public List<LinkPair> getLinkPairs() {
        return linkPairs;
    }

    /**
     * Task nodes where execution can begin, in source order: tasks with no incoming SEQUENTIAL edge
     * from a non-START node. An edge from a START marker does not count, so a task wired only from
     * START is still an entry node.
     */
    public List<GraphNode> getEntryNodes() {
        return entryNodes;
    }

    public List<GraphNode> getTaskNodes() {
        return getNodesOfKind(NodeKind.TASK);
    }

    public List<GraphNode> getNodesOfKind(NodeKind kind) {
        List<GraphNode> out = new ArrayList<>();
        for (GraphNode n : nodes.values()) {
            if (n.getKind() == kind) out.add(n);
        }
        return out;
    }

    /**
     * Task-kind SEQUENTIAL successors of a node, in edge order, without duplicates.
     */
    public List<GraphNode> getSequentialTaskSuccessors(GraphNode node) {
        List<GraphNode> out = new ArrayList<>();
        for (GraphEdge e : node.getOutgoing()) {
            if (!e.is(SemanticTag.SEQUENTIAL)) continue;
            GraphNode target = nodes.get(e.getTargetId());
            if (target != null && target.isTask() && !out.contains(target)) {
                out.add(target);
            }
        }
        return out;
    }

    /** Node ids in an order consistent with SEQUENTIAL edges; see {@link TopologicalSorter#sort}. */
    public List<String> topologicalSort() {
        return TopologicalSorter.sort(this);
    }
}

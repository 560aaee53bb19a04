package com.tabflow.compiler.graph;

import com.tabflow.compiler.edge.EdgeSemantics;
import com.tabflow.compiler.edge.EdgeSemanticsResolver;
import com.tabflow.compiler.edge.SemanticTag;
import com.tabflow.compiler.error.ErrorLocation;
import com.tabflow.compiler.error.StructuralException;
import com.tabflow.workflow.source.RegionSource;
import com.tabflow.workflow.source.SourceEdge;
import com.tabflow.workflow.source.SourceNode;
import com.tabflow.workflow.source.WorkflowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link WorkflowGraph} from region-partitioned source records: creates nodes, resolves edge
 * semantics, pairs link nodes by name and bridges each pair with virtual SEQUENTIAL edges, then computes
 * entry nodes. Fails fast with {@link StructuralException}; never returns a partial graph.
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final EdgeSemanticsResolver resolver;

    public GraphBuilder() {
        this(new EdgeSemanticsResolver());
    }

    public GraphBuilder(EdgeSemanticsResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public WorkflowGraph build(WorkflowSource source) {
        Objects.requireNonNull(source, "source");

        LinkedHashMap<String, GraphNode> nodes = createNodes(source);
        List<GraphEdge> edges = createEdges(source, nodes);
        List<LinkPair> linkPairs = resolveLinkPairs(nodes);
        int bridged = addLinkBridges(linkPairs, nodes, edges);
        List<GraphNode> entryNodes = findEntryNodes(nodes);

        if (log.isDebugEnabled()) {
            log.debug("Workflow graph built: nodes={} edges={} linkPairs={} virtualEdges={} entryNodes={}",
                    nodes.size(), edges.size(), linkPairs.size(), bridged,
                    entryNodes.stream().map(GraphNode::getId).toList());
        }
        return new WorkflowGraph(nodes, edges, linkPairs, entryNodes);
    }

    private static LinkedHashMap<String, GraphNode> createNodes(WorkflowSource source) {
        LinkedHashMap<String, GraphNode> nodes = new LinkedHashMap<>();
        for (RegionSource region : source.regions()) {
            for (SourceNode sourceNode : region.nodes()) {
                if (sourceNode.id() == null || sourceNode.id().isBlank()) {
                    throw new StructuralException("Node without id in region " + region.id(),
                            new ErrorLocation(null, sourceNode.name(), sourceNode.type(), region.id(), null, null));
                }
                GraphNode existing = nodes.get(sourceNode.id());
                if (existing != null) {
                    throw new StructuralException("Duplicate node id '" + sourceNode.id() + "' (also in region "
                            + existing.getRegionId() + ")", ErrorLocation.ofNode(sourceNode.id(), region.id()));
                }
                nodes.put(sourceNode.id(), new GraphNode(sourceNode, region.id()));
            }
        }
        return nodes;
    }

    private List<GraphEdge> createEdges(WorkflowSource source, Map<String, GraphNode> nodes) {
        List<GraphEdge> edges = new ArrayList<>();
        for (RegionSource region : source.regions()) {
            for (SourceEdge sourceEdge : region.edges()) {
                GraphNode from = requireEndpoint(nodes, sourceEdge, sourceEdge.source(), "source", region.id());
                GraphNode to = requireEndpoint(nodes, sourceEdge, sourceEdge.target(), "target", region.id());
                EdgeSemantics semantics = resolver.resolve(from.getKind(), to.getKind(),
                        sourceEdge.sourceHandle(), sourceEdge.targetHandle());
                String edgeId = sourceEdge.id() != null ? sourceEdge.id()
                        : from.getId() + "->" + to.getId() + "#" + edges.size();
                GraphEdge edge = new GraphEdge(edgeId, from.getId(), to.getId(),
                        sourceEdge.sourceHandle(), sourceEdge.targetHandle(), semantics, sourceEdge);
                from.addOutgoing(edge);
                to.addIncoming(edge);
                edges.add(edge);
            }
        }
        return edges;
    }

    private static GraphNode requireEndpoint(Map<String, GraphNode> nodes, SourceEdge edge, String nodeId,
                                             String role, String regionId) {
        GraphNode node = nodeId != null ? nodes.get(nodeId) : null;
        if (node == null) {
            throw new StructuralException("Edge " + edge.id() + " references unknown " + role + " node '" + nodeId + "'",
                    ErrorLocation.ofNode(nodeId, regionId));
        }
        return node;
    }

    /**
     * Link names must be unique per direction within a region. Every link-out is paired with every link-in
     * of the same name, in source order.
     */
    private static List<LinkPair> resolveLinkPairs(Map<String, GraphNode> nodes) {
        Map<String, List<GraphNode>> outputs = new LinkedHashMap<>();
        Map<String, List<GraphNode>> inputs = new LinkedHashMap<>();
        Set<String> seenOut = new HashSet<>();
        Set<String> seenIn = new HashSet<>();

        for (GraphNode node : nodes.values()) {
            if (!node.getKind().isLink()) continue;
            String name = node.getName().trim();
            if (name.isEmpty()) continue;
            boolean out = node.getKind() == NodeKind.LINK_OUT;
            String regionKey = node.getRegionId() + "\u0000" + name;
            if (!(out ? seenOut : seenIn).add(regionKey)) {
                throw new StructuralException("Duplicate " + (out ? "link-out" : "link-in") + " named '" + name
                        + "' in region " + node.getRegionId(), node.toLocation());
            }
            (out ? outputs : inputs).computeIfAbsent(name, k -> new ArrayList<>()).add(node);
        }

        List<LinkPair> pairs = new ArrayList<>();
        for (Map.Entry<String, List<GraphNode>> e : outputs.entrySet()) {
            List<GraphNode> matching = inputs.get(e.getKey());
            if (matching == null) continue;
            for (GraphNode outNode : e.getValue()) {
                for (GraphNode inNode : matching) {
                    pairs.add(new LinkPair(e.getKey(), outNode, inNode));
                }
            }
        }
        return pairs;
    }

    /**
     * Connects every task feeding a link-out node to every task fed by its paired link-in node.
     * Returns the number of virtual edges added.
     */
    private static int addLinkBridges(List<LinkPair> pairs, Map<String, GraphNode> nodes, List<GraphEdge> edges) {
        Set<String> bridged = new HashSet<>();
        int added = 0;
        for (LinkPair pair : pairs) {
            for (GraphEdge in : pair.outNode().getIncoming()) {
                GraphNode from = nodes.get(in.getSourceId());
                if (from == null || !from.isTask()) continue;
                for (GraphEdge out : pair.inNode().getOutgoing()) {
                    GraphNode to = nodes.get(out.getTargetId());
                    if (to == null || !to.isTask()) continue;
                    if (!bridged.add(from.getId() + "\u0000" + to.getId())) continue;
                    GraphEdge edge = GraphEdge.virtualSequential(
                            "link:" + pair.name() + ":" + from.getId() + "->" + to.getId(), from.getId(), to.getId());
                    from.addOutgoing(edge);
                    to.addIncoming(edge);
                    edges.add(edge);
                    added++;
                }
            }
        }
        return added;
    }

    private static List<GraphNode> findEntryNodes(Map<String, GraphNode> nodes) {
        List<GraphNode> entries = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (!node.isTask()) continue;
            boolean hasPredecessor = false;
            for (GraphEdge e : node.getIncoming(SemanticTag.SEQUENTIAL)) {
                GraphNode from = nodes.get(e.getSourceId());
                if (from != null && from.getKind() != NodeKind.START) {
                    hasPredecessor = true;
                    break;
                }
            }
            if (!hasPredecessor) entries.add(node);
        }
        return entries;
    }
}

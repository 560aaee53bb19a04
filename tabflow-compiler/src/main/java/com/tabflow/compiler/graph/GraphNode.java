package com.tabflow.compiler.graph;

import com.tabflow.compiler.edge.SemanticTag;
import com.tabflow.compiler.error.ErrorLocation;
import com.tabflow.workflow.source.SourceNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node of the workflow graph. Edge lists are filled by {@link GraphBuilder} and exposed read-only.
 */
public final class GraphNode {

    public static final String CONFIG_TYPE = "type";
    public static final String CONFIG_FILE_PATH = "file_path";

    private final String id;
    private final NodeKind kind;
    private final String rawType;
    private final String name;
    private final String regionId;
    private final Map<String, Object> config;
    private final List<GraphEdge> incoming = new ArrayList<>();
    private final List<GraphEdge> outgoing = new ArrayList<>();
    private final List<GraphEdge> incomingView = Collections.unmodifiableList(incoming);
    private final List<GraphEdge> outgoingView = Collections.unmodifiableList(outgoing);

    GraphNode(SourceNode sourceNode, String regionId) {
        Objects.requireNonNull(sourceNode, "sourceNode");
        this.id = Objects.requireNonNull(sourceNode.id(), "node id");
        this.rawType = sourceNode.type();
        this.kind = NodeKind.fromType(sourceNode.type());
        this.name = sourceNode.name();
        this.regionId = regionId;
        this.config = sourceNode.config();
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    /** Display name; never null (empty when the source had none). */
    public String getName() {
        return name;
    }

    public String getRegionId() {
        return regionId;
    }

    /** Free-form config. Unmodifiable. */
    public Map<String, Object> getConfig() {
        return config;
    }

    public List<GraphEdge> getIncoming() {
        return incomingView;
    }

    public List<GraphEdge> getOutgoing() {
        return outgoingView;
    }

    public List<GraphEdge> getIncoming(SemanticTag tag) {
        return filter(incoming, tag);
    }

    public List<GraphEdge> getOutgoing(SemanticTag tag) {
        return filter(outgoing, tag);
    }

    public boolean hasIncoming(SemanticTag tag) {
        return incoming.stream().anyMatch(e -> e.is(tag));
    }

    public boolean isTask() {
        return kind.isTask();
    }

    /** Declared behavior for tasks; {@link TaskBehavior#LLM} for non-task nodes. */
    public TaskBehavior getBehavior() {
        return kind.isTask() ? TaskBehavior.fromValue(config.get(CONFIG_TYPE)) : TaskBehavior.LLM;
    }

    /** Config string value, or null when absent, blank or not a string. */
    public String getConfigString(String key) {
        Object v = config.get(key);
        if (v instanceof String && !((String) v).isBlank()) return ((String) v).trim();
        return null;
    }

    public boolean isIsolated() {
        return incoming.isEmpty() && outgoing.isEmpty();
    }

    public ErrorLocation toLocation() {
        return new ErrorLocation(id, name, rawType, regionId, null, null);
    }

    void addIncoming(GraphEdge edge) {
        incoming.add(edge);
    }

    void addOutgoing(GraphEdge edge) {
        outgoing.add(edge);
    }

    private static List<GraphEdge> filter(List<GraphEdge> edges, SemanticTag tag) {
        List<GraphEdge> out = new ArrayList<>();
        for (GraphEdge e : edges) {
            if (e.is(tag)) out.add(e);
        }
        return out;
    }

    @Override
    public String toString() {
        return "GraphNode{" + id + " " + kind + " '" + name + "' region=" + regionId + "}";
    }
}

package com.tabflow.workflow.hierarchy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node of the synthesized execution hierarchy. A LEAF points at one source task by id;
 * SEQUENCE and PARALLEL are wrappers with generated ids and at least two children.
 * Instances are immutable.
 */
public final class HierarchyNode {

    private final String id;
    private final HierarchyNodeType type;
    private final String taskId;
    private final String displayName;
    private final List<HierarchyNode> children;

    @JsonCreator
    public HierarchyNode(
            @JsonProperty("id") String id,
            @JsonProperty("type") HierarchyNodeType type,
            @JsonProperty("taskId") String taskId,
            @JsonProperty("displayName") String displayName,
            @JsonProperty("children") List<HierarchyNode> children) {
        this.id = id;
        this.type = type != null ? type : HierarchyNodeType.LEAF;
        this.taskId = taskId;
        this.displayName = displayName;
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    /** Leaf for a source task; the leaf id is the task id. */
    public static HierarchyNode leaf(String taskId, String displayName) {
        Objects.requireNonNull(taskId, "taskId");
        return new HierarchyNode(taskId, HierarchyNodeType.LEAF, taskId, displayName, List.of());
    }

    public static HierarchyNode sequence(String id, List<HierarchyNode> children) {
        return new HierarchyNode(id, HierarchyNodeType.SEQUENCE, null, "sequential", children);
    }

    public static HierarchyNode parallel(String id, List<HierarchyNode> children) {
        return new HierarchyNode(id, HierarchyNodeType.PARALLEL, null, "parallel", children);
    }

    public String getId() {
        return id;
    }

    /** Never null. */
    public HierarchyNodeType getType() {
        return type;
    }

    /** Source task id for LEAF nodes; null for wrappers. */
    public String getTaskId() {
        return taskId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<HierarchyNode> getChildren() {
        return children;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return type == HierarchyNodeType.LEAF;
    }

    /**
     * Finds a node by id in the tree (DFS). Returns null if not found.
     */
    public static HierarchyNode findNodeById(HierarchyNode root, String nodeId) {
        if (root == null || nodeId == null || nodeId.isBlank()) return null;
        if (nodeId.equals(root.id)) return root;
        for (HierarchyNode child : root.children) {
            HierarchyNode found = findNodeById(child, nodeId);
            if (found != null) return found;
        }
        return null;
    }

    /** Task ids of all leaves in execution order (depth-first, left to right). Duplicates are kept. */
    public List<String> collectTaskIds() {
        List<String> out = new ArrayList<>();
        collectTaskIds(this, out);
        return out;
    }

    private static void collectTaskIds(HierarchyNode node, List<String> out) {
        if (node.isLeaf()) {
            if (node.taskId != null) out.add(node.taskId);
            return;
        }
        for (HierarchyNode child : node.children) {
            collectTaskIds(child, out);
        }
    }

    /**
     * Indented plain-text rendering, one node per line, e.g.
     * <pre>
     * Sequence:
     *   - A
     *   Parallel:
     *     - B
     *     - C
     * </pre>
     * Leaves print their display name, falling back to the task id.
     */
    public String toTopologyString() {
        StringBuilder sb = new StringBuilder();
        render(this, 0, sb);
        return sb.toString();
    }

    private static void render(HierarchyNode node, int depth, StringBuilder sb) {
        if (sb.length() > 0) sb.append('\n');
        sb.append("  ".repeat(depth));
        if (node.isLeaf()) {
            String label = node.displayName != null && !node.displayName.isBlank() ? node.displayName : node.taskId;
            sb.append("- ").append(label);
            return;
        }
        sb.append(node.type == HierarchyNodeType.SEQUENCE ? "Sequence:" : "Parallel:");
        for (HierarchyNode child : node.children) {
            render(child, depth + 1, sb);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HierarchyNode that = (HierarchyNode) o;
        return Objects.equals(id, that.id) && type == that.type
                && Objects.equals(taskId, that.taskId)
                && Objects.equals(displayName, that.displayName)
                && Objects.equals(children, that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, taskId, displayName, children);
    }

    @Override
    public String toString() {
        if (isLeaf()) return "Leaf(" + taskId + ")";
        return (type == HierarchyNodeType.SEQUENCE ? "Sequence" : "Parallel") + children;
    }
}

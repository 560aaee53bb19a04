package com.tabflow.compiler.validation;

import com.tabflow.compiler.edge.InputKind;
import com.tabflow.compiler.edge.SemanticTag;
import com.tabflow.compiler.graph.GraphEdge;
import com.tabflow.compiler.graph.GraphNode;
import com.tabflow.compiler.graph.NodeKind;
import com.tabflow.compiler.graph.TaskBehavior;
import com.tabflow.compiler.graph.TopologicalSorter;
import com.tabflow.compiler.graph.WorkflowGraph;
import com.tabflow.config.CompilerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a built {@link WorkflowGraph} for structural and reference problems. Every check runs and all
 * issues are collected; nothing is thrown. Whether errors abort compilation is decided by the caller
 * (see {@link CompilerConfig#isStrictValidation()}).
 */
public final class WorkflowValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowValidator.class);

    static final String CONFIG_MAX_ITERATIONS = "max_iterations";
    static final String CONFIG_OUTPUT_KEY = "output_key";
    static final String CONFIG_CONTENT = "content";
    static final String CONFIG_CODE = "code";

    private final CompilerConfig config;

    public WorkflowValidator() {
        this(CompilerConfig.defaults());
    }

    public WorkflowValidator(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Validates the graph.
     *
     * @param graph        built graph
     * @param contentTable external content by reference ({@code file_path}); null means no content is available
     * @return errors and warnings, each in check order
     */
    public ValidationResult validate(WorkflowGraph graph, Map<String, String> contentTable) {
        Objects.requireNonNull(graph, "graph");
        Map<String, String> content = contentTable != null ? contentTable : Map.of();
        List<ValidationIssue> issues = new ArrayList<>();

        checkCycles(graph, issues);
        checkMissingReferences(graph, content, issues);
        checkIsolatedTasks(graph, issues);
        checkUnusedContent(graph, issues);
        checkTaskBehavior(graph, issues);
        checkSequentialDataFlow(graph, issues);
        checkStartNodes(graph, issues);
        checkDuplicateNames(graph, issues);
        checkContextConflicts(graph, issues);

        ValidationResult result = ValidationResult.of(issues);
        if (result.isValid()) {
            log.info("Validation passed: warnings={}", result.getWarnings().size());
        } else {
            log.warn("Validation failed: errors={} warnings={}", result.getErrors().size(), result.getWarnings().size());
        }
        if (log.isDebugEnabled()) {
            for (ValidationIssue issue : issues) {
                log.debug("{}", issue);
            }
        }
        return result;
    }

    private void checkCycles(WorkflowGraph graph, List<ValidationIssue> issues) {
        Optional<List<String>> cycle = TopologicalSorter.findCycle(graph);
        if (cycle.isEmpty()) return;
        List<String> path = cycle.get();
        GraphNode first = graph.getNode(path.get(0));
        issues.add(new ValidationIssue(IssueKind.CYCLE,
                "Cycle in sequential flow: " + String.join(" -> ", path),
                first != null ? first.toLocation() : null));
    }

    private void checkMissingReferences(WorkflowGraph graph, Map<String, String> content, List<ValidationIssue> issues) {
        for (GraphNode node : graph.getNodeList()) {
            if (!node.getKind().isFileBased()) continue;
            String filePath = node.getConfigString(GraphNode.CONFIG_FILE_PATH);
            if (filePath == null || content.containsKey(filePath)) continue;
            issues.add(new ValidationIssue(IssueKind.MISSING_REFERENCE,
                    describeKind(node) + " '" + label(node) + "' references missing content: " + filePath,
                    node.toLocation().withFilePath(filePath)));
        }
    }

    private void checkIsolatedTasks(WorkflowGraph graph, List<ValidationIssue> issues) {
        for (GraphNode node : graph.getTaskNodes()) {
            if (node.isIsolated()) {
                issues.add(new ValidationIssue(IssueKind.ISOLATED_TASK,
                        "Task '" + label(node) + "' has no connections (isolated node)", node.toLocation()));
            }
        }
    }

    private void checkUnusedContent(WorkflowGraph graph, List<ValidationIssue> issues) {
        for (GraphNode node : graph.getNodeList()) {
            if (node.getKind().isContentProvider() && node.getOutgoing().isEmpty()) {
                issues.add(new ValidationIssue(IssueKind.UNUSED_CONTENT,
                        describeKind(node) + " '" + label(node) + "' is not connected to any task", node.toLocation()));
            }
        }
    }

    private void checkTaskBehavior(WorkflowGraph graph, List<ValidationIssue> issues) {
        for (GraphNode node : graph.getTaskNodes()) {
            TaskBehavior behavior = node.getBehavior();

            // isolated tasks already carry their own warning
            if (behavior.requiresInstructions() && !node.isIsolated() && !node.hasIncoming(SemanticTag.INPUT_DATA)) {
                issues.add(new ValidationIssue(IssueKind.MISSING_INSTRUCTION,
                        "Task '" + label(node) + "' has no connected prompt, context or tool", node.toLocation()));
            }

            if (behavior.isComposite() && node.getOutgoing().stream().noneMatch(e -> e.getSemantics().isTaskFlow())) {
                issues.add(new ValidationIssue(IssueKind.EMPTY_COMPOSITE,
                        capitalize(behavior) + " task '" + label(node) + "' has no child tasks", node.toLocation()));
            }

            if (behavior == TaskBehavior.LOOP) {
                checkLoopBound(node, issues);
            }
        }
    }

    private void checkLoopBound(GraphNode node, List<ValidationIssue> issues) {
        Object raw = node.getConfig().get(CONFIG_MAX_ITERATIONS);
        Long bound = raw == null ? Long.valueOf(config.getDefaultLoopIterations()) : parseBound(raw);
        if (bound == null || bound <= 0) {
            issues.add(new ValidationIssue(IssueKind.INVALID_LOOP_BOUND,
                    "Loop task '" + label(node) + "' has invalid " + CONFIG_MAX_ITERATIONS + ": " + raw,
                    node.toLocation()));
        } else if (bound > config.getLoopIterationsWarnAbove()) {
            issues.add(new ValidationIssue(IssueKind.LOOP_BOUND_HIGH,
                    "Loop task '" + label(node) + "' has high " + CONFIG_MAX_ITERATIONS + " (" + bound + ")",
                    node.toLocation()));
        }
    }

    /** Whole number from a numeric or numeric-string value; null when not a whole number. */
    static Long parseBound(Object raw) {
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || d != Math.rint(d)) return null;
            return ((Number) raw).longValue();
        }
        if (raw instanceof String) {
            try {
                return Long.parseLong(((String) raw).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private void checkSequentialDataFlow(WorkflowGraph graph, List<ValidationIssue> issues) {
        if (!config.isWarnMissingOutputKey()) return;
        for (GraphEdge edge : graph.getEdges()) {
            if (!edge.is(SemanticTag.SEQUENTIAL)) continue;
            GraphNode source = graph.getNode(edge.getSourceId());
            GraphNode target = graph.getNode(edge.getTargetId());
            if (source == null || target == null || !source.isTask() || !target.isTask()) continue;
            if (source.getConfigString(CONFIG_OUTPUT_KEY) == null) {
                issues.add(new ValidationIssue(IssueKind.MISSING_OUTPUT_KEY,
                        "Task '" + label(source) + "' outputs to '" + label(target) + "' but has no "
                                + CONFIG_OUTPUT_KEY + "; the receiving task cannot read its output",
                        source.toLocation()));
            }
        }
    }

    private void checkStartNodes(WorkflowGraph graph, List<ValidationIssue> issues) {
        List<GraphNode> starts = graph.getNodesOfKind(NodeKind.START);
        if (starts.size() > 1) {
            issues.add(new ValidationIssue(IssueKind.MULTIPLE_START_NODES,
                    "Workflow has " + starts.size() + " start nodes; only one is allowed", starts.get(1).toLocation()));
        } else if (starts.size() == 1 && starts.get(0).getOutgoing().isEmpty()) {
            issues.add(new ValidationIssue(IssueKind.DISCONNECTED_START,
                    "Start node is not connected to any task", starts.get(0).toLocation()));
        }
    }

    /**
     * Tasks and variables need unique names. File-based content nodes may share a name only when they point
     * to the same file with the same inline content.
     */
    private void checkDuplicateNames(WorkflowGraph graph, List<ValidationIssue> issues) {
        Map<String, List<GraphNode>> byName = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodeList()) {
            NodeKind kind = node.getKind();
            if (!requiresUniqueName(kind) && !kind.isFileBased()) continue;
            if (node.getName().isBlank()) continue;
            byName.computeIfAbsent(node.getName(), k -> new ArrayList<>()).add(node);
        }

        for (Map.Entry<String, List<GraphNode>> e : byName.entrySet()) {
            String name = e.getKey();
            List<GraphNode> nodes = e.getValue();
            if (nodes.size() < 2) continue;

            List<GraphNode> unique = new ArrayList<>();
            for (GraphNode n : nodes) {
                if (requiresUniqueName(n.getKind())) unique.add(n);
            }
            if (!unique.isEmpty()) {
                for (GraphNode n : unique) {
                    issues.add(new ValidationIssue(IssueKind.DUPLICATE_NAME,
                            "Duplicate name '" + name + "': " + describeKind(n).toLowerCase() + " names must be unique",
                            n.toLocation()));
                }
                for (GraphNode n : nodes) {
                    if (!n.getKind().isFileBased()) continue;
                    issues.add(new ValidationIssue(IssueKind.DUPLICATE_NAME,
                            "Duplicate name '" + name + "': conflicts with " + describeKind(unique.get(0)).toLowerCase(),
                            n.toLocation()));
                }
                continue;
            }
            checkFileBasedDuplicates(name, nodes, issues);
        }
    }

    private void checkFileBasedDuplicates(String name, List<GraphNode> nodes, List<ValidationIssue> issues) {
        GraphNode reference = nodes.get(0);
        boolean allSame = true;
        for (GraphNode n : nodes) {
            if (!Objects.equals(n.getConfigString(GraphNode.CONFIG_FILE_PATH), reference.getConfigString(GraphNode.CONFIG_FILE_PATH))
                    || !Objects.equals(inlineContent(n), inlineContent(reference))) {
                allSame = false;
                break;
            }
        }
        if (allSame) return;
        for (GraphNode n : nodes) {
            String filePath = n.getConfigString(GraphNode.CONFIG_FILE_PATH);
            issues.add(new ValidationIssue(IssueKind.DUPLICATE_NAME,
                    "Duplicate name '" + name + "' with different content; rename the node or use the same file",
                    n.toLocation().withFilePath(filePath)));
        }
    }

    private void checkContextConflicts(WorkflowGraph graph, List<ValidationIssue> issues) {
        for (GraphNode node : graph.getTaskNodes()) {
            List<String> sources = new ArrayList<>();
            for (GraphEdge e : node.getIncoming()) {
                if (e.getSemantics().inputKind() != InputKind.CONTEXT) continue;
                GraphNode source = graph.getNode(e.getSourceId());
                if (source != null) sources.add(label(source));
            }
            if (sources.size() > 1) {
                issues.add(new ValidationIssue(IssueKind.CONTEXT_CONFLICT,
                        "Task '" + label(node) + "' has " + sources.size() + " context sources: "
                                + String.join(", ", sources) + "; make sure their variable names do not conflict",
                        node.toLocation()));
            }
        }
    }

    private static boolean requiresUniqueName(NodeKind kind) {
        return kind == NodeKind.TASK || kind == NodeKind.VARIABLE;
    }

    private static String inlineContent(GraphNode node) {
        return switch (node.getKind()) {
            case PROMPT, CONTEXT -> node.getConfigString(CONFIG_CONTENT);
            case TOOL, AGENT_TOOL -> node.getConfigString(CONFIG_CODE);
            default -> null;
        };
    }

    private static String label(GraphNode node) {
        return node.getName().isBlank() ? node.getId() : node.getName();
    }

    private static String describeKind(GraphNode node) {
        return switch (node.getKind()) {
            case TASK -> "Task";
            case PROMPT -> "Prompt";
            case CONTEXT -> "Context";
            case VARIABLE -> "Variable";
            case TOOL -> "Tool";
            case AGENT_TOOL -> "Agent tool";
            default -> node.getKind().name();
        };
    }

    private static String capitalize(TaskBehavior behavior) {
        String n = behavior.name().toLowerCase();
        return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }
}

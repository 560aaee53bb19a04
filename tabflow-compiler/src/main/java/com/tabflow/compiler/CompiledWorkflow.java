package com.tabflow.compiler;

import com.tabflow.compiler.graph.WorkflowGraph;
import com.tabflow.compiler.validation.ValidationResult;
import com.tabflow.workflow.hierarchy.HierarchyNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of one {@link WorkflowCompiler#compile} call.
 */
public final class CompiledWorkflow {

    private final WorkflowGraph graph;
    private final ValidationResult validationResult;
    private final List<String> topologicalOrder;
    private final HierarchyNode hierarchy;

    CompiledWorkflow(WorkflowGraph graph, ValidationResult validationResult,
                     List<String> topologicalOrder, HierarchyNode hierarchy) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.validationResult = Objects.requireNonNull(validationResult, "validationResult");
        this.topologicalOrder = List.copyOf(topologicalOrder);
        this.hierarchy = hierarchy;
    }

    public WorkflowGraph getGraph() {
        return graph;
    }

    /** Warnings, plus errors when compiled in lenient mode. */
    public ValidationResult getValidationResult() {
        return validationResult;
    }

    public List<String> getTopologicalOrder() {
        return topologicalOrder;
    }

    /** Root of the execution tree; empty when the workflow has no reachable task. */
    public Optional<HierarchyNode> getHierarchy() {
        return Optional.ofNullable(hierarchy);
    }
}

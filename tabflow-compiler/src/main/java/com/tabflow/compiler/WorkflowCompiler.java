package com.tabflow.compiler;

import com.tabflow.compiler.edge.EdgeRuleTable;
import com.tabflow.compiler.edge.EdgeSemanticsResolver;
import com.tabflow.compiler.error.ValidationFailedException;
import com.tabflow.compiler.graph.GraphBuilder;
import com.tabflow.compiler.graph.TopologicalSorter;
import com.tabflow.compiler.graph.WorkflowGraph;
import com.tabflow.compiler.hierarchy.HierarchySynthesizer;
import com.tabflow.compiler.validation.ValidationIssue;
import com.tabflow.compiler.validation.ValidationResult;
import com.tabflow.compiler.validation.WorkflowValidator;
import com.tabflow.config.CompilerConfig;
import com.tabflow.workflow.hierarchy.HierarchyNode;
import com.tabflow.workflow.source.WorkflowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles a workflow: build graph, validate, order, synthesize the execution tree.
 * <p>
 * Stateless between calls; a compiler may be shared. Each call builds its own graph and uses a fresh
 * {@link HierarchySynthesizer}.
 */
public final class WorkflowCompiler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final CompilerConfig config;
    private final GraphBuilder graphBuilder;
    private final WorkflowValidator validator;

    public WorkflowCompiler() {
        this(CompilerConfig.fromEnvironment(), EdgeRuleTable.defaults());
    }

    public WorkflowCompiler(CompilerConfig config) {
        this(config, EdgeRuleTable.defaults());
    }

    public WorkflowCompiler(CompilerConfig config, EdgeRuleTable ruleTable) {
        this.config = Objects.requireNonNull(config, "config");
        this.graphBuilder = new GraphBuilder(new EdgeSemanticsResolver(Objects.requireNonNull(ruleTable, "ruleTable")));
        this.validator = new WorkflowValidator(config);
    }

    public CompilerConfig getConfig() {
        return config;
    }

    /**
     * Compiles the workflow.
     *
     * @param source       regions with their nodes and edges
     * @param contentTable external content by reference, used for the missing-reference check; may be null
     * @throws com.tabflow.compiler.error.StructuralException    unknown edge endpoint, duplicate node id or link name
     * @throws ValidationFailedException                         strict mode and validation found errors
     * @throws com.tabflow.compiler.error.CycleDetectedException the sequential flow has a cycle
     */
    public CompiledWorkflow compile(WorkflowSource source, Map<String, String> contentTable) {
        Objects.requireNonNull(source, "source");
        log.info("Compiling workflow {} (regions={}, strict={})",
                source.name(), source.regions().size(), config.isStrictValidation());

        WorkflowGraph graph = graphBuilder.build(source);

        ValidationResult validation = validator.validate(graph, contentTable);
        for (ValidationIssue warning : validation.getWarnings()) {
            log.warn("{}", warning);
        }
        if (!validation.isValid()) {
            if (config.isStrictValidation()) {
                throw new ValidationFailedException(validation);
            }
            for (ValidationIssue error : validation.getErrors()) {
                log.warn("Continuing despite validation error (lenient mode): {}", error);
            }
        }

        List<String> order = TopologicalSorter.sort(graph);
        HierarchyNode root = new HierarchySynthesizer(graph).synthesize().orElse(null);

        log.info("Compiled workflow {}: nodes={} tasks={} rootType={}",
                source.name(), graph.getNodes().size(), graph.getTaskNodes().size(),
                root != null ? root.getType() : null);
        return new CompiledWorkflow(graph, validation, order, root);
    }

    public CompiledWorkflow compile(WorkflowSource source) {
        return compile(source, Map.of());
    }
}

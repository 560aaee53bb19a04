package com.tabflow.compiler;

import com.tabflow.compiler.edge.EdgeRule;
import com.tabflow.compiler.edge.EdgeRuleTable;
import com.tabflow.compiler.edge.EdgeSemantics;
import com.tabflow.compiler.error.CycleDetectedException;
import com.tabflow.compiler.error.StructuralException;
import com.tabflow.compiler.error.ValidationFailedException;
import com.tabflow.compiler.graph.NodeKind;
import com.tabflow.compiler.validation.IssueKind;
import com.tabflow.config.CompilerConfig;
import com.tabflow.workflow.WorkflowJson;
import com.tabflow.workflow.hierarchy.HierarchyNode;
import com.tabflow.workflow.source.WorkflowSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.tabflow.compiler.WorkflowFixtures.region;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowCompilerTest {

    private static final String RESEARCH_FLOW = """
            {
              "name": "research",
              "regions": [
                {
                  "id": "tab1",
                  "name": "Collect",
                  "nodes": [
                    { "id": "start", "type": "start", "name": "Start" },
                    { "id": "brief", "type": "prompt", "name": "Brief", "config": { "file_path": "prompts/brief.md" } },
                    { "id": "plan", "type": "agent", "name": "Planner", "config": { "output_key": "plan" } },
                    { "id": "web", "type": "agent", "name": "WebSearch", "config": { "output_key": "web" } },
                    { "id": "papers", "type": "agent", "name": "PaperSearch", "config": { "output_key": "papers" } },
                    { "id": "out", "type": "teleportOut", "name": "toWriting" }
                  ],
                  "edges": [
                    { "id": "e1", "source": "start", "target": "plan" },
                    { "id": "e2", "source": "brief", "target": "plan" },
                    { "id": "e3", "source": "brief", "target": "web" },
                    { "id": "e4", "source": "brief", "target": "papers" },
                    { "id": "e5", "source": "plan", "target": "web", "sourceHandle": "output", "targetHandle": "input" },
                    { "id": "e6", "source": "plan", "target": "papers", "sourceHandle": "output", "targetHandle": "input" },
                    { "id": "e7", "source": "web", "target": "out", "sourceHandle": "output" },
                    { "id": "e8", "source": "papers", "target": "out", "sourceHandle": "output" }
                  ]
                },
                {
                  "id": "tab2",
                  "name": "Write",
                  "nodes": [
                    { "id": "in", "type": "teleportIn", "name": "toWriting" },
                    { "id": "style", "type": "context", "name": "Style", "config": { "file_path": "context/style.md" } },
                    { "id": "write", "type": "agent", "name": "Writer", "config": { "output_key": "draft" } }
                  ],
                  "edges": [
                    { "id": "e9", "source": "in", "target": "write", "targetHandle": "input" },
                    { "id": "e10", "source": "style", "target": "write" }
                  ]
                }
              ]
            }
            """;

    private static final Map<String, String> CONTENT = Map.of(
            "prompts/brief.md", "Research {topic}.",
            "context/style.md", "Be concise.");

    private final WorkflowCompiler compiler = new WorkflowCompiler(CompilerConfig.defaults());

    @Test
    void compile_researchFlowToHierarchy() {
        CompiledWorkflow compiled = compiler.compile(WorkflowJson.sourceFromJson(RESEARCH_FLOW), CONTENT);

        assertTrue(compiled.getValidationResult().isValid());
        assertTrue(compiled.getValidationResult().getWarnings().isEmpty(),
                compiled.getValidationResult().getWarnings().toString());
        HierarchyNode root = compiled.getHierarchy().orElseThrow();
        assertEquals("Sequence[Leaf(plan), Sequence[Parallel[Leaf(web), Leaf(papers)], Leaf(write)]]", root.toString());
        assertEquals(String.join("\n",
                "Sequence:",
                "  - Planner",
                "  Sequence:",
                "    Parallel:",
                "      - WebSearch",
                "      - PaperSearch",
                "    - Writer"), root.toTopologyString());

        List<String> order = compiled.getTopologicalOrder();
        assertEquals(compiled.getGraph().getNodes().size(), order.size());
        assertTrue(order.indexOf("plan") < order.indexOf("web"));
        assertTrue(order.indexOf("papers") < order.indexOf("write"));
    }

    @Test
    void compile_acceptsNullConfigValues() {
        WorkflowSource source = WorkflowJson.sourceFromJson("""
                {
                  "regions": [
                    { "id": "tab1",
                      "nodes": [
                        { "id": "a", "type": "agent", "name": "A",
                          "config": { "output_key": null, "model": "x", "type": null } },
                        { "id": "b", "type": "agent", "name": "B", "config": { "max_iterations": null } }
                      ],
                      "edges": [
                        { "id": "e1", "source": "a", "target": "b", "sourceHandle": "output", "targetHandle": "input" }
                      ]
                    }
                  ]
                }
                """);

        CompiledWorkflow compiled = compiler.compile(source);

        assertTrue(compiled.getValidationResult().isValid());
        assertEquals(1, compiled.getValidationResult().getIssues(IssueKind.MISSING_OUTPUT_KEY).size());
        assertEquals("Sequence[Leaf(a), Leaf(b)]", compiled.getHierarchy().orElseThrow().toString());
    }

    @Test
    void compile_hierarchySurvivesJsonRoundTrip() {
        HierarchyNode root = compiler.compile(WorkflowJson.sourceFromJson(RESEARCH_FLOW), CONTENT)
                .getHierarchy().orElseThrow();

        assertEquals(root, WorkflowJson.hierarchyFromJson(WorkflowJson.toJson(root)));
    }

    @Test
    void compile_strictModeThrowsOnValidationErrors() {
        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> compiler.compile(WorkflowJson.sourceFromJson(RESEARCH_FLOW), Map.of()));

        assertEquals(2, ex.getValidationResult().getErrors().size());
        assertEquals("brief", ex.getLocation().nodeId());
        assertTrue(ex.getMessage().contains("prompts/brief.md"), ex.getMessage());
    }

    @Test
    void compile_lenientModeKeepsErrorsAndStillSynthesizes() {
        WorkflowCompiler lenient = new WorkflowCompiler(CompilerConfig.builder().strictValidation(false).build());

        CompiledWorkflow compiled = lenient.compile(WorkflowJson.sourceFromJson(RESEARCH_FLOW), Map.of());

        assertFalse(compiled.getValidationResult().isValid());
        assertEquals(2, compiled.getValidationResult().getIssues(IssueKind.MISSING_REFERENCE).size());
        assertEquals(5, compiled.getHierarchy().orElseThrow().collectTaskIds().size());
    }

    @Test
    void compile_cycleFailsEvenWhenLenient() {
        WorkflowSource cyclic = WorkflowFixtures.tasks(List.of("A", "B"), "A>B", "B>A");
        WorkflowCompiler lenient = new WorkflowCompiler(CompilerConfig.builder().strictValidation(false).build());

        CycleDetectedException ex = assertThrows(CycleDetectedException.class, () -> lenient.compile(cyclic));
        assertEquals(List.of("A", "B", "A"), ex.getCycle());
        assertEquals("A", ex.getLocation().nodeId());
        assertEquals("main", ex.getLocation().regionId());

        ValidationFailedException strict = assertThrows(ValidationFailedException.class, () -> compiler.compile(cyclic));
        assertEquals(IssueKind.CYCLE, strict.getValidationResult().getErrors().get(0).getKind());
    }

    @Test
    void compile_structuralErrorsFailFast() {
        WorkflowSource broken = region("tab1").task("A").then("A", "missing").toSource();

        assertThrows(StructuralException.class, () -> compiler.compile(broken));
    }

    @Test
    void compile_emptyWorkflowHasNoHierarchy() {
        CompiledWorkflow compiled = compiler.compile(WorkflowSource.of());

        assertTrue(compiled.getHierarchy().isEmpty());
        assertTrue(compiled.getTopologicalOrder().isEmpty());
    }

    @Test
    void compile_customRuleTableChangesEdgeMeaning() {
        EdgeRuleTable rules = EdgeRuleTable.defaults()
                .withRule(EdgeRule.of(NodeKind.TASK, NodeKind.TASK, EdgeSemantics.SEQUENTIAL, 1));
        WorkflowCompiler custom = new WorkflowCompiler(
                CompilerConfig.builder().strictValidation(false).build(), rules);
        WorkflowSource source = region("tab1").task("A").task("B").edge("A", "B").toSource();

        HierarchyNode root = custom.compile(source).getHierarchy().orElseThrow();

        assertEquals("Sequence[Leaf(A), Leaf(B)]", root.toString());
    }
}

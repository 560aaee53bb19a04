package com.tabflow.compiler.validation;

import com.tabflow.compiler.graph.GraphBuilder;
import com.tabflow.compiler.graph.WorkflowGraph;
import com.tabflow.config.CompilerConfig;
import com.tabflow.workflow.source.WorkflowSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.tabflow.compiler.WorkflowFixtures.config;
import static com.tabflow.compiler.WorkflowFixtures.region;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowValidatorTest {

    private static final Map<String, String> CONTENT = Map.of("prompts/brief.md", "Summarize {topic}.");

    private final GraphBuilder builder = new GraphBuilder();
    private final WorkflowValidator validator = new WorkflowValidator();

    @Test
    void validate_wellFormedWorkflowPasses() {
        WorkflowSource source = region("tab1")
                .start("s")
                .prompt("p1", "prompts/brief.md")
                .prompt("p2", "prompts/brief.md")
                .task("A", Map.of("output_key", "notes"))
                .task("B")
                .edge("s", "A")
                .edge("p1", "A")
                .edge("p2", "B")
                .then("A", "B")
                .toSource();

        ValidationResult result = validate(source);

        assertTrue(result.isValid(), result.getErrors().toString());
        assertTrue(result.getWarnings().isEmpty(), result.getWarnings().toString());
    }

    @Test
    void validate_isolatedTaskGivesExactlyOneWarning() {
        ValidationResult result = validate(region("tab1").task("Lonely").toSource());

        assertTrue(result.isValid());
        assertEquals(1, result.getWarnings().size());
        ValidationIssue warning = result.getWarnings().get(0);
        assertEquals(IssueKind.ISOLATED_TASK, warning.getKind());
        assertEquals("Lonely", warning.getLocation().nodeId());
        assertEquals("tab1", warning.getLocation().regionId());
    }

    @Test
    void validate_danglingContentReferenceGivesOneErrorNamingNode() {
        WorkflowSource source = region("tab1")
                .prompt("p1", "prompts/brief.md")
                .prompt("p2", "prompts/missing.md")
                .task("A")
                .task("B")
                .edge("p1", "A")
                .edge("p2", "B")
                .toSource();

        ValidationResult result = validate(source);

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        ValidationIssue error = result.getErrors().get(0);
        assertEquals(IssueKind.MISSING_REFERENCE, error.getKind());
        assertEquals("p2", error.getLocation().nodeId());
        assertEquals("prompts/missing.md", error.getLocation().filePath());
        assertTrue(error.getMessage().contains("prompts/missing.md"), error.getMessage());
    }

    @Test
    void validate_collectsAllMissingReferences() {
        WorkflowSource source = region("tab1")
                .prompt("p1", "a.md")
                .node("t1", "tool", "search", Map.of("file_path", "tools/search.py"))
                .node("c1", "context", "notes", Map.of("file_path", "ctx/notes.md"))
                .node("v1", "variable", "topic", Map.of("file_path", "never-checked"))
                .task("A")
                .edge("p1", "A").edge("t1", "A").edge("c1", "A").edge("v1", "A")
                .toSource();

        ValidationResult result = validate(source);

        assertEquals(3, result.getIssues(IssueKind.MISSING_REFERENCE).size());
        assertEquals(List.of("p1", "t1", "c1"),
                result.getErrors().stream().map(i -> i.getLocation().nodeId()).toList());
    }

    @Test
    void validate_cycleIsFatal() {
        WorkflowSource source = region("tab1")
                .task("A").task("B")
                .prompt("p", "prompts/brief.md")
                .edge("p", "A")
                .then("A", "B").then("B", "A")
                .toSource();

        ValidationResult result = validate(source);

        List<ValidationIssue> cycles = result.getIssues(IssueKind.CYCLE);
        assertEquals(1, cycles.size());
        assertTrue(cycles.get(0).isError());
        assertTrue(cycles.get(0).getMessage().contains("A -> B -> A"), cycles.get(0).getMessage());
    }

    @Test
    void validate_unusedContentAndMissingInstruction() {
        WorkflowSource source = region("tab1")
                .prompt("p", "prompts/brief.md")
                .node("v", "variable", "topic", Map.of())
                .task("A", Map.of("output_key", "x"))
                .task("B")
                .then("A", "B")
                .toSource();

        ValidationResult result = validate(source);

        assertTrue(result.isValid());
        assertEquals(2, result.getIssues(IssueKind.UNUSED_CONTENT).size());
        List<ValidationIssue> missing = result.getIssues(IssueKind.MISSING_INSTRUCTION);
        assertEquals(2, missing.size());
        assertEquals("A", missing.get(0).getLocation().nodeId());
    }

    @Test
    void validate_compositeWithoutChildrenWarns() {
        WorkflowSource source = region("tab1")
                .task("Group", Map.of("type", "parallel"))
                .task("Seq", Map.of("type", "sequential", "output_key", "k"))
                .task("Child")
                .prompt("p", "prompts/brief.md")
                .edge("p", "Group")
                .edge("p", "Child")
                .then("Seq", "Child")
                .toSource();

        ValidationResult result = validate(source);

        List<ValidationIssue> empty = result.getIssues(IssueKind.EMPTY_COMPOSITE);
        assertEquals(1, empty.size());
        assertEquals("Group", empty.get(0).getLocation().nodeId());
    }

    @Test
    void validate_loopBounds() {
        WorkflowSource source = region("tab1")
                .prompt("p", "prompts/brief.md")
                .task("Zero", config("type", "loop", "max_iterations", 0))
                .task("Text", config("type", "loop", "max_iterations", "lots"))
                .task("Huge", config("type", "loop", "max_iterations", 500))
                .task("Fine", config("type", "loop", "max_iterations", "12"))
                .task("Default", config("type", "loop"))
                .edge("p", "Zero").edge("p", "Text").edge("p", "Huge").edge("p", "Fine").edge("p", "Default")
                .toSource();

        ValidationResult result = validate(source);

        List<ValidationIssue> invalid = result.getIssues(IssueKind.INVALID_LOOP_BOUND);
        assertEquals(List.of("Zero", "Text"), invalid.stream().map(i -> i.getLocation().nodeId()).toList());
        List<ValidationIssue> high = result.getIssues(IssueKind.LOOP_BOUND_HIGH);
        assertEquals(1, high.size());
        assertEquals("Huge", high.get(0).getLocation().nodeId());
        assertFalse(high.get(0).isError());
    }

    @Test
    void validate_loopThresholdsComeFromConfig() {
        CompilerConfig cfg = CompilerConfig.builder().loopIterationsWarnAbove(10).defaultLoopIterations(20).build();
        WorkflowSource source = region("tab1")
                .prompt("p", "prompts/brief.md")
                .task("Default", config("type", "loop"))
                .edge("p", "Default")
                .toSource();

        ValidationResult result = new WorkflowValidator(cfg).validate(builder.build(source), CONTENT);

        assertEquals(1, result.getIssues(IssueKind.LOOP_BOUND_HIGH).size());
    }

    @Test
    void validate_startNodes() {
        ValidationResult multiple = validate(region("tab1")
                .start("s1").start("s2").task("A")
                .edge("s1", "A").edge("s2", "A")
                .toSource());
        List<ValidationIssue> starts = multiple.getIssues(IssueKind.MULTIPLE_START_NODES);
        assertEquals(1, starts.size());
        assertEquals("s2", starts.get(0).getLocation().nodeId());

        ValidationResult disconnected = validate(region("tab1").start("s").toSource());
        assertTrue(disconnected.isValid());
        assertEquals(1, disconnected.getIssues(IssueKind.DISCONNECTED_START).size());

        ValidationResult none = validate(region("tab1").task("A").toSource());
        assertTrue(none.getIssues(IssueKind.MULTIPLE_START_NODES).isEmpty());
        assertTrue(none.getIssues(IssueKind.DISCONNECTED_START).isEmpty());
    }

    @Test
    void validate_duplicateTaskNamesAreFatal() {
        WorkflowSource source = region("tab1")
                .node("a1", "agent", "Writer", Map.of())
                .node("a2", "agent", "Writer", Map.of())
                .node("p", "prompt", "Writer", Map.of("file_path", "prompts/brief.md"))
                .toSource();

        ValidationResult result = validate(source);

        List<ValidationIssue> dupes = result.getIssues(IssueKind.DUPLICATE_NAME);
        assertEquals(List.of("a1", "a2", "p"), dupes.stream().map(i -> i.getLocation().nodeId()).toList());
        assertTrue(dupes.get(2).getMessage().contains("conflicts with task"), dupes.get(2).getMessage());
    }

    @Test
    void validate_sharedFileBasedNamesAllowedOnlyForSameFile() {
        Map<String, String> content = Map.of("a.md", "A", "b.md", "B");
        WorkflowSource same = region("tab1")
                .node("p1", "prompt", "Brief", Map.of("file_path", "a.md"))
                .node("p2", "prompt", "Brief", Map.of("file_path", "a.md"))
                .toSource();
        WorkflowSource different = region("tab1")
                .node("p1", "prompt", "Brief", Map.of("file_path", "a.md"))
                .node("p2", "prompt", "Brief", Map.of("file_path", "b.md"))
                .toSource();

        assertTrue(validator.validate(builder.build(same), content).getIssues(IssueKind.DUPLICATE_NAME).isEmpty());
        List<ValidationIssue> dupes = validator.validate(builder.build(different), content)
                .getIssues(IssueKind.DUPLICATE_NAME);
        assertEquals(2, dupes.size());
        assertEquals("b.md", dupes.get(1).getLocation().filePath());
    }

    @Test
    void validate_missingOutputKeyCanBeDisabled() {
        WorkflowSource source = region("tab1")
                .prompt("p", "prompts/brief.md")
                .task("A").task("B")
                .edge("p", "A").edge("p", "B")
                .then("A", "B")
                .toSource();
        WorkflowGraph graph = builder.build(source);

        ValidationResult enabled = validator.validate(graph, CONTENT);
        List<ValidationIssue> missing = enabled.getIssues(IssueKind.MISSING_OUTPUT_KEY);
        assertEquals(1, missing.size());
        assertEquals("A", missing.get(0).getLocation().nodeId());

        CompilerConfig quiet = CompilerConfig.builder().warnMissingOutputKey(false).build();
        assertTrue(new WorkflowValidator(quiet).validate(graph, CONTENT)
                .getIssues(IssueKind.MISSING_OUTPUT_KEY).isEmpty());
    }

    @Test
    void validate_multipleContextSourcesWarn() {
        WorkflowSource source = region("tab1")
                .node("c1", "context", "style", Map.of())
                .node("v1", "variable", "topic", Map.of())
                .task("A")
                .edge("c1", "A").edge("v1", "A")
                .toSource();

        ValidationResult result = validate(source);

        List<ValidationIssue> conflicts = result.getIssues(IssueKind.CONTEXT_CONFLICT);
        assertEquals(1, conflicts.size());
        assertTrue(conflicts.get(0).getMessage().contains("style, topic"), conflicts.get(0).getMessage());
    }

    @Test
    void validate_nullContentTableMeansNothingAvailable() {
        WorkflowGraph graph = builder.build(region("tab1").prompt("p", "a.md").task("A").edge("p", "A").toSource());

        ValidationResult result = validator.validate(graph, null);

        assertEquals(1, result.getErrors().size());
        assertNull(result.getErrors().get(0).getLocation().line());
    }

    private ValidationResult validate(WorkflowSource source) {
        return validator.validate(builder.build(source), CONTENT);
    }
}

package com.tabflow.compiler.edge;

import com.tabflow.compiler.graph.NodeKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, priority-ordered table of {@link EdgeRule}s. Rules are kept sorted by descending priority;
 * rules of equal priority keep insertion order. Modifications return a new table.
 */
public final class EdgeRuleTable {

    public static final String HANDLE_OUTPUT = "output";
    public static final String HANDLE_INPUT = "input";
    public static final String HANDLE_LINK_TOP = "link-top";
    public static final String HANDLE_LINK_BOTTOM = "link-bottom";

    private static final EdgeRuleTable DEFAULT = new EdgeRuleTable(List.of(
            EdgeRule.of(NodeKind.PROMPT, NodeKind.TASK, EdgeSemantics.INSTRUCTION, 10),
            EdgeRule.of(NodeKind.CONTEXT, NodeKind.TASK, EdgeSemantics.CONTEXT, 10),
            EdgeRule.of(NodeKind.TOOL, NodeKind.TASK, EdgeSemantics.TOOL, 10),
            EdgeRule.of(NodeKind.AGENT_TOOL, NodeKind.TASK, EdgeSemantics.TOOL, 10),
            EdgeRule.ofHandles(NodeKind.TASK, NodeKind.TASK, HANDLE_OUTPUT, HANDLE_INPUT, EdgeSemantics.SEQUENTIAL, 10),
            EdgeRule.ofHandles(NodeKind.TASK, NodeKind.TASK, HANDLE_LINK_TOP, HANDLE_LINK_BOTTOM, EdgeSemantics.PARALLEL, 10),
            EdgeRule.ofHandles(NodeKind.TASK, NodeKind.TASK, HANDLE_LINK_BOTTOM, HANDLE_LINK_TOP, EdgeSemantics.PARALLEL, 10),
            EdgeRule.of(NodeKind.TASK, NodeKind.OUTPUT_FILE, EdgeSemantics.OUTPUT_SINK, 10),
            EdgeRule.of(NodeKind.LINK_OUT, NodeKind.LINK_IN, EdgeSemantics.CROSS_REGION_LINK, 10),
            EdgeRule.of(NodeKind.TASK, NodeKind.LINK_OUT, EdgeSemantics.CROSS_REGION_LINK, 10),
            EdgeRule.of(NodeKind.LINK_IN, NodeKind.TASK, EdgeSemantics.CROSS_REGION_LINK, 10),
            EdgeRule.of(NodeKind.VARIABLE, NodeKind.TASK, EdgeSemantics.CONTEXT, 5),
            EdgeRule.of(NodeKind.START, NodeKind.TASK, EdgeSemantics.SEQUENTIAL, 10),
            EdgeRule.of(NodeKind.TASK, NodeKind.END, EdgeSemantics.SEQUENTIAL, 10)
    ));

    private final List<EdgeRule> rules;

    private EdgeRuleTable(List<EdgeRule> rules) {
        List<EdgeRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(EdgeRule::priority).reversed());
        this.rules = List.copyOf(sorted);
    }

    /** Built-in rules for the canvas node types. */
    public static EdgeRuleTable defaults() {
        return DEFAULT;
    }

    public static EdgeRuleTable of(List<EdgeRule> rules) {
        return new EdgeRuleTable(rules != null ? rules : List.of());
    }

    /** Rules in evaluation order (descending priority). Unmodifiable. */
    public List<EdgeRule> getRules() {
        return rules;
    }

    /** Returns a new table with the rule added. */
    public EdgeRuleTable withRule(EdgeRule rule) {
        List<EdgeRule> next = new ArrayList<>(rules);
        next.add(rule);
        return new EdgeRuleTable(next);
    }

    /** Returns a new table without any rule for the given kind pair. */
    public EdgeRuleTable withoutRulesFor(NodeKind sourceKind, NodeKind targetKind) {
        List<EdgeRule> next = new ArrayList<>();
        for (EdgeRule r : rules) {
            if (r.sourceKind() == sourceKind && r.targetKind() == targetKind) continue;
            next.add(r);
        }
        return new EdgeRuleTable(next);
    }

    /** First matching rule in evaluation order. */
    public Optional<EdgeRule> findMatch(NodeKind sourceKind, NodeKind targetKind, String sourceHandle, String targetHandle) {
        for (EdgeRule rule : rules) {
            if (rule.matches(sourceKind, targetKind, sourceHandle, targetHandle)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}

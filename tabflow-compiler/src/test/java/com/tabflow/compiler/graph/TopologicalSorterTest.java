package com.tabflow.compiler.graph;

import com.tabflow.compiler.WorkflowFixtures;
import com.tabflow.compiler.edge.SemanticTag;
import com.tabflow.compiler.error.CycleDetectedException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopologicalSorterTest {

    private final GraphBuilder builder = new GraphBuilder();

    @Test
    void sort_respectsSequentialEdges() {
        WorkflowGraph graph = builder.build(WorkflowFixtures.tasks(
                List.of("D", "C", "B", "A", "E"), "A>B", "A>C", "B>D", "C>D"));

        List<String> order = TopologicalSorter.sort(graph);

        assertEquals(5, order.size());
        for (GraphEdge e : graph.getEdges()) {
            if (!e.is(SemanticTag.SEQUENTIAL)) continue;
            assertTrue(order.indexOf(e.getSourceId()) < order.indexOf(e.getTargetId()),
                    e.getSourceId() + " must precede " + e.getTargetId() + " in " + order);
        }
        assertTrue(order.contains("E"));
    }

    @Test
    void sort_coversNonTaskNodes() {
        WorkflowGraph graph = builder.build(WorkflowFixtures.region("r")
                .start("s").task("A").prompt("p", null)
                .edge("s", "A").edge("p", "A")
                .toSource());

        List<String> order = graph.topologicalSort();

        assertEquals(3, order.size());
        assertTrue(order.indexOf("s") < order.indexOf("A"));
    }

    @Test
    void sort_cycleThrowsWithClosedPath() {
        WorkflowGraph graph = builder.build(WorkflowFixtures.tasks(
                List.of("A", "B", "C"), "A>B", "B>C", "C>A"));

        CycleDetectedException ex = assertThrows(CycleDetectedException.class, () -> TopologicalSorter.sort(graph));

        assertEquals(List.of("A", "B", "C", "A"), ex.getCycle());
        assertEquals("A", ex.getLocation().nodeId());
        assertEquals("main", ex.getLocation().regionId());
        assertEquals("agent", ex.getLocation().nodeType());
        assertTrue(ex.getMessage().contains("A"), ex.getMessage());
    }

    @Test
    void findCycle_reportsOnlyTheCyclicPart() {
        WorkflowGraph graph = builder.build(WorkflowFixtures.tasks(
                List.of("A", "B", "C", "D"), "A>B", "B>C", "C>D", "D>B"));

        Optional<List<String>> cycle = TopologicalSorter.findCycle(graph);

        assertTrue(cycle.isPresent());
        assertEquals(List.of("B", "C", "D", "B"), cycle.get());
    }

    @Test
    void findCycle_emptyForAcyclicGraph() {
        WorkflowGraph graph = builder.build(WorkflowFixtures.tasks(List.of("A", "B"), "A>B"));
        assertTrue(TopologicalSorter.findCycle(graph).isEmpty());
    }

    @Test
    void sort_longChainDoesNotOverflowStack() {
        List<String> ids = new ArrayList<>();
        List<String> links = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            ids.add("t" + i);
            if (i > 0) links.add("t" + (i - 1) + ">t" + i);
        }
        WorkflowGraph graph = builder.build(WorkflowFixtures.tasks(ids, links.toArray(new String[0])));

        List<String> order = TopologicalSorter.sort(graph);

        assertEquals(ids, order);
    }
}

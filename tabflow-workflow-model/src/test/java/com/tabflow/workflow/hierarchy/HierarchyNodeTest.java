package com.tabflow.workflow.hierarchy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HierarchyNodeTest {

    private static HierarchyNode sample() {
        return HierarchyNode.sequence("__seq_1__", List.of(
                HierarchyNode.leaf("a", "A"),
                HierarchyNode.sequence("__seq_3__", List.of(
                        HierarchyNode.parallel("__parallel_2__", List.of(
                                HierarchyNode.leaf("b", "B"),
                                HierarchyNode.leaf("c", null))),
                        HierarchyNode.leaf("d", "D")))));
    }

    @Test
    void collectTaskIds_returnsLeavesInExecutionOrder() {
        assertEquals(List.of("a", "b", "c", "d"), sample().collectTaskIds());
    }

    @Test
    void findNodeById_searchesWholeTree() {
        HierarchyNode root = sample();

        HierarchyNode parallel = HierarchyNode.findNodeById(root, "__parallel_2__");

        assertEquals(HierarchyNodeType.PARALLEL, parallel.getType());
        assertSame(root, HierarchyNode.findNodeById(root, "__seq_1__"));
        assertNull(HierarchyNode.findNodeById(root, "missing"));
        assertNull(HierarchyNode.findNodeById(null, "a"));
    }

    @Test
    void toTopologyString_indentsChildrenAndFallsBackToTaskId() {
        String expected = String.join("\n",
                "Sequence:",
                "  - A",
                "  Sequence:",
                "    Parallel:",
                "      - B",
                "      - c",
                "    - D");

        assertEquals(expected, sample().toTopologyString());
    }

    @Test
    void leaf_requiresTaskIdAndHasNoChildren() {
        HierarchyNode leaf = HierarchyNode.leaf("x", "X");

        assertTrue(leaf.isLeaf());
        assertTrue(leaf.getChildren().isEmpty());
        assertEquals("x", leaf.getId());
        assertThrows(NullPointerException.class, () -> HierarchyNode.leaf(null, "X"));
    }

    @Test
    void typeFromValue_isCaseInsensitiveAndDefaultsToLeaf() {
        assertEquals(HierarchyNodeType.PARALLEL, HierarchyNodeType.fromValue(" parallel "));
        assertEquals(HierarchyNodeType.LEAF, HierarchyNodeType.fromValue("bogus"));
        assertEquals(HierarchyNodeType.LEAF, HierarchyNodeType.fromValue(null));
    }
}

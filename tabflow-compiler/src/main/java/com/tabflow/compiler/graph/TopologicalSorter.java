package com.tabflow.compiler.graph;

import com.tabflow.compiler.edge.SemanticTag;
import com.tabflow.compiler.error.CycleDetectedException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Orders node ids along SEQUENTIAL edges and detects cycles. Depth-first with three-state marking,
 * started from every unvisited node in graph order so unreachable components are covered. The traversal
 * keeps its own stack, so chain length does not bound the call stack.
 */
public final class TopologicalSorter {

    private enum Mark { IN_PROGRESS, DONE }

    private TopologicalSorter() {
    }

    /**
     * Returns every node id such that each node precedes all its SEQUENTIAL successors
     * (the reverse of DFS finish order).
     *
     * @throws CycleDetectedException with the cycle path, closed by repeating its first node
     */
    public static List<String> sort(WorkflowGraph graph) {
        List<String> finished = new ArrayList<>();
        List<String> cycle = traverse(graph, finished);
        if (cycle != null) {
            GraphNode first = graph.getNode(cycle.get(0));
            throw new CycleDetectedException(cycle, first != null ? first.toLocation() : null);
        }
        Collections.reverse(finished);
        return finished;
    }

    /** The first cycle found, without throwing. */
    public static Optional<List<String>> findCycle(WorkflowGraph graph) {
        return Optional.ofNullable(traverse(graph, new ArrayList<>()));
    }

    private static List<String> traverse(WorkflowGraph graph, List<String> finished) {
        Map<String, Mark> marks = new HashMap<>();
        for (String startId : graph.getNodes().keySet()) {
            if (marks.containsKey(startId)) continue;

            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            marks.put(startId, Mark.IN_PROGRESS);
            stack.push(new Frame(startId, successors(graph, startId)));
            path.add(startId);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    Mark mark = marks.get(next);
                    if (mark == Mark.IN_PROGRESS) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                        cycle.add(next);
                        return cycle;
                    }
                    if (mark == null) {
                        marks.put(next, Mark.IN_PROGRESS);
                        stack.push(new Frame(next, successors(graph, next)));
                        path.add(next);
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    marks.put(frame.nodeId, Mark.DONE);
                    finished.add(frame.nodeId);
                }
            }
        }
        return null;
    }

    /** SEQUENTIAL targets that exist in the graph, in edge order. */
    private static Iterator<String> successors(WorkflowGraph graph, String nodeId) {
        GraphNode node = graph.getNode(nodeId);
        List<String> targets = new ArrayList<>();
        if (node != null) {
            for (GraphEdge e : node.getOutgoing()) {
                if (e.is(SemanticTag.SEQUENTIAL) && graph.containsNode(e.getTargetId())) {
                    targets.add(e.getTargetId());
                }
            }
        }
        return targets.iterator();
    }

    private static final class Frame {
        private final String nodeId;
        private final Iterator<String> successors;

        private Frame(String nodeId, Iterator<String> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }
    }
}

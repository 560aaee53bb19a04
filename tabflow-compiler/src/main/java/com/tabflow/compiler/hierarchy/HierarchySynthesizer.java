package com.tabflow.compiler.hierarchy;

import com.tabflow.compiler.graph.GraphNode;
import com.tabflow.compiler.graph.WorkflowGraph;
import com.tabflow.workflow.hierarchy.HierarchyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the acyclic SEQUENTIAL task subgraph into a strict tree of SEQUENCE / PARALLEL / LEAF nodes
 * without placing any task twice.
 * <p>
 * Straight chains become sequences. At a fork the branches are searched for a merge point; if one exists
 * the result is {@code Sequence[Parallel[branches up to the merge point], continuation from the merge point]},
 * otherwise the branches run fully in one PARALLEL. Chains are walked in a loop, so recursion depth grows
 * with the number of nested forks only.
 * <p>
 * The graph must have passed {@link com.tabflow.compiler.graph.TopologicalSorter} first; a cyclic graph
 * gives an undefined (but finite) result.
 */
public final class HierarchySynthesizer {

    private static final Logger log = LoggerFactory.getLogger(HierarchySynthesizer.class);

    private static final String SEQUENCE_PREFIX = "seq";
    private static final String PARALLEL_PREFIX = "parallel";

    private final WorkflowGraph graph;
    private final MergePointFinder mergePointFinder;

    public HierarchySynthesizer(WorkflowGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.mergePointFinder = new MergePointFinder(graph);
    }

    /** Synthesizes from the graph's entry nodes. */
    public Optional<HierarchyNode> synthesize() {
        return synthesize(graph.getEntryNodes());
    }

    /**
     * Synthesizes the tree reachable from the given roots, in root order. Each call runs a fresh pass;
     * repeated calls on an unchanged graph give equal trees.
     *
     * @return the root of the tree, or empty when no task is reachable
     */
    public Optional<HierarchyNode> synthesize(List<GraphNode> roots) {
        SynthesisState state = new SynthesisState(graph);
        HierarchyNode root = buildTree(roots != null ? roots : List.of(), state, Set.of());
        if (log.isDebugEnabled()) {
            log.debug("Hierarchy synthesized: roots={} placedTasks={} root={}",
                    roots != null ? roots.size() : 0, state.placedCount(), root != null ? root.getId() : null);
        }
        return Optional.ofNullable(root);
    }

    /**
     * One level of the recursion: no roots, a single chain, or a fork.
     *
     * @param boundary nodes this call must stop before (the merge point of an enclosing fork)
     */
    private HierarchyNode buildTree(List<GraphNode> roots, SynthesisState state, Set<String> boundary) {
        List<GraphNode> pending = new ArrayList<>();
        for (GraphNode r : roots) {
            if (r == null || state.isPlaced(r) || boundary.contains(r.getId()) || pending.contains(r)) continue;
            pending.add(r);
        }
        if (pending.isEmpty()) return null;
        if (pending.size() == 1) return buildChain(pending.get(0), state, boundary);

        GraphNode mergePoint = mergePointFinder.find(pending, state, boundary);
        if (mergePoint != null) {
            return buildForkJoin(pending, mergePoint, state, boundary);
        }
        return buildFanOut(pending, state, boundary);
    }

    /**
     * Walks a straight chain from start. Stops at the end of the chain, before a boundary node, at an
     * already placed node, or at a fork, whose subtree becomes the last element.
     */
    private HierarchyNode buildChain(GraphNode start, SynthesisState state, Set<String> boundary) {
        List<HierarchyNode> chain = new ArrayList<>();
        GraphNode current = start;
        while (current != null && !state.isPlaced(current) && !boundary.contains(current.getId())) {
            state.place(current);
            chain.add(HierarchyNode.leaf(current.getId(), current.getName()));

            List<GraphNode> next = unplacedSuccessors(current, state, boundary);
            if (next.isEmpty()) {
                current = null;
            } else if (next.size() == 1) {
                current = next.get(0);
            } else {
                HierarchyNode fork = buildTree(next, state, boundary);
                if (fork != null) chain.add(fork);
                current = null;
            }
        }
        return wrapSequence(chain, state);
    }

    /** Branches up to the merge point in parallel, then the continuation from the merge point. */
    private HierarchyNode buildForkJoin(List<GraphNode> roots, GraphNode mergePoint,
                                        SynthesisState state, Set<String> boundary) {
        Set<String> branchBoundary = new HashSet<>(boundary);
        branchBoundary.add(mergePoint.getId());

        List<HierarchyNode> branches = new ArrayList<>();
        for (GraphNode root : roots) {
            HierarchyNode branch = buildChain(root, state, branchBoundary);
            if (branch != null) branches.add(branch);
        }
        HierarchyNode parallel = wrapParallel(branches, state);

        if (log.isDebugEnabled()) {
            log.debug("Fork-join: roots={} mergePoint={} branches={}",
                    roots.stream().map(GraphNode::getId).toList(), mergePoint.getId(), branches.size());
        }

        HierarchyNode continuation = buildTree(List.of(mergePoint), state, boundary);
        if (continuation == null) return parallel;
        if (parallel == null) return continuation;
        return HierarchyNode.sequence(state.nextWrapperId(SEQUENCE_PREFIX), List.of(parallel, continuation));
    }

    /** Branches that never converge: each runs to its end. */
    private HierarchyNode buildFanOut(List<GraphNode> roots, SynthesisState state, Set<String> boundary) {
        List<HierarchyNode> branches = new ArrayList<>();
        for (GraphNode root : roots) {
            HierarchyNode branch = buildChain(root, state, boundary);
            if (branch != null) branches.add(branch);
        }
        return wrapParallel(branches, state);
    }

    private List<GraphNode> unplacedSuccessors(GraphNode node, SynthesisState state, Set<String> boundary) {
        List<GraphNode> out = new ArrayList<>();
        for (GraphNode target : graph.getSequentialTaskSuccessors(node)) {
            if (!state.isPlaced(target) && !boundary.contains(target.getId())) out.add(target);
        }
        return out;
    }

    private static HierarchyNode wrapSequence(List<HierarchyNode> chain, SynthesisState state) {
        if (chain.isEmpty()) return null;
        if (chain.size() == 1) return chain.get(0);
        return HierarchyNode.sequence(state.nextWrapperId(SEQUENCE_PREFIX), chain);
    }

    private static HierarchyNode wrapParallel(List<HierarchyNode> branches, SynthesisState state) {
        if (branches.isEmpty()) return null;
        if (branches.size() == 1) return branches.get(0);
        return HierarchyNode.parallel(state.nextWrapperId(PARALLEL_PREFIX), branches);
    }
}

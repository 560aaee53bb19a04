package com.tabflow.compiler.error;

import java.util.List;

/**
 * Thrown when the SEQUENTIAL edges form a cycle. The cycle is the ordered path of node ids,
 * closed by repeating its first id (e.g. {@code [a, b, c, a]}).
 */
public final class CycleDetectedException extends WorkflowCompilationException {

    private final List<String> cycle;

    /**
     * @param location where the cycle starts (its first node); null means unknown
     */
    public CycleDetectedException(List<String> cycle, ErrorLocation location) {
        super("Cycle detected in sequential flow: " + String.join(" -> ", cycle), location);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}

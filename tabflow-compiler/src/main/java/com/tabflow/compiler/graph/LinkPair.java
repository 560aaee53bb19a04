package com.tabflow.compiler.graph;

import java.util.Objects;

/**
 * Link-out and link-in node sharing a name, possibly in different regions.
 */
public record LinkPair(String name, GraphNode outNode, GraphNode inNode) {

    public LinkPair {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(outNode, "outNode");
        Objects.requireNonNull(inNode, "inNode");
    }

    public boolean crossesRegions() {
        return !Objects.equals(outNode.getRegionId(), inNode.getRegionId());
    }
}

package com.tabflow.workflow.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One region (tab) of the workflow with its own nodes and edges.
 */
public record RegionSource(
        String id,
        String name,
        List<SourceNode> nodes,
        List<SourceEdge> edges
) {
    @JsonCreator
    public RegionSource(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("nodes") List<SourceNode> nodes,
            @JsonProperty("edges") List<SourceEdge> edges) {
        this.id = id;
        this.name = name != null ? name : id;
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
    }
}

package com.tabflow.workflow.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Region-partitioned input of one compilation. Region order is preserved and drives
 * node and edge order in the built graph.
 */
public record WorkflowSource(
        String name,
        List<RegionSource> regions
) {
    @JsonCreator
    public WorkflowSource(
            @JsonProperty("name") String name,
            @JsonProperty("regions") List<RegionSource> regions) {
        this.name = name;
        this.regions = regions != null ? List.copyOf(regions) : List.of();
    }

    public static WorkflowSource of(RegionSource... regions) {
        return new WorkflowSource(null, List.of(regions));
    }
}

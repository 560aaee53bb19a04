package com.tabflow.workflow.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed node record as produced by the project loader. {@code type} is the raw type string from the
 * canvas (e.g. "agent", "prompt", "teleportOut"); the compiler maps it to a closed kind once at build time.
 * {@code config} is free-form and unmodifiable; null values are kept, insertion order is preserved.
 */
public record SourceNode(
        String id,
        String type,
        String name,
        Map<String, Object> config
) {
    @JsonCreator
    public SourceNode(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("config") Map<String, Object> config) {
        this.id = id;
        this.type = type;
        this.name = name != null ? name : "";
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    /** Convenience: node without config. */
    public static SourceNode of(String id, String type, String name) {
        return new SourceNode(id, type, name, Map.of());
    }
}

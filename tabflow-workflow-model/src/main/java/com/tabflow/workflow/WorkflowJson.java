package com.tabflow.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabflow.workflow.hierarchy.HierarchyNode;
import com.tabflow.workflow.source.WorkflowSource;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of workflow sources and synthesized hierarchies.
 * JSON excludes null values when serializing; unknown properties are ignored when reading
 * so canvas files may carry layout data (positions, colors) the compiler does not use.
 */
public final class WorkflowJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private WorkflowJson() {
    }

    /**
     * Deserializes a region-partitioned workflow from a JSON string.
     *
     * @param json the JSON string (e.g. from the project loader)
     * @return the parsed {@link WorkflowSource}
     * @throws UncheckedIOException on parse failure
     */
    public static WorkflowSource sourceFromJson(String json) {
        try {
            return MAPPER.readValue(json, WorkflowSource.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes a workflow source (nulls excluded).
     */
    public static String toJson(WorkflowSource source) {
        try {
            return MAPPER.writeValueAsString(source);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Serializes a hierarchy tree for the execution-plan builder (nulls excluded).
     */
    public static String toJson(HierarchyNode root) {
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Pretty-printed variant of {@link #toJson(HierarchyNode)}; stable across runs for an unchanged graph,
     * so it can be used for snapshot comparison.
     */
    public static String toJsonPretty(HierarchyNode root) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Deserializes a hierarchy tree.
     */
    public static HierarchyNode hierarchyFromJson(String json) {
        try {
            return MAPPER.readValue(json, HierarchyNode.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

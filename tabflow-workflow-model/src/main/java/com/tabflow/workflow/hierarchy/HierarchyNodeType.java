package com.tabflow.workflow.hierarchy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural type of a hierarchy node. JSON uses the enum name; unknown or blank values
 * deserialize as {@link #LEAF}.
 */
public enum HierarchyNodeType {
    /** Runs one task. */
    LEAF,
    /** Runs children one after another, in list order. */
    SEQUENCE,
    /** Runs children concurrently. */
    PARALLEL;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static HierarchyNodeType fromValue(String value) {
        if (value == null || value.isBlank()) return LEAF;
        String normalized = value.trim().toUpperCase();
        for (HierarchyNodeType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        return LEAF;
    }
}

package com.tabflow.compiler.edge;

import java.util.Objects;

/**
 * Semantic tag of an edge plus, for {@link SemanticTag#INPUT_DATA}, what kind of input it carries.
 * {@code inputKind} is non-null exactly when the tag is INPUT_DATA.
 */
public record EdgeSemantics(SemanticTag tag, InputKind inputKind) {

    public static final EdgeSemantics SEQUENTIAL = new EdgeSemantics(SemanticTag.SEQUENTIAL, null);
    public static final EdgeSemantics PARALLEL = new EdgeSemantics(SemanticTag.PARALLEL, null);
    public static final EdgeSemantics SUBTASK = new EdgeSemantics(SemanticTag.SUBTASK, null);
    public static final EdgeSemantics INSTRUCTION = new EdgeSemantics(SemanticTag.INPUT_DATA, InputKind.INSTRUCTION);
    public static final EdgeSemantics TOOL = new EdgeSemantics(SemanticTag.INPUT_DATA, InputKind.TOOL);
    public static final EdgeSemantics CONTEXT = new EdgeSemantics(SemanticTag.INPUT_DATA, InputKind.CONTEXT);
    public static final EdgeSemantics OUTPUT_SINK = new EdgeSemantics(SemanticTag.OUTPUT_SINK, null);
    public static final EdgeSemantics CROSS_REGION_LINK = new EdgeSemantics(SemanticTag.CROSS_REGION_LINK, null);
    public static final EdgeSemantics UNKNOWN = new EdgeSemantics(SemanticTag.UNKNOWN, null);

    public EdgeSemantics {
        Objects.requireNonNull(tag, "tag");
        if ((tag == SemanticTag.INPUT_DATA) != (inputKind != null)) {
            throw new IllegalArgumentException("inputKind must be set exactly for INPUT_DATA, got tag=" + tag
                    + " inputKind=" + inputKind);
        }
    }

    public boolean is(SemanticTag other) {
        return tag == other;
    }

    /** True for instruction, tool and context inputs. */
    public boolean isDataFlow() {
        return tag == SemanticTag.INPUT_DATA;
    }

    /** True for edges that relate two tasks (sequential, parallel, subtask). */
    public boolean isTaskFlow() {
        return tag == SemanticTag.SEQUENTIAL || tag == SemanticTag.PARALLEL || tag == SemanticTag.SUBTASK;
    }

    @Override
    public String toString() {
        return inputKind != null ? tag + "/" + inputKind : tag.name();
    }
}

package com.tabflow.compiler.edge;

/**
 * Sub-kind of {@link SemanticTag#INPUT_DATA}.
 */
public enum InputKind {
    INSTRUCTION,
    TOOL,
    CONTEXT
}

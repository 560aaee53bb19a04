package com.tabflow.compiler.edge;

import com.tabflow.compiler.graph.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Maps (source kind, target kind, source handle, target handle) to {@link EdgeSemantics} using an
 * {@link EdgeRuleTable}. An edge no rule covers resolves to {@link EdgeSemantics#UNKNOWN}; that is not an error.
 */
public final class EdgeSemanticsResolver {

    private static final Logger log = LoggerFactory.getLogger(EdgeSemanticsResolver.class);

    private final EdgeRuleTable rules;

    public EdgeSemanticsResolver() {
        this(EdgeRuleTable.defaults());
    }

    public EdgeSemanticsResolver(EdgeRuleTable rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public EdgeRuleTable getRules() {
        return rules;
    }

    public EdgeSemantics resolve(NodeKind sourceKind, NodeKind targetKind, String sourceHandle, String targetHandle) {
        return rules.findMatch(sourceKind, targetKind, sourceHandle, targetHandle)
                .map(EdgeRule::semantics)
                .orElseGet(() -> {
                    if (log.isDebugEnabled()) {
                        log.debug("No edge rule for {}[{}] -> {}[{}]; edge is UNKNOWN",
                                sourceKind, sourceHandle, targetKind, targetHandle);
                    }
                    return EdgeSemantics.UNKNOWN;
                });
    }
}

package com.llstar.engine.atn;

import com.llstar.engine.grammar.ProductionKind;
import java.util.Objects;

/** Stable address of a decision: the rule, the production kind and its occurrence index. */
public record DecisionKey(String ruleName, ProductionKind kind, int occurrence) {

    public DecisionKey {
        Objects.requireNonNull(ruleName, "ruleName");
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public String toString() {
        return ruleName + ":" + kind + "#" + occurrence;
    }
}

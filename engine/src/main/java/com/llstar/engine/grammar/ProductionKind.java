package com.llstar.engine.grammar;

/** Production kinds that introduce a decision point. */
public enum ProductionKind {
    ALTERNATION,
    OPTION,
    REPETITION,
    REPETITION_MANDATORY,
    REPETITION_WITH_SEPARATOR,
    REPETITION_MANDATORY_WITH_SEPARATOR;

    /** Alternations predict an alternative index; every other kind predicts enter/continue. */
    public boolean predictsAlternative() {
        return this == ALTERNATION;
    }
}

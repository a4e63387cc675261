package com.llstar.engine.validate;

public enum DiagnosticType {
    UNDEFINED_RULE(Severity.ERROR),
    DUPLICATE_RULE(Severity.ERROR),
    DUPLICATE_PRODUCTION(Severity.ERROR),
    TOO_MANY_ALTERNATIVES(Severity.ERROR),
    LEFT_RECURSION(Severity.ERROR),
    EMPTY_REPETITION(Severity.ERROR),
    SHADOWED_ALTERNATIVE(Severity.WARNING),
    OVERLAPPING_PREFIX(Severity.WARNING);

    public final Severity defaultSeverity;

    DiagnosticType(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }
}

package com.llstar.engine.validate;

import com.llstar.engine.atn.DecisionKey;
import com.llstar.engine.token.TokenType;
import java.util.List;
import java.util.Objects;

/**
 * A single finding about a grammar. Detail fields that do not apply to the diagnostic type are
 * empty (or null for the decision key).
 */
public final class Diagnostic {
    public final Severity severity;
    public final DiagnosticType type;
    public final String ruleName;
    public final String message;
    public final DecisionKey decision;
    public final List<Integer> alternatives;
    public final List<TokenType> sharedPrefix;
    public final List<String> cyclePath;

    private Diagnostic(
            Severity severity,
            DiagnosticType type,
            String ruleName,
            String message,
            DecisionKey decision,
            List<Integer> alternatives,
            List<TokenType> sharedPrefix,
            List<String> cyclePath) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.type = Objects.requireNonNull(type, "type");
        this.ruleName = ruleName;
        this.message = Objects.requireNonNull(message, "message");
        this.decision = decision;
        this.alternatives = List.copyOf(alternatives);
        this.sharedPrefix = List.copyOf(sharedPrefix);
        this.cyclePath = List.copyOf(cyclePath);
    }

    public static Diagnostic definition(DiagnosticType type, String ruleName, String message) {
        return new Diagnostic(
                type.defaultSeverity, type, ruleName, message, null, List.of(), List.of(), List.of());
    }

    public static Diagnostic leftRecursion(String ruleName, List<String> cyclePath) {
        return new Diagnostic(
                Severity.ERROR,
                DiagnosticType.LEFT_RECURSION,
                ruleName,
                "Left recursion in rule " + ruleName + ": " + String.join(" -> ", cyclePath),
                null,
                List.of(),
                List.of(),
                cyclePath);
    }

    public static Diagnostic ambiguity(
            Severity severity,
            DiagnosticType type,
            DecisionKey decision,
            List<Integer> alternatives,
            List<TokenType> sharedPrefix,
            String message) {
        return new Diagnostic(
                severity,
                type,
                decision.ruleName(),
                message,
                decision,
                alternatives,
                sharedPrefix,
                List.of());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + type + ": " + message;
    }
}

package com.llstar.engine.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** All diagnostics produced by one grammar build, reported together. */
public final class GrammarDiagnostics {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public GrammarDiagnostics(Collection<Diagnostic> diagnostics) {
        this.diagnostics.addAll(diagnostics);
    }

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> all() {
        return List.copyOf(diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    public List<Diagnostic> ofType(DiagnosticType type) {
        return diagnostics.stream().filter(d -> d.type == type).toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics) {
            sb.append(diagnostic).append('\n');
        }
        return sb.toString();
    }
}

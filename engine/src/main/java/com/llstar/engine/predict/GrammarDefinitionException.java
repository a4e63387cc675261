package com.llstar.engine.predict;

import com.llstar.engine.validate.GrammarDiagnostics;
import java.util.Objects;

/** Thrown once, with the whole batch, when a grammar has definition errors. */
public final class GrammarDefinitionException extends RuntimeException {
    private final GrammarDiagnostics diagnostics;

    public GrammarDefinitionException(GrammarDiagnostics diagnostics) {
        super("Grammar has " + diagnostics.errors().size() + " error(s):\n" + diagnostics);
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public GrammarDiagnostics diagnostics() {
        return diagnostics;
    }
}

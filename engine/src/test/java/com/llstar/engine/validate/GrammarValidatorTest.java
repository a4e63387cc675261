package com.llstar.engine.validate;

import static com.llstar.engine.Grammars.A;
import static com.llstar.engine.Grammars.B;
import static com.llstar.engine.Grammars.C;
import static com.llstar.engine.Grammars.COMMA;
import static com.llstar.engine.Grammars.IDENT;
import static com.llstar.engine.Grammars.N;
import static com.llstar.engine.Grammars.NAME;
import static com.llstar.engine.Grammars.PLUS;
import static com.llstar.engine.Grammars.X;
import static com.llstar.engine.grammar.Productions.atLeastOne;
import static com.llstar.engine.grammar.Productions.atLeastOneSep;
import static com.llstar.engine.grammar.Productions.many;
import static com.llstar.engine.grammar.Productions.manySep;
import static com.llstar.engine.grammar.Productions.option;
import static com.llstar.engine.grammar.Productions.or;
import static com.llstar.engine.grammar.Productions.ref;
import static com.llstar.engine.grammar.Productions.seq;
import static org.junit.jupiter.api.Assertions.*;

import com.llstar.engine.Grammars;
import com.llstar.engine.atn.AtnBuilder;
import com.llstar.engine.atn.DecisionKey;
import com.llstar.engine.grammar.Alternative;
import com.llstar.engine.grammar.Grammar;
import com.llstar.engine.grammar.ProductionKind;
import com.llstar.engine.predict.GrammarDefinitionException;
import com.llstar.engine.predict.LookaheadEngine;
import com.llstar.engine.token.TokenType;
import java.util.List;
import org.junit.jupiter.api.Test;

final class GrammarValidatorTest {

    @Test
    void unambiguousGrammarsAreClean() {
        assertTrue(validate(Grammars.disjoint()).isEmpty());
        assertTrue(validate(Grammars.repetition()).isEmpty());
        assertTrue(validate(new Grammar().add("L", seq(manySep(COMMA, X), atLeastOne(B)))).isEmpty());
    }

    @Test
    void sharedPrefixIsAnOverlapWarning() {
        GrammarDiagnostics diagnostics = validate(Grammars.sharedPrefix());

        assertEquals(1, diagnostics.all().size());
        Diagnostic warning = diagnostics.all().get(0);
        assertEquals(DiagnosticType.OVERLAPPING_PREFIX, warning.type);
        assertEquals(Severity.WARNING, warning.severity);
        assertEquals(new DecisionKey("Alt", ProductionKind.ALTERNATION, 0), warning.decision);
        assertEquals(List.of(0, 1), warning.alternatives);
        assertEquals(List.of(A), warning.sharedPrefix);
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void identicalAlternativeIsShadowed() {
        GrammarDiagnostics diagnostics = validate(Grammars.identical());

        List<Diagnostic> shadowed = diagnostics.ofType(DiagnosticType.SHADOWED_ALTERNATIVE);
        assertEquals(1, shadowed.size());
        assertEquals(List.of(0, 1), shadowed.get(0).alternatives);
        assertEquals(Severity.WARNING, shadowed.get(0).severity);
        assertEquals("Dup", shadowed.get(0).ruleName);
    }

    @Test
    void fatalPolicyTurnsShadowingIntoAnError() {
        GrammarDiagnostics diagnostics =
                new GrammarValidator(GrammarValidator.DEFAULT_MAX_LOOKAHEAD, AmbiguityPolicy.FATAL)
                        .validate(Grammars.identical(), new AtnBuilder().build(Grammars.identical()));
        assertTrue(diagnostics.hasErrors());

        LookaheadEngine.Config config = new LookaheadEngine.Config();
        config.ambiguityPolicy = AmbiguityPolicy.FATAL;
        GrammarDefinitionException e =
                assertThrows(
                        GrammarDefinitionException.class,
                        () -> LookaheadEngine.create(Grammars.identical(), config));
        assertEquals(DiagnosticType.SHADOWED_ALTERNATIVE, e.diagnostics().errors().get(0).type);
    }

    @Test
    void shorterAlternativeIsNotShadowedByALongerOne() {
        Grammar grammar = new Grammar().add("S", or(seq(A, B), A));

        GrammarDiagnostics diagnostics = validate(grammar);

        assertTrue(diagnostics.ofType(DiagnosticType.SHADOWED_ALTERNATIVE).isEmpty());
        assertEquals(1, diagnostics.ofType(DiagnosticType.OVERLAPPING_PREFIX).size());
    }

    @Test
    void categoryTokenIsShadowedByItsParent() {
        Grammar grammar = new Grammar().add("S", or(IDENT, NAME));

        assertEquals(1, validate(grammar).ofType(DiagnosticType.SHADOWED_ALTERNATIVE).size());
        Grammar reversed = new Grammar().add("S", or(NAME, IDENT));
        assertTrue(validate(reversed).ofType(DiagnosticType.SHADOWED_ALTERNATIVE).isEmpty());
    }

    @Test
    void guardedAlternativesAreNotCompared() {
        Grammar grammar = new Grammar().add("G", or(Alternative.guarded(() -> true, seq(A)), seq(A)));

        assertTrue(validate(grammar).isEmpty());
    }

    @Test
    void directLeftRecursionReportsTheCycle() {
        Grammar grammar = new Grammar().add("Expr", or(seq(ref("Expr"), PLUS, N), N));

        List<Diagnostic> recursion = validate(grammar).ofType(DiagnosticType.LEFT_RECURSION);

        assertEquals(1, recursion.size());
        assertEquals(List.of("Expr", "Expr"), recursion.get(0).cyclePath);
        assertTrue(recursion.get(0).isError());
    }

    @Test
    void mutualLeftRecursionThroughANullablePrefix() {
        Grammar grammar =
                new Grammar()
                        .add("First", or(seq(ref("Second"), X), A))
                        .add("Second", seq(option(C), ref("First"), B));

        List<Diagnostic> recursion = validate(grammar).ofType(DiagnosticType.LEFT_RECURSION);

        assertEquals(2, recursion.size());
        assertEquals(List.of("First", "Second", "First"), recursion.get(0).cyclePath);
        assertEquals(List.of("Second", "First", "Second"), recursion.get(1).cyclePath);
    }

    @Test
    void recursionAfterAConsumedTokenIsFine() {
        Grammar grammar = new Grammar().add("Nest", or(seq(A, ref("Nest"), B), C));

        assertTrue(validate(grammar).isEmpty());
    }

    @Test
    void nullableRepetitionBodiesAreErrors() {
        Grammar grammar =
                new Grammar()
                        .add("Empty", seq())
                        .add(
                                "Loops",
                                seq(
                                        many(option(A)),
                                        atLeastOne(ref("Empty")),
                                        manySep(COMMA, many(1, B)),
                                        atLeastOneSep(COMMA, seq(option(1, C)))));

        List<Diagnostic> empty = validate(grammar).ofType(DiagnosticType.EMPTY_REPETITION);

        assertEquals(4, empty.size());
        assertTrue(empty.stream().allMatch(d -> d.ruleName.equals("Loops") && d.isError()));
    }

    @Test
    void definitionErrorsAreIncluded() {
        Grammar grammar = new Grammar().add("Top", or(A, ref("Missing")));

        GrammarDiagnostics diagnostics = validate(grammar);

        assertEquals(1, diagnostics.errors().size());
        assertEquals(DiagnosticType.UNDEFINED_RULE, diagnostics.errors().get(0).type);
    }

    @Test
    void sharedPrefixHelpers() {
        List<List<TokenType>> left = List.of(List.of(A, B, C), List.of(B));
        List<List<TokenType>> right = List.of(List.of(A, B, A));

        assertEquals(List.of(A, B), GrammarValidator.longestSharedPrefix(left, right));
        assertFalse(GrammarValidator.covers(left, right));
        assertTrue(GrammarValidator.covers(left, List.of(List.of(B))));
    }

    private static GrammarDiagnostics validate(Grammar grammar) {
        return new GrammarValidator().validate(grammar, new AtnBuilder().build(grammar));
    }
}

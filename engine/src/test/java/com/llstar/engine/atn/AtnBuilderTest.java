package com.llstar.engine.atn;

import static com.llstar.engine.Grammars.A;
import static com.llstar.engine.Grammars.B;
import static com.llstar.engine.Grammars.C;
import static com.llstar.engine.Grammars.COMMA;
import static com.llstar.engine.Grammars.X;
import static com.llstar.engine.grammar.Productions.atLeastOne;
import static com.llstar.engine.grammar.Productions.atLeastOneSep;
import static com.llstar.engine.grammar.Productions.manySep;
import static com.llstar.engine.grammar.Productions.option;
import static com.llstar.engine.grammar.Productions.or;
import static com.llstar.engine.grammar.Productions.ref;
import static com.llstar.engine.grammar.Productions.seq;
import static org.junit.jupiter.api.Assertions.*;

import com.llstar.engine.Grammars;
import com.llstar.engine.grammar.Grammar;
import com.llstar.engine.grammar.ProductionKind;
import com.llstar.engine.validate.Diagnostic;
import com.llstar.engine.validate.DiagnosticType;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class AtnBuilderTest {

    @Test
    void alternationRegistersOneDecisionWithOneTransitionPerAlternative() {
        AtnBuilder.Result result = new AtnBuilder().build(Grammars.disjoint());

        assertFalse(result.hasErrors());
        Atn atn = result.atn();
        assertEquals(1, atn.decisionCount());
        Decision decision = atn.decision("Id", ProductionKind.ALTERNATION, 0);
        assertEquals(0, decision.id);
        assertEquals(AtnState.Kind.BLOCK_START, decision.state.kind);
        assertEquals(2, decision.alternativeCount());
        assertTrue(decision.predictsAlternative());
        assertSame(decision.state, atn.decisionStates().get(0));
        assertEquals(0, decision.state.decision());
    }

    @Test
    void sequenceSplicesConsumingEdgesIntoTheNextElement() {
        Atn atn = new AtnBuilder().build(new Grammar().add("S", seq(A, B, C))).atn();

        AtnState state = atn.ruleStart("S").transitions().get(0).target();
        for (var expected : List.of(A, B, C)) {
            assertEquals(1, state.transitions().size());
            Transition.Atom atom = (Transition.Atom) state.transitions().get(0);
            assertEquals(expected, atom.type());
            state = atom.target();
        }
        // start, stop, three atom sources, the final exit
        assertEquals(6, atn.states().size());
        assertEquals(Transition.Epsilon.class, state.transitions().get(0).getClass());
        assertSame(atn.ruleStop("S"), state.transitions().get(0).target());
    }

    @Test
    void splicedStatesAreDroppedFromLongSequences() {
        Object[] elements = new Object[1000];
        for (int i = 0; i < elements.length; i++) {
            elements[i] = i % 2 == 0 ? A : B;
        }
        Atn atn = new AtnBuilder().build(new Grammar().add("Long", seq(elements))).atn();

        // start, stop, one source per token, the final exit
        assertEquals(2 + elements.length + 1, atn.states().size());
        Set<AtnState> states = new HashSet<>(atn.states());
        for (AtnState state : atn.states()) {
            for (Transition transition : state.transitions()) {
                assertTrue(states.contains(transition.target()));
            }
        }
    }

    @Test
    void ruleCallReturnsToFollowState() {
        Grammar grammar = new Grammar().add("Outer", seq(ref("Inner"), B)).add("Inner", seq(A));
        Atn atn = new AtnBuilder().build(grammar).atn();

        AtnState entry = atn.ruleStart("Outer").transitions().get(0).target();
        Transition.RuleCall call = (Transition.RuleCall) entry.transitions().get(0);
        assertSame(atn.ruleStart("Inner"), call.target());
        assertEquals("Inner", call.ruleName());
        Transition.Atom afterCall = (Transition.Atom) call.followState().transitions().get(0);
        assertEquals(B, afterCall.type());
    }

    @Test
    void everyTransitionTargetBelongsToTheAtn() {
        Grammar grammar =
                new Grammar()
                        .add("S", seq(option(A), atLeastOne(B), manySep(COMMA, X), ref("T")))
                        .add("T", or(A, seq(B, C), atLeastOneSep(1, COMMA, C)));
        Atn atn = new AtnBuilder().build(grammar).atn();

        Set<AtnState> states = new HashSet<>(atn.states());
        for (AtnState state : atn.states()) {
            for (Transition transition : state.transitions()) {
                assertTrue(states.contains(transition.target()), "dangling target from " + state);
                if (transition instanceof Transition.RuleCall call) {
                    assertTrue(states.contains(call.followState()));
                }
            }
        }
    }

    @Test
    void repetitionKindsRegisterTheirDecisions() {
        Grammar grammar =
                new Grammar()
                        .add("S", seq(option(A), atLeastOne(B), manySep(COMMA, X), atLeastOneSep(COMMA, C)));
        Atn atn = new AtnBuilder().build(grammar).atn();

        assertEquals(5, atn.decisionCount());
        assertEquals(AtnState.Kind.BLOCK_START, atn.decision("S", ProductionKind.OPTION, 0).state.kind);

        Decision plus = atn.decision("S", ProductionKind.REPETITION_MANDATORY, 0);
        assertEquals(AtnState.Kind.LOOP_BACK, plus.state.kind);
        assertTrue(plus.iteration);
        assertSame(plus, atn.iterationDecision("S", ProductionKind.REPETITION_MANDATORY, 0));

        Decision sepEntry = atn.decision("S", ProductionKind.REPETITION_WITH_SEPARATOR, 0);
        Decision sepLoop = atn.iterationDecision("S", ProductionKind.REPETITION_WITH_SEPARATOR, 0);
        assertEquals(AtnState.Kind.LOOP_ENTRY, sepEntry.state.kind);
        assertEquals(AtnState.Kind.LOOP_BACK, sepLoop.state.kind);
        assertNotEquals(sepEntry.id, sepLoop.id);
        Transition.Atom separator =
                (Transition.Atom) sepLoop.state.transitions().get(0).target().transitions().get(0);
        assertEquals(COMMA, separator.type());

        assertEquals(
                AtnState.Kind.LOOP_BACK,
                atn.decision("S", ProductionKind.REPETITION_MANDATORY_WITH_SEPARATOR, 0).state.kind);
        assertThrows(
                IllegalArgumentException.class, () -> atn.decision("S", ProductionKind.ALTERNATION, 0));
    }

    @Test
    void undefinedReferenceIsOneErrorAndTheRuleGetsNoDecisions() {
        Grammar grammar = new Grammar().add("Top", or(A, ref("Missing")));

        AtnBuilder.Result result = new AtnBuilder().build(grammar);

        assertEquals(1, result.errors().size());
        Diagnostic error = result.errors().get(0);
        assertEquals(DiagnosticType.UNDEFINED_RULE, error.type);
        assertEquals("Top", error.ruleName);
        assertTrue(error.message.contains("Missing"));
        assertEquals(0, result.atn().decisionCount());
        assertTrue(result.atn().ruleStart("Top").transitions().isEmpty());
    }

    @Test
    void definitionErrorsAreCollectedTogether() {
        Grammar grammar =
                new Grammar()
                        .add("Dup", seq(A))
                        .add("Dup", seq(B))
                        .add("Twice", seq(option(A), option(B)))
                        .add("Wide", or(A, B, C))
                        .add("Fine", or(A, B));

        AtnBuilder.Result result = new AtnBuilder(2).build(grammar);

        List<DiagnosticType> types = result.errors().stream().map(d -> d.type).toList();
        assertEquals(
                List.of(
                        DiagnosticType.DUPLICATE_RULE,
                        DiagnosticType.DUPLICATE_PRODUCTION,
                        DiagnosticType.TOO_MANY_ALTERNATIVES),
                types);
        assertEquals(1, result.atn().decisionCount());
        assertEquals("Fine", result.atn().decision(0).key.ruleName());
    }
}

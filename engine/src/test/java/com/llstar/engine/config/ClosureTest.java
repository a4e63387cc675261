package com.llstar.engine.config;

import static com.llstar.engine.Grammars.A;
import static com.llstar.engine.Grammars.B;
import static com.llstar.engine.Grammars.C;
import static com.llstar.engine.Grammars.N;
import static com.llstar.engine.Grammars.PLUS;
import static com.llstar.engine.Grammars.X;
import static com.llstar.engine.grammar.Productions.option;
import static com.llstar.engine.grammar.Productions.or;
import static com.llstar.engine.grammar.Productions.ref;
import static com.llstar.engine.grammar.Productions.seq;
import static org.junit.jupiter.api.Assertions.*;

import com.llstar.engine.atn.Atn;
import com.llstar.engine.atn.AtnBuilder;
import com.llstar.engine.atn.Transition;
import com.llstar.engine.grammar.Grammar;
import com.llstar.engine.token.TokenType;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class ClosureTest {

    @Test
    void ruleCallPushesTheFollowState() {
        Grammar grammar = new Grammar().add("Outer", seq(ref("Inner"), B)).add("Inner", or(A, C));
        Atn atn = new AtnBuilder().build(grammar).atn();

        AtnConfigSet result =
                new Closure(atn).compute(new AtnConfig(atn.ruleStart("Outer"), 0, CallStack.EMPTY), false);

        assertEquals(Set.of(A, C), consumable(result));
        for (AtnConfig config : result.elements()) {
            assertEquals("Inner", config.state().ruleName);
            assertEquals(1, config.stack().size());
            Transition.Atom follow = (Transition.Atom) config.stack().peek().transitions().get(0);
            assertEquals(B, follow.type());
        }
        assertTrue(result.isFrozen());
    }

    @Test
    void ruleStopWithEmptyStackIsKept() {
        Atn atn = new AtnBuilder().build(new Grammar().add("Opt", option(A))).atn();

        AtnConfigSet result =
                new Closure(atn).compute(new AtnConfig(atn.ruleStart("Opt"), 0, CallStack.EMPTY), false);

        assertEquals(2, result.size());
        assertTrue(result.hasRuleStopConfig());
        assertFalse(result.allInRuleStop());
    }

    @Test
    void lowerAlternativeClaimsSharedLocations() {
        Atn atn = new AtnBuilder().build(new Grammar().add("Opt", option(A))).atn();
        Closure closure = new Closure(atn);

        AtnConfigSet result =
                closure.compute(
                        List.of(
                                new AtnConfig(atn.ruleStart("Opt"), 1, CallStack.EMPTY),
                                new AtnConfig(atn.ruleStart("Opt"), 0, CallStack.EMPTY)),
                        false);

        assertEquals(0, result.uniqueAlt());
    }

    @Test
    void terminatesOnDirectLeftRecursion() {
        Grammar grammar = new Grammar().add("Expr", or(seq(ref("Expr"), PLUS, N), N));
        Atn atn = new AtnBuilder().build(grammar).atn();

        AtnConfigSet result =
                new Closure(atn).compute(new AtnConfig(atn.ruleStart("Expr"), 0, CallStack.EMPTY), true);

        assertEquals(Set.of(N), consumable(result));
    }

    @Test
    void terminatesOnMutualLeftRecursion() {
        Grammar grammar =
                new Grammar()
                        .add("First", or(seq(ref("Second"), X), A))
                        .add("Second", or(seq(ref("First"), B), C));
        Atn atn = new AtnBuilder().build(grammar).atn();

        AtnConfigSet result =
                new Closure(atn).compute(new AtnConfig(atn.ruleStart("First"), 0, CallStack.EMPTY), false);

        assertEquals(Set.of(A, C), consumable(result));
    }

    private static Set<TokenType> consumable(AtnConfigSet configs) {
        return configs.elements().stream()
                .flatMap(c -> c.state().transitions().stream())
                .filter(t -> t instanceof Transition.Atom)
                .map(t -> ((Transition.Atom) t).type())
                .collect(Collectors.toSet());
    }
}

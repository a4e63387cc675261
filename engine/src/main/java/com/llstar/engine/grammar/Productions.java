package com.llstar.engine.grammar;

import com.llstar.engine.grammar.Production.Action;
import com.llstar.engine.grammar.Production.Alternation;
import com.llstar.engine.grammar.Production.NonTerminal;
import com.llstar.engine.grammar.Production.Option;
import com.llstar.engine.grammar.Production.Repetition;
import com.llstar.engine.grammar.Production.RepetitionMandatory;
import com.llstar.engine.grammar.Production.RepetitionMandatoryWithSeparator;
import com.llstar.engine.grammar.Production.RepetitionWithSeparator;
import com.llstar.engine.grammar.Production.Sequence;
import com.llstar.engine.grammar.Production.Terminal;
import com.llstar.engine.token.TokenType;
import java.util.ArrayList;
import java.util.List;

/** Static factories for assembling production trees in code. */
public final class Productions {

    private Productions() {}

    public static Terminal terminal(TokenType type) {
        return new Terminal(type);
    }

    public static NonTerminal ref(String ruleName) {
        return new NonTerminal(ruleName);
    }

    public static Action action(String label) {
        return new Action(label);
    }

    /** Sequence of productions; token types are wrapped as terminals. */
    public static Sequence seq(Object... elements) {
        List<Production> productions = new ArrayList<>();
        for (Object element : elements) {
            productions.add(toProduction(element));
        }
        return new Sequence(productions);
    }

    /** Alternation with occurrence 0. */
    public static Alternation or(Object... alternatives) {
        return orAt(0, alternatives);
    }

    /** Alternation; elements may be {@link Alternative}s, productions or token types. */
    public static Alternation orAt(int occurrence, Object... alternatives) {
        List<Alternative> list = new ArrayList<>();
        for (Object alternative : alternatives) {
            if (alternative instanceof Alternative alt) {
                list.add(alt);
            } else {
                list.add(Alternative.of(toProduction(alternative)));
            }
        }
        return new Alternation(list, occurrence);
    }

    public static Option option(Object body) {
        return option(0, body);
    }

    public static Option option(int occurrence, Object body) {
        return new Option(toProduction(body), occurrence);
    }

    public static Repetition many(Object body) {
        return many(0, body);
    }

    public static Repetition many(int occurrence, Object body) {
        return new Repetition(toProduction(body), occurrence);
    }

    public static RepetitionMandatory atLeastOne(Object body) {
        return atLeastOne(0, body);
    }

    public static RepetitionMandatory atLeastOne(int occurrence, Object body) {
        return new RepetitionMandatory(toProduction(body), occurrence);
    }

    public static RepetitionWithSeparator manySep(TokenType separator, Object body) {
        return new RepetitionWithSeparator(toProduction(body), separator, 0);
    }

    public static RepetitionWithSeparator manySep(int occurrence, TokenType separator, Object body) {
        return new RepetitionWithSeparator(toProduction(body), separator, occurrence);
    }

    public static RepetitionMandatoryWithSeparator atLeastOneSep(TokenType separator, Object body) {
        return new RepetitionMandatoryWithSeparator(toProduction(body), separator, 0);
    }

    public static RepetitionMandatoryWithSeparator atLeastOneSep(
            int occurrence, TokenType separator, Object body) {
        return new RepetitionMandatoryWithSeparator(toProduction(body), separator, occurrence);
    }

    private static Production toProduction(Object element) {
        if (element instanceof Production production) {
            return production;
        } else if (element instanceof TokenType type) {
            return new Terminal(type);
        }
        throw new IllegalArgumentException("Not a production or token type: " + element);
    }
}

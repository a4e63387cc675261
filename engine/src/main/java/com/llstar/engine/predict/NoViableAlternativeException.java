package com.llstar.engine.predict;

import com.llstar.engine.token.Token;
import com.llstar.engine.token.TokenType;
import java.util.List;

/**
 * Lookahead reached a token no live alternative can consume. The calling parser decides how to
 * recover; the engine does not retry.
 */
public final class NoViableAlternativeException extends RuntimeException {
    private final Token actualToken;
    private final List<List<TokenType>> expectedPaths;
    private final List<Integer> aliveAlternatives;
    private final String ruleName;
    private final int decision;

    public NoViableAlternativeException(
            Token actualToken,
            List<List<TokenType>> expectedPaths,
            List<Integer> aliveAlternatives,
            String ruleName,
            int decision) {
        super(message(actualToken, expectedPaths, aliveAlternatives, ruleName, decision));
        this.actualToken = actualToken;
        this.expectedPaths = List.copyOf(expectedPaths);
        this.aliveAlternatives = List.copyOf(aliveAlternatives);
        this.ruleName = ruleName;
        this.decision = decision;
    }

    private static String message(
            Token actualToken,
            List<List<TokenType>> expectedPaths,
            List<Integer> aliveAlternatives,
            String ruleName,
            int decision) {
        String location = " in rule " + ruleName + " (decision " + decision + ") at " + actualToken;
        if (aliveAlternatives.isEmpty()) {
            return "No enabled alternative" + location;
        }
        return "No viable alternative"
                + location
                + ", alive alternatives "
                + aliveAlternatives
                + ", expected one of "
                + expectedPaths;
    }

    public Token actualToken() {
        return actualToken;
    }

    /** Bounded lookahead paths of the alternatives alive at the failure point. */
    public List<List<TokenType>> expectedPaths() {
        return expectedPaths;
    }

    public List<Integer> aliveAlternatives() {
        return aliveAlternatives;
    }

    public String ruleName() {
        return ruleName;
    }

    public int decision() {
        return decision;
    }
}

package com.llstar.engine.atn;

import com.llstar.engine.token.TokenType;
import java.util.Objects;

/** Edge of the ATN. */
public sealed interface Transition {

    AtnState target();

    /** Moves without consuming input. */
    record Epsilon(AtnState target) implements Transition {
        public Epsilon {
            Objects.requireNonNull(target, "target");
        }
    }

    /** Consumes exactly one token satisfying {@code type}. */
    record Atom(AtnState target, TokenType type) implements Transition {
        public Atom {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(type, "type");
        }
    }

    /** Invokes the rule starting at {@code target}; simulation resumes at {@code followState}. */
    record RuleCall(AtnState target, String ruleName, AtnState followState) implements Transition {
        public RuleCall {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(ruleName, "ruleName");
            Objects.requireNonNull(followState, "followState");
        }
    }
}

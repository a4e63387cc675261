package com.llstar.engine.grammar;

import com.llstar.engine.token.TokenType;
import java.util.List;
import java.util.Objects;

/**
 * Node of a rule's production tree. The variant set is closed; consumers match on it
 * exhaustively and fail loudly on anything else.
 */
public sealed interface Production {

    /** A production that owns a decision point, identified within its rule by kind and occurrence. */
    sealed interface DecisionProduction extends Production {
        ProductionKind kind();

        int occurrence();
    }

    record Terminal(TokenType type) implements Production {
        public Terminal {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return "'" + type.name + "'";
        }
    }

    record NonTerminal(String ruleName) implements Production {
        public NonTerminal {
            Objects.requireNonNull(ruleName, "ruleName");
        }

        @Override
        public String toString() {
            return "<" + ruleName + ">";
        }
    }

    record Sequence(List<Production> elements) implements Production {
        public Sequence {
            elements = List.copyOf(elements);
        }
    }

    /** Embedded semantic action. Consumes nothing and never affects prediction. */
    record Action(String label) implements Production {}

    record Alternation(List<Alternative> alternatives, int occurrence) implements DecisionProduction {
        public Alternation {
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public ProductionKind kind() {
            return ProductionKind.ALTERNATION;
        }
    }

    record Option(Production body, int occurrence) implements DecisionProduction {
        public Option {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public ProductionKind kind() {
            return ProductionKind.OPTION;
        }
    }

    record Repetition(Production body, int occurrence) implements DecisionProduction {
        public Repetition {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public ProductionKind kind() {
            return ProductionKind.REPETITION;
        }
    }

    record RepetitionMandatory(Production body, int occurrence) implements DecisionProduction {
        public RepetitionMandatory {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public ProductionKind kind() {
            return ProductionKind.REPETITION_MANDATORY;
        }
    }

    record RepetitionWithSeparator(Production body, TokenType separator, int occurrence)
            implements DecisionProduction {
        public RepetitionWithSeparator {
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(separator, "separator");
        }

        @Override
        public ProductionKind kind() {
            return ProductionKind.REPETITION_WITH_SEPARATOR;
        }
    }

    record RepetitionMandatoryWithSeparator(Production body, TokenType separator, int occurrence)
            implements DecisionProduction {
        public RepetitionMandatoryWithSeparator {
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(separator, "separator");
        }

        @Override
        public ProductionKind kind() {
            return ProductionKind.REPETITION_MANDATORY_WITH_SEPARATOR;
        }
    }
}

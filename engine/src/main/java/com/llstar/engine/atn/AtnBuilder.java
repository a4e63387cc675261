package com.llstar.engine.atn;

import com.llstar.engine.grammar.Alternative;
import com.llstar.engine.grammar.Grammar;
import com.llstar.engine.grammar.Production;
import com.llstar.engine.grammar.Production.Action;
import com.llstar.engine.grammar.Production.Alternation;
import com.llstar.engine.grammar.Production.DecisionProduction;
import com.llstar.engine.grammar.Production.NonTerminal;
import com.llstar.engine.grammar.Production.Option;
import com.llstar.engine.grammar.Production.Repetition;
import com.llstar.engine.grammar.Production.RepetitionMandatory;
import com.llstar.engine.grammar.Production.RepetitionMandatoryWithSeparator;
import com.llstar.engine.grammar.Production.RepetitionWithSeparator;
import com.llstar.engine.grammar.Production.Sequence;
import com.llstar.engine.grammar.Production.Terminal;
import com.llstar.engine.grammar.Rule;
import com.llstar.engine.token.TokenType;
import com.llstar.engine.validate.Diagnostic;
import com.llstar.engine.validate.DiagnosticType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles production trees into an {@link Atn}. Each production yields an entry/exit state pair;
 * pairs are wired together bottom-up with epsilon transitions, and every alternation, option and
 * repetition registers a decision state.
 *
 * <p>Definition problems (duplicate or undefined rules, duplicate occurrences, oversized
 * alternations) are collected rather than thrown. A rule with such a problem keeps its start and
 * stop states but gets no body, so it registers no decisions.
 */
public final class AtnBuilder {
    private static final Logger LOGGER = Logger.getLogger(AtnBuilder.class.getName());

    public static final int DEFAULT_MAX_ALTERNATIVES = 255;

    public record Result(Atn atn, List<Diagnostic> errors) {
        public Result {
            errors = List.copyOf(errors);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    private record Handle(AtnState left, AtnState right) {}

    private final int maxAlternatives;
    private Atn atn;
    private String currentRule;

    public AtnBuilder() {
        this(DEFAULT_MAX_ALTERNATIVES);
    }

    public AtnBuilder(int maxAlternatives) {
        this.maxAlternatives = maxAlternatives;
    }

    public Result build(Grammar grammar) {
        atn = new Atn();
        List<Diagnostic> errors = new ArrayList<>();
        List<Rule> rules = new ArrayList<>();
        for (String name : grammar.ruleNames()) {
            List<Rule> declarations = grammar.declarations(name);
            if (declarations.size() > 1) {
                errors.add(
                        Diagnostic.definition(
                                DiagnosticType.DUPLICATE_RULE,
                                name,
                                "Rule " + name + " is declared " + declarations.size() + " times"));
            }
            Rule rule = declarations.get(0);
            rules.add(rule);
            AtnState start = atn.newState(AtnState.Kind.RULE_START, name);
            AtnState stop = atn.newState(AtnState.Kind.RULE_STOP, name);
            atn.defineRule(name, start, stop);
        }

        for (Rule rule : rules) {
            List<Diagnostic> ruleErrors = checkDefinition(rule, grammar);
            if (!ruleErrors.isEmpty()) {
                errors.addAll(ruleErrors);
                continue;
            }
            currentRule = rule.name();
            Handle body = build(rule.definition());
            epsilon(atn.ruleStart(rule.name()), body.left);
            epsilon(body.right, atn.ruleStop(rule.name()));
        }
        currentRule = null;
        atn.compact();

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                    "Built ATN: rules="
                            + atn.ruleCount()
                            + ", states="
                            + atn.states().size()
                            + ", decisions="
                            + atn.decisionCount()
                            + ", errors="
                            + errors.size());
        }
        Atn built = atn;
        atn = null;
        return new Result(built, errors);
    }

    private List<Diagnostic> checkDefinition(Rule rule, Grammar grammar) {
        List<Diagnostic> errors = new ArrayList<>();
        Set<String> seenOccurrences = new HashSet<>();
        check(rule.name(), rule.definition(), grammar, seenOccurrences, errors);
        return errors;
    }

    private void check(
            String ruleName,
            Production production,
            Grammar grammar,
            Set<String> seenOccurrences,
            List<Diagnostic> errors) {
        if (production instanceof NonTerminal ref) {
            if (grammar.rule(ref.ruleName()) == null) {
                errors.add(
                        Diagnostic.definition(
                                DiagnosticType.UNDEFINED_RULE,
                                ruleName,
                                "Rule " + ruleName + " references undefined rule " + ref.ruleName()));
            }
            return;
        }
        if (production instanceof DecisionProduction decision) {
            String occurrence = decision.kind() + "#" + decision.occurrence();
            if (!seenOccurrences.add(occurrence)) {
                errors.add(
                        Diagnostic.definition(
                                DiagnosticType.DUPLICATE_PRODUCTION,
                                ruleName,
                                "Rule " + ruleName + " uses " + occurrence + " more than once"));
            }
        }
        for (Production child : children(production)) {
            check(ruleName, child, grammar, seenOccurrences, errors);
        }
        if (production instanceof Alternation alternation
                && alternation.alternatives().size() > maxAlternatives) {
            errors.add(
                    Diagnostic.definition(
                            DiagnosticType.TOO_MANY_ALTERNATIVES,
                            ruleName,
                            "Alternation #"
                                    + alternation.occurrence()
                                    + " in rule "
                                    + ruleName
                                    + " has "
                                    + alternation.alternatives().size()
                                    + " alternatives, limit is "
                                    + maxAlternatives));
        }
    }

    private static List<Production> children(Production production) {
        if (production instanceof Sequence sequence) {
            return sequence.elements();
        } else if (production instanceof Alternation alternation) {
            return alternation.alternatives().stream().map(Alternative::body).toList();
        } else if (production instanceof Option option) {
            return List.of(option.body());
        } else if (production instanceof Repetition repetition) {
            return List.of(repetition.body());
        } else if (production instanceof RepetitionMandatory repetition) {
            return List.of(repetition.body());
        } else if (production instanceof RepetitionWithSeparator repetition) {
            return List.of(repetition.body());
        } else if (production instanceof RepetitionMandatoryWithSeparator repetition) {
            return List.of(repetition.body());
        }
        return List.of();
    }

    private Handle build(Production production) {
        if (production instanceof Terminal terminal) {
            return terminal(terminal.type());
        } else if (production instanceof NonTerminal ref) {
            AtnState left = newState(AtnState.Kind.BASIC);
            AtnState right = newState(AtnState.Kind.BASIC);
            left.addTransition(new Transition.RuleCall(atn.ruleStart(ref.ruleName()), ref.ruleName(), right));
            return new Handle(left, right);
        } else if (production instanceof Sequence sequence) {
            return sequence(sequence);
        } else if (production instanceof Action) {
            AtnState state = newState(AtnState.Kind.BASIC);
            return new Handle(state, state);
        } else if (production instanceof Alternation alternation) {
            return alternation(alternation);
        } else if (production instanceof Option option) {
            return option(option);
        } else if (production instanceof Repetition repetition) {
            return repetition(repetition);
        } else if (production instanceof RepetitionMandatory repetition) {
            return mandatory(repetition, repetition.body(), null);
        } else if (production instanceof RepetitionWithSeparator repetition) {
            return separated(repetition);
        } else if (production instanceof RepetitionMandatoryWithSeparator repetition) {
            return mandatory(repetition, repetition.body(), repetition.separator());
        }
        throw new IllegalStateException("Unknown production " + production);
    }

    private Handle terminal(TokenType type) {
        AtnState left = newState(AtnState.Kind.BASIC);
        AtnState right = newState(AtnState.Kind.BASIC);
        left.addTransition(new Transition.Atom(right, type));
        return new Handle(left, right);
    }

    /**
     * Links the elements in order. Where an element is a single consuming or calling edge into a
     * bare exit state, the edge is retargeted to the next element's entry and the exit state is
     * dropped; this leaves the accepted language unchanged.
     */
    private Handle sequence(Sequence sequence) {
        if (sequence.elements().isEmpty()) {
            AtnState state = newState(AtnState.Kind.BASIC);
            return new Handle(state, state);
        }
        List<Handle> handles = new ArrayList<>();
        for (Production element : sequence.elements()) {
            handles.add(build(element));
        }
        for (int i = 0; i < handles.size() - 1; i++) {
            Handle handle = handles.get(i);
            AtnState next = handles.get(i + 1).left;
            if (!splice(handle, next)) {
                epsilon(handle.right, next);
            }
        }
        return new Handle(handles.get(0).left, handles.get(handles.size() - 1).right);
    }

    private boolean splice(Handle handle, AtnState next) {
        AtnState left = handle.left;
        AtnState right = handle.right;
        if (left == right
                || left.kind != AtnState.Kind.BASIC
                || right.kind != AtnState.Kind.BASIC
                || left.transitions().size() != 1
                || !right.transitions().isEmpty()) {
            return false;
        }
        Transition transition = left.transitions().get(0);
        if (transition instanceof Transition.Atom atom && atom.target() == right) {
            left.setTransition(0, new Transition.Atom(next, atom.type()));
        } else if (transition instanceof Transition.RuleCall call && call.followState() == right) {
            left.setTransition(0, new Transition.RuleCall(call.target(), call.ruleName(), next));
        } else {
            return false;
        }
        atn.removeState(right);
        return true;
    }

    private Handle alternation(Alternation alternation) {
        AtnState start = newState(AtnState.Kind.BLOCK_START);
        AtnState end = newState(AtnState.Kind.BLOCK_END);
        List<Alternative.Guard> guards = new ArrayList<>();
        for (Alternative alternative : alternation.alternatives()) {
            Handle body = build(alternative.body());
            epsilon(start, body.left);
            epsilon(body.right, end);
            guards.add(alternative.guard());
        }
        atn.defineDecision(start, key(alternation), false, guards);
        return new Handle(start, end);
    }

    private Handle option(Option option) {
        AtnState start = newState(AtnState.Kind.BLOCK_START);
        AtnState end = newState(AtnState.Kind.BLOCK_END);
        Handle body = build(option.body());
        epsilon(start, body.left);
        epsilon(start, end);
        epsilon(body.right, end);
        atn.defineDecision(start, key(option), false, Collections.emptyList());
        return new Handle(start, end);
    }

    /** entry: alt 0 runs the body and loops back to entry, alt 1 exits. */
    private Handle repetition(Repetition repetition) {
        AtnState entry = newState(AtnState.Kind.LOOP_ENTRY);
        AtnState loopBack = newState(AtnState.Kind.LOOP_BACK);
        AtnState end = newState(AtnState.Kind.BLOCK_END);
        Handle body = build(repetition.body());
        epsilon(entry, body.left);
        epsilon(entry, end);
        epsilon(body.right, loopBack);
        epsilon(loopBack, entry);
        atn.defineDecision(entry, key(repetition), false, Collections.emptyList());
        return new Handle(entry, end);
    }

    /**
     * The body runs once unconditionally; the loop-back state then decides between another
     * iteration (alt 0, through the separator when there is one) and exit (alt 1).
     */
    private Handle mandatory(DecisionProduction production, Production bodyProduction, TokenType separator) {
        Handle body = build(bodyProduction);
        AtnState loopBack = newState(AtnState.Kind.LOOP_BACK);
        AtnState end = newState(AtnState.Kind.BLOCK_END);
        epsilon(body.right, loopBack);
        epsilon(loopBack, separator == null ? body.left : separatorEdge(separator, body.left));
        epsilon(loopBack, end);
        atn.defineDecision(loopBack, key(production), true, Collections.emptyList());
        return new Handle(body.left, end);
    }

    /**
     * Entry decides whether the first element is present; after each element the loop-back
     * state decides between separator-and-element (alt 0) and exit (alt 1).
     */
    private Handle separated(RepetitionWithSeparator repetition) {
        AtnState entry = newState(AtnState.Kind.LOOP_ENTRY);
        Handle body = build(repetition.body());
        AtnState loopBack = newState(AtnState.Kind.LOOP_BACK);
        AtnState end = newState(AtnState.Kind.BLOCK_END);
        epsilon(entry, body.left);
        epsilon(entry, end);
        epsilon(body.right, loopBack);
        epsilon(loopBack, separatorEdge(repetition.separator(), body.left));
        epsilon(loopBack, end);
        atn.defineDecision(entry, key(repetition), false, Collections.emptyList());
        atn.defineDecision(loopBack, key(repetition), true, Collections.emptyList());
        return new Handle(entry, end);
    }

    private AtnState separatorEdge(TokenType separator, AtnState bodyEntry) {
        AtnState state = newState(AtnState.Kind.BASIC);
        state.addTransition(new Transition.Atom(bodyEntry, separator));
        return state;
    }

    private DecisionKey key(DecisionProduction production) {
        return new DecisionKey(currentRule, production.kind(), production.occurrence());
    }

    private AtnState newState(AtnState.Kind kind) {
        return atn.newState(kind, currentRule);
    }

    private static void epsilon(AtnState from, AtnState to) {
        from.addTransition(new Transition.Epsilon(to));
    }
}

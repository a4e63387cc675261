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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory grammar: named rules, each owning a production tree. Rules are kept in declaration
 * order; a name declared twice is retained so the builder can report it.
 */
public final class Grammar {

    private final Map<String, List<Rule>> byName = new LinkedHashMap<>();

    public Grammar add(Rule rule) {
        byName.computeIfAbsent(rule.name(), key -> new ArrayList<>()).add(rule);
        return this;
    }

    public Grammar add(String name, Production definition) {
        return add(new Rule(name, definition));
    }

    /** First declaration of {@code name}, or null when undefined. */
    public Rule rule(String name) {
        List<Rule> rules = byName.get(name);
        return rules == null ? null : rules.get(0);
    }

    public List<Rule> declarations(String name) {
        return byName.getOrDefault(name, List.of());
    }

    public Set<String> ruleNames() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    public List<Rule> allRules() {
        return byName.values().stream().flatMap(List::stream).toList();
    }

    /**
     * Computes the rules that can derive the empty sequence, relaxing until no rule changes.
     * References to undefined rules count as non-nullable.
     */
    public Set<String> nullableRules() {
        Set<String> nullable = new HashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String name : byName.keySet()) {
                if (!nullable.contains(name) && isNullable(rule(name).definition(), nullable)) {
                    nullable.add(name);
                    changed = true;
                }
            }
        }
        return nullable;
    }

    /** Whether {@code production} derives the empty sequence given the nullable rule set. */
    public static boolean isNullable(Production production, Set<String> nullableRules) {
        if (production instanceof Terminal) {
            return false;
        } else if (production instanceof NonTerminal ref) {
            return nullableRules.contains(ref.ruleName());
        } else if (production instanceof Sequence sequence) {
            for (Production element : sequence.elements()) {
                if (!isNullable(element, nullableRules)) {
                    return false;
                }
            }
            return true;
        } else if (production instanceof Alternation alternation) {
            for (Alternative alternative : alternation.alternatives()) {
                if (isNullable(alternative.body(), nullableRules)) {
                    return true;
                }
            }
            return false;
        } else if (production instanceof RepetitionMandatory repetition) {
            return isNullable(repetition.body(), nullableRules);
        } else if (production instanceof RepetitionMandatoryWithSeparator repetition) {
            return isNullable(repetition.body(), nullableRules);
        } else if (production instanceof Option
                || production instanceof Repetition
                || production instanceof RepetitionWithSeparator
                || production instanceof Action) {
            return true;
        }
        throw new IllegalStateException("Unknown production " + production);
    }

    /**
     * Rules that {@code production} can invoke before consuming any token: the callees that
     * make left recursion possible.
     */
    public static Set<String> leadingCalls(Production production, Set<String> nullableRules) {
        Set<String> calls = new LinkedHashSet<>();
        collectLeadingCalls(production, nullableRules, calls);
        return calls;
    }

    private static void collectLeadingCalls(
            Production production, Set<String> nullableRules, Set<String> calls) {
        if (production instanceof Terminal || production instanceof Action) {
            return;
        } else if (production instanceof NonTerminal ref) {
            calls.add(ref.ruleName());
        } else if (production instanceof Sequence sequence) {
            for (Production element : sequence.elements()) {
                collectLeadingCalls(element, nullableRules, calls);
                if (!isNullable(element, nullableRules)) {
                    return;
                }
            }
        } else if (production instanceof Alternation alternation) {
            for (Alternative alternative : alternation.alternatives()) {
                collectLeadingCalls(alternative.body(), nullableRules, calls);
            }
        } else if (production instanceof Option option) {
            collectLeadingCalls(option.body(), nullableRules, calls);
        } else if (production instanceof Repetition repetition) {
            collectLeadingCalls(repetition.body(), nullableRules, calls);
        } else if (production instanceof RepetitionMandatory repetition) {
            collectLeadingCalls(repetition.body(), nullableRules, calls);
        } else if (production instanceof RepetitionWithSeparator repetition) {
            collectLeadingCalls(repetition.body(), nullableRules, calls);
        } else if (production instanceof RepetitionMandatoryWithSeparator repetition) {
            collectLeadingCalls(repetition.body(), nullableRules, calls);
        } else {
            throw new IllegalStateException("Unknown production " + production);
        }
    }
}

package com.llstar.engine.validate;

import com.llstar.engine.atn.Atn;
import com.llstar.engine.atn.AtnBuilder;
import com.llstar.engine.atn.Decision;
import com.llstar.engine.grammar.Alternative;
import com.llstar.engine.grammar.Grammar;
import com.llstar.engine.grammar.Production;
import com.llstar.engine.grammar.Production.Alternation;
import com.llstar.engine.grammar.Production.DecisionProduction;
import com.llstar.engine.grammar.Production.Option;
import com.llstar.engine.grammar.Production.Repetition;
import com.llstar.engine.grammar.Production.RepetitionMandatory;
import com.llstar.engine.grammar.Production.RepetitionMandatoryWithSeparator;
import com.llstar.engine.grammar.Production.RepetitionWithSeparator;
import com.llstar.engine.grammar.Production.Sequence;
import com.llstar.engine.token.TokenType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Offline analysis run once per grammar build, before any prediction. Combines the builder's
 * definition errors with left recursion, empty repetition and ambiguity findings into a single
 * batch.
 *
 * <p>Ambiguity is judged on bounded lookahead paths: a later alternative whose every path is
 * matched by an earlier alternative is shadowed; alternatives that merely share a prefix are
 * reported as overlapping and left to first-match at runtime. Pairs involving a guarded
 * alternative are skipped.
 */
public final class GrammarValidator {
    private static final Logger LOGGER = Logger.getLogger(GrammarValidator.class.getName());

    public static final int DEFAULT_MAX_LOOKAHEAD = 4;

    private final int maxLookahead;
    private final AmbiguityPolicy policy;

    public GrammarValidator() {
        this(DEFAULT_MAX_LOOKAHEAD, AmbiguityPolicy.WARN);
    }

    public GrammarValidator(int maxLookahead, AmbiguityPolicy policy) {
        this.maxLookahead = maxLookahead;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public GrammarDiagnostics validate(Grammar grammar, AtnBuilder.Result built) {
        GrammarDiagnostics diagnostics = new GrammarDiagnostics(built.errors());
        Set<String> nullable = grammar.nullableRules();
        checkLeftRecursion(grammar, nullable, diagnostics);
        for (String name : grammar.ruleNames()) {
            checkEmptyRepetitions(name, grammar.rule(name).definition(), nullable, diagnostics);
        }
        checkAmbiguities(built.atn(), diagnostics);

        for (Diagnostic diagnostic : diagnostics.all()) {
            if (LOGGER.isLoggable(Level.WARNING)) {
                LOGGER.warning(diagnostic.toString());
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                    "Validated grammar: errors="
                            + diagnostics.errors().size()
                            + ", warnings="
                            + diagnostics.warnings().size());
        }
        return diagnostics;
    }

    private void checkLeftRecursion(Grammar grammar, Set<String> nullable, GrammarDiagnostics diagnostics) {
        Map<String, Set<String>> calls = new LinkedHashMap<>();
        for (String name : grammar.ruleNames()) {
            calls.put(name, Grammar.leadingCalls(grammar.rule(name).definition(), nullable));
        }
        for (String name : calls.keySet()) {
            List<String> cycle = findCycle(name, calls);
            if (cycle != null) {
                diagnostics.add(Diagnostic.leftRecursion(name, cycle));
            }
        }
    }

    /** Shortest call path from {@code start} back to itself, or null. */
    private static List<String> findCycle(String start, Map<String, Set<String>> calls) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String callee : calls.getOrDefault(current, Set.of())) {
                if (callee.equals(start)) {
                    List<String> path = new ArrayList<>();
                    path.add(start);
                    for (String step = current; !step.equals(start); step = parent.get(step)) {
                        path.add(1, step);
                    }
                    path.add(start);
                    return path;
                }
                if (calls.containsKey(callee) && !parent.containsKey(callee)) {
                    parent.put(callee, current);
                    queue.add(callee);
                }
            }
        }
        return null;
    }

    private void checkEmptyRepetitions(
            String ruleName, Production production, Set<String> nullable, GrammarDiagnostics diagnostics) {
        Production body = null;
        if (production instanceof Repetition repetition) {
            body = repetition.body();
        } else if (production instanceof RepetitionMandatory repetition) {
            body = repetition.body();
        } else if (production instanceof RepetitionWithSeparator repetition) {
            body = repetition.body();
        } else if (production instanceof RepetitionMandatoryWithSeparator repetition) {
            body = repetition.body();
        }
        if (body != null && Grammar.isNullable(body, nullable)) {
            DecisionProduction repetition = (DecisionProduction) production;
            diagnostics.add(
                    Diagnostic.definition(
                            DiagnosticType.EMPTY_REPETITION,
                            ruleName,
                            "Repetition "
                                    + repetition.kind()
                                    + "#"
                                    + repetition.occurrence()
                                    + " in rule "
                                    + ruleName
                                    + " can match the empty sequence"));
        }
        if (production instanceof Sequence sequence) {
            for (Production element : sequence.elements()) {
                checkEmptyRepetitions(ruleName, element, nullable, diagnostics);
            }
        } else if (production instanceof Alternation alternation) {
            for (Alternative alternative : alternation.alternatives()) {
                checkEmptyRepetitions(ruleName, alternative.body(), nullable, diagnostics);
            }
        } else if (production instanceof Option option) {
            checkEmptyRepetitions(ruleName, option.body(), nullable, diagnostics);
        } else if (body != null) {
            checkEmptyRepetitions(ruleName, body, nullable, diagnostics);
        }
    }

    private void checkAmbiguities(Atn atn, GrammarDiagnostics diagnostics) {
        LookaheadPaths enumerator = new LookaheadPaths(atn, maxLookahead);
        for (Decision decision : atn.decisions()) {
            if (decision.alternativeCount() < 2) {
                continue;
            }
            List<List<List<TokenType>>> paths = enumerator.forDecision(decision);
            for (int j = 1; j < paths.size(); j++) {
                if (decision.guard(j) != null) {
                    continue;
                }
                for (int i = 0; i < j; i++) {
                    if (decision.guard(i) != null) {
                        continue;
                    }
                    Diagnostic finding = compare(decision, i, j, paths.get(i), paths.get(j));
                    if (finding != null) {
                        diagnostics.add(finding);
                        if (finding.type == DiagnosticType.SHADOWED_ALTERNATIVE) {
                            break;
                        }
                    }
                }
            }
        }
    }

    private Diagnostic compare(
            Decision decision, int i, int j, List<List<TokenType>> earlier, List<List<TokenType>> later) {
        if (!later.isEmpty() && covers(earlier, later)) {
            Severity severity = policy == AmbiguityPolicy.FATAL ? Severity.ERROR : Severity.WARNING;
            List<TokenType> example = later.get(0);
            return Diagnostic.ambiguity(
                    severity,
                    DiagnosticType.SHADOWED_ALTERNATIVE,
                    decision.key,
                    List.of(i, j),
                    example,
                    "Alternative "
                            + j
                            + " of "
                            + decision.key
                            + " is shadowed by alternative "
                            + i
                            + " (e.g. on "
                            + example
                            + ")");
        }
        List<TokenType> shared = longestSharedPrefix(earlier, later);
        if (!shared.isEmpty()) {
            return Diagnostic.ambiguity(
                    Severity.WARNING,
                    DiagnosticType.OVERLAPPING_PREFIX,
                    decision.key,
                    List.of(i, j),
                    shared,
                    "Alternatives "
                            + i
                            + " and "
                            + j
                            + " of "
                            + decision.key
                            + " share the prefix "
                            + shared
                            + "; alternative "
                            + i
                            + " wins where both match");
        }
        return null;
    }

    /** Every path of {@code later} is matched token by token by some path of {@code earlier}. */
    static boolean covers(List<List<TokenType>> earlier, List<List<TokenType>> later) {
        for (List<TokenType> path : later) {
            boolean matched = false;
            for (List<TokenType> candidate : earlier) {
                if (matchesPath(path, candidate)) {
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesPath(List<TokenType> path, List<TokenType> candidate) {
        if (path.size() != candidate.size()) {
            return false;
        }
        for (int k = 0; k < path.size(); k++) {
            if (!path.get(k).matches(candidate.get(k))) {
                return false;
            }
        }
        return true;
    }

    static List<TokenType> longestSharedPrefix(List<List<TokenType>> a, List<List<TokenType>> b) {
        List<TokenType> best = List.of();
        for (List<TokenType> left : a) {
            for (List<TokenType> right : b) {
                int n = 0;
                while (n < left.size() && n < right.size() && left.get(n).overlaps(right.get(n))) {
                    n++;
                }
                if (n > best.size()) {
                    best = left.subList(0, n);
                }
            }
        }
        return List.copyOf(best);
    }
}

package com.llstar.engine.atn;

import com.llstar.engine.grammar.Alternative;
import com.llstar.engine.grammar.ProductionKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Augmented transition network for a whole grammar: one sub-graph per rule, connected through
 * rule-call transitions. Built once by {@link AtnBuilder} and read-only afterwards.
 */
public final class Atn {
    private final List<AtnState> states = new ArrayList<>();
    private final Set<AtnState> removed = new HashSet<>();
    private final Map<String, AtnState> ruleToStart = new LinkedHashMap<>();
    private final Map<String, AtnState> ruleToStop = new LinkedHashMap<>();
    private final List<Decision> decisions = new ArrayList<>();
    private final Map<DecisionKey, Decision> entryDecisions = new HashMap<>();
    private final Map<DecisionKey, Decision> iterationDecisions = new HashMap<>();
    private int nextStateId;

    Atn() {}

    AtnState newState(AtnState.Kind kind, String ruleName) {
        AtnState state = new AtnState(nextStateId++, kind, ruleName);
        states.add(state);
        return state;
    }

    /** Marks {@code state} as unreachable; it is dropped by the next {@link #compact()}. */
    void removeState(AtnState state) {
        removed.add(state);
    }

    void compact() {
        if (!removed.isEmpty()) {
            states.removeIf(removed::contains);
            removed.clear();
        }
    }

    void defineRule(String ruleName, AtnState start, AtnState stop) {
        ruleToStart.put(ruleName, start);
        ruleToStop.put(ruleName, stop);
    }

    Decision defineDecision(
            AtnState state, DecisionKey key, boolean iteration, List<Alternative.Guard> guards) {
        Decision decision = new Decision(decisions.size(), key, state, iteration, guards);
        state.markDecision(decision.id);
        decisions.add(decision);
        if (iteration) {
            iterationDecisions.put(key, decision);
        } else {
            entryDecisions.put(key, decision);
        }
        return decision;
    }

    public List<AtnState> states() {
        return Collections.unmodifiableList(states);
    }

    public AtnState ruleStart(String ruleName) {
        return ruleToStart.get(ruleName);
    }

    public AtnState ruleStop(String ruleName) {
        return ruleToStop.get(ruleName);
    }

    public List<String> ruleNames() {
        return List.copyOf(ruleToStart.keySet());
    }

    public int ruleCount() {
        return ruleToStart.size();
    }

    /** Decision states in decision-id order. */
    public List<AtnState> decisionStates() {
        return decisions.stream().map(d -> d.state).toList();
    }

    public List<Decision> decisions() {
        return Collections.unmodifiableList(decisions);
    }

    public int decisionCount() {
        return decisions.size();
    }

    public Decision decision(int id) {
        if (id < 0 || id >= decisions.size()) {
            throw new IllegalArgumentException("Unknown decision id " + id);
        }
        return decisions.get(id);
    }

    /**
     * The decision taken on entering the production. For repetitions without a separate entry
     * question this is also the decision asked before every further iteration.
     */
    public Decision decision(String ruleName, ProductionKind kind, int occurrence) {
        DecisionKey key = new DecisionKey(ruleName, kind, occurrence);
        Decision decision = entryDecisions.get(key);
        if (decision == null) {
            decision = iterationDecisions.get(key);
        }
        if (decision == null) {
            throw new IllegalArgumentException("Unknown decision " + key);
        }
        return decision;
    }

    /** The "continue?" decision asked after each completed iteration of a repetition. */
    public Decision iterationDecision(String ruleName, ProductionKind kind, int occurrence) {
        DecisionKey key = new DecisionKey(ruleName, kind, occurrence);
        Decision decision = iterationDecisions.get(key);
        if (decision == null) {
            decision = entryDecisions.get(key);
        }
        if (decision == null) {
            throw new IllegalArgumentException("Unknown decision " + key);
        }
        return decision;
    }
}

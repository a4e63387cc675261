package com.llstar.engine.atn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the ATN. Outgoing transitions are ordered; for a decision state, transition {@code i}
 * leads into alternative {@code i}. States compare by identity and hash by id.
 */
public final class AtnState {

    public enum Kind {
        BASIC,
        RULE_START,
        RULE_STOP,
        BLOCK_START,
        BLOCK_END,
        LOOP_BACK,
        LOOP_ENTRY
    }

    public final int id;
    public final Kind kind;
    public final String ruleName;
    private final List<Transition> transitions = new ArrayList<>();
    private int decision = -1;

    AtnState(int id, Kind kind, String ruleName) {
        this.id = id;
        this.kind = kind;
        this.ruleName = ruleName;
    }

    public List<Transition> transitions() {
        return Collections.unmodifiableList(transitions);
    }

    /** Decision id, or -1 when this state is not a decision point. */
    public int decision() {
        return decision;
    }

    public boolean isDecision() {
        return decision >= 0;
    }

    public boolean isRuleStop() {
        return kind == Kind.RULE_STOP;
    }

    /** Whether leaving this state consumes a token. */
    public boolean hasAtomTransition() {
        for (Transition transition : transitions) {
            if (transition instanceof Transition.Atom) {
                return true;
            }
        }
        return false;
    }

    void addTransition(Transition transition) {
        transitions.add(transition);
    }

    void setTransition(int index, Transition transition) {
        transitions.set(index, transition);
    }

    void markDecision(int decision) {
        this.decision = decision;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return kind + "#" + id + "(" + ruleName + ")";
    }
}

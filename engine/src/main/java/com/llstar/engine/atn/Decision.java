package com.llstar.engine.atn;

import com.llstar.engine.grammar.Alternative;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A registered decision point. {@code iteration} distinguishes the "continue?" decision of a
 * separated zero-or-more repetition from its "enter?" decision.
 */
public final class Decision {
    public final int id;
    public final DecisionKey key;
    public final AtnState state;
    public final boolean iteration;
    private final List<Alternative.Guard> guards;

    Decision(int id, DecisionKey key, AtnState state, boolean iteration, List<Alternative.Guard> guards) {
        this.id = id;
        this.key = Objects.requireNonNull(key, "key");
        this.state = Objects.requireNonNull(state, "state");
        this.iteration = iteration;
        this.guards = Collections.unmodifiableList(new ArrayList<>(guards));
    }

    public int alternativeCount() {
        return state.transitions().size();
    }

    public boolean predictsAlternative() {
        return key.kind().predictsAlternative();
    }

    /** Guard of alternative {@code alt}, or null when unguarded. */
    public Alternative.Guard guard(int alt) {
        return alt < guards.size() ? guards.get(alt) : null;
    }

    public boolean hasGuards() {
        for (Alternative.Guard guard : guards) {
            if (guard != null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "decision " + id + " (" + key + (iteration ? ", iteration" : "") + ")";
    }
}

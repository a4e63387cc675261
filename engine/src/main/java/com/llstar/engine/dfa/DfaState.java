package com.llstar.engine.dfa;

import com.llstar.engine.config.AtnConfigSet;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A memoized lookahead state: the frontier of ATN configs after some token prefix, plus edges
 * keyed by token type id. Accepting states carry the predicted alternative; conflict states are
 * accepting states whose prediction was settled by first-match because lookahead could not
 * separate the alternatives.
 */
public final class DfaState {
    public final AtnConfigSet configs;
    public final boolean acceptState;
    public final int prediction;
    public final boolean conflict;
    private final Map<Integer, DfaState> edges = new HashMap<>();

    public DfaState(AtnConfigSet configs) {
        this.configs = Objects.requireNonNull(configs, "configs");
        int unique = configs.uniqueAlt();
        if (unique >= 0) {
            this.acceptState = true;
            this.prediction = unique;
            this.conflict = false;
        } else if (configs.isConflictTerminal()) {
            this.acceptState = true;
            this.prediction = configs.alts().nextSetBit(0);
            this.conflict = true;
        } else {
            this.acceptState = false;
            this.prediction = -1;
            this.conflict = false;
        }
    }

    public BitSet alts() {
        return configs.alts();
    }

    public DfaState edge(int tokenTypeId) {
        return edges.get(tokenTypeId);
    }

    public int edgeCount() {
        return edges.size();
    }

    void addEdge(int tokenTypeId, DfaState target) {
        edges.put(tokenTypeId, target);
    }

    @Override
    public String toString() {
        return "DfaState" + configs.alts() + (acceptState ? "=>" + prediction : "") + (conflict ? "!" : "");
    }
}

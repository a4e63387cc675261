package com.llstar.engine.dfa;

import com.llstar.engine.atn.Atn;
import com.llstar.engine.atn.Decision;
import java.util.Objects;

/**
 * One lazily created DFA per decision, indexed by decision id. A cache belongs to one engine
 * instance and is not safe for concurrent mutation.
 */
public final class DfaCache {
    private final Atn atn;
    private Dfa[] dfas;

    public DfaCache(Atn atn) {
        this.atn = Objects.requireNonNull(atn, "atn");
        this.dfas = new Dfa[atn.decisionCount()];
    }

    public Dfa dfa(Decision decision) {
        Dfa dfa = dfas[decision.id];
        if (dfa == null) {
            dfa = new Dfa(decision);
            dfas[decision.id] = dfa;
        }
        return dfa;
    }

    /** The DFA of {@code decisionId} if one was created, else null. */
    public Dfa existing(int decisionId) {
        return dfas[decisionId];
    }

    public int stateCount() {
        int count = 0;
        for (Dfa dfa : dfas) {
            if (dfa != null) {
                count += dfa.stateCount();
            }
        }
        return count;
    }

    public int edgeCount() {
        int count = 0;
        for (Dfa dfa : dfas) {
            if (dfa != null) {
                count += dfa.edgeCount();
            }
        }
        return count;
    }

    public void clear() {
        dfas = new Dfa[atn.decisionCount()];
    }
}

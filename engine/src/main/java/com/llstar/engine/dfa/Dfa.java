package com.llstar.engine.dfa;

import com.llstar.engine.atn.Decision;
import com.llstar.engine.config.AtnConfigSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lookahead automaton of one decision, populated lazily and only ever grown. New states and
 * edges are staged in a {@link Transaction} and published together once a prediction succeeds.
 */
public final class Dfa {
    public final Decision decision;
    private final Map<AtnConfigSet.Key, DfaState> states = new HashMap<>();
    private DfaState start;
    private int edgeCount;

    Dfa(Decision decision) {
        this.decision = Objects.requireNonNull(decision, "decision");
    }

    public DfaState start() {
        return start;
    }

    public int stateCount() {
        return states.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public Transaction begin() {
        return new Transaction();
    }

    /** Uncommitted additions made while simulating one prediction. */
    public final class Transaction {
        private final Map<AtnConfigSet.Key, DfaState> newStates = new HashMap<>();
        private final Map<DfaState, Map<Integer, DfaState>> newEdges = new HashMap<>();
        private DfaState newStart;

        private Transaction() {}

        public DfaState start() {
            return newStart != null ? newStart : start;
        }

        public void setStart(DfaState state) {
            newStart = state;
        }

        /** The memoized state for {@code configs}, or a new staged one. */
        public DfaState state(AtnConfigSet configs) {
            AtnConfigSet.Key key = configs.key();
            DfaState existing = states.get(key);
            if (existing == null) {
                existing = newStates.get(key);
            }
            if (existing != null) {
                return existing;
            }
            DfaState created = new DfaState(configs);
            newStates.put(key, created);
            return created;
        }

        public boolean isNew(DfaState state) {
            return newStates.get(state.configs.key()) == state;
        }

        public DfaState edge(DfaState from, int tokenTypeId) {
            DfaState target = from.edge(tokenTypeId);
            if (target == null) {
                Map<Integer, DfaState> staged = newEdges.get(from);
                target = staged == null ? null : staged.get(tokenTypeId);
            }
            return target;
        }

        public void addEdge(DfaState from, int tokenTypeId, DfaState to) {
            newEdges.computeIfAbsent(from, k -> new HashMap<>()).put(tokenTypeId, to);
        }

        public int stagedStates() {
            return newStates.size();
        }

        public void commit() {
            if (newStart != null && start == null) {
                start = newStart;
                states.put(newStart.configs.key(), newStart);
            }
            states.putAll(newStates);
            for (Map.Entry<DfaState, Map<Integer, DfaState>> entry : newEdges.entrySet()) {
                for (Map.Entry<Integer, DfaState> edge : entry.getValue().entrySet()) {
                    if (entry.getKey().edge(edge.getKey()) == null) {
                        entry.getKey().addEdge(edge.getKey(), edge.getValue());
                        edgeCount++;
                    }
                }
            }
        }
    }
}

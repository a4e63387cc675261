package com.llstar.engine.config;

import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated frontier of configs. By default configs collide on {@code (state, stack)} and the
 * lowest alternative wins; an alt-sensitive set keeps every colliding alternative so conflicts
 * stay observable.
 */
public final class AtnConfigSet {

    private record Entry(int stateId, int alt, CallStack stack) {}

    /** Order-independent identity of a frozen set, used to memoize DFA states. */
    public static final class Key {
        private final Set<Entry> entries;
        private final int hash;

        private Key(Set<Entry> entries) {
            this.entries = entries;
            this.hash = entries.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Key other && other.hash == hash && other.entries.equals(entries);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    private final boolean altSensitive;
    private final Map<Entry, AtnConfig> configs = new LinkedHashMap<>();
    private boolean frozen;
    private Key key;
    private BitSet alts;
    private int uniqueAlt = -2;

    public AtnConfigSet(boolean altSensitive) {
        this.altSensitive = altSensitive;
    }

    /** Adds {@code config}; returns false when an equivalent config was already present. */
    public boolean add(AtnConfig config) {
        if (frozen) {
            throw new IllegalStateException("config set is frozen");
        }
        Entry entry = entryOf(config);
        AtnConfig existing = configs.get(entry);
        if (existing != null && (altSensitive || existing.alt() <= config.alt())) {
            return false;
        }
        configs.put(entry, config);
        alts = null;
        uniqueAlt = -2;
        return true;
    }

    public boolean contains(AtnConfig config) {
        AtnConfig existing = configs.get(entryOf(config));
        return existing != null && existing.alt() == config.alt();
    }

    public List<AtnConfig> elements() {
        return List.copyOf(configs.values());
    }

    public int size() {
        return configs.size();
    }

    public boolean isEmpty() {
        return configs.isEmpty();
    }

    /** Alternatives still represented in this set. */
    public BitSet alts() {
        if (alts == null) {
            BitSet computed = new BitSet();
            for (AtnConfig config : configs.values()) {
                computed.set(config.alt());
            }
            alts = computed;
        }
        return (BitSet) alts.clone();
    }

    /** The single alternative all configs agree on, or -1. */
    public int uniqueAlt() {
        if (uniqueAlt == -2) {
            BitSet present = alts();
            uniqueAlt = present.cardinality() == 1 ? present.nextSetBit(0) : -1;
        }
        return uniqueAlt;
    }

    public boolean hasRuleStopConfig() {
        for (AtnConfig config : configs.values()) {
            if (config.state().isRuleStop()) {
                return true;
            }
        }
        return false;
    }

    public boolean allInRuleStop() {
        if (configs.isEmpty()) {
            return false;
        }
        for (AtnConfig config : configs.values()) {
            if (!config.state().isRuleStop()) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when lookahead can no longer separate the alternatives: either every path has left
     * the decision's rule, or every {@code (state, stack)} is shared by several alternatives and
     * none is owned by a single one.
     */
    public boolean isConflictTerminal() {
        if (allInRuleStop()) {
            return true;
        }
        Map<Entry, BitSet> altsByLocation = new LinkedHashMap<>();
        for (AtnConfig config : configs.values()) {
            Entry location = new Entry(config.state().id, -1, config.stack());
            altsByLocation.computeIfAbsent(location, k -> new BitSet()).set(config.alt());
        }
        boolean conflicting = false;
        for (BitSet set : altsByLocation.values()) {
            if (set.cardinality() == 1) {
                return false;
            }
            conflicting = true;
        }
        return conflicting;
    }

    public AtnConfigSet freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Identity including alternatives, independent of insertion order. */
    public Key key() {
        if (!frozen) {
            throw new IllegalStateException("key of a mutable config set");
        }
        if (key == null) {
            Set<Entry> entries = new HashSet<>();
            for (AtnConfig config : configs.values()) {
                entries.add(new Entry(config.state().id, config.alt(), config.stack()));
            }
            key = new Key(Set.copyOf(entries));
        }
        return key;
    }

    private Entry entryOf(AtnConfig config) {
        return new Entry(config.state().id, altSensitive ? config.alt() : -1, config.stack());
    }

    @Override
    public String toString() {
        return configs.values().toString();
    }
}

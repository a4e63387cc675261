package com.llstar.engine.predict;

import java.util.BitSet;

/**
 * Alternatives a caller allows for one prediction, usually the outcome of gates it evaluated
 * itself. Alternatives outside the mask are never predicted.
 */
public final class PredicateMask {
    public static final PredicateMask ALL = new PredicateMask(null);

    private final BitSet disabled;

    private PredicateMask(BitSet disabled) {
        this.disabled = disabled;
    }

    /** Mask from per-alternative flags; alternatives beyond the array are enabled. */
    public static PredicateMask of(boolean... enabled) {
        BitSet disabled = new BitSet();
        for (int alt = 0; alt < enabled.length; alt++) {
            if (!enabled[alt]) {
                disabled.set(alt);
            }
        }
        return disabled.isEmpty() ? ALL : new PredicateMask(disabled);
    }

    public static PredicateMask disabling(int... alts) {
        BitSet disabled = new BitSet();
        for (int alt : alts) {
            disabled.set(alt);
        }
        return disabled.isEmpty() ? ALL : new PredicateMask(disabled);
    }

    public boolean isEnabled(int alt) {
        return disabled == null || !disabled.get(alt);
    }

    public boolean isAll() {
        return disabled == null;
    }

    /** {@code alts} restricted to enabled alternatives. */
    public BitSet filter(BitSet alts) {
        BitSet result = (BitSet) alts.clone();
        if (disabled != null) {
            result.andNot(disabled);
        }
        return result;
    }

    @Override
    public String toString() {
        return disabled == null ? "ALL" : "disabled" + disabled;
    }
}

package com.llstar.engine.validate;

import com.llstar.engine.atn.Atn;
import com.llstar.engine.atn.Decision;
import com.llstar.engine.atn.Transition;
import com.llstar.engine.config.AtnConfig;
import com.llstar.engine.config.CallStack;
import com.llstar.engine.config.Closure;
import com.llstar.engine.token.TokenType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bounded-depth enumeration of the token sequences an alternative can start with. A path shorter
 * than the depth ends where the decision's rule ends; a path of full depth may continue.
 */
public final class LookaheadPaths {
    private final Closure closure;
    private final int depth;

    public LookaheadPaths(Atn atn, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("lookahead depth must be positive: " + depth);
        }
        this.closure = new Closure(Objects.requireNonNull(atn, "atn"));
        this.depth = depth;
    }

    public List<List<TokenType>> forAlternative(Decision decision, int alt) {
        Transition entry = decision.state.transitions().get(alt);
        List<AtnConfig> start =
                closure.compute(new AtnConfig(entry.target(), alt, CallStack.EMPTY), true).elements();
        Set<List<TokenType>> paths = new LinkedHashSet<>();
        explore(start, new ArrayList<>(), paths);
        return List.copyOf(paths);
    }

    public List<List<List<TokenType>>> forDecision(Decision decision) {
        List<List<List<TokenType>>> perAlternative = new ArrayList<>();
        for (int alt = 0; alt < decision.alternativeCount(); alt++) {
            perAlternative.add(forAlternative(decision, alt));
        }
        return perAlternative;
    }

    private void explore(List<AtnConfig> configs, List<TokenType> prefix, Set<List<TokenType>> paths) {
        if (prefix.size() >= depth) {
            paths.add(List.copyOf(prefix));
            return;
        }
        Map<TokenType, List<AtnConfig>> byType = new LinkedHashMap<>();
        boolean exits = false;
        for (AtnConfig config : configs) {
            if (config.state().isRuleStop()) {
                exits = true;
                continue;
            }
            for (Transition transition : config.state().transitions()) {
                if (transition instanceof Transition.Atom atom) {
                    byType.computeIfAbsent(atom.type(), k -> new ArrayList<>())
                            .add(config.moveTo(atom.target()));
                }
            }
        }
        if (exits) {
            paths.add(List.copyOf(prefix));
        }
        for (Map.Entry<TokenType, List<AtnConfig>> entry : byType.entrySet()) {
            prefix.add(entry.getKey());
            explore(closure.compute(entry.getValue(), true).elements(), prefix, paths);
            prefix.remove(prefix.size() - 1);
        }
    }
}

package com.llstar.engine.config;

import com.llstar.engine.atn.Atn;
import com.llstar.engine.atn.AtnState;
import com.llstar.engine.atn.Transition;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Epsilon closure over the ATN with simulated rule calls. A rule call pushes its follow state; a
 * rule stop pops it, or, with an empty stack, is kept as a rule exit. Only configs that are about
 * to consume a token, or that have left the decision's rule, end up in the result.
 *
 * <p>Each {@code (state, stack)} is expanded once per computation. Within one computation the
 * stack may grow by at most the number of rules: deeper growth is only possible through left
 * recursion, which is cut off here and reported by the validator.
 */
public final class Closure {
    private record Visit(int stateId, int alt, CallStack stack) {}

    private final Atn atn;

    public Closure(Atn atn) {
        this.atn = Objects.requireNonNull(atn, "atn");
    }

    public AtnConfigSet compute(Collection<AtnConfig> initial, boolean altSensitive) {
        List<AtnConfig> ordered = new ArrayList<>(initial);
        ordered.sort(Comparator.comparingInt(AtnConfig::alt));
        int baseDepth = 0;
        for (AtnConfig config : ordered) {
            baseDepth = Math.max(baseDepth, config.stack().size());
        }
        int depthLimit = baseDepth + atn.ruleCount();
        AtnConfigSet result = new AtnConfigSet(altSensitive);
        Set<Visit> visited = new HashSet<>();
        for (AtnConfig config : ordered) {
            expand(config, result, visited, altSensitive, depthLimit);
        }
        return result.freeze();
    }

    public AtnConfigSet compute(AtnConfig initial, boolean altSensitive) {
        return compute(List.of(initial), altSensitive);
    }

    private void expand(
            AtnConfig config,
            AtnConfigSet result,
            Set<Visit> visited,
            boolean altSensitive,
            int depthLimit) {
        Visit visit = new Visit(config.state().id, altSensitive ? config.alt() : -1, config.stack());
        if (!visited.add(visit)) {
            return;
        }
        AtnState state = config.state();
        if (state.isRuleStop()) {
            if (config.stack().isEmpty()) {
                result.add(config);
            } else {
                AtnState follow = config.stack().peek();
                expand(
                        new AtnConfig(follow, config.alt(), config.stack().pop()),
                        result,
                        visited,
                        altSensitive,
                        depthLimit);
            }
            return;
        }
        if (state.hasAtomTransition()) {
            result.add(config);
        }
        for (Transition transition : state.transitions()) {
            if (transition instanceof Transition.Epsilon) {
                expand(config.moveTo(transition.target()), result, visited, altSensitive, depthLimit);
            } else if (transition instanceof Transition.RuleCall call) {
                if (config.stack().size() >= depthLimit) {
                    continue;
                }
                expand(
                        new AtnConfig(call.target(), config.alt(), config.stack().push(call.followState())),
                        result,
                        visited,
                        altSensitive,
                        depthLimit);
            } else if (!(transition instanceof Transition.Atom)) {
                throw new IllegalStateException("Unexpected transition " + transition);
            }
        }
    }
}

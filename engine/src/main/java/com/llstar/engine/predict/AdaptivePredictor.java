package com.llstar.engine.predict;

import com.llstar.engine.atn.Decision;
import com.llstar.engine.atn.Transition;
import com.llstar.engine.config.AtnConfig;
import com.llstar.engine.config.AtnConfigSet;
import com.llstar.engine.config.CallStack;
import com.llstar.engine.config.Closure;
import com.llstar.engine.dfa.Dfa;
import com.llstar.engine.dfa.DfaCache;
import com.llstar.engine.dfa.DfaState;
import com.llstar.engine.grammar.Alternative;
import com.llstar.engine.token.Token;
import com.llstar.engine.token.TokenStream;
import com.llstar.engine.token.TokenType;
import com.llstar.engine.validate.LookaheadPaths;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adaptive lookahead: walks (and lazily extends) the decision's DFA one token at a time until
 * the live alternatives collapse to one. When lookahead cannot separate them, including once the
 * end of input has been consumed, guards are tried in declared order and otherwise the lowest
 * alternative wins.
 *
 * <p>Without a restricting mask every step goes through the cached DFA. With one, unless
 * configured otherwise, the DFA is not touched at all: the start state and every reach are
 * computed from the enabled alternatives only.
 */
final class AdaptivePredictor {
    private static final Logger LOGGER = Logger.getLogger(AdaptivePredictor.class.getName());

    private final DfaCache cache;
    private final Closure closure;
    private final LookaheadPaths paths;
    private final boolean detectAmbiguities;
    private final boolean reuseEdgesUnderPredicates;

    AdaptivePredictor(
            DfaCache cache,
            Closure closure,
            LookaheadPaths paths,
            boolean detectAmbiguities,
            boolean reuseEdgesUnderPredicates) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.closure = Objects.requireNonNull(closure, "closure");
        this.paths = Objects.requireNonNull(paths, "paths");
        this.detectAmbiguities = detectAmbiguities;
        this.reuseEdgesUnderPredicates = reuseEdgesUnderPredicates;
    }

    int predict(Decision decision, TokenStream input, PredicateMask mask) {
        if (decision.alternativeCount() == 1) {
            return 0;
        }
        // Reused edges must keep colliding alternatives apart, since a mask may disable the winner.
        boolean altSensitive = detectAmbiguities || reuseEdgesUnderPredicates || decision.hasGuards();
        boolean bypassEdges = !mask.isAll() && !reuseEdgesUnderPredicates;
        Dfa dfa = cache.dfa(decision);
        Dfa.Transaction transaction = dfa.begin();

        DfaState state;
        if (bypassEdges) {
            // The cached start may have merged an enabled alternative into a disabled one.
            state = new DfaState(startConfigs(decision, mask, altSensitive));
        } else {
            state = transaction.start();
            if (state == null) {
                state = transaction.state(startConfigs(decision, PredicateMask.ALL, altSensitive));
                transaction.setStart(state);
                reportIfConflict(decision, state);
            }
        }

        int k = 1;
        boolean pastEnd = false;
        while (true) {
            BitSet live = mask.filter(state.alts());
            if (live.isEmpty()) {
                throw noViableAlternative(decision, input.peek(k), live);
            }
            if (live.cardinality() == 1) {
                commit(decision, transaction);
                return live.nextSetBit(0);
            }
            if (state.conflict || pastEnd) {
                int alt = firstHolding(decision, live);
                if (alt < 0) {
                    throw noViableAlternative(decision, input.peek(k), live);
                }
                commit(decision, transaction);
                return alt;
            }

            Token token = input.peek(k);
            DfaState next = bypassEdges ? null : transaction.edge(state, token.typeId());
            if (next == null) {
                AtnConfigSet reach =
                        computeReach(state.configs, token, bypassEdges ? mask : PredicateMask.ALL, altSensitive);
                if (reach.isEmpty()) {
                    throw noViableAlternative(decision, token, live);
                }
                if (bypassEdges) {
                    next = new DfaState(reach);
                } else {
                    next = transaction.state(reach);
                    transaction.addEdge(state, token.typeId(), next);
                    if (transaction.isNew(next)) {
                        reportIfConflict(decision, next);
                    }
                }
            } else if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer(decision + ": cached edge on " + token.type());
            }
            state = next;
            pastEnd = token.type().equals(TokenType.EOF);
            k++;
        }
    }

    private AtnConfigSet startConfigs(Decision decision, PredicateMask mask, boolean altSensitive) {
        List<AtnConfig> initial = new ArrayList<>();
        List<Transition> transitions = decision.state.transitions();
        for (int alt = 0; alt < transitions.size(); alt++) {
            if (!mask.isEnabled(alt)) {
                continue;
            }
            Transition transition = transitions.get(alt);
            if (!(transition instanceof Transition.Epsilon)) {
                throw new IllegalStateException(
                        decision + " has a non-epsilon alternative entry: " + transition);
            }
            initial.add(new AtnConfig(transition.target(), alt, CallStack.EMPTY));
        }
        return closure.compute(initial, altSensitive);
    }

    /**
     * Configs reachable by consuming {@code token}. Paths that already left the decision's rule
     * cannot consume anything; they are kept alive only while no consuming path has also left it.
     */
    private AtnConfigSet computeReach(
            AtnConfigSet configs, Token token, PredicateMask mask, boolean altSensitive) {
        List<AtnConfig> moved = new ArrayList<>();
        List<AtnConfig> exited = new ArrayList<>();
        for (AtnConfig config : configs.elements()) {
            if (!mask.isEnabled(config.alt())) {
                continue;
            }
            if (config.state().isRuleStop()) {
                exited.add(config);
                continue;
            }
            for (Transition transition : config.state().transitions()) {
                if (transition instanceof Transition.Atom atom && token.type().matches(atom.type())) {
                    moved.add(config.moveTo(atom.target()));
                }
            }
        }
        AtnConfigSet reach = closure.compute(moved, altSensitive);
        if (!exited.isEmpty() && !reach.hasRuleStopConfig()) {
            List<AtnConfig> all = new ArrayList<>(moved);
            all.addAll(exited);
            reach = closure.compute(all, altSensitive);
        }
        return reach;
    }

    private static int firstHolding(Decision decision, BitSet live) {
        for (int alt = live.nextSetBit(0); alt >= 0; alt = live.nextSetBit(alt + 1)) {
            Alternative.Guard guard = decision.guard(alt);
            if (guard == null || guard.holds()) {
                return alt;
            }
        }
        return -1;
    }

    private void commit(Decision decision, Dfa.Transaction transaction) {
        int created = transaction.stagedStates();
        transaction.commit();
        if (created > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(decision + ": added " + created + " DFA state(s)");
        }
    }

    private void reportIfConflict(Decision decision, DfaState state) {
        if (!state.conflict || !detectAmbiguities || decision.hasGuards()) {
            return;
        }
        if (LOGGER.isLoggable(Level.WARNING)) {
            LOGGER.warning(
                    "Ambiguous lookahead in "
                            + decision
                            + ": alternatives "
                            + state.alts()
                            + " cannot be told apart, choosing "
                            + state.prediction);
        }
    }

    private NoViableAlternativeException noViableAlternative(Decision decision, Token token, BitSet alive) {
        List<Integer> alternatives = new ArrayList<>();
        List<List<TokenType>> expected = new ArrayList<>();
        for (int alt = alive.nextSetBit(0); alt >= 0; alt = alive.nextSetBit(alt + 1)) {
            alternatives.add(alt);
            for (List<TokenType> path : paths.forAlternative(decision, alt)) {
                if (!expected.contains(path)) {
                    expected.add(path);
                }
            }
        }
        return new NoViableAlternativeException(
                token, expected, alternatives, decision.key.ruleName(), decision.id);
    }
}

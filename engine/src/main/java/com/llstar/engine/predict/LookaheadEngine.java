package com.llstar.engine.predict;

import com.llstar.engine.atn.Atn;
import com.llstar.engine.atn.AtnBuilder;
import com.llstar.engine.atn.Decision;
import com.llstar.engine.config.Closure;
import com.llstar.engine.dfa.DfaCache;
import com.llstar.engine.grammar.Grammar;
import com.llstar.engine.grammar.ProductionKind;
import com.llstar.engine.token.TokenStream;
import com.llstar.engine.validate.AmbiguityPolicy;
import com.llstar.engine.validate.GrammarDiagnostics;
import com.llstar.engine.validate.GrammarValidator;
import com.llstar.engine.validate.LookaheadPaths;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a parser: owns the grammar's ATN and one DFA cache. The parser calls
 * {@link #predict} at each alternation and {@link #predictContinue} at each option or repetition.
 *
 * <p>An engine is single-threaded. Parsers on other threads get their own instance through
 * {@link #withFreshCache()}, which shares the immutable ATN.
 */
public final class LookaheadEngine {
    private static final Logger LOGGER = Logger.getLogger(LookaheadEngine.class.getName());

    public static final class Config {
        public int maxLookahead = GrammarValidator.DEFAULT_MAX_LOOKAHEAD;
        public AmbiguityPolicy ambiguityPolicy = AmbiguityPolicy.WARN;
        public boolean reuseEdgesUnderPredicates = false;
        public boolean detectAmbiguities = false;
        public int maxAlternatives = AtnBuilder.DEFAULT_MAX_ALTERNATIVES;

        /** Reads {@code llstar.*} keys; absent keys keep their defaults. */
        public static Config fromProperties(Properties properties) {
            Config config = new Config();
            config.maxLookahead = intValue(properties, "llstar.maxLookahead", config.maxLookahead);
            config.maxAlternatives = intValue(properties, "llstar.maxAlternatives", config.maxAlternatives);
            config.reuseEdgesUnderPredicates =
                    booleanValue(properties, "llstar.reuseEdgesUnderPredicates", config.reuseEdgesUnderPredicates);
            config.detectAmbiguities =
                    booleanValue(properties, "llstar.detectAmbiguities", config.detectAmbiguities);
            String policy = properties.getProperty("llstar.ambiguityPolicy");
            if (policy != null) {
                try {
                    config.ambiguityPolicy = AmbiguityPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid llstar.ambiguityPolicy: " + policy, e);
                }
            }
            if (config.maxLookahead < 1) {
                throw new IllegalArgumentException("llstar.maxLookahead must be positive: " + config.maxLookahead);
            }
            return config;
        }

        Config copy() {
            Config copy = new Config();
            copy.maxLookahead = maxLookahead;
            copy.ambiguityPolicy = ambiguityPolicy;
            copy.reuseEdgesUnderPredicates = reuseEdgesUnderPredicates;
            copy.detectAmbiguities = detectAmbiguities;
            copy.maxAlternatives = maxAlternatives;
            return copy;
        }

        private static int intValue(Properties properties, String key, int defaultValue) {
            String value = properties.getProperty(key);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
            }
        }

        private static boolean booleanValue(Properties properties, String key, boolean defaultValue) {
            String value = properties.getProperty(key);
            if (value == null) {
                return defaultValue;
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if (!normalized.equals("true") && !normalized.equals("false")) {
                throw new IllegalArgumentException("Invalid " + key + ": " + value);
            }
            return Boolean.parseBoolean(normalized);
        }
    }

    private final Atn atn;
    private final GrammarDiagnostics diagnostics;
    private final Config config;
    private final DfaCache cache;
    private final AdaptivePredictor predictor;

    private LookaheadEngine(Atn atn, GrammarDiagnostics diagnostics, Config config) {
        this.atn = atn;
        this.diagnostics = diagnostics;
        this.config = config;
        this.cache = new DfaCache(atn);
        this.predictor =
                new AdaptivePredictor(
                        cache,
                        new Closure(atn),
                        new LookaheadPaths(atn, config.maxLookahead),
                        config.detectAmbiguities,
                        config.reuseEdgesUnderPredicates);
    }

    public static LookaheadEngine create(Grammar grammar) {
        return create(grammar, new Config());
    }

    /**
     * Builds and validates the grammar.
     *
     * @throws GrammarDefinitionException with every diagnostic when any of them is an error
     */
    public static LookaheadEngine create(Grammar grammar, Config config) {
        Objects.requireNonNull(grammar, "grammar");
        Config snapshot = Objects.requireNonNull(config, "config").copy();
        AtnBuilder.Result built = new AtnBuilder(snapshot.maxAlternatives).build(grammar);
        GrammarDiagnostics diagnostics =
                new GrammarValidator(snapshot.maxLookahead, snapshot.ambiguityPolicy).validate(grammar, built);
        if (diagnostics.hasErrors()) {
            throw new GrammarDefinitionException(diagnostics);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                    "Lookahead engine ready: decisions="
                            + built.atn().decisionCount()
                            + ", warnings="
                            + diagnostics.warnings().size());
        }
        return new LookaheadEngine(built.atn(), diagnostics, snapshot);
    }

    /** Builds and validates without creating an engine; never throws for definition errors. */
    public static GrammarDiagnostics analyze(Grammar grammar, Config config) {
        AtnBuilder.Result built = new AtnBuilder(config.maxAlternatives).build(grammar);
        return new GrammarValidator(config.maxLookahead, config.ambiguityPolicy).validate(grammar, built);
    }

    /** An engine over the same ATN with an empty cache of its own. */
    public LookaheadEngine withFreshCache() {
        return new LookaheadEngine(atn, diagnostics, config);
    }

    /** Predicts the alternative to take at {@code decisionId}. */
    public int predict(int decisionId, TokenStream input) {
        return predict(decisionId, input, PredicateMask.ALL);
    }

    public int predict(int decisionId, TokenStream input, PredicateMask mask) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(mask, "mask");
        return predictor.predict(atn.decision(decisionId), input, mask);
    }

    /** For option and repetition decisions: whether to enter (or run another iteration of) the body. */
    public boolean predictContinue(int decisionId, TokenStream input) {
        return predictContinue(decisionId, input, PredicateMask.ALL);
    }

    public boolean predictContinue(int decisionId, TokenStream input, PredicateMask mask) {
        Decision decision = atn.decision(decisionId);
        if (decision.predictsAlternative()) {
            throw new IllegalArgumentException(decision + " predicts an alternative, not a flag");
        }
        return predict(decisionId, input, mask) == 0;
    }

    public int decisionId(String ruleName, ProductionKind kind, int occurrence) {
        return atn.decision(ruleName, kind, occurrence).id;
    }

    public int iterationDecisionId(String ruleName, ProductionKind kind, int occurrence) {
        return atn.iterationDecision(ruleName, kind, occurrence).id;
    }

    public Atn atn() {
        return atn;
    }

    public GrammarDiagnostics diagnostics() {
        return diagnostics;
    }

    public DfaCache cache() {
        return cache;
    }

    public void clearCache() {
        cache.clear();
    }
}

package com.plotlab.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.plotlab.expr.ExpressionEngine;
import com.plotlab.expr.parser.ExpressionException;
import com.plotlab.sampling.SamplingSettings;

/**
 * Immutable rules of a session: sampling domain, difficulty tiers, target
 * templates per tier, skip penalty, hint budget and hint wording.
 *
 * Built explicitly through {@link Builder} (or read by {@link GameConfigLoader})
 * and handed to {@link PlotChallenge}; nothing here is global.
 */
public final class GameConfig {

    public static final int DEFAULT_SKIP_PENALTY = 50;
    public static final int DEFAULT_INITIAL_HINTS = 3;
    public static final double DEFAULT_ERROR_EPSILON = 1e-6;
    public static final String DEFAULT_FALLBACK_HINT = "Try basic functions like sin, cos, or polynomials";

    private final SamplingSettings sampling;
    private final Map<DifficultyTier, TierSettings> tiers;
    private final Map<DifficultyTier, List<String>> templates;
    private final int skipPenalty;
    private final int initialHints;
    private final double errorEpsilon;
    private final Map<String, String> hintFacts;
    private final String fallbackHint;

    private GameConfig(Builder b) {
        this.sampling = b.sampling;
        this.tiers = Collections.unmodifiableMap(new EnumMap<>(b.tiers));
        EnumMap<DifficultyTier, List<String>> t = new EnumMap<>(DifficultyTier.class);
        for (Map.Entry<DifficultyTier, List<String>> e : b.templates.entrySet()) {
            t.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.templates = Collections.unmodifiableMap(t);
        this.skipPenalty = b.skipPenalty;
        this.initialHints = b.initialHints;
        this.errorEpsilon = b.errorEpsilon;
        this.hintFacts = Collections.unmodifiableMap(new LinkedHashMap<>(b.hintFacts));
        this.fallbackHint = b.fallbackHint;
    }

    public static GameConfig defaults() {
        return defaultsBuilder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with the stock rules, for overriding a few values. */
    public static Builder defaultsBuilder() {
        Builder b = new Builder()
                .sampling(SamplingSettings.defaults())
                .skipPenalty(DEFAULT_SKIP_PENALTY)
                .initialHints(DEFAULT_INITIAL_HINTS)
                .errorEpsilon(DEFAULT_ERROR_EPSILON)
                .fallbackHint(DEFAULT_FALLBACK_HINT)
                .tier(new TierSettings(DifficultyTier.EASY, 3, 100, 0.05))
                .tier(new TierSettings(DifficultyTier.MEDIUM, 6, 200, 0.04))
                .tier(new TierSettings(DifficultyTier.HARD, 10, 300, 0.03))
                .tier(new TierSettings(DifficultyTier.EXPERT, TierSettings.UNBOUNDED, 500, 0.02))
                .templates(DifficultyTier.EASY, List.of(
                        "sin(x)",
                        "cos(x)",
                        "x",
                        "x ** 2"))
                .templates(DifficultyTier.MEDIUM, List.of(
                        "2 * sin(x)",
                        "cos(x * 2)",
                        "x ** 2 - 3",
                        "sqrt(x + 1)",
                        "log(x + 1)",
                        "sin(x) + cos(x)"))
                .templates(DifficultyTier.HARD, List.of(
                        "sin(x) * cos(x)",
                        "exp(x / 5) - 2",
                        "sin(x ** 2)",
                        "tan(x / 2)",
                        "sqrt(abs(sin(x * 3)))",
                        "log(abs(x) + 1) * sin(x)"))
                .templates(DifficultyTier.EXPERT, List.of(
                        "sinh(x / 2)",
                        "sin(x) / (x + 1)",
                        "exp(-x) * sin(x * 3)",
                        "atan(x) * 2",
                        "floor(sin(x * 3)) + x / 5",
                        "cosh(x / 3) - 2"));

        b.hintFact("sin", "Uses sine function")
                .hintFact("cos", "Uses cosine function")
                .hintFact("tan", "Uses tangent function")
                .hintFact("sinh", "Uses hyperbolic sine")
                .hintFact("cosh", "Uses hyperbolic cosine")
                .hintFact("tanh", "Uses hyperbolic tangent")
                .hintFact("asin", "Uses inverse sine")
                .hintFact("acos", "Uses inverse cosine")
                .hintFact("atan", "Uses inverse tangent")
                .hintFact("sqrt", "Uses square root")
                .hintFact("log", "Uses logarithm")
                .hintFact("log10", "Uses logarithm")
                .hintFact("exp", "Uses exponential")
                .hintFact("abs", "Uses absolute value")
                .hintFact("floor", "Uses rounding down")
                .hintFact("ceil", "Uses rounding up")
                .hintFact("round", "Uses rounding")
                .hintFact("pow", "Uses power/exponentiation")
                .hintFact("**", "Uses power/exponentiation")
                .hintFact("*", "Uses multiplication")
                .hintFact("/", "Uses division");
        return b;
    }

    public SamplingSettings getSampling() {
        return sampling;
    }

    public TierSettings getTier(DifficultyTier tier) {
        return tiers.get(tier);
    }

    /**
     * First tier whose threshold is at or above {@code level}; the last tier
     * catches everything beyond.
     */
    public TierSettings tierForLevel(int level) {
        if (level < 1) throw new IllegalArgumentException("level must be >= 1, got " + level);
        for (DifficultyTier t : DifficultyTier.values()) {
            TierSettings s = tiers.get(t);
            if (level <= s.levelThreshold) return s;
        }
        return tiers.get(DifficultyTier.EXPERT);
    }

    public List<String> getTemplates(DifficultyTier tier) {
        return templates.get(tier);
    }

    public int getSkipPenalty() {
        return skipPenalty;
    }

    public int getInitialHints() {
        return initialHints;
    }

    /** Floor for the target range span when normalizing error. */
    public double getErrorEpsilon() {
        return errorEpsilon;
    }

    /** Hint text keyed by function name or operator symbol, in preference order. */
    public Map<String, String> getHintFacts() {
        return hintFacts;
    }

    public String getFallbackHint() {
        return fallbackHint;
    }

    /**
     * Compiles every template with {@code engine}.
     *
     * @throws GameConfigException naming the first template that does not compile
     */
    public void validateTemplates(ExpressionEngine engine) {
        for (DifficultyTier t : DifficultyTier.values()) {
            for (String template : templates.get(t)) {
                try {
                    engine.compile(template);
                } catch (ExpressionException e) {
                    throw new GameConfigException("Invalid " + t.id() + " template '" + template + "': " + e.getMessage(), e);
                }
            }
        }
    }

    public static final class Builder {
        private SamplingSettings sampling;
        private final Map<DifficultyTier, TierSettings> tiers = new EnumMap<>(DifficultyTier.class);
        private final Map<DifficultyTier, List<String>> templates = new EnumMap<>(DifficultyTier.class);
        private int skipPenalty;
        private int initialHints;
        private double errorEpsilon = DEFAULT_ERROR_EPSILON;
        private final Map<String, String> hintFacts = new LinkedHashMap<>();
        private String fallbackHint = DEFAULT_FALLBACK_HINT;

        private Builder() {}

        public Builder sampling(SamplingSettings sampling) {
            this.sampling = sampling;
            return this;
        }

        public Builder tier(TierSettings settings) {
            tiers.put(settings.tier, settings);
            return this;
        }

        public Builder templates(DifficultyTier tier, List<String> formulas) {
            templates.put(tier, new ArrayList<>(formulas));
            return this;
        }

        public Builder skipPenalty(int skipPenalty) {
            this.skipPenalty = skipPenalty;
            return this;
        }

        public Builder initialHints(int initialHints) {
            this.initialHints = initialHints;
            return this;
        }

        public Builder errorEpsilon(double errorEpsilon) {
            this.errorEpsilon = errorEpsilon;
            return this;
        }

        public Builder hintFact(String feature, String text) {
            hintFacts.put(feature, text);
            return this;
        }

        public Builder clearHintFacts() {
            hintFacts.clear();
            return this;
        }

        public Builder fallbackHint(String fallbackHint) {
            this.fallbackHint = fallbackHint;
            return this;
        }

        public GameConfig build() {
            if (sampling == null) throw new GameConfigException("sampling settings are required");
            if (skipPenalty < 0) throw new GameConfigException("skipPenalty must be >= 0");
            if (initialHints < 0) throw new GameConfigException("initialHints must be >= 0");
            if (!(errorEpsilon > 0)) throw new GameConfigException("errorEpsilon must be > 0");
            if (fallbackHint == null || fallbackHint.isBlank()) throw new GameConfigException("fallbackHint is required");

            int previous = 0;
            for (DifficultyTier t : DifficultyTier.values()) {
                TierSettings s = tiers.get(t);
                if (s == null) throw new GameConfigException("Missing settings for tier " + t.id());
                if (s.levelThreshold <= previous) {
                    throw new GameConfigException("Tier " + t.id() + " threshold must exceed " + previous);
                }
                previous = s.levelThreshold;
                List<String> list = templates.get(t);
                if (list == null || list.isEmpty()) throw new GameConfigException("No templates for tier " + t.id());
            }
            if (!tiers.get(DifficultyTier.EXPERT).isUnbounded()) {
                throw new GameConfigException("Tier " + DifficultyTier.EXPERT.id() + " must be unbounded");
            }
            return new GameConfig(this);
        }
    }
}

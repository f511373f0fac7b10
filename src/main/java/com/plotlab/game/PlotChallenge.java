package com.plotlab.game;

import java.util.List;
import java.util.OptionalDouble;

import com.plotlab.debug.Debug;
import com.plotlab.expr.CompiledExpression;
import com.plotlab.expr.ExpressionEngine;
import com.plotlab.expr.parser.ExpressionException;
import com.plotlab.sampling.Curve;
import com.plotlab.sampling.SampleResult;
import com.plotlab.sampling.Sampler;
import com.plotlab.sampling.YRange;

/**
 * One player's session: level, score, hint budget, the hidden target and the
 * player's current attempt.
 *
 * All state changes go through {@link #setPlayerText}, {@link #startNewLevel},
 * {@link #skipLevel}, {@link #confirmWin} and {@link #requestHint}. Every call
 * runs to completion on the caller's thread; the session stays usable after
 * any input, however malformed.
 *
 * A round keeps the tier it was started with. Winning awards that tier's
 * points and advances the level once per round; the tier for the new level
 * takes effect at the next {@link #startNewLevel()}.
 */
public class PlotChallenge {

    private static final String TAG = Debug.TAG_GAME;

    private final GameConfig config;
    private final ExpressionEngine engine;
    private final Sampler sampler;
    private final RandomSource random;
    private final HintCatalog hints;

    private int level = 1;
    private int score = 0;
    private int hintsRemaining;

    private TierSettings roundTier;
    private CompiledExpression target;
    private SampleResult targetResult;

    private String playerText = "";
    private SampleResult playerResult;
    private boolean win;
    private Double currentError;
    private boolean roundAwarded;

    public PlotChallenge(GameConfig config, RandomSource random) {
        this(config, new ExpressionEngine(), random);
    }

    public PlotChallenge(GameConfig config, ExpressionEngine engine, RandomSource random) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        if (engine == null) throw new IllegalArgumentException("engine must not be null");
        if (random == null) throw new IllegalArgumentException("random must not be null");
        config.validateTemplates(engine);

        this.config = config;
        this.engine = engine;
        this.sampler = new Sampler(engine, config.getSampling());
        this.random = random;
        this.hints = HintCatalog.from(config);
        this.hintsRemaining = config.getInitialHints();

        startNewLevel();
    }

    // ===================== COMMANDS =====================

    /** Picks a target for the current level's tier and clears the player's attempt. */
    public void startNewLevel() {
        TierSettings tier = config.tierForLevel(level);
        List<String> pool = config.getTemplates(tier.tier);
        String formula = pool.get(random.nextInt(pool.size()));
        beginRound(tier, engine.compile(formula));
    }

    /**
     * Starts a round on a caller-chosen target instead of a random template.
     *
     * @throws ExpressionException if {@code formula} does not compile; the current round is kept
     */
    public void startLevelWithTarget(String formula) {
        CompiledExpression compiled = engine.compile(formula);
        beginRound(config.tierForLevel(level), compiled);
    }

    /** Re-samples the player's text and re-evaluates the win condition. */
    public void setPlayerText(String text) {
        String newText = (text == null) ? "" : text;
        SampleResult newResult = sampler.sample(newText);
        playerText = newText;
        playerResult = newResult;

        if (playerResult.isValid()) {
            checkWin();
        } else {
            win = false;
            currentError = null;
        }
    }

    /** Applies the skip penalty (never below zero) and starts a fresh round. */
    public void skipLevel() {
        int before = score;
        score = Math.max(0, score - config.getSkipPenalty());
        Debug.get().i(TAG, "skip at level " + level + ": score " + before + " -> " + score);
        startNewLevel();
    }

    /**
     * Moves on once the current round is won.
     *
     * @return true if a new level was started, false if the round is not won
     */
    public boolean confirmWin() {
        if (!win) return false;
        startNewLevel();
        return true;
    }

    /** Spends one hint on a fact about the target, or reports that none are left. */
    public HintResult requestHint() {
        if (hintsRemaining <= 0) {
            Debug.get().d(TAG, "hint requested with empty budget");
            return HintResult.unavailable();
        }
        hintsRemaining--;
        String text = hints.pick(target, random);
        Debug.get().i(TAG, "hint issued (" + hintsRemaining + " left): " + text);
        return HintResult.of(text);
    }

    // ===================== INTERNALS =====================

    private void beginRound(TierSettings tier, CompiledExpression newTarget) {
        roundTier = tier;
        target = newTarget;
        targetResult = sampler.sample(newTarget);

        playerText = "";
        playerResult = SampleResult.invalid(config.getSampling().fallbackRange, null);
        win = false;
        currentError = null;
        roundAwarded = false;

        Debug.get().i(TAG, "level " + level + " (" + tier.tier.id() + ")");
        Debug.get().d(TAG, "target: " + newTarget.getSource());
        if (!targetResult.isValid()) {
            Debug.get().w(TAG, "target '" + newTarget.getSource() + "' has no valid point; round cannot be won");
        }
    }

    private void checkWin() {
        Curve targetCurve = targetResult.getCurve();
        Curve playerCurve = playerResult.getCurve();
        if (!targetResult.isValid() || targetCurve.isEmpty() || playerCurve.isEmpty()) {
            win = false;
            currentError = null;
            return;
        }

        double error = normalizedError(targetCurve, playerCurve, targetResult.getYRange(), config.getErrorEpsilon());
        currentError = error;
        win = error < roundTier.errorTolerance;

        if (win && !roundAwarded) {
            roundAwarded = true;
            score += roundTier.points;
            level++;
            Debug.get().i(TAG, "win with error " + error + ": +" + roundTier.points
                    + " (score " + score + "), next level " + level);
        }
    }

    /**
     * Mean of {@code |player_y - target_y| / max(span, epsilon)} over the first
     * {@code min(len(target), len(player))} index-aligned points.
     */
    public static double normalizedError(Curve target, Curve player, YRange targetRange, double epsilon) {
        int n = Math.min(target.size(), player.size());
        if (n == 0) throw new IllegalArgumentException("curves must not be empty");
        double span = Math.max(targetRange.span(), epsilon);
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            total += Math.abs(player.get(i).y - target.get(i).y) / span;
        }
        return total / n;
    }

    // ===================== READ-ONLY STATE =====================

    public String getTargetFormula() {
        return target.getSource();
    }

    public Curve getTargetCurve() {
        return targetResult.getCurve();
    }

    public boolean isTargetValid() {
        return targetResult.isValid();
    }

    public String getPlayerText() {
        return playerText;
    }

    public Curve getPlayerCurve() {
        return playerResult.getCurve();
    }

    /** Whether the player's text produced at least one plottable point. */
    public boolean isValid() {
        return playerResult.isValid();
    }

    /** Compile error of the player's text, or null. */
    public String getPlayerError() {
        return playerResult.getCompileError();
    }

    public boolean isWin() {
        return win;
    }

    public OptionalDouble getCurrentError() {
        return currentError == null ? OptionalDouble.empty() : OptionalDouble.of(currentError);
    }

    public double getDomainMin() {
        return config.getSampling().xMin;
    }

    public double getDomainMax() {
        return config.getSampling().xMax;
    }

    /** Plotting range of the target curve. */
    public YRange getYRange() {
        return targetResult.getYRange();
    }

    public int getLevel() {
        return level;
    }

    public int getScore() {
        return score;
    }

    /** Tier of the current level number. */
    public DifficultyTier getDifficulty() {
        return config.tierForLevel(level).tier;
    }

    /** Tier whose tolerance and award apply to the round in progress. */
    public DifficultyTier getRoundTier() {
        return roundTier.tier;
    }

    public int getHintsRemaining() {
        return hintsRemaining;
    }

    public ProgressSnapshot snapshot() {
        return new ProgressSnapshot(this);
    }
}

package com.plotlab.game;

import java.util.Locale;
import java.util.OptionalDouble;

import com.plotlab.sampling.Curve;
import com.plotlab.sampling.YRange;

/**
 * Point-in-time, read-only copy of a session's public state, for renderers
 * and other consumers that must not drive the session.
 */
public final class ProgressSnapshot {

    public final String targetFormula;
    public final Curve targetCurve;
    public final Curve playerCurve;
    public final String playerText;
    public final boolean valid;
    public final boolean win;
    private final Double currentError;
    public final double domainMin;
    public final double domainMax;
    public final YRange yRange;
    public final int level;
    public final int score;
    /** Tier of the current level number; after a win this is already the next round's tier. */
    public final DifficultyTier difficulty;
    /** Tier the round on screen was started with; its tolerance and award apply until the next round. */
    public final DifficultyTier roundTier;
    public final int hintsRemaining;

    ProgressSnapshot(PlotChallenge c) {
        this.targetFormula = c.getTargetFormula();
        this.targetCurve = c.getTargetCurve();
        this.playerCurve = c.getPlayerCurve();
        this.playerText = c.getPlayerText();
        this.valid = c.isValid();
        this.win = c.isWin();
        OptionalDouble err = c.getCurrentError();
        this.currentError = err.isPresent() ? err.getAsDouble() : null;
        this.domainMin = c.getDomainMin();
        this.domainMax = c.getDomainMax();
        this.yRange = c.getYRange();
        this.level = c.getLevel();
        this.score = c.getScore();
        this.difficulty = c.getDifficulty();
        this.roundTier = c.getRoundTier();
        this.hintsRemaining = c.getHintsRemaining();
    }

    public OptionalDouble currentError() {
        return currentError == null ? OptionalDouble.empty() : OptionalDouble.of(currentError);
    }

    @Override
    public String toString() {
        return "level=" + level + " (" + difficulty.id() + ") score=" + score + " hints=" + hintsRemaining
                + " valid=" + valid + " win=" + win
                + " error=" + (currentError == null ? "-" : String.format(Locale.ROOT, "%.4f", currentError));
    }
}

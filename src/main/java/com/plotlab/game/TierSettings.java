package com.plotlab.game;

/**
 * Per-tier rules: the highest level still in the tier, the score awarded for
 * a win and the normalized error a match must stay under.
 */
public final class TierSettings {

    /** Threshold of a catch-all tier. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public final DifficultyTier tier;
    public final int levelThreshold;
    public final int points;
    public final double errorTolerance;

    public TierSettings(DifficultyTier tier, int levelThreshold, int points, double errorTolerance) {
        if (tier == null) throw new IllegalArgumentException("tier must not be null");
        if (levelThreshold < 1) throw new IllegalArgumentException(tier.id() + ": threshold must be >= 1");
        if (points < 0) throw new IllegalArgumentException(tier.id() + ": points must be >= 0");
        // a win needs error < tolerance, so zero would make every round unwinnable
        if (!(errorTolerance > 0)) throw new IllegalArgumentException(tier.id() + ": tolerance must be > 0");
        this.tier = tier;
        this.levelThreshold = levelThreshold;
        this.points = points;
        this.errorTolerance = errorTolerance;
    }

    public boolean isUnbounded() {
        return levelThreshold == UNBOUNDED;
    }

    @Override
    public String toString() {
        return tier.id() + "{threshold=" + (isUnbounded() ? "inf" : levelThreshold)
                + ", points=" + points + ", tolerance=" + errorTolerance + "}";
    }
}

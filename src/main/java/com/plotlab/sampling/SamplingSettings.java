package com.plotlab.sampling;

/**
 * Fixed sampling parameters: the x domain, how many steps partition it, and
 * how the plotting range is padded around the observed values.
 */
public final class SamplingSettings {

    public static final double DEFAULT_X_MIN = 0.0;
    public static final double DEFAULT_X_MAX = 10.0;
    public static final int DEFAULT_STEPS = 400;
    public static final double DEFAULT_MARGIN_RATIO = 0.2;
    public static final double DEFAULT_CONSTANT_PADDING = 1.0;
    public static final YRange DEFAULT_FALLBACK_RANGE = new YRange(-5.0, 5.0);

    public final double xMin;
    public final double xMax;
    /** Number of equal steps; the curve has {@code steps + 1} candidate points. */
    public final int steps;
    public final double marginRatio;
    public final double constantPadding;
    public final YRange fallbackRange;

    public SamplingSettings(double xMin, double xMax, int steps,
                            double marginRatio, double constantPadding, YRange fallbackRange) {
        if (!Double.isFinite(xMin) || !Double.isFinite(xMax) || !(xMin < xMax)) {
            throw new IllegalArgumentException("Invalid domain [" + xMin + ", " + xMax + "]");
        }
        if (steps < 1) throw new IllegalArgumentException("steps must be >= 1, got " + steps);
        if (marginRatio < 0) throw new IllegalArgumentException("marginRatio must be >= 0");
        if (!(constantPadding > 0)) throw new IllegalArgumentException("constantPadding must be > 0");
        if (fallbackRange == null) throw new IllegalArgumentException("fallbackRange must not be null");
        this.xMin = xMin;
        this.xMax = xMax;
        this.steps = steps;
        this.marginRatio = marginRatio;
        this.constantPadding = constantPadding;
        this.fallbackRange = fallbackRange;
    }

    public static SamplingSettings defaults() {
        return new SamplingSettings(DEFAULT_X_MIN, DEFAULT_X_MAX, DEFAULT_STEPS,
                DEFAULT_MARGIN_RATIO, DEFAULT_CONSTANT_PADDING, DEFAULT_FALLBACK_RANGE);
    }

    public double step() {
        return (xMax - xMin) / steps;
    }

    /** x of the i-th sample, {@code 0 <= i <= steps}. */
    public double xAt(int i) {
        return i == steps ? xMax : xMin + i * step();
    }
}

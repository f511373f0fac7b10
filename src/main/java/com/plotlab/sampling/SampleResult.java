package com.plotlab.sampling;

/**
 * Outcome of sampling one expression across the domain.
 *
 * Callers must check {@link #isValid()} before plotting or scoring; an invalid
 * result carries an empty curve and the fallback range.
 */
public final class SampleResult {

    private final Curve curve;
    private final boolean valid;
    private final YRange yRange;
    private final int skippedPoints;
    private final String compileError;

    SampleResult(Curve curve, boolean valid, YRange yRange, int skippedPoints, String compileError) {
        this.curve = curve;
        this.valid = valid;
        this.yRange = yRange;
        this.skippedPoints = skippedPoints;
        this.compileError = compileError;
    }

    /** Result for text that never compiled, or for no text at all. */
    public static SampleResult invalid(YRange fallback, String reason) {
        return new SampleResult(Curve.empty(), false, fallback, 0, reason);
    }

    public Curve getCurve() {
        return curve;
    }

    public boolean isValid() {
        return valid;
    }

    public YRange getYRange() {
        return yRange;
    }

    /** Domain points dropped because their evaluation failed. */
    public int getSkippedPoints() {
        return skippedPoints;
    }

    /** Why the text was rejected before sampling, or null when it compiled. */
    public String getCompileError() {
        return compileError;
    }

    @Override
    public String toString() {
        return "SampleResult{valid=" + valid + ", points=" + curve.size() + ", skipped=" + skippedPoints
                + ", yRange=" + yRange + (compileError == null ? "" : ", error=" + compileError) + "}";
    }
}

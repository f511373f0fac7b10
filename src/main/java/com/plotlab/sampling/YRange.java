package com.plotlab.sampling;

/** Closed vertical plotting range. */
public final class YRange {
    public final double min;
    public final double max;

    public YRange(double min, double max) {
        if (!(min <= max)) throw new IllegalArgumentException("min must not exceed max: " + min + " > " + max);
        this.min = min;
        this.max = max;
    }

    public double span() {
        return max - min;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof YRange)) return false;
        YRange r = (YRange) o;
        return Double.compare(min, r.min) == 0 && Double.compare(max, r.max) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(min) + Double.hashCode(max);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}

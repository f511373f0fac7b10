package com.plotlab.sampling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Sample points of one expression in ascending x order. May be empty. */
public final class Curve {

    private static final Curve EMPTY = new Curve(Collections.emptyList());

    private final List<SamplePoint> points;

    private Curve(List<SamplePoint> points) {
        this.points = points;
    }

    public static Curve empty() {
        return EMPTY;
    }

    static Curve of(List<SamplePoint> points) {
        return points.isEmpty() ? EMPTY : new Curve(Collections.unmodifiableList(new ArrayList<>(points)));
    }

    public List<SamplePoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public SamplePoint get(int index) {
        return points.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Curve)) return false;
        return points.equals(((Curve) o).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "Curve[" + points.size() + " points]";
    }
}

package com.example.automatacurve;

import java.util.Collections;
import java.util.List;

/**
 * Coordinates produced by a curve computation. Scatter data unless
 * {@link #isCurve()}, in which case the points are meant to be joined.
 */
public class PointSet {

    public static final String DEFAULT_COLOR = "red";

    /** Closed axis interval. */
    public static class Range {
        private final double min;
        private final double max;

        public Range(double min, double max) {
            this.min = min;
            this.max = max;
        }

        public double getMin() { return min; }
        public double getMax() { return max; }

        @Override
        public String toString() { return "(" + min + ", " + max + ")"; }
    }

    private final List<Double> x;
    private final List<Double> y;
    private final Range xlim;
    private final Range ylim;
    private final boolean curve;
    private final String color;

    public PointSet(List<Double> x, List<Double> y, Range xlim, Range ylim) {
        this(x, y, xlim, ylim, false, DEFAULT_COLOR);
    }

    public PointSet(List<Double> x, List<Double> y, Range xlim, Range ylim, boolean curve, String color) {
        if (x.size() != y.size()) {
            throw new IllegalArgumentException("x and y differ in length: " + x.size() + " vs " + y.size());
        }
        this.x = Collections.unmodifiableList(x);
        this.y = Collections.unmodifiableList(y);
        this.xlim = xlim;
        this.ylim = ylim;
        this.curve = curve;
        this.color = color;
    }

    public List<Double> getX() { return x; }
    public List<Double> getY() { return y; }

    /** @return axis bounds, or {@code null} when the set leaves them open */
    public Range getXlim() { return xlim; }
    public Range getYlim() { return ylim; }

    public boolean isCurve() { return curve; }
    public String getColor() { return color; }

    public int size() { return x.size(); }
}

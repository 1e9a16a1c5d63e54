package com.deca.engine.base;

import java.util.Arrays;

/**
 * Immutable pair of lower and upper bound arrays of equal length.
 */
public final class IntervalVector {

    private final double[] lower;
    private final double[] upper;

    public IntervalVector(double[] lower, double[] upper) {
        if (lower.length != upper.length) {
            throw new IllegalArgumentException("bound arrays differ in length: " + lower.length + " vs " + upper.length);
        }
        this.lower = lower.clone();
        this.upper = upper.clone();
    }

    public int size() {
        return lower.length;
    }

    public double lower(int index) {
        return lower[index];
    }

    public double upper(int index) {
        return upper[index];
    }

    public double[] lowerBounds() {
        return lower.clone();
    }

    public double[] upperBounds() {
        return upper.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntervalVector that = (IntervalVector) o;
        return Arrays.equals(lower, that.lower) && Arrays.equals(upper, that.upper);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(lower) + Arrays.hashCode(upper);
    }
}

package com.deca.engine.eval;

import java.util.Objects;

/**
 * Lower, middle and upper expected value of one evaluation.
 */
public final class EvaluationResult {

    private final double min;
    private final double mid;
    private final double max;

    public EvaluationResult(double min, double mid, double max) {
        this.min = min;
        this.mid = mid;
        this.max = max;
    }

    public double getMin() {
        return min;
    }

    public double getMid() {
        return mid;
    }

    public double getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EvaluationResult that = (EvaluationResult) o;
        return Double.compare(min, that.min) == 0 && Double.compare(mid, that.mid) == 0
                && Double.compare(max, that.max) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, mid, max);
    }

    @Override
    public String toString() {
        return "EvaluationResult{min=" + min + ", mid=" + mid + ", max=" + max + "}";
    }
}

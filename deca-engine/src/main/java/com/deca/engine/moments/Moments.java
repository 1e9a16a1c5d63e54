package com.deca.engine.moments;

import java.util.Objects;

/**
 * Mean, variance and third central moment of an aggregated outcome.
 */
public final class Moments {

    private final double mean;
    private final double variance;
    private final double thirdCentral;

    public Moments(double mean, double variance, double thirdCentral) {
        this.mean = mean;
        this.variance = variance;
        this.thirdCentral = thirdCentral;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getThirdCentral() {
        return thirdCentral;
    }

    public double getStandardDeviation() {
        return Math.sqrt(variance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Moments that = (Moments) o;
        return Double.compare(mean, that.mean) == 0 && Double.compare(variance, that.variance) == 0
                && Double.compare(thirdCentral, that.thirdCentral) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, variance, thirdCentral);
    }

    @Override
    public String toString() {
        return "Moments{mean=" + mean + ", variance=" + variance + ", thirdCentral=" + thirdCentral + "}";
    }
}

package com.deca.engine.eval;

/**
 * Result of an extremal allocation: the expected value reached and the local probability given
 * to each node of the evaluated subtree (indexed by sequential node index, -1 outside the subtree).
 */
public final class Allocation {

    private final double expectedValue;
    private final double[] localProbabilities;

    Allocation(double expectedValue, double[] localProbabilities) {
        this.expectedValue = expectedValue;
        this.localProbabilities = localProbabilities;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double localProbability(int seq) {
        return localProbabilities[seq];
    }

    Allocation negated() {
        return new Allocation(-expectedValue, localProbabilities);
    }

    public double[] getLocalProbabilities() {
        return localProbabilities.clone();
    }
}

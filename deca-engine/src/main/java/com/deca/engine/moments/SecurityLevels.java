package com.deca.engine.moments;

/**
 * Probability, per alternative, that the outcome falls below a threshold, in three strengths.
 * Arrays are indexed by alternative - 1.
 */
public final class SecurityLevels {

    private final double threshold;
    private final double[] strong;
    private final double[] marked;
    private final double[] weak;

    SecurityLevels(double threshold, double[] strong, double[] marked, double[] weak) {
        this.threshold = threshold;
        this.strong = strong;
        this.marked = marked;
        this.weak = weak;
    }

    public double getThreshold() {
        return threshold;
    }

    /** Lowest probability of the consequences lying entirely below the threshold. */
    public double strong(int alt) {
        return strong[alt - 1];
    }

    /** Probability mid-range for consequences whose interval centre lies below the threshold. */
    public double marked(int alt) {
        return marked[alt - 1];
    }

    /** Highest probability of the consequences reaching below the threshold at all. */
    public double weak(int alt) {
        return weak[alt - 1];
    }

    public int alternativeCount() {
        return strong.length;
    }
}

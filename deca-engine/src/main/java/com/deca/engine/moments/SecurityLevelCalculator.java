package com.deca.engine.moments;

import com.deca.engine.base.Tolerance;
import com.deca.engine.probability.ProbabilityState;
import com.deca.engine.value.ValueState;
import com.deca.tree.AlternativeTree;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;

/**
 * Bounds the probability mass of a "dangerous" consequence set. Each level splits the parent's
 * mass between the set and its complement; intermediate nodes contribute their subtree share.
 */
public final class SecurityLevelCalculator {

    private final FrameTopology topology;
    private final ProbabilityState probabilities;
    private final ValueState values;

    public SecurityLevelCalculator(FrameTopology topology, ProbabilityState probabilities, ValueState values) {
        this.topology = topology;
        this.probabilities = probabilities;
        this.values = values;
    }

    /**
     * @throws DecaException INPUT_ERROR for a threshold outside [0,1], INCONSISTENT when a bound
     *                       goes negative
     */
    public SecurityLevels compute(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "security threshold " + threshold + " outside [0,1]");
        }
        int n = topology.alternativeCount();
        double[] strong = new double[n];
        double[] marked = new double[n];
        double[] weak = new double[n];
        int reals = topology.totalRealCount();
        boolean[] strongSet = new boolean[reals];
        boolean[] markedSet = new boolean[reals];
        boolean[] weakSet = new boolean[reals];
        double cut = threshold - Tolerance.EPS;
        for (int r = 0; r < reals; r++) {
            double lo = values.hullLower(r);
            double hi = values.hullUpper(r);
            strongSet[r] = hi < cut;
            markedSet[r] = (lo + hi) / 2.0 < cut;
            weakSet[r] = lo < cut;
        }
        for (int alt = 1; alt <= n; alt++) {
            double s = setMinimum(alt, 0, strongSet);
            if (s < -Tolerance.EPS) {
                throw new DecaException(ErrorKind.INCONSISTENT, "strong security level of alternative " + alt);
            }
            double m = (setMinimum(alt, 0, markedSet) + setMaximum(alt, 0, markedSet)) / 2.0;
            double w = setMaximum(alt, 0, weakSet);
            if (w < -Tolerance.EPS) {
                throw new DecaException(ErrorKind.INCONSISTENT, "weak security level of alternative " + alt);
            }
            strong[alt - 1] = s;
            marked[alt - 1] = m;
            weak[alt - 1] = w;
        }
        return new SecurityLevels(threshold, strong, marked, weak);
    }

    /** Smallest mass the set can carry below {@code parent}. */
    double setMinimum(int alt, int parent, boolean[] set) {
        AlternativeTree tree = topology.tree(alt);
        int offset = topology.sequentialOffset(alt);
        double inside = 0.0;
        double outside = 1.0;
        for (int t : tree.children(parent)) {
            int i = offset + t - 1;
            if (tree.isIntermediate(t)) {
                double share = setMinimum(alt, t, set);
                inside += share * probabilities.localHullLower(i);
                outside -= (1.0 - share) * probabilities.localHullUpper(i);
            } else if (set[topology.realOfSequential(i)]) {
                inside += probabilities.localHullLower(i);
            } else {
                outside -= probabilities.localHullUpper(i);
            }
        }
        return Math.max(inside, outside);
    }

    /** Largest mass the set can carry below {@code parent}. */
    double setMaximum(int alt, int parent, boolean[] set) {
        AlternativeTree tree = topology.tree(alt);
        int offset = topology.sequentialOffset(alt);
        double inside = 0.0;
        double outside = 1.0;
        for (int t : tree.children(parent)) {
            int i = offset + t - 1;
            if (tree.isIntermediate(t)) {
                double share = setMaximum(alt, t, set);
                inside += share * probabilities.localHullUpper(i);
                outside -= (1.0 - share) * probabilities.localHullLower(i);
            } else if (set[topology.realOfSequential(i)]) {
                inside += probabilities.localHullUpper(i);
            } else {
                outside -= probabilities.localHullLower(i);
            }
        }
        return Math.min(inside, outside);
    }
}

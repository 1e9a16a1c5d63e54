package com.deca.engine.moments;

import com.deca.config.MeanSnapMode;
import com.deca.engine.base.Tolerance;
import com.deca.engine.probability.ProbabilityState;
import com.deca.engine.value.ValueState;
import com.deca.tree.AlternativeTree;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;

import java.util.Arrays;

/**
 * Net moments of an alternative's outcome, aggregated bottom up.
 * <p>
 * Local probabilities are modelled as bounded Dirichlet marginals, values as triangular
 * distributions. Per node the two are multiplied; per level the products are summed with a
 * separable covariance correction. The third moment of a level is divided by its branching
 * factor.
 */
public final class MomentCalculator {

    private static final double TCM_FLOOR = 1e-18;

    private final MeanSnapMode snapMode;

    public MomentCalculator(MeanSnapMode snapMode) {
        this.snapMode = snapMode;
    }

    /** Moments of every alternative from the probability and value states. */
    public MomentReport compute(FrameTopology topology, ProbabilityState probabilities, ValueState values) {
        Moments[] result = new Moments[topology.alternativeCount()];
        double[] pSd = newDeviations(topology);
        double[] vSd = newDeviations(topology);
        for (int alt = 1; alt <= topology.alternativeCount(); alt++) {
            Level level = new Level(topology, alt, probabilities, pSd, vSd, leafSource(values));
            result[alt - 1] = level.aggregate(0);
        }
        return new MomentReport(topology, result, pSd, vSd);
    }

    /**
     * Moments of the subtree below {@code node} of alternative 1, with the outcome of every real
     * node supplied by the caller instead of the value layer. Used when alternative 1 holds a
     * criteria weight tree and the leaf outcomes are themselves aggregates.
     *
     * @param mean         per real node of alternative 1 (ordinal - 1)
     * @param variance     per real node of alternative 1
     * @param thirdCentral per real node of alternative 1
     */
    public MomentReport computeCriteria(FrameTopology topology, ProbabilityState probabilities, int node,
                                        double[] mean, double[] variance, double[] thirdCentral) {
        int leaves = topology.realCount(1);
        if (mean.length < leaves || variance.length < leaves || thirdCentral.length < leaves) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "criteria moments need " + leaves + " entries");
        }
        if (node != 0) {
            topology.requireNode(1, node);
            if (!topology.tree(1).isIntermediate(node)) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "criteria subtree root " + node + " is a real node");
            }
        }
        Moments[] result = new Moments[topology.alternativeCount()];
        double[] pSd = newDeviations(topology);
        double[] vSd = newDeviations(topology);
        int offset = topology.realOffset(1);
        LeafSource supplied = real -> new double[]{mean[real - offset], variance[real - offset], thirdCentral[real - offset]};
        result[0] = new Level(topology, 1, probabilities, pSd, vSd, supplied).aggregate(node);
        return new MomentReport(topology, result, pSd, vSd);
    }

    private static double[] newDeviations(FrameTopology topology) {
        double[] sd = new double[topology.totalNodeCount()];
        Arrays.fill(sd, -1.0);
        return sd;
    }

    private LeafSource leafSource(ValueState values) {
        return real -> {
            double[] vt = valueMoments(values.hullLower(real), values.mass(real), values.hullUpper(real));
            return new double[]{values.mass(real), vt[0], vt[1]};
        };
    }

    /** Variance and covariance factor of a local probability. */
    static double[] probabilityMoments(double lower, double mid, double upper, double lambda) {
        double t = upper - lower;
        if (t > Tolerance.EPS) {
            return new double[]{t * t * mid * (1.0 - mid) / (lambda + 1.0), t * t * mid * mid / (lambda + 1.0)};
        }
        return new double[]{0.0, 0.0};
    }

    /** Variance and third central moment of a triangular value distribution with the given support and mean. */
    double[] valueMoments(double lower, double mid, double upper) {
        double t = upper - lower;
        if (t <= Tolerance.EPS) {
            return new double[]{0.0, 0.0};
        }
        double mean = mid;
        if (snapMode != MeanSnapMode.NONE) {
            mean = Math.max(mid, (2.0 * lower + upper) / 3.0);
            mean = Math.min(mean, (lower + 2.0 * upper) / 3.0);
            if (snapMode == MeanSnapMode.HALF) {
                mean += (mid - mean) / 2.0;
            }
        }
        double mode = 3.0 * mean - lower - upper;
        double q = (mode - lower) / t;
        double variance = t * t * (1.0 - q + q * q) / 18.0;
        double tcm = t * t * t * (2.0 - 3.0 * q - 3.0 * q * q + 2.0 * q * q * q) / 270.0;
        if (tcm < TCM_FLOOR) {
            tcm = 0.0;
        }
        return new double[]{variance, tcm};
    }

    /** Mean, variance and third central moment of a leaf outcome, by global real index. */
    @FunctionalInterface
    private interface LeafSource {
        double[] moments(int real);
    }

    /** One bottom-up pass over an alternative. */
    private static final class Level {
        private final FrameTopology topology;
        private final AlternativeTree tree;
        private final int offset;
        private final ProbabilityState probabilities;
        private final double[] pSd;
        private final double[] vSd;
        private final LeafSource leaves;

        Level(FrameTopology topology, int alt, ProbabilityState probabilities, double[] pSd, double[] vSd,
              LeafSource leaves) {
            this.topology = topology;
            this.tree = topology.tree(alt);
            this.offset = topology.sequentialOffset(alt);
            this.probabilities = probabilities;
            this.pSd = pSd;
            this.vSd = vSd;
            this.leaves = leaves;
        }

        Moments aggregate(int parent) {
            int[] children = tree.children(parent);
            double lambda = 0.0;
            double lowerSum = 0.0;
            for (int t : children) {
                int i = offset + t - 1;
                lambda += probabilities.localHullUpper(i) - probabilities.localHullLower(i);
                lowerSum += probabilities.localHullLower(i);
            }
            lambda = lowerSum < 1.0 - Tolerance.EPS ? lambda / (1.0 - lowerSum) : 1.0;

            double mean = 0.0;
            double variance = 0.0;
            double tcm = 0.0;
            double[] covariance = new double[children.length];
            for (int k = 0; k < children.length; k++) {
                int t = children[k];
                int i = offset + t - 1;
                double pMean = probabilities.localMass(i);
                double[] p = probabilityMoments(probabilities.localHullLower(i), pMean,
                        probabilities.localHullUpper(i), lambda);
                double vMean;
                double vVar;
                double vTcm;
                if (tree.isIntermediate(t)) {
                    Moments sub = aggregate(t);
                    vMean = sub.getMean();
                    vVar = sub.getVariance();
                    vTcm = sub.getThirdCentral();
                } else {
                    double[] v = leaves.moments(topology.realOfSequential(i));
                    vMean = v[0];
                    vVar = v[1];
                    vTcm = v[2];
                }
                mean += pMean * vMean;
                variance += p[0] * vVar + p[0] * vMean * vMean + pMean * pMean * vVar;
                tcm += pMean * vTcm;
                covariance[k] = Math.sqrt(p[1]) * vMean;
                pSd[i] = Math.sqrt(p[0]);
                vSd[i] = Math.sqrt(vVar);
            }
            double cross = 0.0;
            for (int a = 0; a < children.length; a++) {
                for (int b = a + 1; b < children.length; b++) {
                    cross -= covariance[a] * covariance[b];
                }
            }
            variance += 2.0 * cross;
            tcm /= children.length;
            if (variance < Tolerance.EPS) variance = 0.0;
            if (tcm < Tolerance.EPS) tcm = 0.0;
            return new Moments(mean, variance, tcm);
        }
    }
}

package com.deca.engine.probability;

import com.deca.config.EngineConfig;
import com.deca.engine.base.Tolerance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corrects the degrees-of-freedom mass point of one sibling level towards the centroid of the
 * box truncated by the normalization simplex.
 * <p>
 * Corners of the active box (each sibling at its lower or upper bound) whose coordinate sum
 * stays below the target are enumerated depth first. Each corner contributes
 * {@code (target - sum)^(dim-1)}, signed by the parity of its upper coordinates; the signed sums
 * give the centroid coordinates in closed form. The enumeration is exponential in the number of
 * siblings, so it is faded out above the soft dimension and skipped above the hard one.
 */
final class WarpCorrection {

    private static final Logger log = LoggerFactory.getLogger(WarpCorrection.class);

    private final boolean enabled;
    private final int softDimension;
    private final int maxDimension;
    private final double weight;
    private final int maxCorners;

    WarpCorrection(EngineConfig config) {
        this.enabled = config.isWarpEnabled();
        this.softDimension = config.getWarpSoftDimension();
        this.maxDimension = config.getWarpMaxDimension();
        this.weight = config.getWarpWeight();
        this.maxCorners = 1 << (maxDimension - 1);
    }

    /**
     * Blends the centroid estimate into {@code mass}.
     *
     * @param lower  local lower bounds of the siblings
     * @param upper  local upper bounds of the siblings
     * @param mass   local mass points of the siblings, updated in place
     * @param lofrac blend fraction used for the degrees-of-freedom mass point of this level
     */
    void apply(double[] lower, double[] upper, double[] mass, double lofrac) {
        int n = lower.length;
        if (!enabled || n > maxDimension) {
            if (enabled && log.isDebugEnabled()) log.debug("Warp skipped | siblings={} | max={}", n, maxDimension);
            return;
        }
        double factor = n <= softDimension ? 1.0
                : (double) (maxDimension + 1 - n) / (double) (maxDimension + 1 - softDimension);
        factor *= weight;
        if (factor <= 0.0) return;

        int[] active = new int[n];
        int dim = 0;
        double target = 1.0;
        for (int j = 0; j < n; j++) {
            if (upper[j] - lower[j] > Tolerance.EPS100) {
                active[dim++] = j;
            } else {
                target -= lofrac * lower[j] + (1.0 - lofrac) * upper[j];
            }
        }
        if (dim < 2) return;

        Corners corners = new Corners(lower, upper, active, dim, target, maxCorners);
        corners.walk(0, 0.0, 0);
        if (corners.count == 0) return;
        double sum2 = 0.0;
        for (int c = 0; c < corners.count; c++) {
            sum2 += corners.signedWeight(c);
        }
        if (sum2 < Tolerance.EPS) return;

        for (int k = 0; k < dim; k++) {
            int x = active[k];
            double sum1 = 0.0;
            for (int c = 0; c < corners.count; c++) {
                double coordinate = (corners.path[c] & (1 << k)) != 0 ? upper[x] : lower[x];
                sum1 += corners.signedWeight(c) * (dim * coordinate + target - corners.sigma[c]);
            }
            double estimate = sum1 / (dim * sum2);
            mass[x] = (1.0 - factor) * mass[x] + factor * estimate;
        }
    }

    /** Corner records of one enumeration. */
    private static final class Corners {
        private final double[] lower;
        private final double[] upper;
        private final int[] active;
        private final int dim;
        private final double target;
        private final int capacity;
        private final double[] sigma;
        private final double[] power;
        private final int[] path;
        private int count;

        Corners(double[] lower, double[] upper, int[] active, int dim, double target, int capacity) {
            this.lower = lower;
            this.upper = upper;
            this.active = active;
            this.dim = dim;
            this.target = target;
            this.capacity = Math.min(capacity, 1 << dim);
            this.sigma = new double[this.capacity];
            this.power = new double[this.capacity];
            this.path = new int[this.capacity];
        }

        /** Returns true when the lower branch overflowed, in which case the upper branch cannot fit either. */
        boolean walk(int k, double value, int upBits) {
            if (value > target - Tolerance.EPS) return true;
            if (k == dim) {
                if (count >= capacity) return true;
                sigma[count] = value;
                power[count] = Math.pow(target - value, dim - 1);
                path[count] = upBits;
                count++;
                return false;
            }
            int x = active[k];
            boolean overflow = walk(k + 1, value + lower[x], upBits);
            if (!overflow) {
                walk(k + 1, value + upper[x], upBits | (1 << k));
            }
            return overflow;
        }

        double signedWeight(int c) {
            return (Integer.bitCount(path[c]) % 2 == 1) ? -power[c] : power[c];
        }
    }
}

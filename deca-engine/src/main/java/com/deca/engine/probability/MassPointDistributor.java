package com.deca.engine.probability;

import com.deca.engine.base.Tolerance;
import com.deca.tree.AlternativeTree;

/**
 * Chooses one probability per node inside the local midpoint hull.
 * <p>
 * Every level shares one interpolation fraction between the children's lower and upper bounds
 * such that the children sum to one; the warp correction is then blended in and the local
 * values are scaled down the tree into global mass points.
 */
final class MassPointDistributor {

    private final WarpCorrection warp;

    MassPointDistributor(WarpCorrection warp) {
        this.warp = warp;
    }

    void distribute(AlternativeTree tree, int offset, double[] lower, double[] upper,
                    double[] localMass, double[] mass) {
        level(tree, offset, 0, 1.0, lower, upper, localMass, mass);
    }

    private void level(AlternativeTree tree, int offset, int parent, double norm,
                       double[] lower, double[] upper, double[] localMass, double[] mass) {
        int[] children = tree.children(parent);
        int n = children.length;
        double pmin = 0.0;
        double pmax = 0.0;
        for (int t : children) {
            pmin += lower[offset + t - 1];
            pmax += upper[offset + t - 1];
        }
        double lofrac;
        if (pmin >= 1.0) {
            lofrac = 1.0;
        } else if (pmax <= 1.0) {
            lofrac = 0.0;
        } else if (pmax > pmin + Tolerance.EPS) {
            lofrac = (pmax - 1.0) / (pmax - pmin);
        } else {
            lofrac = 0.5;
        }

        double[] lo = new double[n];
        double[] hi = new double[n];
        double[] mp = new double[n];
        for (int k = 0; k < n; k++) {
            int i = offset + children[k] - 1;
            lo[k] = lower[i];
            hi[k] = upper[i];
            mp[k] = lofrac * lo[k] + (1.0 - lofrac) * hi[k];
        }
        warp.apply(lo, hi, mp, lofrac);

        for (int k = 0; k < n; k++) {
            int t = children[k];
            int i = offset + t - 1;
            localMass[i] = mp[k];
            mass[i] = norm * mp[k];
            if (tree.isIntermediate(t)) {
                level(tree, offset, t, mass[i], lower, upper, localMass, mass);
            }
        }
    }

    /**
     * Moves any residual local mass (sum of a level off one by more than EPS) towards the
     * children's upper or lower bounds in proportion to their slack, then recomputes the
     * global mass points from the local ones.
     */
    void renormalize(AlternativeTree tree, int offset, double[] lower, double[] upper,
                     double[] localMass, double[] mass) {
        renormalizeLevel(tree, offset, 0, lower, upper, localMass);
        globalize(tree, offset, 0, 1.0, localMass, mass);
    }

    private void renormalizeLevel(AlternativeTree tree, int offset, int parent,
                                  double[] lower, double[] upper, double[] localMass) {
        double sum = 0.0;
        for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
            sum += localMass[offset + t - 1];
        }
        if (sum < 1.0 - Tolerance.EPS) {
            double slack = 0.0;
            for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
                int i = offset + t - 1;
                slack += upper[i] - localMass[i];
            }
            if (slack > Tolerance.EPS) {
                double frac = (1.0 - sum) / slack;
                for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
                    int i = offset + t - 1;
                    localMass[i] += frac * (upper[i] - localMass[i]);
                }
            }
        } else if (sum > 1.0 + Tolerance.EPS) {
            double slack = 0.0;
            for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
                int i = offset + t - 1;
                slack += localMass[i] - lower[i];
            }
            if (slack > Tolerance.EPS) {
                double frac = (1.0 - sum) / slack;
                for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
                    int i = offset + t - 1;
                    localMass[i] += frac * (localMass[i] - lower[i]);
                }
            }
        }
        for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
            if (tree.isIntermediate(t)) {
                renormalizeLevel(tree, offset, t, lower, upper, localMass);
            }
        }
    }

    private static void globalize(AlternativeTree tree, int offset, int parent, double norm,
                                  double[] localMass, double[] mass) {
        for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
            int i = offset + t - 1;
            mass[i] = norm * localMass[i];
            if (tree.isIntermediate(t)) {
                globalize(tree, offset, t, mass[i], localMass, mass);
            }
        }
    }
}

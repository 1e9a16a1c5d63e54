package com.deca.engine.probability;

import com.deca.engine.base.Tolerance;
import com.deca.tree.AlternativeTree;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;

/**
 * Level-by-level tightening of probability intervals. At each level the children's bounds
 * must be able to sum to one; each child is then clipped to what its siblings leave over
 * (local hull) and scaled by the parent's global range (global hull).
 * <p>
 * All arrays are indexed by sequential node index; {@code offset} is the sequential index of
 * the alternative's first node.
 */
final class HullPropagator {

    private HullPropagator() {
    }

    /**
     * @throws DecaException INCONSISTENT when some level cannot be normalized
     */
    static void propagate(int alt, AlternativeTree tree, int offset,
                          double[] boxLower, double[] boxUpper,
                          double[] localLower, double[] localUpper,
                          double[] globalLower, double[] globalUpper) {
        level(alt, tree, offset, 0, 1.0, 1.0, boxLower, boxUpper, localLower, localUpper, globalLower, globalUpper);
    }

    private static void level(int alt, AlternativeTree tree, int offset, int parent, double parentLower, double parentUpper,
                              double[] boxLower, double[] boxUpper,
                              double[] localLower, double[] localUpper,
                              double[] globalLower, double[] globalUpper) {
        double pmin = 0.0;
        double pmax = 0.0;
        for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
            int i = offset + t - 1;
            pmin += boxLower[i];
            pmax += boxUpper[i];
        }
        if (pmin > 1.0 + Tolerance.EPS || pmax < 1.0 - Tolerance.EPS) {
            throw new DecaException(ErrorKind.INCONSISTENT,
                    "alternative " + alt + ", children of node " + parent + " sum to [" + pmin + ", " + pmax + "]");
        }
        pmin = Math.min(pmin, 1.0);
        pmax = Math.max(pmax, 1.0);
        for (int t = tree.firstChild(parent); t != 0; t = tree.nextSibling(t)) {
            int i = offset + t - 1;
            localLower[i] = Math.max(boxLower[i], boxUpper[i] + 1.0 - pmax);
            localUpper[i] = Math.min(boxUpper[i], boxLower[i] + 1.0 - pmin);
            globalLower[i] = localLower[i] * parentLower;
            globalUpper[i] = localUpper[i] * parentUpper;
            if (tree.isIntermediate(t)) {
                level(alt, tree, offset, t, globalLower[i], globalUpper[i],
                        boxLower, boxUpper, localLower, localUpper, globalLower, globalUpper);
            }
        }
    }
}

package com.deca.engine.eval;

import com.deca.engine.probability.ProbabilityState;
import com.deca.tree.AlternativeTree;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Greedy extremal expected value over the local probability hull.
 * <p>
 * Per level, siblings are ranked by their value (a leaf's own value, or the extremal EV of an
 * intermediate node's subtree, computed first). Every sibling gets its lower bound; the mass
 * left to reach one is handed out in rank order, each sibling taking at most its width.
 * Maximizing ranks by descending value, minimizing by ascending value.
 */
public final class ExtremalAllocator {

    private final FrameTopology topology;
    private final ProbabilityState probabilities;

    public ExtremalAllocator(FrameTopology topology, ProbabilityState probabilities) {
        this.topology = topology;
        this.probabilities = probabilities;
    }

    /**
     * Highest expected value of the subtree below {@code node} (0 = whole alternative).
     *
     * @param values value of every real node, indexed by global real index
     */
    public Allocation maximize(int alt, int node, double[] values) {
        return allocate(alt, node, values, true);
    }

    /** Lowest expected value of the subtree below {@code node}. */
    public Allocation minimize(int alt, int node, double[] values) {
        return allocate(alt, node, values, false);
    }

    /** As {@link #maximize(int, int, double[])}, with the expected value negated when {@code negate} is set. */
    public Allocation maximize(int alt, int node, double[] values, boolean negate) {
        Allocation a = maximize(alt, node, values);
        return negate ? a.negated() : a;
    }

    public Allocation minimize(int alt, int node, double[] values, boolean negate) {
        Allocation a = minimize(alt, node, values);
        return negate ? a.negated() : a;
    }

    /** Extremal EV of a whole alternative without keeping the allocation. */
    double extremum(int alt, double[] values, boolean maximize) {
        double[] scratch = new double[topology.totalNodeCount()];
        return level(topology.tree(alt), topology.sequentialOffset(alt), 0, values, scratch, maximize);
    }

    private Allocation allocate(int alt, int node, double[] values, boolean maximize) {
        topology.requireAlternative(alt);
        if (node != 0) {
            topology.requireNode(alt, node);
            if (!topology.tree(alt).isIntermediate(node)) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "node " + alt + "." + node + " has no subtree");
            }
        }
        if (values.length < topology.totalRealCount()) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "need " + topology.totalRealCount() + " values, got "
                    + values.length);
        }
        double[] allocation = new double[topology.totalNodeCount()];
        Arrays.fill(allocation, -1.0);
        double ev = level(topology.tree(alt), topology.sequentialOffset(alt), node, values, allocation, maximize);
        return new Allocation(ev, allocation);
    }

    private double level(AlternativeTree tree, int offset, int parent, double[] values,
                         double[] allocation, boolean maximize) {
        int[] children = tree.children(parent);
        int n = children.length;
        double[] lower = new double[n];
        double[] width = new double[n];
        double[] value = new double[n];
        double free = 1.0;
        for (int k = 0; k < n; k++) {
            int t = children[k];
            int i = offset + t - 1;
            lower[k] = probabilities.localHullLower(i);
            width[k] = probabilities.localHullUpper(i) - lower[k];
            value[k] = tree.isIntermediate(t)
                    ? level(tree, offset, t, values, allocation, maximize)
                    : values[topology.realOfSequential(i)];
            free -= lower[k];
        }
        Integer[] order = new Integer[n];
        for (int k = 0; k < n; k++) order[k] = k;
        Comparator<Integer> byValue = Comparator.comparingDouble(k -> value[k]);
        Arrays.sort(order, maximize ? byValue.reversed() : byValue);

        double ev = 0.0;
        for (int k : order) {
            double addOn = Math.min(width[k], free);
            double p = lower[k] + addOn;
            free -= addOn;
            allocation[offset + children[k] - 1] = p;
            ev += p * value[k];
        }
        return ev;
    }
}

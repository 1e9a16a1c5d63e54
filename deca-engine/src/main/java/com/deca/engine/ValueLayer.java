package com.deca.engine;

import com.deca.engine.base.IntervalVector;
import com.deca.engine.base.Tolerance;
import com.deca.engine.value.ValueState;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;

/**
 * Value constraints of a frame. Only real nodes carry values; array views report -1 for
 * intermediate nodes and ignore their entries on input.
 */
public final class ValueLayer extends ConstraintLayer {

    ValueLayer(DecisionFrame frame) {
        super(frame);
    }

    @Override
    String layerName() {
        return "V";
    }

    @Override
    void checkStatement(int alt, int node, double lower, double upper) {
        topology().requireNode(alt, node);
        checkBounds("value statement", lower, upper);
        if (topology().tree(alt).isIntermediate(node)) {
            throw new DecaException(ErrorKind.ILLEGAL_NODE, "value statement on intermediate node " + alt + "." + node);
        }
    }

    @Override
    void checkMidpoint(int alt, int node, double lower, double upper) {
        topology().requireNode(alt, node);
        if (topology().tree(alt).isIntermediate(node)) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "value midpoint on intermediate node " + alt + "." + node);
        }
        if (lower < 0.0 || upper > 1.0 || lower > upper) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "value midpoint [" + lower + ", " + upper + "]");
        }
    }

    @Override
    boolean acceptsNode(int seq) {
        return topology().realOfSequential(seq) >= 0;
    }

    /** Removes the midpoint hint of a real node; a no-op without one. */
    @Override
    public void deleteMidpoint(int alt, int node) {
        frame.checkNotDisposed();
        topology().requireNode(alt, node);
        if (topology().tree(alt).isIntermediate(node)) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "no value midpoint on intermediate node " + alt + "." + node);
        }
        int seq = topology().sequentialIndex(alt, node);
        if (!base.hasMidpoint(seq)) {
            return;
        }
        mutate("delete midpoint", b -> b.clearMidpoint(seq));
    }

    // ---- derived state, attached frames only ----

    /** Value hull per sequential node index, -1 for intermediate nodes. */
    public IntervalVector getHull() {
        ValueState s = state();
        FrameTopology topology = topology();
        int n = topology.totalNodeCount();
        double[] lo = new double[n];
        double[] hi = new double[n];
        for (int i = 0; i < n; i++) {
            int r = topology.realOfSequential(i);
            lo[i] = r < 0 ? Tolerance.UNSET : s.hullLower(r);
            hi[i] = r < 0 ? Tolerance.UNSET : s.hullUpper(r);
        }
        return new IntervalVector(lo, hi);
    }

    /** Value mass point per sequential node index, -1 for intermediate nodes. */
    public double[] getMassPoints() {
        ValueState s = state();
        FrameTopology topology = topology();
        double[] mass = new double[topology.totalNodeCount()];
        for (int i = 0; i < mass.length; i++) {
            int r = topology.realOfSequential(i);
            mass[i] = r < 0 ? Tolerance.UNSET : s.mass(r);
        }
        return mass;
    }

    public double getMassPoint(int alt, int node) {
        ValueState s = state();
        topology().requireNode(alt, node);
        int r = topology().realIndex(alt, node);
        return r < 0 ? Tolerance.UNSET : s.mass(r);
    }

    private ValueState state() {
        return frame.loaded().values();
    }
}

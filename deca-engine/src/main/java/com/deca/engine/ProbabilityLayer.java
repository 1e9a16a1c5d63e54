package com.deca.engine;

import com.deca.engine.base.IntervalVector;
import com.deca.engine.probability.ProbabilityState;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;

/**
 * Probability constraints of a frame. Statements may target real and intermediate nodes; the
 * bounds of a node are local, i.e. conditional on reaching its parent.
 */
public final class ProbabilityLayer extends ConstraintLayer {

    ProbabilityLayer(DecisionFrame frame) {
        super(frame);
    }

    @Override
    String layerName() {
        return "P";
    }

    @Override
    void checkStatement(int alt, int node, double lower, double upper) {
        topology().requireNode(alt, node);
        checkBounds("probability statement", lower, upper);
    }

    @Override
    void checkMidpoint(int alt, int node, double lower, double upper) {
        topology().requireNode(alt, node);
        if (lower < 0.0 || upper > 1.0 || lower > upper) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "probability midpoint [" + lower + ", " + upper + "]");
        }
    }

    @Override
    boolean acceptsNode(int seq) {
        return true;
    }

    /**
     * Removes the midpoint hint of a node. Without a hint this is a no-op for a real node and an
     * error for an intermediate one.
     */
    @Override
    public void deleteMidpoint(int alt, int node) {
        frame.checkNotDisposed();
        topology().requireNode(alt, node);
        int seq = topology().sequentialIndex(alt, node);
        if (!base.hasMidpoint(seq)) {
            if (topology().tree(alt).isIntermediate(node)) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "no probability midpoint on node " + alt + "." + node);
            }
            return;
        }
        mutate("delete midpoint", b -> b.clearMidpoint(seq));
    }

    // ---- derived state, attached frames only ----

    /** Global hull per node. */
    public IntervalVector getHull() {
        return state().hull();
    }

    /** Hull conditional on the parent, per node. */
    public IntervalVector getLocalHull() {
        return state().localHull();
    }

    /** Box after intersecting with all statements. */
    public IntervalVector getTightenedBox() {
        return state().tightenedBox();
    }

    /** Global mass point per node; the real nodes of an alternative sum to one. */
    public double[] getMassPoints() {
        return state().massPoints();
    }

    public double[] getLocalMassPoints() {
        return state().localMassPoints();
    }

    public double getMassPoint(int alt, int node) {
        ProbabilityState s = state();
        topology().requireNode(alt, node);
        return s.mass(topology().sequentialIndex(alt, node));
    }

    public double getLocalMassPoint(int alt, int node) {
        ProbabilityState s = state();
        topology().requireNode(alt, node);
        return s.localMass(topology().sequentialIndex(alt, node));
    }

    private ProbabilityState state() {
        return frame.loaded().probabilities();
    }
}

package com.deca.engine.value;

import com.deca.tree.FrameTopology;

/**
 * Derived value picture of one successful load, indexed by global real index.
 * Immutable.
 */
public final class ValueState {

    private final FrameTopology topology;
    private final double[] hullLower;
    private final double[] hullUpper;
    private final double[] mass;

    ValueState(FrameTopology topology, double[] hullLower, double[] hullUpper, double[] mass) {
        this.topology = topology;
        this.hullLower = hullLower;
        this.hullUpper = hullUpper;
        this.mass = mass;
    }

    public FrameTopology topology() {
        return topology;
    }

    public double hullLower(int real) {
        return hullLower[real];
    }

    public double hullUpper(int real) {
        return hullUpper[real];
    }

    public double mass(int real) {
        return mass[real];
    }

    public double[] lowerHull() {
        return hullLower.clone();
    }

    public double[] upperHull() {
        return hullUpper.clone();
    }

    public double[] massPoints() {
        return mass.clone();
    }
}

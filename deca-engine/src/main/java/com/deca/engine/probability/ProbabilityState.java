package com.deca.engine.probability;

import com.deca.engine.base.IntervalVector;
import com.deca.tree.FrameTopology;

/**
 * Derived probability picture of one successful load. Every array is indexed by sequential node
 * index. Instances are immutable and replaced wholesale on the next load.
 */
public final class ProbabilityState {

    private final FrameTopology topology;
    private final double[] boxLower;
    private final double[] boxUpper;
    private final double[] localHullLower;
    private final double[] localHullUpper;
    private final double[] hullLower;
    private final double[] hullUpper;
    private final double[] localMidHullLower;
    private final double[] localMidHullUpper;
    private final double[] localMass;
    private final double[] mass;

    ProbabilityState(FrameTopology topology,
                     double[] boxLower, double[] boxUpper,
                     double[] localHullLower, double[] localHullUpper,
                     double[] hullLower, double[] hullUpper,
                     double[] localMidHullLower, double[] localMidHullUpper,
                     double[] localMass, double[] mass) {
        this.topology = topology;
        this.boxLower = boxLower;
        this.boxUpper = boxUpper;
        this.localHullLower = localHullLower;
        this.localHullUpper = localHullUpper;
        this.hullLower = hullLower;
        this.hullUpper = hullUpper;
        this.localMidHullLower = localMidHullLower;
        this.localMidHullUpper = localMidHullUpper;
        this.localMass = localMass;
        this.mass = mass;
    }

    public FrameTopology topology() {
        return topology;
    }

    /** Box after intersecting every statement. */
    public double boxLower(int seq) {
        return boxLower[seq];
    }

    public double boxUpper(int seq) {
        return boxUpper[seq];
    }

    /** Hull relative to the parent node. */
    public double localHullLower(int seq) {
        return localHullLower[seq];
    }

    public double localHullUpper(int seq) {
        return localHullUpper[seq];
    }

    /** Hull of the unconditional probability. */
    public double hullLower(int seq) {
        return hullLower[seq];
    }

    public double hullUpper(int seq) {
        return hullUpper[seq];
    }

    public double localMidHullLower(int seq) {
        return localMidHullLower[seq];
    }

    public double localMidHullUpper(int seq) {
        return localMidHullUpper[seq];
    }

    public double localMass(int seq) {
        return localMass[seq];
    }

    public double mass(int seq) {
        return mass[seq];
    }

    public IntervalVector hull() {
        return new IntervalVector(hullLower, hullUpper);
    }

    public IntervalVector localHull() {
        return new IntervalVector(localHullLower, localHullUpper);
    }

    public IntervalVector tightenedBox() {
        return new IntervalVector(boxLower, boxUpper);
    }

    public double[] massPoints() {
        return mass.clone();
    }

    public double[] localMassPoints() {
        return localMass.clone();
    }
}

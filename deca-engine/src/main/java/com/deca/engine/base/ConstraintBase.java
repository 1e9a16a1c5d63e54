package com.deca.engine.base;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Mutable user input of one layer: statements in insertion order, an optional box override and
 * the midpoint hints. Box and midpoint arrays are indexed by sequential node index.
 * <p>
 * Not thread safe; owned by a single frame.
 */
public final class ConstraintBase {

    private final int nodeCount;
    private final List<Statement> statements = new ArrayList<>();
    private boolean boxSet;
    private final double[] boxLower;
    private final double[] boxUpper;
    private final double[] midLower;
    private final double[] midUpper;

    public ConstraintBase(int nodeCount) {
        this.nodeCount = nodeCount;
        this.boxLower = new double[nodeCount];
        this.boxUpper = new double[nodeCount];
        this.midLower = new double[nodeCount];
        this.midUpper = new double[nodeCount];
        Arrays.fill(boxUpper, 1.0);
        Arrays.fill(midLower, Tolerance.UNSET);
        Arrays.fill(midUpper, Tolerance.UNSET);
    }

    public int nodeCount() {
        return nodeCount;
    }

    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    public int statementCount() {
        return statements.size();
    }

    /** Statement by 1-based number. */
    public Statement statement(int number) {
        return statements.get(number - 1);
    }

    public void append(Statement statement) {
        statements.add(statement);
    }

    public void replace(int number, Statement statement) {
        statements.set(number - 1, statement);
    }

    /** Removes a statement; later statements move up one number. */
    public Statement remove(int number) {
        return statements.remove(number - 1);
    }

    public boolean isBoxSet() {
        return boxSet;
    }

    public void setBox(double[] lower, double[] upper) {
        System.arraycopy(lower, 0, boxLower, 0, nodeCount);
        System.arraycopy(upper, 0, boxUpper, 0, nodeCount);
        boxSet = true;
    }

    public void clearBox() {
        boxSet = false;
    }

    /** Box lower bound of a node; 0 when no box is set. */
    public double boxLower(int seq) {
        return boxSet ? boxLower[seq] : 0.0;
    }

    /** Box upper bound of a node; 1 when no box is set. */
    public double boxUpper(int seq) {
        return boxSet ? boxUpper[seq] : 1.0;
    }

    public boolean hasMidpoint(int seq) {
        return midLower[seq] >= 0.0;
    }

    /** True when any node carries a midpoint hint. */
    public boolean hasAnyMidpoint() {
        for (int i = 0; i < nodeCount; i++) {
            if (midLower[i] >= 0.0) return true;
        }
        return false;
    }

    public double midLower(int seq) {
        return midLower[seq];
    }

    public double midUpper(int seq) {
        return midUpper[seq];
    }

    public void setMidpoint(int seq, double lower, double upper) {
        midLower[seq] = lower;
        midUpper[seq] = upper;
    }

    public void clearMidpoint(int seq) {
        midLower[seq] = Tolerance.UNSET;
        midUpper[seq] = Tolerance.UNSET;
    }

    /** Drops statements, box and midpoints. */
    public void reset() {
        statements.clear();
        boxSet = false;
        Arrays.fill(midLower, Tolerance.UNSET);
        Arrays.fill(midUpper, Tolerance.UNSET);
    }

    public ConstraintBase copy() {
        ConstraintBase c = new ConstraintBase(nodeCount);
        c.restoreFrom(this);
        return c;
    }

    /** Overwrites this base with the content of {@code other}. */
    public void restoreFrom(ConstraintBase other) {
        if (other.nodeCount != nodeCount) {
            throw new IllegalArgumentException("node count mismatch: " + other.nodeCount + " vs " + nodeCount);
        }
        statements.clear();
        statements.addAll(other.statements);
        boxSet = other.boxSet;
        System.arraycopy(other.boxLower, 0, boxLower, 0, nodeCount);
        System.arraycopy(other.boxUpper, 0, boxUpper, 0, nodeCount);
        System.arraycopy(other.midLower, 0, midLower, 0, nodeCount);
        System.arraycopy(other.midUpper, 0, midUpper, 0, nodeCount);
    }
}

package com.deca.engine.base;

import java.util.Objects;

/**
 * Interval statement on one node: {@code lower <= x(alternative, node) <= upper}.
 * Node is the 1-based tree position inside the alternative.
 */
public final class Statement {

    private final int alternative;
    private final int node;
    private final double lower;
    private final double upper;

    public Statement(int alternative, int node, double lower, double upper) {
        this.alternative = alternative;
        this.node = node;
        this.lower = lower;
        this.upper = upper;
    }

    public int getAlternative() {
        return alternative;
    }

    public int getNode() {
        return node;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    /** Same node, new bounds. */
    public Statement withBounds(double lower, double upper) {
        return new Statement(alternative, node, lower, upper);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Statement that = (Statement) o;
        return alternative == that.alternative && node == that.node
                && Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alternative, node, lower, upper);
    }

    @Override
    public String toString() {
        return "Statement{alt=" + alternative + ", node=" + node + ", [" + lower + ", " + upper + "]}";
    }
}

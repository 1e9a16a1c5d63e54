package com.deca.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Input of one constraint layer: statements in order, the box override (absent when unset) and
 * the midpoint box with -1 for nodes without a hint. Arrays are indexed by sequential node index.
 */
public final class LayerSnapshot {

    private final List<StatementRecord> statements;
    private final double[] boxLower;
    private final double[] boxUpper;
    private final double[] midpointLower;
    private final double[] midpointUpper;

    @JsonCreator
    public LayerSnapshot(
            @JsonProperty("statements") List<StatementRecord> statements,
            @JsonProperty("boxLower") double[] boxLower,
            @JsonProperty("boxUpper") double[] boxUpper,
            @JsonProperty("midpointLower") double[] midpointLower,
            @JsonProperty("midpointUpper") double[] midpointUpper) {
        this.statements = statements != null ? List.copyOf(statements) : List.of();
        this.boxLower = copy(boxLower);
        this.boxUpper = copy(boxUpper);
        this.midpointLower = copy(midpointLower);
        this.midpointUpper = copy(midpointUpper);
    }

    public List<StatementRecord> getStatements() {
        return statements;
    }

    /** Box lower bounds, or null when the layer uses the default box. */
    public double[] getBoxLower() {
        return copy(boxLower);
    }

    public double[] getBoxUpper() {
        return copy(boxUpper);
    }

    public double[] getMidpointLower() {
        return copy(midpointLower);
    }

    public double[] getMidpointUpper() {
        return copy(midpointUpper);
    }

    private static double[] copy(double[] a) {
        return a != null ? a.clone() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LayerSnapshot that = (LayerSnapshot) o;
        return statements.equals(that.statements)
                && Arrays.equals(boxLower, that.boxLower)
                && Arrays.equals(boxUpper, that.boxUpper)
                && Arrays.equals(midpointLower, that.midpointLower)
                && Arrays.equals(midpointUpper, that.midpointUpper);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(statements);
        h = 31 * h + Arrays.hashCode(boxLower);
        h = 31 * h + Arrays.hashCode(boxUpper);
        h = 31 * h + Arrays.hashCode(midpointLower);
        h = 31 * h + Arrays.hashCode(midpointUpper);
        return h;
    }
}

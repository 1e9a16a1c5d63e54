package com.deca.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Serialized interval statement on node {@code node} of alternative {@code alternative}.
 */
public final class StatementRecord {

    private final int alternative;
    private final int node;
    private final double lower;
    private final double upper;

    @JsonCreator
    public StatementRecord(
            @JsonProperty("alternative") int alternative,
            @JsonProperty("node") int node,
            @JsonProperty("lower") double lower,
            @JsonProperty("upper") double upper) {
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StatementRecord that = (StatementRecord) o;
        return alternative == that.alternative && node == that.node
                && Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alternative, node, lower, upper);
    }
}

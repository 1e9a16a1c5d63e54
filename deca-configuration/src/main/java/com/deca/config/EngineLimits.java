package com.deca.config;

import java.util.Objects;

/**
 * Hard caps on frame shape and base size. Checked when a frame is created and before
 * every statement is added. All values except {@code minStatementWidth} must be positive.
 */
public final class EngineLimits {

    /** Default: 100 alternatives, 1022 nodes and 512 leaves per alternative, 920 leaves per frame, 301 statements per base. */
    public static final EngineLimits DEFAULT = new EngineLimits(100, 1022, 512, 920, 301, 0.0);

    private final int maxAlternatives;
    private final int maxNodesPerAlternative;
    private final int maxLeavesPerAlternative;
    private final int maxLeaves;
    private final int maxStatements;
    private final double minStatementWidth;

    public EngineLimits(int maxAlternatives,
                        int maxNodesPerAlternative,
                        int maxLeavesPerAlternative,
                        int maxLeaves,
                        int maxStatements,
                        double minStatementWidth) {
        this.maxAlternatives = requirePositive(maxAlternatives, "maxAlternatives");
        this.maxNodesPerAlternative = requirePositive(maxNodesPerAlternative, "maxNodesPerAlternative");
        this.maxLeavesPerAlternative = requirePositive(maxLeavesPerAlternative, "maxLeavesPerAlternative");
        this.maxLeaves = requirePositive(maxLeaves, "maxLeaves");
        this.maxStatements = requirePositive(maxStatements, "maxStatements");
        if (maxAlternatives < 2) {
            throw new IllegalArgumentException("maxAlternatives must be at least 2, got: " + maxAlternatives);
        }
        if (!(minStatementWidth >= 0.0 && minStatementWidth <= 1.0)) {
            throw new IllegalArgumentException("minStatementWidth must be in [0,1], got: " + minStatementWidth);
        }
        this.minStatementWidth = minStatementWidth;
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    /** Max alternatives in one frame. */
    public int getMaxAlternatives() {
        return maxAlternatives;
    }

    /** Max tree nodes (real and intermediate) in one alternative. */
    public int getMaxNodesPerAlternative() {
        return maxNodesPerAlternative;
    }

    /** Max real nodes in one alternative. */
    public int getMaxLeavesPerAlternative() {
        return maxLeavesPerAlternative;
    }

    /** Max real nodes over all alternatives of a frame. */
    public int getMaxLeaves() {
        return maxLeaves;
    }

    /** Max statements held by one base. */
    public int getMaxStatements() {
        return maxStatements;
    }

    /** Minimum width of a probability statement after box intersection; 0 turns the check off. */
    public double getMinStatementWidth() {
        return minStatementWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EngineLimits that = (EngineLimits) o;
        return maxAlternatives == that.maxAlternatives
                && maxNodesPerAlternative == that.maxNodesPerAlternative
                && maxLeavesPerAlternative == that.maxLeavesPerAlternative
                && maxLeaves == that.maxLeaves
                && maxStatements == that.maxStatements
                && Double.compare(minStatementWidth, that.minStatementWidth) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAlternatives, maxNodesPerAlternative, maxLeavesPerAlternative, maxLeaves,
                maxStatements, minStatementWidth);
    }

    @Override
    public String toString() {
        return "EngineLimits{alts=" + maxAlternatives + ", nodesPerAlt=" + maxNodesPerAlternative
                + ", leavesPerAlt=" + maxLeavesPerAlternative + ", leaves=" + maxLeaves
                + ", stmts=" + maxStatements + ", minWidth=" + minStatementWidth + "}";
    }
}

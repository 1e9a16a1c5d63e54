package com.deca.tree;

/**
 * Kind of a tree node.
 */
public enum NodeKind {
    /** Terminal consequence: carries probability and value statements. */
    REAL,
    /** Branching node: carries probability statements only and aggregates its children. */
    INTERMEDIATE
}

package com.deca.tree.error;

/**
 * Failure kinds reported by the engine. Each kind carries the short lower-case text used in
 * messages and logs.
 */
public enum ErrorKind {
    /** The constraint set admits no normalized distribution at some tree level. */
    INCONSISTENT("inconsistent"),
    /** Out-of-range bound, bad node or alternative reference, bad argument. */
    INPUT_ERROR("input error"),
    /** Malformed topology at construction. */
    TREE_ERROR("tree error"),
    /** Operation not valid for the node kind, e.g. a value statement on an intermediate node. */
    ILLEGAL_NODE("illegal node"),
    TOO_MANY_ALTS("too many alternatives"),
    TOO_MANY_CONS("too many consequences"),
    TOO_MANY_STMTS("too many statements"),
    /** Statement interval narrower than the configured minimum width. */
    TOO_NARROW_STMT("too narrow statement"),
    TOO_FEW_ALTS("too few alternatives"),
    /** The frame handle has been disposed. */
    CORRUPTED("frame corrupted"),
    ATTACHED("frame attached"),
    DETACHED("frame detached"),
    /** Reserved for persistence collaborators. */
    NO_FILE("no such file or directory"),
    UNLIMITED("infinite solution"),
    OUT_OF_MEMORY("out of memory"),
    MEMORY_LEAK("memory leak");

    private final String text;

    ErrorKind(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }
}

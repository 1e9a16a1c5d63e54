package com.deca.tree.error;

import java.util.Objects;

/**
 * Thrown by frame, base and evaluation operations when a call cannot be completed.
 * {@link #getKind()} tells which rule was broken; the message adds the call context.
 */
public class DecaException extends RuntimeException {

    private final ErrorKind kind;
    private final String detail;

    public DecaException(ErrorKind kind, String detail) {
        super(kind.getText() + (detail == null || detail.isEmpty() ? "" : ": " + detail));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
    }

    public DecaException(ErrorKind kind) {
        this(kind, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Call context without the kind text, may be null. */
    public String getDetail() {
        return detail;
    }
}

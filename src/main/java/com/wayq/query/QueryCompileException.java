package com.wayq.query;

/**
 * Raised when an expression tree contains a construct that has no Overpass representation.
 */
public class QueryCompileException extends RuntimeException {

    public enum Reason {
        UNSUPPORTED_NODE,
        UNSUPPORTED_INVERSION
    }

    private final Reason reason;

    public QueryCompileException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

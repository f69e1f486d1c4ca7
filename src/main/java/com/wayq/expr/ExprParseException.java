package com.wayq.expr;

/**
 * Raised when a filter expression cannot be tokenized or parsed.
 */
public class ExprParseException extends IllegalArgumentException {
    private final int position;

    public ExprParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}

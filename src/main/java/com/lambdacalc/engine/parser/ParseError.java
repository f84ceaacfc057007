package com.lambdacalc.engine.parser;

/**
 * Malformed source text. Always recoverable: callers report it and carry on.
 *
 * The offending text is the lexeme found at {@link #position()}, or the empty
 * string when the input ended early.
 */
public class ParseError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String offending;
    private final String reason;

    public ParseError(String reason, String offending, int position) {
        super(reason + " at pos " + position);
        this.reason = reason;
        this.offending = offending == null ? "" : offending;
        this.position = position;
    }

    public int position() { return position; }

    public String offending() { return offending; }

    /** The message without the position suffix. */
    public String reason() { return reason; }

    public boolean atEndOfInput() { return offending.isEmpty(); }
}

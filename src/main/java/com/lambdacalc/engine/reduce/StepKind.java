package com.lambdacalc.engine.reduce;

/** Which rule produced a reduction step. */
public enum StepKind {
    /** {@code (λx.b) a  →  b[x := a]} */
    BETA("β"),
    /** A defined name replaced by its definition. */
    DELTA("δ");

    private final String symbol;

    StepKind(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }
}

package com.lambdacalc.engine.reduce;

import com.lambdacalc.engine.parser.Expr.ExprInterface;

/** Outcome of driving the reducer: the last term, how many steps it took, and whether it is normal. */
public final class NormalForm {
    private final ExprInterface term;
    private final int steps;
    private final boolean reached;

    public NormalForm(ExprInterface term, int steps, boolean reached) {
        this.term = term;
        this.steps = steps;
        this.reached = reached;
    }

    public ExprInterface term() { return term; }
    public int steps() { return steps; }

    /** False when the step limit stopped the loop before a normal form was found. */
    public boolean reached() { return reached; }
}

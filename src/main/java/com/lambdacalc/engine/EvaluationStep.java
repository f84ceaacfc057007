package com.lambdacalc.engine;

import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.reduce.StepKind;

/** One entry of an evaluation trace. Step 0 is the parsed input and has no kind. */
public final class EvaluationStep {
    private final int index;
    private final ExprInterface term;
    private final StepKind kind;

    public EvaluationStep(int index, ExprInterface term, StepKind kind) {
        this.index = index;
        this.term = term;
        this.kind = kind;
    }

    public int index() { return index; }
    public ExprInterface term() { return term; }

    /** Null for the initial term. */
    public StepKind kind() { return kind; }

    public boolean isInitial() { return kind == null; }

    /** "initial", "β" or "δ". */
    public String typeLabel() {
        return kind == null ? "initial" : kind.symbol();
    }
}

package com.lambdacalc.engine.reduce;

import java.util.Objects;

import com.lambdacalc.engine.parser.Expr.ExprInterface;

/** Result of one reduction step: the whole rewritten term and the rule applied. */
public final class Reduction {
    private final ExprInterface term;
    private final StepKind kind;

    public Reduction(ExprInterface term, StepKind kind) {
        this.term = Objects.requireNonNull(term, "term");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ExprInterface term() { return term; }
    public StepKind kind() { return kind; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reduction)) return false;
        Reduction that = (Reduction) o;
        return kind == that.kind && term.equals(that.term);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, kind);
    }

    @Override
    public String toString() {
        return term + " (" + kind.symbol() + ")";
    }
}

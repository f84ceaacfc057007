package com.lambdacalc.engine;

import java.util.Collections;
import java.util.List;

import com.lambdacalc.engine.parser.Expr.ExprInterface;

/** Full trace of an evaluation plus its summary figures. */
public class EvaluationResult {
    private final String input;
    private final List<EvaluationStep> steps;
    private final ExprInterface finalTerm;
    private final ExprInterface abstracted;
    private final boolean normalForm;
    private final int betaSteps;
    private final int deltaSteps;

    public EvaluationResult(String input, List<EvaluationStep> steps, ExprInterface finalTerm,
                            ExprInterface abstracted, boolean normalForm, int betaSteps, int deltaSteps) {
        this.input = input;
        this.steps = Collections.unmodifiableList(steps);
        this.finalTerm = finalTerm;
        this.abstracted = abstracted;
        this.normalForm = normalForm;
        this.betaSteps = betaSteps;
        this.deltaSteps = deltaSteps;
    }

    public String input() { return input; }

    /** Initial term first, then one entry per reduction step. */
    public List<EvaluationStep> steps() { return steps; }

    public ExprInterface finalTerm() { return finalTerm; }

    /** The final term with Church numerals rewritten to digits. */
    public ExprInterface abstracted() { return abstracted; }

    /** False when the step limit stopped evaluation first. */
    public boolean normalForm() { return normalForm; }

    public int totalSteps() { return betaSteps + deltaSteps; }
    public int betaSteps() { return betaSteps; }
    public int deltaSteps() { return deltaSteps; }
}

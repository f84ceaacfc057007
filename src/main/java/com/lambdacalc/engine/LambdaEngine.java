package com.lambdacalc.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.lambdacalc.debug.Debug;
import com.lambdacalc.debug.DebugLevel;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Lexer;
import com.lambdacalc.engine.parser.ParseError;
import com.lambdacalc.engine.parser.Parser;
import com.lambdacalc.engine.reduce.Definitions;
import com.lambdacalc.engine.reduce.NormalForm;
import com.lambdacalc.engine.reduce.NumeralCanonicalizer;
import com.lambdacalc.engine.reduce.Reducer;
import com.lambdacalc.engine.reduce.Reduction;
import com.lambdacalc.engine.reduce.StepKind;

/**
 * Lambda calculus engine.
 *
 * - Syntax: {@code λx.body}, application by juxtaposition, parentheses, decimal
 *   literals as Church numerals
 * - Strategy: normal order, one beta or delta step at a time
 * - Definitions: an immutable table given at construction (built-ins by default)
 * - No ambient state: two engines with different tables never interfere
 */
public class LambdaEngine {

    private static final String TAG = Debug.EVAL;

    /** Receives every trace entry as soon as it is produced. */
    public interface StepListener {
        void onStep(EvaluationStep step);
    }

    private final Definitions definitions;

    public LambdaEngine() {
        this(Definitions.defaults());
    }

    public LambdaEngine(Definitions definitions) {
        this.definitions = Objects.requireNonNull(definitions, "definitions");
    }

    public static Definitions defaultDefinitions() {
        return Definitions.defaults();
    }

    public Definitions definitions() { return definitions; }

    // ===================== CORE OPERATIONS =====================

    /** @throws ParseError on malformed input */
    public ExprInterface parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public String render(ExprInterface term) {
        return term.toString();
    }

    public Optional<Reduction> reduceOnce(ExprInterface term) {
        return Reducer.reduceOnce(term, definitions);
    }

    public ExprInterface canonicalizeNumerals(ExprInterface term) {
        return NumeralCanonicalizer.canonicalize(term);
    }

    /** Unbounded; does not return for terms without a normal form. */
    public NormalForm normalize(ExprInterface term) {
        return Reducer.normalize(term, definitions);
    }

    public NormalForm normalize(ExprInterface term, int maxSteps) {
        return Reducer.normalize(term, definitions, maxSteps);
    }

    // ===================== EVALUATION DRIVER =====================

    public EvaluationResult evaluate(String source, int maxSteps) {
        return evaluate(source, maxSteps, null);
    }

    /**
     * Parses {@code source} and reduces it step by step, recording the trace,
     * until normal form or until {@code maxSteps} steps ({@code <= 0}: no limit).
     *
     * @throws ParseError on malformed input
     */
    public EvaluationResult evaluate(String source, int maxSteps, StepListener listener) {
        ExprInterface term = parse(source);
        return evaluate(source, term, maxSteps, listener);
    }

    public EvaluationResult evaluate(String input, ExprInterface term, int maxSteps, StepListener listener) {
        List<EvaluationStep> steps = new ArrayList<>();
        record(steps, new EvaluationStep(0, term, null), listener);

        int beta = 0;
        int delta = 0;
        boolean normal = false;
        ExprInterface current = term;

        while (true) {
            Optional<Reduction> next = Reducer.reduceOnce(current, definitions);
            if (!next.isPresent()) {
                normal = true;
                break;
            }
            if (maxSteps > 0 && beta + delta >= maxSteps) break;

            Reduction r = next.get();
            current = r.term();
            if (r.kind() == StepKind.BETA) beta++;
            else delta++;
            record(steps, new EvaluationStep(beta + delta, current, r.kind()), listener);
            if (Debug.get().enabled(DebugLevel.TRACE)) {
                Debug.get().t(TAG, "step " + (beta + delta) + " (" + r.kind().symbol() + "): " + current);
            }
        }

        ExprInterface abstracted = NumeralCanonicalizer.canonicalize(current);
        Debug.get().d(TAG, "evaluated steps=" + (beta + delta) + " beta=" + beta + " delta=" + delta
                + " normalForm=" + normal);
        if (!normal) {
            Debug.get().w(TAG, "step limit " + maxSteps + " reached before normal form");
        }
        return new EvaluationResult(input, steps, current, abstracted, normal, beta, delta);
    }

    private static void record(List<EvaluationStep> steps, EvaluationStep step, StepListener listener) {
        steps.add(step);
        if (listener != null) listener.onStep(step);
    }
}

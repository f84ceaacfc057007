package com.lambdacalc.engine.reduce;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

import com.lambdacalc.engine.parser.Expr.Abstraction;
import com.lambdacalc.engine.parser.Expr.Application;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Expr.Variable;

/**
 * Normal-order (leftmost-outermost) single-step reducer.
 *
 * At every node a beta or delta redex is taken before looking inside it; when
 * looking inside, the function side of an application is searched completely
 * before the argument side. Unused arguments are therefore never evaluated,
 * which is what makes the boolean definitions usable on diverging terms.
 *
 * The search walks an explicit stack of frames, each remembering its parent and
 * which child it is, so the rewritten spine can be rebuilt without recursion.
 */
public final class Reducer {

    private enum Slot { FN, ARG, BODY }

    private static final class Frame {
        final ExprInterface expr;
        final Frame parent;
        final Slot slot;

        Frame(ExprInterface expr, Frame parent, Slot slot) {
            this.expr = expr;
            this.parent = parent;
            this.slot = slot;
        }
    }

    private Reducer() {}

    /**
     * One reduction step, or empty when {@code term} is in normal form with
     * respect to {@code defs}. Deterministic: same term and table, same step.
     */
    public static Optional<Reduction> reduceOnce(ExprInterface term, Definitions defs) {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(defs, "defs");

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(term, null, null));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            ExprInterface expr = frame.expr;

            Reduction local = contract(expr, defs);
            if (local != null) {
                return Optional.of(new Reduction(rebuild(frame, local.term()), local.kind()));
            }

            if (expr instanceof Application) {
                Application app = (Application) expr;
                stack.push(new Frame(app.arg, frame, Slot.ARG));
                stack.push(new Frame(app.fn, frame, Slot.FN));
            } else if (expr instanceof Abstraction) {
                stack.push(new Frame(((Abstraction) expr).body, frame, Slot.BODY));
            }
        }
        return Optional.empty();
    }

    /** The redex at this exact node, if it is one. */
    private static Reduction contract(ExprInterface expr, Definitions defs) {
        if (expr instanceof Variable) {
            ExprInterface def = defs.lookup(((Variable) expr).name);
            return def == null ? null : new Reduction(def, StepKind.DELTA);
        }
        if (expr instanceof Application) {
            Application app = (Application) expr;
            if (app.fn instanceof Abstraction) {
                Abstraction fn = (Abstraction) app.fn;
                return new Reduction(Names.substitute(fn.body, fn.param, app.arg), StepKind.BETA);
            }
        }
        return null;
    }

    /** Re-wraps {@code replacement} in copies of every ancestor of {@code frame}. */
    private static ExprInterface rebuild(Frame frame, ExprInterface replacement) {
        ExprInterface result = replacement;
        for (Frame f = frame; f.parent != null; f = f.parent) {
            ExprInterface parent = f.parent.expr;
            switch (f.slot) {
                case FN:
                    result = new Application(result, ((Application) parent).arg);
                    break;
                case ARG:
                    result = new Application(((Application) parent).fn, result);
                    break;
                default:
                    result = new Abstraction(((Abstraction) parent).param, result);
                    break;
            }
        }
        return result;
    }

    /** Reduces until no step applies. Does not return for terms without a normal form. */
    public static NormalForm normalize(ExprInterface term, Definitions defs) {
        return normalize(term, defs, 0);
    }

    /**
     * Reduces until no step applies or {@code maxSteps} steps have been taken
     * ({@code maxSteps <= 0} means no limit).
     */
    public static NormalForm normalize(ExprInterface term, Definitions defs, int maxSteps) {
        ExprInterface current = term;
        int steps = 0;
        while (maxSteps <= 0 || steps < maxSteps) {
            Optional<Reduction> next = reduceOnce(current, defs);
            if (!next.isPresent()) return new NormalForm(current, steps, true);
            current = next.get().term();
            steps++;
        }
        boolean normal = !reduceOnce(current, defs).isPresent();
        return new NormalForm(current, steps, normal);
    }
}

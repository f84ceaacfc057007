package com.lambdacalc.engine.reduce;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;

import com.lambdacalc.engine.parser.Expr.Abstraction;
import com.lambdacalc.engine.parser.Expr.Application;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Expr.Variable;

/**
 * Rewrites Church-numeral-shaped subterms into variables named by their value,
 * so {@code λf.λx.f (f x)} prints as {@code 2}.
 *
 * The match is structural and by name: two nested binders {@code f} and
 * {@code x}, then only applications of {@code f}, ending in exactly {@code x}.
 * Children are rewritten before their parent is checked. The output never
 * matches the shape again, so the pass is idempotent.
 */
public final class NumeralCanonicalizer {

    private NumeralCanonicalizer() {}

    public static ExprInterface canonicalize(ExprInterface term) {
        Map<ExprInterface, ExprInterface> done = new IdentityHashMap<>();
        Deque<ExprInterface> stack = new ArrayDeque<>();
        Deque<Boolean> expanded = new ArrayDeque<>();
        stack.push(term);
        expanded.push(Boolean.FALSE);

        while (!stack.isEmpty()) {
            ExprInterface expr = stack.pop();
            boolean childrenDone = expanded.pop();
            if (done.containsKey(expr)) continue;

            if (!childrenDone) {
                stack.push(expr);
                expanded.push(Boolean.TRUE);
                if (expr instanceof Application) {
                    Application app = (Application) expr;
                    stack.push(app.arg);
                    expanded.push(Boolean.FALSE);
                    stack.push(app.fn);
                    expanded.push(Boolean.FALSE);
                } else if (expr instanceof Abstraction) {
                    stack.push(((Abstraction) expr).body);
                    expanded.push(Boolean.FALSE);
                }
                continue;
            }

            done.put(expr, process(expr, done));
        }
        return done.get(term);
    }

    private static ExprInterface process(ExprInterface expr, Map<ExprInterface, ExprInterface> done) {
        ExprInterface rebuilt;
        if (expr instanceof Abstraction) {
            Abstraction abs = (Abstraction) expr;
            ExprInterface body = done.get(abs.body);
            rebuilt = body == abs.body ? abs : new Abstraction(abs.param, body);
        } else if (expr instanceof Application) {
            Application app = (Application) expr;
            ExprInterface fn = done.get(app.fn);
            ExprInterface arg = done.get(app.arg);
            rebuilt = (fn == app.fn && arg == app.arg) ? app : new Application(fn, arg);
        } else {
            return expr;
        }

        int value = numeralValue(rebuilt);
        return value < 0 ? rebuilt : new Variable(Integer.toString(value));
    }

    /** The number of applications if {@code expr} has Church-numeral shape, otherwise -1. */
    public static int numeralValue(ExprInterface expr) {
        if (!(expr instanceof Abstraction)) return -1;
        Abstraction outer = (Abstraction) expr;
        if (!(outer.body instanceof Abstraction)) return -1;
        Abstraction inner = (Abstraction) outer.body;

        int count = 0;
        ExprInterface curr = inner.body;
        while (curr instanceof Application) {
            Application app = (Application) curr;
            if (!(app.fn instanceof Variable) || !((Variable) app.fn).name.equals(outer.param)) return -1;
            curr = app.arg;
            count++;
        }
        return (curr instanceof Variable && ((Variable) curr).name.equals(inner.param)) ? count : -1;
    }

    public static boolean isNumeral(ExprInterface expr) {
        return numeralValue(expr) >= 0;
    }
}

package com.lambdacalc.engine.reduce;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import com.lambdacalc.engine.parser.Expr.Abstraction;
import com.lambdacalc.engine.parser.Expr.Application;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Expr.ExprVisitor;
import com.lambdacalc.engine.parser.Expr.Variable;

/**
 * Free-variable analysis, fresh-name synthesis and capture-avoiding substitution.
 *
 * Free-variable analysis walks an explicit work-list. Substitution recurses
 * over the term, so its depth limit is the depth of the term against the
 * thread stack; front ends that accept arbitrary input run it on a thread with
 * a generous stack.
 */
public final class Names {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    private Names() {}

    /** Names occurring in {@code term} that no enclosing abstraction binds, in first-seen order. */
    public static Set<String> freeVariables(ExprInterface term) {
        Set<String> result = new LinkedHashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(term, Collections.emptySet()));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            ExprInterface expr = frame.expr;

            if (expr instanceof Variable) {
                String name = ((Variable) expr).name;
                if (!frame.bound.contains(name)) result.add(name);
            } else if (expr instanceof Abstraction) {
                Abstraction abs = (Abstraction) expr;
                Set<String> bound = frame.bound;
                if (!bound.contains(abs.param)) {
                    bound = new HashSet<>(bound);
                    bound.add(abs.param);
                }
                stack.push(new Frame(abs.body, bound));
            } else {
                Application app = (Application) expr;
                // arg first so fn is visited first and names come out left to right
                stack.push(new Frame(app.arg, frame.bound));
                stack.push(new Frame(app.fn, frame.bound));
            }
        }
        return result;
    }

    /**
     * First name not in {@code avoid}: {@code a..z}, then {@code a1..z1},
     * {@code a2..z2} and so on.
     */
    public static String freshName(Set<String> avoid) {
        for (int suffix = 0; ; suffix++) {
            for (int i = 0; i < ALPHABET.length(); i++) {
                String candidate = suffix == 0
                        ? String.valueOf(ALPHABET.charAt(i))
                        : ALPHABET.charAt(i) + Integer.toString(suffix);
                if (!avoid.contains(candidate)) return candidate;
            }
        }
    }

    /** {@code term[name := value]}, renaming binders that would capture a free variable of {@code value}. */
    public static ExprInterface substitute(ExprInterface term, String name, ExprInterface value) {
        return term.accept(new Substitution(name, value));
    }

    private static final class Frame {
        final ExprInterface expr;
        final Set<String> bound;

        Frame(ExprInterface expr, Set<String> bound) {
            this.expr = expr;
            this.bound = bound;
        }
    }

    private static final class Substitution implements ExprVisitor<ExprInterface> {
        private final String name;
        private final ExprInterface value;
        private Set<String> valueFree;

        Substitution(String name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        private Set<String> valueFree() {
            if (valueFree == null) valueFree = freeVariables(value);
            return valueFree;
        }

        @Override
        public ExprInterface visitVariable(Variable expr) {
            return expr.name.equals(name) ? value : expr;
        }

        @Override
        public ExprInterface visitApplication(Application expr) {
            ExprInterface fn = expr.fn.accept(this);
            ExprInterface arg = expr.arg.accept(this);
            if (fn == expr.fn && arg == expr.arg) return expr;
            return new Application(fn, arg);
        }

        @Override
        public ExprInterface visitAbstraction(Abstraction expr) {
            // name is shadowed: nothing below is free
            if (expr.param.equals(name)) return expr;

            if (valueFree().contains(expr.param)) {
                Set<String> used = new HashSet<>(freeVariables(expr.body));
                used.addAll(valueFree());
                used.add(expr.param);
                used.add(name);

                String fresh = freshName(used);
                ExprInterface renamed = substitute(expr.body, expr.param, new Variable(fresh));
                return new Abstraction(fresh, renamed.accept(this));
            }

            ExprInterface body = expr.body.accept(this);
            return body == expr.body ? expr : new Abstraction(expr.param, body);
        }
    }
}

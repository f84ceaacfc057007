package com.lambdacalc.engine.parser;

import java.util.Objects;

/**
 * Term algebra of the untyped lambda calculus.
 *
 * Exactly three node shapes exist; every consumer dispatches over them through
 * {@link ExprVisitor}, so a new shape means a new visitor method everywhere.
 * Nodes are immutable, compare syntactically (same shape, same names), and
 * {@code toString()} is the canonical rendering.
 */
public final class Expr {

    private Expr() {}

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitVariable(Variable expr);
        R visitAbstraction(Abstraction expr);
        R visitApplication(Application expr);
    }

    public static Variable var(String name) { return new Variable(name); }
    public static Abstraction abs(String param, ExprInterface body) { return new Abstraction(param, body); }
    public static Application app(ExprInterface fn, ExprInterface arg) { return new Application(fn, arg); }

    // -------------------------
    // Nodes
    // -------------------------

    public static final class Variable implements ExprInterface {
        public final String name;

        public Variable(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isEmpty()) throw new IllegalArgumentException("Variable name must not be empty");
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Variable)) return false;
            return name.equals(((Variable) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Abstraction implements ExprInterface {
        public final String param;
        public final ExprInterface body;
        private final int hash;

        public Abstraction(String param, ExprInterface body) {
            Objects.requireNonNull(param, "param");
            Objects.requireNonNull(body, "body");
            if (param.isEmpty()) throw new IllegalArgumentException("Parameter name must not be empty");
            this.param = param;
            this.body = body;
            this.hash = Objects.hash(param, body);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAbstraction(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Abstraction)) return false;
            Abstraction that = (Abstraction) o;
            return hash == that.hash && param.equals(that.param) && body.equals(that.body);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            String b = (body instanceof Abstraction) ? "(" + body + ")" : body.toString();
            return "λ" + param + "." + b;
        }
    }

    public static final class Application implements ExprInterface {
        public final ExprInterface fn;
        public final ExprInterface arg;
        private final int hash;

        public Application(ExprInterface fn, ExprInterface arg) {
            Objects.requireNonNull(fn, "fn");
            Objects.requireNonNull(arg, "arg");
            this.fn = fn;
            this.arg = arg;
            this.hash = Objects.hash(fn, arg);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitApplication(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Application)) return false;
            Application that = (Application) o;
            return hash == that.hash && fn.equals(that.fn) && arg.equals(that.arg);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            String fnS = (fn instanceof Abstraction) ? "(" + fn + ")" : fn.toString();
            String argS = (arg instanceof Variable) ? arg.toString() : "(" + arg + ")";
            return fnS + " " + argS;
        }
    }
}

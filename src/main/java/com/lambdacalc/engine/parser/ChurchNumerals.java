package com.lambdacalc.engine.parser;

import com.lambdacalc.engine.parser.Expr.Abstraction;
import com.lambdacalc.engine.parser.Expr.Application;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Expr.Variable;

/** Church encoding of natural numbers: n is {@code λf.λx.f (f (... x))}. */
public final class ChurchNumerals {

    public static final String FN_PARAM = "f";
    public static final String BASE_PARAM = "x";

    private ChurchNumerals() {}

    public static Abstraction church(int n) {
        if (n < 0) throw new IllegalArgumentException("Church numerals are natural numbers: " + n);
        Variable f = new Variable(FN_PARAM);
        ExprInterface body = new Variable(BASE_PARAM);
        for (int i = 0; i < n; i++) {
            body = new Application(f, body);
        }
        return new Abstraction(FN_PARAM, new Abstraction(BASE_PARAM, body));
    }
}

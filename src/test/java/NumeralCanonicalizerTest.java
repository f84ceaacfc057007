import org.junit.jupiter.api.Test;

import com.lambdacalc.engine.parser.ChurchNumerals;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Parser;
import com.lambdacalc.engine.reduce.NumeralCanonicalizer;

import static com.lambdacalc.engine.parser.Expr.var;
import static org.junit.jupiter.api.Assertions.*;

public class NumeralCanonicalizerTest {

    private static String canon(String src) {
        return NumeralCanonicalizer.canonicalize(Parser.parse(src)).toString();
    }

    @Test
    void churchNumerals_becomeDigits() {
        for (int i = 0; i <= 10; i++) {
            assertEquals(String.valueOf(i), NumeralCanonicalizer.canonicalize(ChurchNumerals.church(i)).toString());
        }
    }

    @Test
    void binderNamesDoNotMatter() {
        assertEquals("2", canon("λf.λx.f (f x)"));
        assertEquals("3", canon("λs.λz.s (s (s z))"));
    }

    @Test
    void nonNumerals_areLeftAlone() {
        assertEquals("λf.(λx.y)", canon("λf.λx.y"));
        assertEquals("λf.(λx.f y)", canon("λf.λx.f y"));
        assertEquals("λf.(λx.g x)", canon("λf.λx.g x"));
        assertEquals("λf.(λx.f)", canon("λf.λx.f"));
        assertEquals("λf.(λx.f x y)", canon("λf.λx.f x y"));
    }

    @Test
    void numeralValue_countsApplications() {
        assertEquals(3, NumeralCanonicalizer.numeralValue(Parser.parse("λf.λx.f (f (f x))")));
        assertEquals(-1, NumeralCanonicalizer.numeralValue(Parser.parse("λf.λx.f (g x)")));
        assertEquals(-1, NumeralCanonicalizer.numeralValue(var("x")));
        assertTrue(NumeralCanonicalizer.isNumeral(ChurchNumerals.church(0)));
        assertFalse(NumeralCanonicalizer.isNumeral(Parser.parse("λx.x")));
    }

    @Test
    void nestedNumerals_areRewrittenInPlace() {
        assertEquals("2 1", canon("(λf.λx.f (f x)) (λf.λx.f x)"));
        assertEquals("λz.z 2", canon("λz.z (λf.λx.f (f x))"));
        assertEquals("pair 1 2", canon("pair 1 2"));
        assertEquals("λa.0", canon("λa.λf.λx.x"));
    }

    @Test
    void canonicalize_isIdempotent() {
        ExprInterface once = NumeralCanonicalizer.canonicalize(Parser.parse("pair 3 (λy.y 4)"));
        assertEquals(once, NumeralCanonicalizer.canonicalize(once));
    }

    @Test
    void deepNumeral_doesNotOverflow() {
        assertEquals("5000", NumeralCanonicalizer.canonicalize(ChurchNumerals.church(5000)).toString());
    }
}

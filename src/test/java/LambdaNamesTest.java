import org.junit.jupiter.api.Test;

import com.lambdacalc.engine.parser.Expr.Abstraction;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Parser;
import com.lambdacalc.engine.reduce.Names;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.lambdacalc.engine.parser.Expr.var;
import static org.junit.jupiter.api.Assertions.*;

public class LambdaNamesTest {

    private static List<String> fv(String src) {
        return new ArrayList<>(Names.freeVariables(Parser.parse(src)));
    }

    private static Set<String> alphabet() {
        Set<String> s = new HashSet<>();
        for (char c = 'a'; c <= 'z'; c++) s.add(String.valueOf(c));
        return s;
    }

    @Test
    void freeVariables_respectBinders() {
        assertEquals(List.of("y"), fv("λx.x y"));
        assertEquals(List.of("z"), fv("λx.λy.x y z"));
        assertEquals(List.of("z"), fv("λx.(λy.x y) z"));
        assertEquals(List.of(), fv("λx.λx.x"));
    }

    @Test
    void freeVariables_inFirstSeenOrder() {
        assertEquals(List.of("x", "z"), fv("x (λx.x) z"));
        assertEquals(List.of("+"), fv("+ 2 3"));
    }

    @Test
    void freshName_walksTheAlphabetThenSuffixes() {
        assertEquals("a", Names.freshName(Set.of()));
        assertEquals("d", Names.freshName(Set.of("a", "b", "c")));

        Set<String> used = alphabet();
        assertEquals("a1", Names.freshName(used));
        used.add("a1");
        assertEquals("b1", Names.freshName(used));
        for (char c = 'a'; c <= 'z'; c++) used.add(c + "1");
        assertEquals("a2", Names.freshName(used));
    }

    @Test
    void substitute_replacesFreeOccurrences() {
        assertEquals(Parser.parse("(λz.z) (λz.z)"),
                Names.substitute(Parser.parse("x x"), "x", Parser.parse("λz.z")));
        assertEquals(var("v"), Names.substitute(var("x"), "x", var("v")));
        assertEquals(var("y"), Names.substitute(var("y"), "x", var("v")));
    }

    @Test
    void substitute_stopsAtShadowingBinder() {
        ExprInterface term = Parser.parse("λx.x");
        assertSame(term, Names.substitute(term, "x", var("z")));
    }

    @Test
    void substitute_withoutCaptureRisk_keepsBinder() {
        assertEquals(Parser.parse("λz.y z"), Names.substitute(Parser.parse("λz.x z"), "x", var("y")));
    }

    @Test
    void substitute_renamesCapturingBinder() {
        ExprInterface result = Names.substitute(Parser.parse("λy.x y"), "x", var("y"));

        assertTrue(result instanceof Abstraction);
        assertNotEquals("y", ((Abstraction) result).param);
        assertNotEquals("λy.y y", result.toString());
        assertEquals("λa.y a", result.toString());
    }

    @Test
    void substitute_renamesNestedBinders() {
        ExprInterface result = Names.substitute(Parser.parse("λy.λa.x y a"), "x", Parser.parse("y a"));
        assertEquals("λb.(λc.y a b c)", result.toString());
    }
}

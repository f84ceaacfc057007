import org.junit.jupiter.api.Test;

import com.lambdacalc.engine.EvaluationResult;
import com.lambdacalc.engine.EvaluationStep;
import com.lambdacalc.engine.LambdaEngine;
import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.ParseError;
import com.lambdacalc.engine.reduce.Definitions;
import com.lambdacalc.engine.reduce.NormalForm;
import com.lambdacalc.engine.reduce.NumeralCanonicalizer;
import com.lambdacalc.engine.reduce.StepKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LambdaEngineTest {

    private final LambdaEngine engine = new LambdaEngine();

    private String abstracted(String src) {
        EvaluationResult r = engine.evaluate(src, 0);
        assertTrue(r.normalForm(), "no normal form for " + src);
        return r.abstracted().toString();
    }

    @Test
    void identityApplied_oneBetaStep() {
        EvaluationResult r = engine.evaluate("(λx.x) (λy.y)", 0);

        assertEquals("λy.y", r.finalTerm().toString());
        assertTrue(r.normalForm());
        assertEquals(1, r.totalSteps());
        assertEquals(1, r.betaSteps());
        assertEquals(0, r.deltaSteps());

        List<EvaluationStep> steps = r.steps();
        assertEquals(2, steps.size());
        assertTrue(steps.get(0).isInitial());
        assertEquals("initial", steps.get(0).typeLabel());
        assertEquals(StepKind.BETA, steps.get(1).kind());
        assertEquals("β", steps.get(1).typeLabel());
    }

    @Test
    void addition() {
        assertEquals("0", abstracted("+ 0 0"));
        assertEquals("5", abstracted("+ 2 3"));
        assertEquals("12", abstracted("+ 5 7"));

        EvaluationResult r = engine.evaluate("+ 2 3", 0);
        assertEquals(5, NumeralCanonicalizer.numeralValue(r.finalTerm()));
        assertTrue(r.deltaSteps() > 0);
    }

    @Test
    void multiplication() {
        assertEquals("0", abstracted("* 0 5"));
        assertEquals("6", abstracted("* 2 3"));
        assertEquals("12", abstracted("* 3 4"));
    }

    @Test
    void nestedArithmetic() {
        assertEquals("10", abstracted("+ (* 2 3) 4"));
        assertEquals("9", abstracted("* (+ 1 2) 3"));
        assertEquals("24", abstracted("* (+ 2 2) (+ 3 3)"));
    }

    @Test
    void comparison_yieldsBooleans() {
        Definitions defs = engine.definitions();
        assertEquals(defs.lookup("⊤"), engine.evaluate("≤ 2 5", 0).finalTerm());
        assertEquals(defs.lookup("⊥"), engine.evaluate("≤ 5 2", 0).finalTerm());
        assertEquals(defs.lookup("⊤"), engine.evaluate("≤ 3 3", 0).finalTerm());
        assertEquals(defs.lookup("⊥"), engine.evaluate("≤ 1 0", 0).finalTerm());
    }

    @Test
    void booleansSelect() {
        assertEquals("5", abstracted("⊤ 5 7"));
        assertEquals("7", abstracted("⊥ 5 7"));
        assertEquals("1", abstracted("pair 1 2 ⊤"));
    }

    @Test
    void stepLimit_stopsDivergentTerm() {
        EvaluationResult r = engine.evaluate("(λx.x x) (λx.x x)", 10);
        assertFalse(r.normalForm());
        assertEquals(10, r.totalSteps());
        assertEquals(11, r.steps().size());
    }

    @Test
    void stepLimit_exactlyEnough_isNormalForm() {
        EvaluationResult r = engine.evaluate("(λx.x) (λy.y)", 1);
        assertTrue(r.normalForm());
        assertEquals(1, r.totalSteps());
    }

    @Test
    void listener_seesEveryStepInOrder() {
        List<Integer> seen = new ArrayList<>();
        EvaluationResult r = engine.evaluate("⊤ a b", 0, step -> seen.add(step.index()));
        assertEquals(List.of(0, 1, 2, 3), seen);
        assertEquals(1, r.deltaSteps());
        assertEquals(2, r.betaSteps());
        assertEquals("a", r.finalTerm().toString());
    }

    @Test
    void parseErrors_propagate() {
        assertThrows(ParseError.class, () -> engine.evaluate("λx", 0));
        assertThrows(ParseError.class, () -> engine.parse("(λx.x"));
    }

    @Test
    void render_roundTrips() {
        ExprInterface t = engine.parse("λf.λx.f (f x)");
        assertEquals("λf.(λx.f (f x))", engine.render(t));
        assertEquals(t, engine.parse(engine.render(t)));
    }

    @Test
    void normalize_andCanonicalize() {
        NormalForm nf = engine.normalize(engine.parse("+ 1 1"));
        assertTrue(nf.reached());
        assertEquals("2", engine.canonicalizeNumerals(nf.term()).toString());

        NormalForm limited = engine.normalize(engine.parse("(λx.x x) (λx.x x)"), 5);
        assertFalse(limited.reached());
    }

    @Test
    void enginesWithDifferentTables_doNotInterfere() {
        LambdaEngine custom = new LambdaEngine(Definitions.defaults().extend(Map.of("id", "λx.x")));

        assertEquals("y", custom.evaluate("id y", 0).finalTerm().toString());
        assertEquals("id y", engine.evaluate("id y", 0).finalTerm().toString());
        assertFalse(LambdaEngine.defaultDefinitions().contains("id"));
    }
}

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.lambdacalc.engine.LambdaCli;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LambdaCliTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String input, String... args) {
        InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return LambdaCli.run(args, in, out, err);
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }
    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    @Test
    void expressionArgument_printsTrace() {
        int code = run("", "--colorParens=false", "--stackSizeMb=16", "(λx.x)", "(λy.y)");

        assertEquals(0, code);
        String[] lines = out().split("\\R");
        assertEquals("Step 0: (λx.x)(λy.y)", lines[0]);
        assertEquals("Step 1 (β): λy.y", lines[1]);
        assertEquals("→ normal form reached.", lines[2]);
        assertEquals("", lines[3]);
        assertEquals("δ‑abstracted: λy.y", lines[4]);
    }

    @Test
    void deltaSteps_areLabelled() {
        assertEquals(0, run("", "--colorParens=false", "--stackSizeMb=16", "+ 2 3"));
        assertTrue(out().contains("Step 1 (δ): "));
        assertTrue(out().contains("δ‑abstracted: 5"));
    }

    @Test
    void stepTypeAndAbstractionCanBeTurnedOff() {
        run("", "--colorParens=false", "--showStepType=false", "--abstractNumerals=false", "--stackSizeMb=16", "⊤ a b");
        assertTrue(out().contains("Step 1: "));
        assertFalse(out().contains("(δ)"));
        assertFalse(out().contains("abstracted"));
    }

    @Test
    void stepLimit_isReported() {
        int code = run("", "--maxSteps=3", "--colorParens=false", "--stackSizeMb=16", "(λx.x x) (λx.x x)");
        assertEquals(0, code);
        assertTrue(out().contains("Step 3 (β): "));
        assertFalse(out().contains("Step 4"));
        assertTrue(out().contains("→ step limit reached after 3 steps."));
    }

    @Test
    void parseError_exitsWithOne() {
        assertEquals(1, run("", "--stackSizeMb=16", "λx"));
        assertTrue(out().contains("Parse error: Expected '.' after λ parameter at pos 2"), out());
    }

    @Test
    void unknownOption_isUsageError() {
        assertEquals(2, run("", "--nope=1", "x"));
        assertTrue(err().contains("Unknown option: --nope"));
        assertTrue(err().contains("Usage"));
    }

    @Test
    void help() {
        assertEquals(0, run("", "--help"));
        assertTrue(out().startsWith("Usage"));
    }

    @Test
    void missingConfigFile_isUsageError() {
        assertEquals(2, run("", "--config=" + tmp.resolve("missing.json"), "x"));
        assertTrue(err().contains("Failed to read config file"));
    }

    @Test
    void configFile_definitionsAreUsable() throws Exception {
        Path cfg = tmp.resolve("cfg.json");
        Files.writeString(cfg, "{\"colorParens\": false, \"stackSizeMb\": 16, \"definitions\": {\"id\": \"λx.x\"}}",
                StandardCharsets.UTF_8);

        assertEquals(0, run("", "--config=" + cfg, "id", "z"));
        assertTrue(out().contains("Step 1 (δ): (λx.x)z"), out());
        assertTrue(out().contains("Step 2 (β): z"), out());
    }

    @Test
    void badDefinition_isUsageError() {
        assertEquals(2, run("", "--define=bad=(λx", "x"));
        assertTrue(err().contains("Definition 'bad'"));
    }

    @Test
    void interactive_evaluatesLinesUntilQuit() {
        int code = run(":defs\n\n(λx.x) y\n:quit\nnever\n", "--colorParens=false", "--stackSizeMb=16");

        assertEquals(0, code);
        String out = out();
        assertTrue(out.contains("λ‑expr> "));
        assertTrue(out.contains("⊤ = λx.(λy.x)"));
        assertTrue(out.contains("Step 1 (β): y"));
        assertFalse(out.contains("never"));
    }

    @Test
    void interactive_keepsGoingAfterParseError() {
        int code = run("(λx\nλx.x\n", "--colorParens=false", "--stackSizeMb=16");
        assertEquals(0, code);
        assertTrue(out().contains("Parse error: "));
        assertTrue(out().contains("Step 0: λx.x"));
    }
}

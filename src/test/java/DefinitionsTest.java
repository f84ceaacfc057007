import org.junit.jupiter.api.Test;

import com.lambdacalc.engine.parser.ParseError;
import com.lambdacalc.engine.parser.Parser;
import com.lambdacalc.engine.reduce.Definitions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DefinitionsTest {

    @Test
    void builtins_inTableOrder() {
        Definitions defs = Definitions.defaults();
        assertEquals(12, defs.size());
        assertEquals(List.of("⊤", "⊥", "∧", "∨", "↓", "↑", "+", "*", "is0", "-", "≤", "pair"),
                new ArrayList<>(defs.names()));
        assertSame(defs, Definitions.defaults());
    }

    @Test
    void builtins_parsedFromSource() {
        Definitions defs = Definitions.defaults();
        assertEquals("λx.(λy.x)", defs.lookup("⊤").toString());
        assertEquals("λx.(λy.y)", defs.lookup("⊥").toString());
        assertEquals(Parser.parse(defs.source("pair")), defs.lookup("pair"));
        assertNull(defs.lookup("nope"));
    }

    @Test
    void table_isReadOnly() {
        Map<String, ?> view = Definitions.defaults().asMap();
        assertThrows(UnsupportedOperationException.class, () -> view.remove("⊤"));
        assertTrue(Definitions.empty().names().isEmpty());
    }

    @Test
    void extend_addsAndReplaces() {
        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("id", "λx.x");
        extra.put("⊤", "λa.λb.a");

        Definitions base = Definitions.defaults();
        Definitions ext = base.extend(extra);

        assertEquals(13, ext.size());
        assertEquals("λa.(λb.a)", ext.lookup("⊤").toString());
        assertEquals("⊤", ext.names().iterator().next());
        assertEquals("id", new ArrayList<>(ext.names()).get(12));

        // base table untouched
        assertEquals("λx.(λy.x)", base.lookup("⊤").toString());
        assertFalse(base.contains("id"));
    }

    @Test
    void extend_rejectsBadNames() {
        Definitions defs = Definitions.defaults();
        assertThrows(IllegalArgumentException.class, () -> defs.extend(Map.of("2x", "λx.x")));
        assertThrows(IllegalArgumentException.class, () -> defs.extend(Map.of("a b", "λx.x")));
        assertThrows(IllegalArgumentException.class, () -> defs.extend(Map.of("", "λx.x")));
        assertThrows(IllegalArgumentException.class, () -> defs.extend(Map.of("f(x)", "λx.x")));
    }

    @Test
    void extend_reportsWhichDefinitionIsMalformed() {
        ParseError e = assertThrows(ParseError.class,
                () -> Definitions.defaults().extend(Map.of("bad", "λx")));
        assertTrue(e.reason().startsWith("Definition 'bad':"), e.reason());
        assertEquals(2, e.position());
    }
}

package com.lambdacalc.engine.reduce;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.parser.Lexer;
import com.lambdacalc.engine.parser.ParseError;
import com.lambdacalc.engine.parser.Parser;

/**
 * Immutable, ordered table of delta definitions: name → pre-parsed term.
 *
 * The built-in table covers booleans, successor/predecessor, arithmetic,
 * comparison and pairing over Church numerals. It is parsed once on first use
 * and shared; {@link #extend(Map)} derives a new table and never touches this one.
 */
public final class Definitions {

    private static final Map<String, String> BUILTIN_SOURCES;
    static {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("⊤", "λx.λy.x");
        map.put("⊥", "λx.λy.y");
        map.put("∧", "λp.λq.p q p");
        map.put("∨", "λp.λq.p p q");
        map.put("↓", "λn.λf.λx.n (λg.λh.h (g f)) (λu.x) (λu.u)");
        map.put("↑", "λn.λf.λx.f (n f x)");
        map.put("+", "λm.λn.m ↑ n");
        map.put("*", "λm.λn.m (+ n) 0");
        map.put("is0", "λn.n (λx.⊥) ⊤");
        map.put("-", "λm.λn.n ↓ m");
        map.put("≤", "λm.λn.is0 (- m n)");
        map.put("pair", "λx.λy.λf.f x y");
        BUILTIN_SOURCES = Collections.unmodifiableMap(map);
    }

    private static final class DefaultsHolder {
        static final Definitions DEFAULTS = buildDefaults();
    }

    private static final Definitions EMPTY = new Definitions(Collections.emptyMap(), Collections.emptyMap());

    private final Map<String, String> sources;
    private final Map<String, ExprInterface> terms;

    private Definitions(Map<String, String> sources, Map<String, ExprInterface> terms) {
        this.sources = Collections.unmodifiableMap(sources);
        this.terms = Collections.unmodifiableMap(terms);
    }

    /** The built-in table, parsed once per JVM. */
    public static Definitions defaults() {
        return DefaultsHolder.DEFAULTS;
    }

    public static Definitions empty() {
        return EMPTY;
    }

    /** Source text of the built-in definitions, in table order. */
    public static Map<String, String> builtinSources() {
        return BUILTIN_SOURCES;
    }

    private static Definitions buildDefaults() {
        Map<String, String> sources = new LinkedHashMap<>();
        Map<String, ExprInterface> terms = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : BUILTIN_SOURCES.entrySet()) {
            try {
                terms.put(e.getKey(), Parser.parse(e.getValue()));
            } catch (ParseError pe) {
                throw new IllegalStateException("Built-in definition '" + e.getKey() + "' is malformed: " + pe.getMessage(), pe);
            }
            sources.put(e.getKey(), e.getValue());
        }
        return new Definitions(sources, terms);
    }

    /**
     * A new table with {@code extra} layered over this one. An entry with an
     * existing name replaces it in place; new names go to the end.
     *
     * @throws ParseError if one of the extra sources is malformed; the reason names the definition
     */
    public Definitions extend(Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) return this;

        Map<String, String> sources = new LinkedHashMap<>(this.sources);
        Map<String, ExprInterface> terms = new LinkedHashMap<>(this.terms);
        for (Map.Entry<String, String> e : extra.entrySet()) {
            String name = e.getKey();
            if (name == null || name.isEmpty() || !isValidName(name)) {
                throw new IllegalArgumentException("Invalid definition name: '" + name + "'");
            }
            ExprInterface term;
            try {
                term = Parser.parse(e.getValue());
            } catch (ParseError pe) {
                throw new ParseError("Definition '" + name + "': " + pe.reason(), pe.offending(), pe.position());
            }
            sources.put(name, e.getValue());
            terms.put(name, term);
        }
        return new Definitions(sources, terms);
    }

    // digit-led names would lex as numerals and could never be referenced
    private static boolean isValidName(String name) {
        char first = name.charAt(0);
        if (first >= '0' && first <= '9') return false;
        for (int i = 0; i < name.length(); i++) {
            if (!Lexer.isNameChar(name.charAt(i))) return false;
        }
        return true;
    }

    /** The definition bound to {@code name}, or null if the name is not defined. */
    public ExprInterface lookup(String name) {
        return terms.get(name);
    }

    public boolean contains(String name) {
        return terms.containsKey(name);
    }

    public Set<String> names() {
        return terms.keySet();
    }

    public String source(String name) {
        return sources.get(name);
    }

    public Map<String, ExprInterface> asMap() {
        return terms;
    }

    public int size() {
        return terms.size();
    }
}

package com.lambdacalc.engine.format;

import java.util.Objects;

import com.lambdacalc.engine.parser.Expr.ExprInterface;
import com.lambdacalc.engine.reduce.StepKind;

/**
 * Turns terms into display strings: optional space stripping, parentheses
 * colored by nesting depth, and highlighting of what changed between two
 * consecutive steps. Purely cosmetic; the canonical form is {@code toString()}.
 */
public final class TermFormatter {

    private final PrintOptions options;

    public TermFormatter(PrintOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public PrintOptions options() { return options; }

    public String format(ExprInterface term) {
        String s = term.toString();
        if (options.compact()) s = s.replace(" ", "");
        return options.colorParens() ? colorParens(s) : s;
    }

    /** " (β)" or " (δ)", or nothing when step labels are off. */
    public String stepLabel(StepKind kind) {
        return options.showStepType() && kind != null ? " (" + kind.symbol() + ")" : "";
    }

    static String colorParens(String s) {
        int depth = 0;
        int maxDepth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') maxDepth = Math.max(maxDepth, ++depth);
            else if (c == ')') depth--;
        }

        StringBuilder out = new StringBuilder(s.length() * 4);
        depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') {
                depth++;
                out.append(depthColor(depth, maxDepth)).append(c).append(Ansi.RESET);
            } else if (c == ')') {
                out.append(depthColor(depth, maxDepth)).append(c).append(Ansi.RESET);
                depth--;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /** Teal at the outermost level fading to cyan at the deepest. */
    static String depthColor(int depth, int maxDepth) {
        double ratio = maxDepth > 1 ? (depth - 1) / (double) (maxDepth - 1) : 0;
        int g = (int) (128 * (1 - ratio) + 255 * ratio);
        int b = (int) (128 * (1 - ratio) + 255 * ratio);
        return Ansi.rgb(0, g, b);
    }

    /**
     * Wraps the part of {@code current} that differs from {@code previous}
     * (everything between the common prefix and the common suffix) in the
     * highlight color. Works on the visible text, so existing colors in
     * {@code current} are dropped when highlighting is on.
     */
    public String highlightDiff(String previous, String current) {
        if (!options.colorDiff()) return current;

        String o = Ansi.strip(previous);
        String n = Ansi.strip(current);
        int limit = Math.min(o.length(), n.length());

        int prefix = 0;
        while (prefix < limit && o.charAt(prefix) == n.charAt(prefix)) prefix++;

        int suffix = 0;
        while (suffix < limit - prefix
                && o.charAt(o.length() - 1 - suffix) == n.charAt(n.length() - 1 - suffix)) {
            suffix++;
        }

        return n.substring(0, prefix)
                + Ansi.HIGHLIGHT + n.substring(prefix, n.length() - suffix) + Ansi.RESET
                + n.substring(n.length() - suffix);
    }
}

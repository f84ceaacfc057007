package com.lambdacalc.engine.format;

/** Presentation switches, passed explicitly to the formatter. */
public final class PrintOptions {

    /** Compact, no color, no labels: what goes over the wire and into tests. */
    public static final PrintOptions PLAIN = new PrintOptions(true, false, false, false);

    private final boolean compact;
    private final boolean colorParens;
    private final boolean colorDiff;
    private final boolean showStepType;

    public PrintOptions(boolean compact, boolean colorParens, boolean colorDiff, boolean showStepType) {
        this.compact = compact;
        this.colorParens = colorParens;
        this.colorDiff = colorDiff;
        this.showStepType = showStepType;
    }

    public boolean compact() { return compact; }
    public boolean colorParens() { return colorParens; }
    public boolean colorDiff() { return colorDiff; }
    public boolean showStepType() { return showStepType; }
}

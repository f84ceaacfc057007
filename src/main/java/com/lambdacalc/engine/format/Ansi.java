package com.lambdacalc.engine.format;

import java.util.regex.Pattern;

/** 24-bit ANSI SGR helpers. */
public final class Ansi {

    public static final String ESC = "\u001b[";
    public static final String RESET = ESC + "0m";
    public static final String HIGHLIGHT = ESC + "38;2;255;255;0m";

    private static final Pattern SGR = Pattern.compile("\u001b\\[[0-9;]*m");

    private Ansi() {}

    public static String rgb(int r, int g, int b) {
        return ESC + "38;2;" + r + ";" + g + ";" + b + "m";
    }

    /** Removes every SGR sequence, leaving the visible text. */
    public static String strip(String s) {
        return s == null ? null : SGR.matcher(s).replaceAll("");
    }
}

package com.specbridge.report;

import java.util.regex.Pattern;

/**
 * ANSI colour helpers for rendered log lines.
 */
public final class Ansi {

    public static final String RED   = "\u001b[31m";
    public static final String GREEN = "\u001b[32m";
    public static final String BLUE  = "\u001b[34m";
    public static final String CYAN  = "\u001b[36m";
    public static final String RESET = "\u001b[0m";

    private static final Pattern ESCAPES = Pattern.compile("\u001b\\[[0-9;]*m");

    private Ansi() {}

    public static String red(String s)   { return colored(RED, s); }
    public static String green(String s) { return colored(GREEN, s); }
    public static String blue(String s)  { return colored(BLUE, s); }
    public static String cyan(String s)  { return colored(CYAN, s); }

    public static String colored(String code, String s) {
        return code + s + RESET;
    }

    /** Removes every colour escape from {@code s}. */
    public static String strip(String s) {
        return ESCAPES.matcher(s).replaceAll("");
    }
}

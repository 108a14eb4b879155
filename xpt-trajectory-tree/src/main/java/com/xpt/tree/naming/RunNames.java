package com.xpt.tree.naming;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formatting and parsing of run names ({@code run_00000003}).
 */
public final class RunNames {

    public static final String FORMAT = "run_%08d";

    private static final Pattern RUN_NAME = Pattern.compile("run_(\\d{8})");

    private RunNames() {
    }

    /** Formatted name of the run with the given index. */
    public static String name(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Run index must be non-negative, got: " + index);
        }
        return String.format(FORMAT, index);
    }

    public static boolean isRunName(String name) {
        return name != null && RUN_NAME.matcher(name).matches();
    }

    /** Index encoded in a run name, or -1 if the name is not a run name. */
    public static int indexOf(String name) {
        if (name == null) return -1;
        Matcher m = RUN_NAME.matcher(name);
        return m.matches() ? Integer.parseInt(m.group(1)) : -1;
    }
}

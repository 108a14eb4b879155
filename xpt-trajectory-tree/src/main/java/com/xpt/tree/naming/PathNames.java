package com.xpt.tree.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Path splitting, name validation and alias translation.
 * <p>
 * Aliases: {@code par → parameters}, {@code dpar → derived_parameters}, {@code res → results},
 * {@code conf → config}. Run tokens: {@code $} and {@code crun} stand for the currently bound run,
 * {@code r_<n>} for run n. Alias words are reserved and cannot be used as node names.
 */
public final class PathNames {

    public static final String SEPARATOR = ".";
    public static final String WILDCARD = "$";
    public static final String CURRENT_RUN = "crun";

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern RUN_SHORTCUT = Pattern.compile("r_(\\d{1,9})");
    private static final Map<String, String> ALIASES = Map.of(
            "par", "parameters",
            "dpar", "derived_parameters",
            "res", "results",
            "conf", "config");
    private static final Set<String> RESERVED = Set.of("par", "dpar", "res", "conf", CURRENT_RUN, WILDCARD);

    private PathNames() {
    }

    /** Splits a dot path into its segments. Empty segments are dropped. */
    public static List<String> split(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null || path.isEmpty()) return segments;
        for (String s : path.split("\\.", -1)) {
            String trimmed = s.trim();
            if (!trimmed.isEmpty()) segments.add(trimmed);
        }
        return segments;
    }

    public static boolean isWildcard(String segment) {
        return WILDCARD.equals(segment) || CURRENT_RUN.equals(segment);
    }

    /**
     * Translates one segment: aliases to branch names, run tokens to run names.
     * Returns null for a wildcard when no run is bound.
     *
     * @param currentRun index of the bound run, or null when no run is bound
     */
    public static String translate(String segment, Integer currentRun) {
        String alias = ALIASES.get(segment);
        if (alias != null) return alias;
        if (isWildcard(segment)) {
            return currentRun != null ? RunNames.name(currentRun) : null;
        }
        Matcher m = RUN_SHORTCUT.matcher(segment);
        if (m.matches()) {
            return RunNames.name(Integer.parseInt(m.group(1)));
        }
        return segment;
    }

    /**
     * Splits and translates a path for node creation. A wildcard without a bound run is rejected.
     *
     * @throws IllegalStateException if the path uses a wildcard and no run is bound
     */
    public static List<String> translateForCreation(String path, Integer currentRun) {
        List<String> out = new ArrayList<>();
        for (String segment : split(path)) {
            String translated = translate(segment, currentRun);
            if (translated == null) {
                throw new IllegalStateException("Path `" + path + "` uses the run wildcard `" + segment
                        + "` but no run is bound");
            }
            validateName(translated);
            out.add(translated);
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("Path must not be empty");
        }
        return out;
    }

    /**
     * Validates a single node name.
     *
     * @throws IllegalArgumentException if the name is blank, contains characters other than
     *                                  letters, digits and underscore, or is reserved
     */
    public static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Node name must not be empty");
        }
        if (RESERVED.contains(name)) {
            throw new IllegalArgumentException("`" + name + "` is a reserved name");
        }
        if (!VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid node name `" + name + "`; use letters, digits and underscore only");
        }
    }

    /** Joins a parent full name and a child name; the root's full name is empty. */
    public static String join(String parentFullName, String name) {
        if (parentFullName == null || parentFullName.isEmpty()) return name;
        return parentFullName + SEPARATOR + name;
    }
}

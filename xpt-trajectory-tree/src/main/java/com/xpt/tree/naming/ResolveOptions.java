package com.xpt.tree.naming;

/**
 * Options for a single lookup.
 *
 * @param shortcuts  search the subtree when a segment is not a direct child
 * @param withLinks  treat links like children; false makes links invisible
 * @param currentRun index of the bound run substituted for wildcards, or null
 */
public record ResolveOptions(boolean shortcuts, boolean withLinks, Integer currentRun) {

    private static final ResolveOptions DEFAULTS = new ResolveOptions(true, true, null);

    /** Shortcuts and links on, no run bound. */
    public static ResolveOptions defaults() {
        return DEFAULTS;
    }

    public ResolveOptions withShortcuts(boolean value) {
        return new ResolveOptions(value, withLinks, currentRun);
    }

    public ResolveOptions withLinks(boolean value) {
        return new ResolveOptions(shortcuts, value, currentRun);
    }

    public ResolveOptions withRun(Integer runIndex) {
        return new ResolveOptions(shortcuts, withLinks, runIndex);
    }
}

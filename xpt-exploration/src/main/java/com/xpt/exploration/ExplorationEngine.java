package com.xpt.exploration;

import com.xpt.tree.Branch;
import com.xpt.tree.LeafNode;
import com.xpt.tree.Node;
import com.xpt.tree.NodeTree;
import com.xpt.tree.NodeTypeMismatchException;
import com.xpt.tree.item.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Turns explored parameter sequences into ordered runs.
 * <p>
 * All sequences of one call have the same length L; once runs exist, further explorations must
 * match their count. Every binding is validated before any parameter changes.
 */
public final class ExplorationEngine {

    private static final Logger log = LoggerFactory.getLogger(ExplorationEngine.class);

    private final NodeTree tree;
    private final List<RunInfo> runs = new ArrayList<>();
    private final Set<String> explored = new LinkedHashSet<>();
    private boolean placeholderRun;

    public ExplorationEngine(NodeTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    /**
     * Explores the given parameters (path → values). Creates the runs on the first exploration, replacing
     * the placeholder run left by {@link #ensureRuns}.
     *
     * @throws ExplorationLengthMismatchException if lengths differ or do not match existing runs
     * @throws IllegalArgumentException           if a path is not a parameter below {@code parameters}
     *                                            or values have the wrong type
     */
    public void explore(Map<String, ? extends List<?>> bindings) {
        requireBindings(bindings);
        Map<LeafNode, List<?>> resolved = resolveAll(bindings);
        int length = commonLength(resolved);
        if (placeholderRun) {
            runs.clear();
            placeholderRun = false;
        }
        if (!runs.isEmpty() && length != runs.size()) {
            throw new ExplorationLengthMismatchException(firstName(resolved), runs.size(), length);
        }
        for (Map.Entry<LeafNode, List<?>> e : resolved.entrySet()) {
            parameterOf(e.getKey()).copy().explore(e.getValue());
        }
        for (Map.Entry<LeafNode, List<?>> e : resolved.entrySet()) {
            parameterOf(e.getKey()).explore(e.getValue());
            explored.add(e.getKey().getFullName());
        }
        if (runs.isEmpty()) {
            for (int i = 0; i < length; i++) runs.add(new RunInfo(i, null));
        }
        refreshSummaries(0);
        log.info("Explore | parameters={} | runs={}", bindingNames(resolved), runs.size());
    }

    /**
     * Appends runs. Every explored parameter must be bound; parameters explored for the first time are
     * padded with their default value for the existing runs. Without runs this is {@link #explore}.
     */
    public void expand(Map<String, ? extends List<?>> bindings) {
        if (runs.isEmpty() || placeholderRun) {
            explore(bindings);
            return;
        }
        requireBindings(bindings);
        Map<LeafNode, List<?>> resolved = resolveAll(bindings);
        int added = commonLength(resolved);
        Set<String> bound = new LinkedHashSet<>();
        resolved.keySet().forEach(l -> bound.add(l.getFullName()));
        for (String name : explored) {
            if (!bound.contains(name)) {
                throw new IllegalArgumentException("Explored parameter `" + name + "` must be bound when expanding");
            }
        }
        int existing = runs.size();
        Map<Parameter, List<Object>> plan = new LinkedHashMap<>();
        for (Map.Entry<LeafNode, List<?>> e : resolved.entrySet()) {
            Parameter p = parameterOf(e.getKey());
            Parameter check = p.copy();
            if (p.isArray()) {
                check.addItems(e.getValue());
                plan.put(p, new ArrayList<>(e.getValue()));
            } else {
                List<Object> full = new ArrayList<>(Collections.nCopies(existing, p.get()));
                full.addAll(e.getValue());
                check.explore(full);
                plan.put(p, full);
            }
        }
        for (Map.Entry<Parameter, List<Object>> e : plan.entrySet()) {
            if (e.getKey().isArray()) e.getKey().addItems(e.getValue());
            else e.getKey().explore(e.getValue());
        }
        explored.addAll(bound);
        for (int i = 0; i < added; i++) runs.add(new RunInfo(existing + i, null));
        refreshSummaries(existing);
        log.info("Expand | parameters={} | added={} | runs={}", bound, added, runs.size());
    }

    /**
     * Locked single-value view of {@code leaf} for run {@code n}; unexplored parameters return themselves.
     *
     * @throws IndexOutOfBoundsException if {@code n} is not a run index
     */
    public Parameter access(LeafNode leaf, int n) {
        Parameter p = leaf.getItem(Parameter.class);
        if (n < 0 || n >= length()) {
            throw new IndexOutOfBoundsException("Run index " + n + " out of range, length " + length());
        }
        return p.access(n);
    }

    /** Number of runs; 1 for an unexplored trajectory. */
    public int length() {
        return Math.max(1, runs.size());
    }

    public List<RunInfo> runs() {
        return Collections.unmodifiableList(runs);
    }

    public RunInfo run(int index) {
        return runs.get(index);
    }

    /** Full names of explored parameters in exploration order. */
    public List<String> exploredParameters() {
        return List.copyOf(explored);
    }

    public boolean isExplored() {
        return !explored.isEmpty();
    }

    /**
     * Creates the single run of an unexplored trajectory so it can be executed like an explored one.
     * No-op when runs exist. The first later exploration replaces this run with its own runs.
     */
    public void ensureRuns() {
        if (runs.isEmpty()) {
            runs.add(new RunInfo(0, ""));
            placeholderRun = true;
            log.info("Runs | unexplored trajectory, single run created");
        }
    }

    /** Replaces run bookkeeping, e.g. after loading a stored trajectory. */
    public void restore(List<RunInfo> storedRuns, Collection<String> exploredNames) {
        runs.clear();
        runs.addAll(storedRuns);
        placeholderRun = false;
        explored.clear();
        explored.addAll(exploredNames);
    }

    /** Drops all runs and explored ranges, keeping default values. */
    public void shrink() {
        for (String name : explored) {
            Node node = tree.find(tree.getRoot(), name, tree.defaultOptions().withShortcuts(false)).orElse(null);
            if (node instanceof LeafNode leaf && leaf.getItem() instanceof Parameter p) {
                boolean locked = p.isLocked();
                p.unlock();
                p.shrink();
                if (locked) p.lock();
            }
        }
        log.info("Shrink | parameters={} | droppedRuns={}", explored.size(), runs.size());
        explored.clear();
        runs.clear();
        placeholderRun = false;
    }

    private Map<LeafNode, List<?>> resolveAll(Map<String, ? extends List<?>> bindings) {
        Map<LeafNode, List<?>> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends List<?>> e : bindings.entrySet()) {
            Node node = tree.get(e.getKey());
            if (!(node instanceof LeafNode leaf) || !(leaf.getItem() instanceof Parameter)) {
                throw new NodeTypeMismatchException(node.getFullName(), "parameter", node.getKind().name());
            }
            if (leaf.getBranch() != Branch.PARAMETERS) {
                throw new IllegalArgumentException("Only parameters below `parameters` can be explored, got `"
                        + leaf.getFullName() + "`");
            }
            if (e.getValue() == null || e.getValue().isEmpty()) {
                throw new IllegalArgumentException("No values given for `" + leaf.getFullName() + "`");
            }
            resolved.put(leaf, e.getValue());
        }
        return resolved;
    }

    private static int commonLength(Map<LeafNode, List<?>> resolved) {
        int length = -1;
        for (Map.Entry<LeafNode, List<?>> e : resolved.entrySet()) {
            int size = e.getValue().size();
            if (length < 0) length = size;
            else if (size != length) {
                throw new ExplorationLengthMismatchException(e.getKey().getFullName(), length, size);
            }
        }
        return length;
    }

    private static void requireBindings(Map<String, ? extends List<?>> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            throw new IllegalArgumentException("Nothing to explore");
        }
    }

    private static Parameter parameterOf(LeafNode leaf) {
        return leaf.getItem(Parameter.class);
    }

    private static String firstName(Map<LeafNode, List<?>> resolved) {
        return resolved.keySet().iterator().next().getFullName();
    }

    private static List<String> bindingNames(Map<LeafNode, List<?>> resolved) {
        List<String> names = new ArrayList<>();
        resolved.keySet().forEach(l -> names.add(l.getFullName()));
        return names;
    }

    private void refreshSummaries(int from) {
        List<LeafNode> leaves = new ArrayList<>();
        for (String name : explored) {
            tree.find(tree.getRoot(), name, tree.defaultOptions().withShortcuts(false))
                    .filter(LeafNode.class::isInstance)
                    .map(LeafNode.class::cast)
                    .ifPresent(leaves::add);
        }
        for (int i = from; i < runs.size(); i++) {
            StringJoiner joiner = new StringJoiner(", ");
            for (LeafNode leaf : leaves) {
                joiner.add(leaf.getName() + ": " + parameterOf(leaf).valueAt(i));
            }
            runs.get(i).setSummary(joiner.toString());
        }
    }
}

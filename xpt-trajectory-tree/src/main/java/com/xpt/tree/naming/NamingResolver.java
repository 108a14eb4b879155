package com.xpt.tree.naming;

import com.xpt.tree.GroupNode;
import com.xpt.tree.Node;
import com.xpt.tree.link.LinkIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves dot paths against a tree.
 * <p>
 * Each segment is translated (aliases, run tokens) and followed as a direct child, or as a link when
 * links are enabled. When it is neither and shortcuts are enabled, the subtree below the current group
 * is searched breadth-first; every edge (child or link) with a matching name is a candidate, keyed by
 * the path through which the search reached it. Exactly one candidate resolves the segment. Expanded
 * groups are tracked by identity so link cycles terminate. While a run is bound, groups named after
 * other runs are not searched.
 */
public final class NamingResolver {

    private static final Logger log = LoggerFactory.getLogger(NamingResolver.class);

    private final LinkIndex links;

    public NamingResolver(LinkIndex links) {
        this.links = links;
    }

    /**
     * Resolves {@code path} starting at {@code start}. An empty path resolves to {@code start}.
     *
     * @throws NoSuchNodeException    if a segment matches nothing
     * @throws NotUniqueNodeException if a shortcut segment matches more than one node
     */
    public Node resolve(GroupNode start, String path, ResolveOptions options) {
        Node current = start;
        for (String segment : PathNames.split(path)) {
            String name = translate(segment, path, options);
            if (!(current instanceof GroupNode group)) {
                throw new NoSuchNodeException(path, "`" + current.getFullName() + "` is a leaf");
            }
            Node next = direct(group, name, options.withLinks());
            if (next == null) {
                if (!options.shortcuts()) {
                    throw new NoSuchNodeException(path, "`" + name + "` is not a child of `" + group.getFullName() + "`");
                }
                Map<String, Node> candidates = search(group, name, options);
                if (candidates.isEmpty()) {
                    throw new NoSuchNodeException(path, "`" + name + "` not found below `" + group.getFullName() + "`");
                }
                if (candidates.size() > 1) {
                    throw new NotUniqueNodeException(path, new ArrayList<>(candidates.keySet()));
                }
                next = candidates.values().iterator().next();
            }
            current = next;
        }
        if (log.isDebugEnabled()) log.debug("Resolve | path={} | node={}", path, current.getFullName());
        return current;
    }

    /**
     * Every node matching {@code path}, keyed by full name. Each segment may match any number of
     * nodes; nothing is thrown for ambiguity. An empty map means no match.
     */
    public Map<String, Node> resolveAll(GroupNode start, String path, ResolveOptions options) {
        Map<String, Node> current = new LinkedHashMap<>();
        current.put(start.getFullName(), start);
        for (String segment : PathNames.split(path)) {
            String name = PathNames.translate(segment, options.currentRun());
            if (name == null) return Collections.emptyMap();
            Map<String, Node> next = new LinkedHashMap<>();
            for (Node node : current.values()) {
                if (!(node instanceof GroupNode group)) continue;
                Node hit = direct(group, name, options.withLinks());
                if (hit != null) next.putIfAbsent(hit.getFullName(), hit);
                if (options.shortcuts()) {
                    for (Node candidate : search(group, name, options).values()) {
                        next.putIfAbsent(candidate.getFullName(), candidate);
                    }
                }
            }
            current = next;
            if (current.isEmpty()) break;
        }
        return current;
    }

    private static String translate(String segment, String path, ResolveOptions options) {
        String name = PathNames.translate(segment, options.currentRun());
        if (name == null) {
            throw new NoSuchNodeException(path, "run wildcard `" + segment + "` used but no run is bound");
        }
        return name;
    }

    private Node direct(GroupNode group, String name, boolean withLinks) {
        Node child = group.getChild(name);
        if (child != null) return child;
        return withLinks ? links.target(group, name) : null;
    }

    /** Breadth-first search below {@code start}; candidate reach path → node. */
    private Map<String, Node> search(GroupNode start, String name, ResolveOptions options) {
        Map<String, Node> candidates = new LinkedHashMap<>();
        Set<Node> expanded = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Reach> queue = new ArrayDeque<>();
        queue.add(new Reach(start, start.getFullName()));
        expanded.add(start);
        String boundRun = options.currentRun() == null ? null : RunNames.name(options.currentRun());
        while (!queue.isEmpty()) {
            Reach reach = queue.poll();
            for (Node child : reach.group().getChildren()) {
                visit(child.getName(), child, reach, name, boundRun, candidates, expanded, queue);
            }
            if (options.withLinks()) {
                for (Map.Entry<String, Node> link : links.targetsOf(reach.group()).entrySet()) {
                    visit(link.getKey(), link.getValue(), reach, name, boundRun, candidates, expanded, queue);
                }
            }
        }
        return candidates;
    }

    private static void visit(String edgeName, Node node, Reach from, String wanted, String boundRun,
                              Map<String, Node> candidates, Set<Node> expanded, Deque<Reach> queue) {
        String reachPath = PathNames.join(from.path(), edgeName);
        if (edgeName.equals(wanted)) {
            candidates.put(reachPath, node);
        }
        if (node instanceof GroupNode group && !isOtherRun(edgeName, boundRun) && expanded.add(group)) {
            queue.add(new Reach(group, reachPath));
        }
    }

    private static boolean isOtherRun(String name, String boundRun) {
        return boundRun != null && RunNames.isRunName(name) && !name.equals(boundRun);
    }

    private record Reach(GroupNode group, String path) {
    }
}

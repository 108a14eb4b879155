package com.xpt.tree.link;

import com.xpt.tree.GroupNode;
import com.xpt.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Non-owning named edges between nodes of one tree. Forward map: owner → (name → target);
 * reverse map: target → link refs, used to drop or refuse links when a subtree is removed.
 * Links may form cycles.
 */
public final class LinkIndex {

    private static final Logger log = LoggerFactory.getLogger(LinkIndex.class);

    private final Map<GroupNode, Map<String, Node>> byOwner = new IdentityHashMap<>();
    private final Map<Node, Set<LinkRef>> byTarget = new IdentityHashMap<>();

    /**
     * Adds link {@code owner.name → target}.
     *
     * @throws IllegalArgumentException if {@code name} is a child of {@code owner} or already one of
     *                                  its links, the target is the root, or the target is not attached
     *                                  to the owner's tree
     */
    public void addLink(GroupNode owner, String name, Node target) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        if (owner.hasChild(name)) {
            throw new IllegalArgumentException("`" + name + "` is already a child of `" + owner.getFullName() + "`");
        }
        if (hasLink(owner, name)) {
            throw new IllegalArgumentException("`" + owner.getFullName() + "` already has a link named `" + name + "`");
        }
        if (target.isRoot()) {
            throw new IllegalArgumentException("Cannot link to the root");
        }
        if (!target.isAttached() || target.getTree() != owner.getTree()) {
            throw new IllegalArgumentException("Link target `" + target.getName() + "` is not part of the owner's tree");
        }
        byOwner.computeIfAbsent(owner, k -> new LinkedHashMap<>()).put(name, target);
        byTarget.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(new LinkRef(owner, name));
        if (log.isDebugEnabled()) {
            log.debug("Link added | owner={} | name={} | target={}", owner.getFullName(), name, target.getFullName());
        }
    }

    /** Adds a link named after the target. */
    public void addLink(GroupNode owner, Node target) {
        addLink(owner, target.getName(), target);
    }

    /**
     * @throws IllegalArgumentException if the owner has no such link
     */
    public void removeLink(GroupNode owner, String name) {
        Map<String, Node> links = byOwner.get(owner);
        Node target = links == null ? null : links.remove(name);
        if (target == null) {
            throw new IllegalArgumentException("`" + owner.getFullName() + "` has no link named `" + name + "`");
        }
        if (links.isEmpty()) byOwner.remove(owner);
        dropReverse(target, new LinkRef(owner, name));
    }

    public boolean hasLink(GroupNode owner, String name) {
        Map<String, Node> links = byOwner.get(owner);
        return links != null && links.containsKey(name);
    }

    /** Target of {@code owner.name}, or null. */
    public Node target(GroupNode owner, String name) {
        Map<String, Node> links = byOwner.get(owner);
        return links == null ? null : links.get(name);
    }

    public Map<String, Node> targetsOf(GroupNode owner) {
        Map<String, Node> links = byOwner.get(owner);
        return links == null ? Map.of() : Collections.unmodifiableMap(links);
    }

    public Set<LinkRef> ownersOf(Node target) {
        Set<LinkRef> refs = byTarget.get(target);
        return refs == null ? Set.of() : Collections.unmodifiableSet(refs);
    }

    /** Number of links pointing at {@code target}. */
    public int linkCount(Node target) {
        Set<LinkRef> refs = byTarget.get(target);
        return refs == null ? 0 : refs.size();
    }

    /** Total number of links. */
    public int size() {
        int n = 0;
        for (Map<String, Node> links : byOwner.values()) n += links.size();
        return n;
    }

    /** Drops every link owned by {@code owner}. Called by the tree when the owner is removed. */
    public void removeOwnedBy(GroupNode owner) {
        Map<String, Node> links = byOwner.remove(owner);
        if (links == null) return;
        links.forEach((name, target) -> dropReverse(target, new LinkRef(owner, name)));
    }

    /** Drops every link pointing at {@code target}. Called by the tree when the target is removed. */
    public void removeTargeting(Node target) {
        Set<LinkRef> refs = byTarget.remove(target);
        if (refs == null) return;
        List<LinkRef> copy = new ArrayList<>(refs);
        for (LinkRef ref : copy) {
            Map<String, Node> links = byOwner.get(ref.owner());
            if (links != null) {
                links.remove(ref.name());
                if (links.isEmpty()) byOwner.remove(ref.owner());
            }
        }
    }

    private void dropReverse(Node target, LinkRef ref) {
        Set<LinkRef> refs = byTarget.get(target);
        if (refs == null) return;
        refs.remove(ref);
        if (refs.isEmpty()) byTarget.remove(target);
    }
}

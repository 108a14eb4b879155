package com.xpt.tree;

import com.xpt.tree.item.ItemContract;
import com.xpt.tree.link.LinkIndex;
import com.xpt.tree.link.LinkRef;
import com.xpt.tree.naming.NamingResolver;
import com.xpt.tree.naming.NoSuchNodeException;
import com.xpt.tree.naming.NotUniqueNodeException;
import com.xpt.tree.naming.PathNames;
import com.xpt.tree.naming.ResolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Owning hierarchy of group and leaf nodes plus the link index.
 * <p>
 * Adding plans the whole path first and only then mutates, so a failing add leaves the tree as it was.
 * Missing intermediate groups are created and inherit their parent's branch. Not thread-safe; workers
 * operate on their own copy.
 */
public final class NodeTree {

    private static final Logger log = LoggerFactory.getLogger(NodeTree.class);

    private final GroupNode root = new GroupNode("", Branch.GENERIC);
    private final LinkIndex linkIndex = new LinkIndex();
    private final NamingResolver resolver = new NamingResolver(linkIndex);
    private Integer currentRun;
    private boolean withLinks = true;

    public NodeTree() {
        root.attach(this, null);
    }

    public GroupNode getRoot() {
        return root;
    }

    public LinkIndex getLinkIndex() {
        return linkIndex;
    }

    public NamingResolver getResolver() {
        return resolver;
    }

    /** Index of the bound run, substituted for {@code $} and {@code crun}; null when none. */
    public Integer getCurrentRun() {
        return currentRun;
    }

    public void setCurrentRun(Integer currentRun) {
        if (currentRun != null && currentRun < 0) {
            throw new IllegalArgumentException("Run index must be non-negative, got: " + currentRun);
        }
        this.currentRun = currentRun;
    }

    /** Default for whether lookups and iteration follow links. */
    public boolean isWithLinks() {
        return withLinks;
    }

    public void setWithLinks(boolean withLinks) {
        this.withLinks = withLinks;
    }

    /** Shortcuts on; links and run as configured on this tree. */
    public ResolveOptions defaultOptions() {
        return new ResolveOptions(true, withLinks, currentRun);
    }

    // ---- lookup ----

    public Node get(String path) {
        return get(root, path, defaultOptions());
    }

    public Node get(String path, ResolveOptions options) {
        return get(root, path, options);
    }

    public Node get(GroupNode start, String path, ResolveOptions options) {
        requireOwned(start);
        return resolver.resolve(start, path, options);
    }

    /** Like {@link #get(String)} but empty when nothing matches. Ambiguity still throws. */
    public Optional<Node> find(String path) {
        return find(root, path, defaultOptions());
    }

    public Optional<Node> find(GroupNode start, String path, ResolveOptions options) {
        try {
            return Optional.of(get(start, path, options));
        } catch (NoSuchNodeException e) {
            return Optional.empty();
        }
    }

    public boolean contains(String path) {
        return contains(root, path, withLinks);
    }

    public boolean contains(String path, boolean followLinks) {
        return contains(root, path, followLinks);
    }

    /** Whether {@code path} resolves; an ambiguous shortcut counts as present. */
    public boolean contains(GroupNode start, String path, boolean followLinks) {
        try {
            get(start, path, defaultOptions().withLinks(followLinks));
            return true;
        } catch (NoSuchNodeException e) {
            return false;
        } catch (NotUniqueNodeException e) {
            return true;
        }
    }

    /** Whether {@code node} is attached to this tree. */
    public boolean contains(Node node) {
        return node != null && node.getTree() == this && node.isAttached();
    }

    /** Every node matching {@code path}, keyed by full name. */
    public Map<String, Node> getAll(String path) {
        return resolver.resolveAll(root, path, defaultOptions());
    }

    // ---- adding ----

    public GroupNode addGroup(String path) {
        return addGroup(root, path, null);
    }

    public GroupNode addGroup(String path, String comment) {
        return addGroup(root, path, comment);
    }

    /**
     * Adds the group at {@code path} below {@code start}, creating missing intermediate groups.
     * An existing group is returned unchanged apart from a non-null comment.
     *
     * @throws NodeTypeMismatchException if a leaf sits on the path
     * @throws IllegalArgumentException  if the path runs through or ends on a link
     */
    public GroupNode addGroup(GroupNode start, String path, String comment) {
        requireOwned(start);
        List<String> names = PathNames.translateForCreation(path, currentRun);
        GroupNode parent = walkExisting(start, names.subList(0, names.size() - 1), path);
        String last = names.get(names.size() - 1);
        if (parent != null) {
            Node existing = parent.getChild(last);
            if (existing instanceof GroupNode g) {
                if (comment != null) g.setComment(comment);
                return g;
            }
            if (existing != null) {
                throw new NodeTypeMismatchException(existing.getFullName(), "group", "leaf");
            }
            rejectLinkName(parent, last, path);
        }
        GroupNode group = (GroupNode) createPath(start, names, null);
        if (comment != null) group.setComment(comment);
        return group;
    }

    public LeafNode addLeaf(String path, ItemContract item) {
        return addLeaf(root, path, item, false);
    }

    public LeafNode addLeaf(String path, ItemContract item, boolean replace) {
        return addLeaf(root, path, item, replace);
    }

    /**
     * Adds a leaf holding {@code item}. With {@code replace} an existing leaf keeps its identity and
     * receives the new item.
     *
     * @throws NodeTypeMismatchException if a leaf sits on the path, a group occupies the name, or the
     *                                   item kind is not accepted by the target branch
     * @throws IllegalArgumentException  if the leaf exists and {@code replace} is false, or the path
     *                                   runs through or ends on a link
     */
    public LeafNode addLeaf(GroupNode start, String path, ItemContract item, boolean replace) {
        requireOwned(start);
        Objects.requireNonNull(item, "item");
        List<String> names = PathNames.translateForCreation(path, currentRun);
        List<String> parents = names.subList(0, names.size() - 1);
        GroupNode parent = walkExisting(start, parents, path);
        String last = names.get(names.size() - 1);
        Branch branch = parent != null ? parent.getBranch() : plannedBranch(start, parents);
        if (!branch.accepts(item)) {
            throw new NodeTypeMismatchException(PathNames.join(start.getFullName(), String.join(".", names)),
                    "item accepted by " + branch, item.typeName());
        }
        if (parent != null) {
            Node existing = parent.getChild(last);
            if (existing instanceof GroupNode) {
                throw new NodeTypeMismatchException(existing.getFullName(), "leaf", "group");
            }
            if (existing instanceof LeafNode leaf) {
                if (!replace) {
                    throw new IllegalArgumentException("Leaf `" + leaf.getFullName() + "` already exists");
                }
                leaf.setItem(item);
                leaf.setStored(false);
                return leaf;
            }
            rejectLinkName(parent, last, path);
        }
        return (LeafNode) createPath(start, names, item);
    }

    /**
     * Adds link {@code path → target}; the last segment is the link name, the rest is a group path
     * created as needed.
     */
    public void addLink(String path, Node target) {
        List<String> names = PathNames.translateForCreation(path, currentRun);
        GroupNode owner = names.size() == 1
                ? root
                : addGroup(root, String.join(".", names.subList(0, names.size() - 1)), null);
        addLink(owner, names.get(names.size() - 1), target);
    }

    public void addLink(GroupNode owner, String name, Node target) {
        requireOwned(owner);
        PathNames.validateName(name);
        linkIndex.addLink(owner, name, target);
    }

    public void removeLink(GroupNode owner, String name) {
        requireOwned(owner);
        linkIndex.removeLink(owner, name);
    }

    // ---- removal ----

    public void removeChild(GroupNode parent, String name, boolean recursive) {
        removeChild(parent, name, recursive, LinkPolicy.CASCADE);
    }

    /**
     * Removes child {@code name} of {@code parent}, or the link of that name. Links owned by removed
     * nodes are dropped; links from outside into the removed subtree are dropped or, with
     * {@link LinkPolicy#FAIL}, make the removal fail before anything changes.
     *
     * @throws NoSuchNodeException   if there is no such child or link
     * @throws IllegalStateException if the child is a non-empty group and {@code recursive} is false,
     *                               or the policy is FAIL and external links point into the subtree
     */
    public void removeChild(GroupNode parent, String name, boolean recursive, LinkPolicy policy) {
        requireOwned(parent);
        Node child = parent.getChild(name);
        if (child == null) {
            if (linkIndex.hasLink(parent, name)) {
                linkIndex.removeLink(parent, name);
                return;
            }
            throw new NoSuchNodeException(PathNames.join(parent.getFullName(), name), "no such child or link");
        }
        if (child instanceof GroupNode g && g.hasChildren() && !recursive) {
            throw new IllegalStateException("Group `" + g.getFullName() + "` is not empty; remove recursively");
        }
        List<Node> subtree = collectSubtree(child);
        Set<Node> inSubtree = Collections.newSetFromMap(new IdentityHashMap<>());
        inSubtree.addAll(subtree);
        if (policy == LinkPolicy.FAIL) {
            for (Node n : subtree) {
                for (LinkRef ref : linkIndex.ownersOf(n)) {
                    if (!inSubtree.contains(ref.owner())) {
                        throw new IllegalStateException(String.format(
                                "`%s` is linked from `%s` as `%s`", n.getFullName(), ref.owner().getFullName(), ref.name()));
                    }
                }
            }
        }
        String fullName = child.getFullName();
        for (Node n : subtree) {
            if (n instanceof GroupNode g) linkIndex.removeOwnedBy(g);
            linkIndex.removeTargeting(n);
        }
        parent.removeChildEntry(name);
        for (Node n : subtree) n.detach();
        if (log.isInfoEnabled()) log.info("Tree removeChild | node={} | removedNodes={}", fullName, subtree.size());
    }

    // ---- iteration ----

    /**
     * Lazy breadth-first iteration below {@code start} (not including it). Each node is yielded once
     * even when reachable through several links; each call to {@code iterator()} starts over.
     */
    public Iterable<Node> iterNodes(GroupNode start, boolean recursive, boolean followLinks) {
        requireOwned(start);
        return () -> new BreadthFirstIterator(start, recursive, followLinks);
    }

    private final class BreadthFirstIterator implements Iterator<Node> {
        private final boolean recursive;
        private final boolean followLinks;
        private final Deque<Node> queue = new ArrayDeque<>();
        private final Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        BreadthFirstIterator(GroupNode start, boolean recursive, boolean followLinks) {
            this.recursive = recursive;
            this.followLinks = followLinks;
            seen.add(start);
            enqueueEdges(start);
        }

        @Override
        public boolean hasNext() {
            return !queue.isEmpty();
        }

        @Override
        public Node next() {
            Node n = queue.poll();
            if (n == null) throw new NoSuchElementException();
            if (recursive && n instanceof GroupNode g) enqueueEdges(g);
            return n;
        }

        private void enqueueEdges(GroupNode group) {
            for (Node child : group.getChildren()) {
                if (seen.add(child)) queue.add(child);
            }
            if (followLinks) {
                for (Node target : linkIndex.targetsOf(group).values()) {
                    if (seen.add(target)) queue.add(target);
                }
            }
        }
    }

    // ---- internals ----

    private void requireOwned(GroupNode group) {
        if (group == null || group.getTree() != this) {
            throw new IllegalArgumentException("Group is not part of this tree");
        }
    }

    /**
     * Follows existing groups along {@code names}; returns the last group, or null when a name is
     * missing (the rest will be created).
     */
    private GroupNode walkExisting(GroupNode start, List<String> names, String path) {
        GroupNode current = start;
        for (String name : names) {
            Node child = current.getChild(name);
            if (child == null) {
                rejectLinkName(current, name, path);
                return null;
            }
            if (!(child instanceof GroupNode g)) {
                throw new NodeTypeMismatchException(child.getFullName(), "group", "leaf");
            }
            current = g;
        }
        return current;
    }

    private void rejectLinkName(GroupNode group, String name, String path) {
        if (linkIndex.hasLink(group, name)) {
            throw new IllegalArgumentException("Cannot add `" + path + "`: `" + PathNames.join(group.getFullName(), name)
                    + "` is a link");
        }
    }

    private Branch plannedBranch(GroupNode start, List<String> names) {
        GroupNode current = start;
        Branch branch = start.getBranch();
        for (String name : names) {
            Node child = current == null ? null : current.getChild(name);
            if (child instanceof GroupNode g) {
                current = g;
                branch = g.getBranch();
            } else {
                branch = childBranch(current, name, branch);
                current = null;
            }
        }
        return branch;
    }

    private Branch childBranch(GroupNode parent, String name, Branch inherited) {
        if (parent == root) return Branch.ofGroupName(name).orElse(Branch.GENERIC);
        return inherited;
    }

    /** Creates missing groups along {@code names}; the last name becomes a leaf when {@code item} is set. */
    private Node createPath(GroupNode start, List<String> names, ItemContract item) {
        GroupNode current = start;
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            boolean last = i == names.size() - 1;
            Node existing = current.getChild(name);
            if (existing instanceof GroupNode g && !(last && item != null)) {
                current = g;
                continue;
            }
            Node created = last && item != null
                    ? new LeafNode(name, item)
                    : new GroupNode(name, childBranch(current, name, current.getBranch()));
            created.attach(this, current);
            current.putChild(created);
            if (log.isDebugEnabled()) log.debug("Tree add | node={} | kind={}", created.getFullName(), created.getKind());
            if (last) return created;
            current = (GroupNode) created;
        }
        return current;
    }

    /** Nodes of the subtree rooted at {@code node} through children only. */
    static List<Node> collectSubtree(Node node) {
        List<Node> out = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            Node n = stack.pop();
            out.add(n);
            if (n instanceof GroupNode g) {
                for (Node c : g.getChildren()) stack.push(c);
            }
        }
        return out;
    }
}

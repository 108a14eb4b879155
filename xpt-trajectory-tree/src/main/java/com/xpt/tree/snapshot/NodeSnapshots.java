package com.xpt.tree.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xpt.tree.GroupNode;
import com.xpt.tree.LeafNode;
import com.xpt.tree.Node;
import com.xpt.tree.NodeKind;
import com.xpt.tree.NodeTree;
import com.xpt.tree.item.ItemContract;
import com.xpt.tree.item.ItemTypes;
import com.xpt.tree.naming.ResolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Captures nodes into {@link NodeSnapshot}s, rebuilds trees from them and converts them to JSON.
 */
public final class NodeSnapshots {

    private static final Logger log = LoggerFactory.getLogger(NodeSnapshots.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> VALUES = new TypeReference<>() { };

    /** Exact lookup by full name: no shortcuts, no links. */
    private static final ResolveOptions EXACT = new ResolveOptions(false, false, null);

    public static final int UNLIMITED = Integer.MAX_VALUE;

    private NodeSnapshots() {
    }

    /**
     * Captures {@code node} and its descendants up to {@code maxDepth} extra levels
     * (0 = the node only). Children are followed, links recorded by target full name.
     * Payloads and annotations are copied through JSON, so numbers take their JSON types and the
     * snapshot shares no values with the live items.
     */
    public static NodeSnapshot capture(NodeTree tree, Node node, int maxDepth) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
        if (!tree.contains(node)) {
            throw new IllegalArgumentException("Node `" + node.getFullName() + "` is not part of the tree");
        }
        return captureNode(tree, node, maxDepth);
    }

    private static NodeSnapshot captureNode(NodeTree tree, Node node, int remaining) {
        if (node instanceof LeafNode leaf) {
            ItemContract item = leaf.getItem();
            return new NodeSnapshot(leaf.getName(), leaf.getFullName(), NodeKind.LEAF, leaf.getBranch(),
                    item.typeName(), leaf.getComment(), detach(leaf.getAnnotations()), detach(item.store()), item.isLocked(),
                    null, null);
        }
        GroupNode group = (GroupNode) node;
        Map<String, String> links = new LinkedHashMap<>();
        tree.getLinkIndex().targetsOf(group).forEach((name, target) -> links.put(name, target.getFullName()));
        List<NodeSnapshot> children = new ArrayList<>();
        if (remaining > 0) {
            for (Node child : group.getChildren()) {
                children.add(captureNode(tree, child, remaining - 1));
            }
        }
        return new NodeSnapshot(group.getName(), group.getFullName(), NodeKind.GROUP, group.getBranch(),
                null, group.getComment(), detach(group.getAnnotations()), null, false, links, children);
    }

    /**
     * Adds the snapshot's nodes to {@code tree} at their full names, replacing existing leaves.
     * Restored items get their own copies of the snapshot's values.
     * Links are applied in a second pass once every node exists; links whose target is not in the tree
     * are skipped with a warning.
     *
     * @return the node at the snapshot's full name
     */
    public static Node restore(NodeTree tree, NodeSnapshot snapshot) {
        Node top = restoreNodes(tree, snapshot);
        Deque<NodeSnapshot> stack = new ArrayDeque<>();
        stack.push(snapshot);
        while (!stack.isEmpty()) {
            NodeSnapshot s = stack.pop();
            s.getChildren().forEach(stack::push);
            if (s.getLinks().isEmpty()) continue;
            GroupNode owner = (GroupNode) node(tree, s.getFullName());
            for (Map.Entry<String, String> link : s.getLinks().entrySet()) {
                if (tree.getLinkIndex().hasLink(owner, link.getKey())) continue;
                Optional<Node> target = tree.find(tree.getRoot(), link.getValue(), EXACT);
                if (target.isEmpty()) {
                    log.warn("Snapshot restore | link target missing, skipped | owner={} | link={} | target={}",
                            s.getFullName(), link.getKey(), link.getValue());
                    continue;
                }
                tree.addLink(owner, link.getKey(), target.get());
            }
        }
        return top;
    }

    private static Node restoreNodes(NodeTree tree, NodeSnapshot s) {
        Node node;
        if (s.getFullName().isEmpty()) {
            node = tree.getRoot();
        } else if (s.isLeaf()) {
            ItemContract item = ItemTypes.create(s.getItemType());
            item.load(detach(s.getPayload()));
            if (s.isLocked()) item.lock();
            node = tree.addLeaf(tree.getRoot(), s.getFullName(), item, true);
        } else {
            node = tree.addGroup(tree.getRoot(), s.getFullName(), null);
        }
        node.setComment(s.getComment());
        node.setAnnotations(detach(s.getAnnotations()));
        for (NodeSnapshot child : s.getChildren()) {
            restoreNodes(tree, child);
        }
        return node;
    }

    /** Deep copy of an item's values through JSON. */
    private static Map<String, Object> detach(Map<String, Object> values) {
        if (values == null || values.isEmpty()) return values;
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(values), VALUES);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy item values", e);
        }
    }

    private static Node node(NodeTree tree, String fullName) {
        return fullName.isEmpty() ? tree.getRoot() : tree.get(tree.getRoot(), fullName, EXACT);
    }

    public static String toJson(NodeSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize snapshot of " + snapshot.getFullName(), e);
        }
    }

    public static NodeSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, NodeSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse snapshot", e);
        }
    }
}

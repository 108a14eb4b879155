package com.xpt.tree.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.xpt.tree.Branch;
import com.xpt.tree.NodeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, serializable copy of a node and (up to a depth) its descendants. Links are recorded as
 * link name → target full name. Workers receive snapshots; the writer stores them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NodeSnapshot {

    private final String name;
    private final String fullName;
    private final NodeKind kind;
    private final Branch branch;
    private final String itemType;
    private final String comment;
    private final Map<String, Object> annotations;
    private final Map<String, Object> payload;
    private final boolean locked;
    private final Map<String, String> links;
    private final List<NodeSnapshot> children;

    @JsonCreator
    public NodeSnapshot(
            @JsonProperty("name") String name,
            @JsonProperty("fullName") String fullName,
            @JsonProperty("kind") NodeKind kind,
            @JsonProperty("branch") Branch branch,
            @JsonProperty("itemType") String itemType,
            @JsonProperty("comment") String comment,
            @JsonProperty("annotations") Map<String, Object> annotations,
            @JsonProperty("payload") Map<String, Object> payload,
            @JsonProperty("locked") boolean locked,
            @JsonProperty("links") Map<String, String> links,
            @JsonProperty("children") List<NodeSnapshot> children) {
        this.name = name != null ? name : "";
        this.fullName = fullName != null ? fullName : "";
        this.kind = kind != null ? kind : NodeKind.GROUP;
        this.branch = branch != null ? branch : Branch.GENERIC;
        this.itemType = itemType;
        this.comment = comment != null ? comment : "";
        this.annotations = orderedCopy(annotations);
        this.payload = kind == NodeKind.LEAF ? orderedCopy(payload) : null;
        this.locked = locked;
        this.links = orderedCopy(links);
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    private static <V> Map<String, V> orderedCopy(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public String getName() {
        return name;
    }

    public String getFullName() {
        return fullName;
    }

    public NodeKind getKind() {
        return kind;
    }

    public Branch getBranch() {
        return branch;
    }

    /** Item type name for leaves; null for groups. */
    public String getItemType() {
        return itemType;
    }

    public String getComment() {
        return comment;
    }

    public Map<String, Object> getAnnotations() {
        return annotations;
    }

    /** Item fields for leaves; null for groups. */
    public Map<String, Object> getPayload() {
        return payload;
    }

    public boolean isLocked() {
        return locked;
    }

    public Map<String, String> getLinks() {
        return links;
    }

    public List<NodeSnapshot> getChildren() {
        return children;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return kind == NodeKind.LEAF;
    }

    /** This node without children, for single-node writes. */
    public NodeSnapshot withoutChildren() {
        if (children.isEmpty()) return this;
        return new NodeSnapshot(name, fullName, kind, branch, itemType, comment, annotations, payload, locked, links, null);
    }

    /** Number of nodes in this snapshot including itself. */
    public int size() {
        int n = 1;
        for (NodeSnapshot c : children) n += c.size();
        return n;
    }
}

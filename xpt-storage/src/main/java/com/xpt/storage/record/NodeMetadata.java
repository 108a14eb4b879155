package com.xpt.storage.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.xpt.tree.Branch;
import com.xpt.tree.NodeKind;
import com.xpt.tree.snapshot.NodeSnapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored description of a node without its payload. Links are link name → target full name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeMetadata(
        String name,
        String fullName,
        NodeKind kind,
        Branch branch,
        String itemType,
        String comment,
        Map<String, Object> annotations,
        Map<String, String> links) {

    public NodeMetadata {
        name = name != null ? name : "";
        fullName = fullName != null ? fullName : "";
        kind = kind != null ? kind : NodeKind.GROUP;
        branch = branch != null ? branch : Branch.GENERIC;
        comment = comment != null ? comment : "";
        annotations = ordered(annotations);
        links = ordered(links);
    }

    private static <V> Map<String, V> ordered(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static NodeMetadata of(NodeSnapshot s) {
        return new NodeMetadata(s.getName(), s.getFullName(), s.getKind(), s.getBranch(), s.getItemType(),
                s.getComment(), s.getAnnotations(), s.getLinks());
    }

    /** Group skeleton with no comment, annotations or links. */
    public static NodeMetadata group(String name, String fullName, Branch branch) {
        return new NodeMetadata(name, fullName, NodeKind.GROUP, branch, null, null, null, null);
    }

    public NodeMetadata withLinks(Map<String, String> newLinks) {
        return new NodeMetadata(name, fullName, kind, branch, itemType, comment, annotations, newLinks);
    }
}

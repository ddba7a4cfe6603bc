package com.enrichreview.engine.core.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.enrichreview.engine.core.path.FieldPath;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Ordered key → {@link DiffNode} mapping for one object level. Immutable.
 */
public final class DiffTree {

    public static final DiffTree EMPTY = new DiffTree(Map.of());

    private final Map<String, DiffNode> nodes;

    DiffTree(Map<String, DiffNode> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public DiffNode get(String key) {
        return nodes.get(key);
    }

    public Map<String, DiffNode> asMap() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean hasChanges() {
        return nodes.values().stream().anyMatch(DiffNode::isChange);
    }

    /** Exact node at {@code path}; every intermediate must carry children. */
    public Optional<DiffNode> nodeAt(FieldPath path) {
        if (path.isRoot()) return Optional.empty();

        DiffTree cur = this;
        DiffNode node = null;
        for (String seg : path.segments()) {
            if (cur == null) return Optional.empty();
            node = cur.get(seg);
            if (node == null) return Optional.empty();
            cur = node.children();
        }
        return Optional.ofNullable(node);
    }

    /** Child tree of the node at {@code path}; the root path yields this tree. */
    public Optional<DiffTree> childrenAt(FieldPath path) {
        if (path.isRoot()) return Optional.of(this);
        return nodeAt(path).map(DiffNode::children);
    }

    /**
     * Paths that carry a decision beneath {@code path}: the node itself when it
     * has no children (a whole array, a NEW object, a primitive), otherwise every
     * childless descendant. Empty when the tree has no node there.
     */
    public List<FieldPath> leafPaths(FieldPath path) {
        List<FieldPath> out = new ArrayList<>();
        Optional<DiffTree> children = childrenAt(path);
        if (children.isPresent()) {
            children.get().collectLeaves(out);
        } else {
            nodeAt(path).ifPresent(n -> out.add(n.path()));
        }
        return out;
    }

    private void collectLeaves(List<FieldPath> out) {
        for (DiffNode node : nodes.values()) {
            if (node.hasChildren()) node.children().collectLeaves(out);
            else out.add(node.path());
        }
    }

    /**
     * Kind reported for a path. Unknown keys are UNCHANGED; a path running past a
     * node without children (for instance into an array element) reports that
     * node's kind.
     */
    public DiffKind kindAt(FieldPath path) {
        return closest(path).map(DiffNode::kind).orElse(DiffKind.UNCHANGED);
    }

    /** Original value for a path, resolved the same way as {@link #kindAt}. */
    public Optional<JsonNode> originalValueAt(FieldPath path) {
        return closest(path).flatMap(DiffNode::original);
    }

    private Optional<DiffNode> closest(FieldPath path) {
        DiffTree cur = this;
        for (int i = 0; i < path.size(); i++) {
            DiffNode node = cur.get(path.segment(i));
            if (node == null) return Optional.empty();
            if (i == path.size() - 1 || !node.hasChildren()) return Optional.of(node);
            cur = node.children();
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiffTree other)) return false;
        return nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "DiffTree" + nodes.keySet();
    }
}

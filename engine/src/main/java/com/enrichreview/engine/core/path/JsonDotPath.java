package com.enrichreview.engine.core.path;

import java.util.Iterator;
import java.util.Map;
import java.util.OptionalInt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Copy-on-write updates of a document at a {@link FieldPath}.
 *
 * <p>Only the containers along the path are copied; every untouched subtree is
 * shared with the input. Documents handled here are snapshots: nothing in this
 * project mutates a node after it has been handed out.
 */
public final class JsonDotPath {
    private JsonDotPath() {}

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Returns a new document with {@code value} stored at {@code path}.
     * Missing or non-container intermediates become empty objects. An array
     * segment that is not an in-range index leaves that array untouched.
     */
    public static JsonNode set(JsonNode root, FieldPath path, JsonNode value) {
        JsonNode leaf = (value == null) ? NullNode.getInstance() : value;
        if (path.isRoot()) return leaf;
        return setAt(root, path, 0, leaf);
    }

    /**
     * Returns a new document without the element at {@code path}. A path whose
     * parent does not resolve to a container, or whose trailing array segment is
     * not an in-range index, returns {@code root} itself.
     */
    public static JsonNode remove(JsonNode root, FieldPath path) {
        if (root == null || path.isRoot()) return root;
        return removeAt(root, path, 0);
    }

    private static JsonNode setAt(JsonNode node, FieldPath path, int i, JsonNode value) {
        String seg = path.segment(i);
        boolean last = i == path.size() - 1;

        if (node != null && node.isArray()) {
            OptionalInt idx = FieldPath.parseIndex(seg);
            if (idx.isEmpty() || idx.getAsInt() >= node.size()) return node;

            int at = idx.getAsInt();
            ArrayNode copy = copyArray((ArrayNode) node);
            copy.set(at, last ? value : setAt(container(node.get(at)), path, i + 1, value));
            return copy;
        }

        ObjectNode copy = (node != null && node.isObject()) ? copyObject((ObjectNode) node) : NODES.objectNode();
        copy.set(seg, last ? value : setAt(container(copy.get(seg)), path, i + 1, value));
        return copy;
    }

    private static JsonNode removeAt(JsonNode node, FieldPath path, int i) {
        String seg = path.segment(i);

        if (i == path.size() - 1) {
            return switch (node.getNodeType()) {
                case OBJECT -> {
                    if (!node.has(seg)) yield node;
                    ObjectNode copy = copyObject((ObjectNode) node);
                    copy.remove(seg);
                    yield copy;
                }
                case ARRAY -> {
                    OptionalInt idx = FieldPath.parseIndex(seg);
                    if (idx.isEmpty() || idx.getAsInt() >= node.size()) yield node;
                    ArrayNode copy = copyArray((ArrayNode) node);
                    copy.remove(idx.getAsInt());
                    yield copy;
                }
                case BINARY, BOOLEAN, MISSING, NULL, NUMBER, POJO, STRING -> node;
            };
        }

        JsonNode child = JsonPath.step(node, seg);
        if (child == null || !child.isContainerNode()) return node;

        JsonNode updated = removeAt(child, path, i + 1);
        if (updated == child) return node;

        if (node.isArray()) {
            ArrayNode copy = copyArray((ArrayNode) node);
            copy.set(FieldPath.parseIndex(seg).getAsInt(), updated);
            return copy;
        }
        ObjectNode copy = copyObject((ObjectNode) node);
        copy.set(seg, updated);
        return copy;
    }

    private static JsonNode container(JsonNode n) {
        return (n != null && n.isContainerNode()) ? n : NODES.objectNode();
    }

    private static ObjectNode copyObject(ObjectNode src) {
        ObjectNode copy = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = src.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            copy.set(e.getKey(), e.getValue());
        }
        return copy;
    }

    private static ArrayNode copyArray(ArrayNode src) {
        ArrayNode copy = NODES.arrayNode(src.size());
        for (JsonNode n : src) copy.add(n);
        return copy;
    }
}

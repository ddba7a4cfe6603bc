package com.enrichreview.engine.core.diff;

import java.util.Map;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Wire shape of a diff tree:
 * {"offers":{"kind":"MODIFIED","path":"offers","value":{...},"originalValue":{...},"children":{...}}}
 */
public final class DiffTreeJson {
    private DiffTreeJson() {}

    public static ObjectNode write(DiffTree tree) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, DiffNode> e : tree.asMap().entrySet()) {
            out.set(e.getKey(), write(e.getValue()));
        }
        return out;
    }

    private static ObjectNode write(DiffNode node) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("kind", node.kind().name());
        n.put("path", node.path().key());
        n.set("value", node.enrichedValue());
        if (node.originalValue() != null) n.set("originalValue", node.originalValue());
        if (node.hasChildren()) n.set("children", write(node.children()));
        return n;
    }
}

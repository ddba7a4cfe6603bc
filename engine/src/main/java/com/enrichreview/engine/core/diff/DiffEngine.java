package com.enrichreview.engine.core.diff;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.enrichreview.engine.core.path.FieldPath;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Structural comparison of an original document against its enriched version.
 *
 * <p>Only object keys become tree nodes. Arrays and primitives are compared as
 * whole values. Keys present only in the original produce no node.
 */
public final class DiffEngine {
    private DiffEngine() {}

    public static DiffTree compare(JsonNode original, JsonNode enriched) {
        return compare(original, enriched, FieldPath.ROOT);
    }

    public static DiffTree compare(JsonNode original, JsonNode enriched, FieldPath prefix) {
        ObjectNode o = asObject(original);
        ObjectNode e = asObject(enriched);

        // original's keys first, then keys introduced by enrichment
        Set<String> keys = new LinkedHashSet<>();
        o.fieldNames().forEachRemaining(keys::add);
        e.fieldNames().forEachRemaining(keys::add);

        Map<String, DiffNode> out = new LinkedHashMap<>();
        for (String key : keys) {
            JsonNode originalValue = o.get(key);
            JsonNode enrichedValue = e.get(key);
            FieldPath path = prefix.child(key);

            if (originalValue == null) {
                out.put(key, DiffNode.added(path, enrichedValue));
            } else if (enrichedValue == null) {
                // removed by enrichment: not tracked
                continue;
            } else if (originalValue.isObject() && enrichedValue.isObject()) {
                DiffTree nested = compare(originalValue, enrichedValue, path);
                out.put(key, DiffNode.nested(path, enrichedValue, originalValue, nested));
            } else {
                DiffKind kind = JsonEquality.equivalent(originalValue, enrichedValue)
                        ? DiffKind.UNCHANGED
                        : DiffKind.MODIFIED;
                out.put(key, DiffNode.leaf(path, kind, enrichedValue, originalValue));
            }
        }
        return new DiffTree(out);
    }

    /** Null, missing and non-object roots compare as an empty object. */
    private static ObjectNode asObject(JsonNode node) {
        if (node == null) return JsonNodeFactory.instance.objectNode();
        return switch (node.getNodeType()) {
            case OBJECT -> (ObjectNode) node;
            case ARRAY, BINARY, BOOLEAN, MISSING, NULL, NUMBER, POJO, STRING -> JsonNodeFactory.instance.objectNode();
        };
    }
}

package com.enrichreview.engine.core.merge;

import java.util.Iterator;
import java.util.Map;

import com.enrichreview.engine.core.diff.DiffNode;
import com.enrichreview.engine.core.diff.DiffTree;
import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.validation.ValidationState;
import com.enrichreview.engine.core.validation.ValidationStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reconciles the enriched document with the reviewer's decisions into the
 * document that gets exported.
 *
 * <ul>
 *   <li>NEW: kept unless DECLINED, in which case the key is dropped.</li>
 *   <li>MODIFIED: DECLINED reverts the whole value to the original; otherwise the
 *       enriched value is kept, recursing so nested decisions still apply.</li>
 *   <li>UNCHANGED: kept, recursing into nested objects.</li>
 *   <li>Keys without a diff node (added after the diff was taken) are copied as-is.</li>
 * </ul>
 *
 * Key order follows the enriched document. Inputs are never modified and the
 * result shares no nodes with them.
 */
public final class FinalDocumentGenerator {
    private FinalDocumentGenerator() {}

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static JsonNode generate(JsonNode original, JsonNode enriched, DiffTree diff, ValidationStore store) {
        return process(original, enriched, diff, store, FieldPath.ROOT);
    }

    private static JsonNode process(JsonNode original, JsonNode enriched, DiffTree diff,
                                    ValidationStore store, FieldPath path) {
        if (enriched == null) return null;

        return switch (enriched.getNodeType()) {
            case OBJECT -> mergeObject(original, (ObjectNode) enriched, diff == null ? DiffTree.EMPTY : diff, store, path);
            case ARRAY, BINARY, BOOLEAN, MISSING, NULL, NUMBER, POJO, STRING -> enriched.deepCopy();
        };
    }

    private static ObjectNode mergeObject(JsonNode original, ObjectNode enriched, DiffTree diff,
                                          ValidationStore store, FieldPath path) {
        ObjectNode result = NODES.objectNode();

        Iterator<Map.Entry<String, JsonNode>> it = enriched.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            JsonNode value = e.getValue();
            FieldPath fieldPath = path.child(key);

            DiffNode node = diff.get(key);
            if (node == null) {
                result.set(key, value.deepCopy());
                continue;
            }

            ValidationState state = store.getState(fieldPath);

            switch (node.kind()) {
                case NEW -> {
                    if (state != ValidationState.DECLINED) {
                        result.set(key, descend(NODES.objectNode(), value, node, store, fieldPath));
                    }
                }
                case MODIFIED -> {
                    if (state == ValidationState.DECLINED) {
                        JsonNode reverted = originalOf(node, original, key);
                        if (reverted != null) result.set(key, reverted.deepCopy());
                    } else {
                        result.set(key, descend(originalOrEmpty(node), value, node, store, fieldPath));
                    }
                }
                case UNCHANGED -> result.set(key, descend(originalOrEmpty(node), value, node, store, fieldPath));
            }
        }
        return result;
    }

    private static JsonNode descend(JsonNode original, JsonNode value, DiffNode node,
                                    ValidationStore store, FieldPath path) {
        if (node.hasChildren() && value.isObject()) {
            return process(original, value, node.children(), store, path);
        }
        return value.deepCopy();
    }

    private static JsonNode originalOrEmpty(DiffNode node) {
        return node.originalValue() != null ? node.originalValue() : NODES.objectNode();
    }

    /** The node's recorded original, else the key's value in the original container, else null. */
    private static JsonNode originalOf(DiffNode node, JsonNode original, String key) {
        if (node.originalValue() != null) return node.originalValue();
        if (original != null && original.isObject()) return original.get(key);
        return null;
    }
}

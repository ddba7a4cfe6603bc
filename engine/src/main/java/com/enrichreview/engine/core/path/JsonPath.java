package com.enrichreview.engine.core.path;

import java.util.Optional;
import java.util.OptionalInt;

import com.fasterxml.jackson.databind.JsonNode;

public final class JsonPath {
    private JsonPath() {}

    /**
     * Resolve a dot-path like "offers.price" or "image.[0]" against a JsonNode.
     * - Object segments are looked up by key, "[i]" segments index into arrays.
     * - Returns Optional.empty() if any segment is missing.
     */
    public static Optional<JsonNode> get(JsonNode root, String dotPath) {
        if (dotPath == null || dotPath.isBlank()) return Optional.empty();
        return get(root, FieldPath.parse(dotPath));
    }

    public static Optional<JsonNode> get(JsonNode root, FieldPath path) {
        if (root == null || root.isMissingNode()) return Optional.empty();

        JsonNode cur = root;
        for (String p : path.segments()) {
            cur = step(cur, p);
            if (cur == null) return Optional.empty();
        }
        return Optional.of(cur);
    }

    /** One traversal step; null when the segment does not resolve. */
    static JsonNode step(JsonNode cur, String segment) {
        if (cur == null) return null;
        return switch (cur.getNodeType()) {
            case OBJECT -> cur.get(segment);
            case ARRAY -> {
                OptionalInt idx = FieldPath.parseIndex(segment);
                yield idx.isPresent() ? cur.get(idx.getAsInt()) : null;
            }
            case BINARY, BOOLEAN, MISSING, NULL, NUMBER, POJO, STRING -> null;
        };
    }
}

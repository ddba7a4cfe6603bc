package com.enrichreview.engine.core.diff;

import java.util.Optional;

import com.enrichreview.engine.core.path.FieldPath;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Classification of one object key.
 *
 * @param path          where the key sits in the enriched document
 * @param kind          NEW, MODIFIED or UNCHANGED
 * @param enrichedValue the value on the enriched side
 * @param originalValue the value on the original side, null for NEW keys
 * @param children      nested classification, present only when both sides are objects
 */
public record DiffNode(
        FieldPath path,
        DiffKind kind,
        JsonNode enrichedValue,
        JsonNode originalValue,
        DiffTree children
) {

    static DiffNode added(FieldPath path, JsonNode enrichedValue) {
        return new DiffNode(path, DiffKind.NEW, enrichedValue, null, null);
    }

    static DiffNode leaf(FieldPath path, DiffKind kind, JsonNode enrichedValue, JsonNode originalValue) {
        return new DiffNode(path, kind, enrichedValue, originalValue, null);
    }

    static DiffNode nested(FieldPath path, JsonNode enrichedValue, JsonNode originalValue, DiffTree children) {
        DiffKind kind = children.hasChanges() ? DiffKind.MODIFIED : DiffKind.UNCHANGED;
        return new DiffNode(path, kind, enrichedValue, originalValue, children);
    }

    public boolean hasChildren() {
        return children != null;
    }

    public boolean isChange() {
        return kind != DiffKind.UNCHANGED;
    }

    public Optional<JsonNode> original() {
        return Optional.ofNullable(originalValue);
    }
}

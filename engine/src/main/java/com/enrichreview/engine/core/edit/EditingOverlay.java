package com.enrichreview.engine.core.edit;

import java.util.Optional;

import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.path.JsonDotPath;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Holds at most one active edit. Starting a new edit replaces the previous one.
 */
public final class EditingOverlay {

    private EditingCursor cursor;

    public void startEdit(FieldPath path, JsonNode currentValue) {
        cursor = new EditingCursor(path, currentValue, ValueCoercion.displayText(currentValue));
    }

    public void updateEdit(String text) {
        if (cursor != null) cursor = cursor.withText(text);
    }

    /**
     * Applies the active edit to {@code enriched} and clears it. Returns the new
     * document snapshot, or empty when no edit is active.
     */
    public Optional<JsonNode> commitEdit(JsonNode enriched) {
        if (cursor == null) return Optional.empty();

        EditingCursor c = cursor;
        cursor = null;
        return Optional.of(JsonDotPath.set(enriched, c.path(), c.coercedValue()));
    }

    public void cancelEdit() {
        cursor = null;
    }

    public Optional<EditingCursor> current() {
        return Optional.ofNullable(cursor);
    }
}

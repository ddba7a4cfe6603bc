package com.enrichreview.engine.core.edit;

import com.enrichreview.engine.core.path.FieldPath;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The single in-progress edit.
 *
 * @param path         field being edited
 * @param preEditValue value at {@code path} when the edit started, drives coercion
 * @param text         what the reviewer has typed so far
 */
public record EditingCursor(FieldPath path, JsonNode preEditValue, String text) {

    public EditingCursor withText(String next) {
        return new EditingCursor(path, preEditValue, next);
    }

    public JsonNode coercedValue() {
        return ValueCoercion.coerce(preEditValue, text);
    }
}

package com.enrichreview.engine.core.diff;

import java.util.Comparator;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Canonical deep equality for JSON values.
 * - Numbers compare by value, so 10 equals 10.0.
 * - Object key order is ignored, array order is not.
 */
public final class JsonEquality {
    private JsonEquality() {}

    private static final Comparator<JsonNode> SCALARS = (a, b) -> {
        if (a.equals(b)) return 0;
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0 ? 0 : 1;
        }
        return 1;
    };

    public static boolean equivalent(JsonNode a, JsonNode b) {
        if (a == null || b == null) return a == b;
        return a.equals(SCALARS, b);
    }
}

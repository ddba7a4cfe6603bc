package com.enrichreview.engine.core.path;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

public final class LeafPaths {
    private LeafPaths() {}

    /**
     * Every non-container position beneath {@code value}, in document order.
     * Objects contribute their keys, arrays their {@code [i]} segments; a
     * primitive (or null) value is its own single leaf. Empty containers have none.
     */
    public static List<FieldPath> under(FieldPath path, JsonNode value) {
        List<FieldPath> out = new ArrayList<>();
        collect(path, value, out);
        return out;
    }

    private static void collect(FieldPath path, JsonNode value, List<FieldPath> out) {
        if (value == null) {
            out.add(path);
            return;
        }
        switch (value.getNodeType()) {
            case OBJECT -> {
                Iterator<Map.Entry<String, JsonNode>> it = value.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    collect(path.child(e.getKey()), e.getValue(), out);
                }
            }
            case ARRAY -> {
                for (int i = 0; i < value.size(); i++) {
                    collect(path.element(i), value.get(i), out);
                }
            }
            case BINARY, BOOLEAN, MISSING, NULL, NUMBER, POJO, STRING -> out.add(path);
        }
    }
}

package com.enrichreview.engine.core.pending;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.enrichreview.engine.core.diff.DiffNode;
import com.enrichreview.engine.core.diff.DiffTree;
import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.validation.ValidationState;
import com.enrichreview.engine.core.validation.ValidationStore;

/**
 * Lists the leaf fields that still need a reviewer decision. Export is allowed
 * only once the list is empty.
 */
public final class PendingFieldCollector {
    private PendingFieldCollector() {}

    /** Schema type markers are never reviewed. */
    public static final String TYPE_KEY = "@type";

    public static List<String> collectPending(DiffTree tree, ValidationStore store) {
        return collectPending(tree, store, FieldPath.ROOT);
    }

    public static List<String> collectPending(DiffTree tree, ValidationStore store, FieldPath prefix) {
        List<String> out = new ArrayList<>();
        collect(tree, store, prefix, out);
        return out;
    }

    public static boolean isExportReady(DiffTree tree, ValidationStore store) {
        return collectPending(tree, store).isEmpty();
    }

    private static void collect(DiffTree tree, ValidationStore store, FieldPath prefix, List<String> out) {
        if (tree == null) return;

        for (Map.Entry<String, DiffNode> e : tree.asMap().entrySet()) {
            String key = e.getKey();
            if (TYPE_KEY.equals(key)) continue;

            DiffNode node = e.getValue();
            FieldPath path = prefix.child(key);

            if (node.hasChildren()) {
                collect(node.children(), store, path, out);
            } else if (node.isChange() && store.getState(path) == ValidationState.PENDING) {
                out.add(path.key());
            }
        }
    }
}

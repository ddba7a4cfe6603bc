package com.enrichreview.engine.core.validation;

import java.util.List;

import com.enrichreview.engine.core.diff.DiffTree;
import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.path.LeafPaths;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Derived, read-only status of a node for display. Never written back.
 *
 * <p>Leaves are the paths the diff tracks as single decisions beneath the node,
 * so a changed array or a NEW object counts as one leaf. Positions the diff does
 * not reach fall back to the leaves of the value itself.
 */
public enum EffectiveState {
    FULLY_APPROVED,
    FULLY_DECLINED,
    MIXED;

    public static EffectiveState of(ValidationStore store, DiffTree diff, FieldPath path, JsonNode value) {
        List<FieldPath> leaves = (diff == null) ? List.of() : diff.leafPaths(path);
        if (leaves.isEmpty()) {
            leaves = (value != null && value.isContainerNode()) ? LeafPaths.under(path, value) : List.of(path);
        }

        boolean allApproved = !leaves.isEmpty()
                && leaves.stream().allMatch(p -> store.getState(p) == ValidationState.APPROVED);

        if (allApproved) return FULLY_APPROVED;
        if (store.getState(path) == ValidationState.DECLINED) return FULLY_DECLINED;
        return MIXED;
    }
}

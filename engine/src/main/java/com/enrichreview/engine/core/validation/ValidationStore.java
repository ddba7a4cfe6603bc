package com.enrichreview.engine.core.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.enrichreview.engine.core.diff.DiffTree;
import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.path.LeafPaths;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reviewer decisions keyed by field path. A path without an entry is PENDING.
 *
 * <p>Entries are keyed by path string only, so they survive any number of diff
 * recomputations over edited documents.
 */
public final class ValidationStore {

    private final Map<String, ValidationState> states = new LinkedHashMap<>();

    public static ValidationStore of(List<ValidationDecision> decisions) {
        ValidationStore store = new ValidationStore();
        if (decisions != null) {
            for (ValidationDecision d : decisions) {
                if (d != null) store.apply(d);
            }
        }
        return store;
    }

    public ValidationState getState(String fieldPath) {
        return states.getOrDefault(fieldPath, ValidationState.PENDING);
    }

    public ValidationState getState(FieldPath path) {
        return getState(path.key());
    }

    public void setState(String fieldPath, ValidationState state) {
        if (fieldPath == null) throw new IllegalArgumentException("fieldPath is required");
        if (state == null || state == ValidationState.PENDING) {
            throw new IllegalArgumentException("only APPROVED or DECLINED can be stored: " + state);
        }
        states.put(fieldPath, state);
    }

    public void setState(FieldPath path, ValidationState state) {
        setState(path.key(), state);
    }

    public void apply(ValidationDecision decision) {
        if (decision.decisionType() == null) throw new IllegalArgumentException("decisionType is required");
        setState(decision.fieldPath(), decision.targetState());
    }

    /**
     * Approves every leaf beneath {@code value} together with every path the diff
     * tracks as a single decision beneath {@code path} (a whole array, a NEW
     * object). Returns the number of distinct paths written.
     */
    public int approveAll(FieldPath path, JsonNode value, DiffTree diff) {
        Set<FieldPath> targets = new LinkedHashSet<>(LeafPaths.under(path, value));
        if (diff != null) targets.addAll(diff.leafPaths(path));
        for (FieldPath p : targets) {
            states.put(p.key(), ValidationState.APPROVED);
        }
        return targets.size();
    }

    public void reset() {
        states.clear();
    }

    public Map<String, ValidationState> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }
}

package com.enrichreview.engine.core.session;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.enrichreview.engine.core.diff.DiffEngine;
import com.enrichreview.engine.core.diff.DiffKind;
import com.enrichreview.engine.core.diff.DiffTree;
import com.enrichreview.engine.core.edit.EditingCursor;
import com.enrichreview.engine.core.edit.EditingOverlay;
import com.enrichreview.engine.core.merge.FinalDocumentGenerator;
import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.path.JsonDotPath;
import com.enrichreview.engine.core.path.JsonPath;
import com.enrichreview.engine.core.pending.PendingFieldCollector;
import com.enrichreview.engine.core.pipeline.DocumentPair;
import com.enrichreview.engine.core.validation.EffectiveState;
import com.enrichreview.engine.core.validation.ValidationDecision;
import com.enrichreview.engine.core.validation.ValidationState;
import com.enrichreview.engine.core.validation.ValidationStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * One reviewer's pass over one (original, enriched) pair.
 *
 * <p>Owns the current enriched snapshot, its diff tree, the decisions and the
 * editing cursor. Every change to the enriched document re-runs the diff and
 * drops the cursor; decisions are kept because they are keyed by path.
 * Not thread-safe: callers serialize actions on a session.
 */
public final class ReviewSession {

    private static final Logger log = LoggerFactory.getLogger(ReviewSession.class);

    private final JsonNode originalDoc;
    private final JsonNode initialEnrichedDoc;
    private final ValidationStore validation = new ValidationStore();
    private final EditingOverlay editing = new EditingOverlay();

    private JsonNode enrichedDoc;
    private DiffTree diffTree;

    private ReviewSession(JsonNode originalDoc, JsonNode enrichedDoc) {
        this.originalDoc = originalDoc;
        this.initialEnrichedDoc = enrichedDoc;
        this.enrichedDoc = enrichedDoc;
        this.diffTree = DiffEngine.compare(originalDoc, enrichedDoc);
    }

    public static ReviewSession open(DocumentPair pair) {
        Objects.requireNonNull(pair, "pair");
        ReviewSession s = new ReviewSession(copyOf(pair.originalDoc()), copyOf(pair.enrichedDoc()));
        log.debug("opened review session: {} top-level keys, {} pending", s.diffTree.size(), s.collectPendingFields().size());
        return s;
    }

    // ---- decisions ----

    public void decide(ValidationDecision decision) {
        Objects.requireNonNull(decision, "decision");
        validation.apply(decision);
    }

    /**
     * Approves everything beneath the enriched value at {@code path}, including
     * the path itself when the diff tracks it as one field; returns how many.
     */
    public int approveAll(FieldPath path) {
        Optional<JsonNode> value = JsonPath.get(enrichedDoc, path);
        if (value.isEmpty()) return 0;
        return validation.approveAll(path, value.get(), diffTree);
    }

    /** Clears every decision and restores the enriched document the session opened with. */
    public void resetValidation() {
        validation.reset();
        replaceEnriched(initialEnrichedDoc);
    }

    // ---- editing ----

    public void startEdit(FieldPath path, JsonNode currentValue) {
        editing.startEdit(path, currentValue);
    }

    /** Starts editing the value currently stored at {@code path}. */
    public void startEdit(FieldPath path) {
        editing.startEdit(path, JsonPath.get(enrichedDoc, path).orElse(NullNode.getInstance()));
    }

    public void updateEdit(String text) {
        editing.updateEdit(text);
    }

    /** Writes the active edit into the enriched document; false when nothing was being edited. */
    public boolean commitEdit() {
        Optional<JsonNode> next = editing.commitEdit(enrichedDoc);
        next.ifPresent(this::replaceEnriched);
        return next.isPresent();
    }

    public void cancelEdit() {
        editing.cancelEdit();
    }

    public Optional<EditingCursor> editingCursor() {
        return editing.current();
    }

    // ---- removal ----

    public void removeField(FieldPath path) {
        JsonNode next = JsonDotPath.remove(enrichedDoc, path);
        if (next == enrichedDoc) {
            log.debug("remove {}: nothing at that path", path);
            return;
        }
        replaceEnriched(next);
    }

    // ---- generation ----

    public JsonNode generate() {
        return FinalDocumentGenerator.generate(originalDoc, enrichedDoc, diffTree, validation);
    }

    /** The final document, only once no field is pending. */
    public JsonNode export() {
        List<String> pending = collectPendingFields();
        if (!pending.isEmpty()) throw new ExportNotReadyException(pending);
        return generate();
    }

    // ---- queries ----

    public DiffKind getDiffKind(FieldPath path) {
        return diffTree.kindAt(path);
    }

    public Optional<JsonNode> getOriginalValue(FieldPath path) {
        return diffTree.originalValueAt(path);
    }

    public ValidationState getValidationState(FieldPath path) {
        return validation.getState(path);
    }

    public EffectiveState getEffectiveState(FieldPath path) {
        return EffectiveState.of(validation, diffTree, path, JsonPath.get(enrichedDoc, path).orElse(null));
    }

    public List<String> collectPendingFields() {
        return PendingFieldCollector.collectPending(diffTree, validation);
    }

    public boolean isExportReady() {
        return PendingFieldCollector.isExportReady(diffTree, validation);
    }

    public JsonNode originalDoc() {
        return originalDoc;
    }

    public JsonNode enrichedDoc() {
        return enrichedDoc;
    }

    public DiffTree diffTree() {
        return diffTree;
    }

    public ValidationStore validation() {
        return validation;
    }

    private void replaceEnriched(JsonNode next) {
        enrichedDoc = next;
        diffTree = DiffEngine.compare(originalDoc, enrichedDoc);
        editing.cancelEdit();
    }

    private static JsonNode copyOf(JsonNode n) {
        return (n == null) ? NullNode.getInstance() : n.deepCopy();
    }
}

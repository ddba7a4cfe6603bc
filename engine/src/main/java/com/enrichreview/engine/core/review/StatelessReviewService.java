package com.enrichreview.engine.core.review;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.enrichreview.engine.core.diff.DiffEngine;
import com.enrichreview.engine.core.diff.DiffTree;
import com.enrichreview.engine.core.diff.DiffTreeJson;
import com.enrichreview.engine.core.edit.ValueCoercion;
import com.enrichreview.engine.core.merge.FinalDocumentGenerator;
import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.path.JsonDotPath;
import com.enrichreview.engine.core.path.JsonPath;
import com.enrichreview.engine.core.pending.PendingFieldCollector;
import com.enrichreview.engine.core.pipeline.DocumentPair;
import com.enrichreview.engine.core.pipeline.DocumentPairSource;
import com.enrichreview.engine.core.session.ExportNotReadyException;
import com.enrichreview.engine.core.validation.ValidationDecision;
import com.enrichreview.engine.core.validation.ValidationStore;
import com.enrichreview.engine.model.pipeline.EnrichmentRequest;
import com.enrichreview.engine.model.review.DiffRequest;
import com.enrichreview.engine.model.review.DiffResponse;
import com.enrichreview.engine.model.review.DocumentUpdateResponse;
import com.enrichreview.engine.model.review.FetchPairResponse;
import com.enrichreview.engine.model.review.FieldChangeRequest;
import com.enrichreview.engine.model.review.GenerateResponse;
import com.enrichreview.engine.model.review.PendingResponse;
import com.enrichreview.engine.model.review.ReviewRequest;
import com.enrichreview.engine.util.ApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Review operations for callers that keep the session state themselves: every
 * request carries the documents and the decisions taken so far.
 */
public final class StatelessReviewService {

    private final DocumentPairSource pairs;

    public StatelessReviewService(DocumentPairSource pairs) {
        this.pairs = Objects.requireNonNull(pairs, "pairs");
    }

    public DiffResponse diff(DiffRequest req) {
        if (req == null) throw new ApiException(400, "body is required");

        DiffTree tree = DiffEngine.compare(req.original(), req.enriched());
        List<String> pending = PendingFieldCollector.collectPending(tree, new ValidationStore());
        return new DiffResponse(DiffTreeJson.write(tree), pending, pending.isEmpty());
    }

    public PendingResponse pending(ReviewRequest req) {
        if (req == null) throw new ApiException(400, "body is required");

        DiffTree tree = DiffEngine.compare(req.original(), req.enriched());
        List<String> pending = PendingFieldCollector.collectPending(tree, decisions(req.decisions()));
        return new PendingResponse(pending, pending.size(), pending.isEmpty());
    }

    /** Final document regardless of pending fields (pending behaves as approved). */
    public GenerateResponse generate(ReviewRequest req) {
        if (req == null) throw new ApiException(400, "body is required");

        ValidationStore store = decisions(req.decisions());
        DiffTree tree = DiffEngine.compare(req.original(), req.enriched());
        List<String> pending = PendingFieldCollector.collectPending(tree, store);
        JsonNode doc = FinalDocumentGenerator.generate(req.original(), req.enriched(), tree, store);
        return new GenerateResponse(doc, pending, pending.isEmpty());
    }

    /** Final document, refused with 409 while any field is pending. */
    public GenerateResponse export(ReviewRequest req) {
        GenerateResponse out = generate(req);
        if (!out.exportReady()) throw new ExportNotReadyException(out.pendingFields());
        return out;
    }

    public DocumentUpdateResponse edit(FieldChangeRequest req) {
        FieldPath path = requirePath(req);

        JsonNode current = JsonPath.get(req.enriched(), path).orElse(NullNode.getInstance());
        JsonNode value = ValueCoercion.coerce(current, req.value());
        JsonNode next = JsonDotPath.set(req.enriched(), path, value);
        return rediff(req, next);
    }

    public DocumentUpdateResponse remove(FieldChangeRequest req) {
        FieldPath path = requirePath(req);
        return rediff(req, JsonDotPath.remove(req.enriched(), path));
    }

    public FetchPairResponse fetchPair(EnrichmentRequest req) {
        if (req == null || req.url() == null || req.url().isBlank()) throw new ApiException(400, "url is required");

        DocumentPair pair = pairs.fetch(req);
        DiffTree tree = DiffEngine.compare(pair.originalDoc(), pair.enrichedDoc());
        List<String> pending = PendingFieldCollector.collectPending(tree, new ValidationStore());
        return new FetchPairResponse(pairs.name(), pair.originalDoc(), pair.enrichedDoc(), DiffTreeJson.write(tree), pending);
    }

    private DocumentUpdateResponse rediff(FieldChangeRequest req, JsonNode next) {
        DiffTree tree = DiffEngine.compare(req.original(), next);
        List<String> pending = PendingFieldCollector.collectPending(tree, decisions(req.decisions()));
        return new DocumentUpdateResponse(next, DiffTreeJson.write(tree), pending, pending.isEmpty());
    }

    private static FieldPath requirePath(FieldChangeRequest req) {
        if (req == null) throw new ApiException(400, "body is required");
        if (req.enriched() == null || req.enriched().isNull()) throw new ApiException(400, "enriched is required");
        if (req.fieldPath() == null || req.fieldPath().isBlank()) throw new ApiException(400, "fieldPath is required");
        return FieldPath.parse(req.fieldPath().trim());
    }

    private static ValidationStore decisions(List<ValidationDecision> decisions) {
        List<String> errs = new ArrayList<>();
        if (decisions != null) {
            for (int i = 0; i < decisions.size(); i++) {
                ValidationDecision d = decisions.get(i);
                if (d == null) { errs.add("decisions[" + i + "] is null"); continue; }
                if (d.decisionType() == null) errs.add("decisions[" + i + "].decisionType must be APPROVE or DECLINE");
                if (d.fieldPath() == null || d.fieldPath().isBlank()) errs.add("decisions[" + i + "].fieldPath required");
            }
        }
        if (!errs.isEmpty()) throw new ApiException(400, String.join("; ", errs));
        return ValidationStore.of(decisions);
    }
}

package com.enrichreview.engine.model.review;

import java.util.List;

import com.enrichreview.engine.core.validation.ValidationDecision;
import com.fasterxml.jackson.databind.JsonNode;

/** Edit or removal of one field of the enriched document. */
public record FieldChangeRequest(
        JsonNode original,
        JsonNode enriched,
        List<ValidationDecision> decisions,
        String fieldPath,   // dot-path e.g. "offers.price" or "image.[1]"
        String value        // edit text; ignored for removal
) {}

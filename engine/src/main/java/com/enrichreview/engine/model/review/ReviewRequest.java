package com.enrichreview.engine.model.review;

import java.util.List;

import com.enrichreview.engine.core.validation.ValidationDecision;
import com.fasterxml.jackson.databind.JsonNode;

public record ReviewRequest(
        JsonNode original,
        JsonNode enriched,
        List<ValidationDecision> decisions   // optional; missing paths are PENDING
) {}

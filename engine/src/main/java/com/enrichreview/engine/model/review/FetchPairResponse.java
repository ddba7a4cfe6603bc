package com.enrichreview.engine.model.review;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

public record FetchPairResponse(
        String source,      // "http" | "sample"
        JsonNode original,
        JsonNode enriched,
        JsonNode diff,
        List<String> pendingFields
) {}

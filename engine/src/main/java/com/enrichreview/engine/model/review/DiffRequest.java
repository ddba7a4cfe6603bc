package com.enrichreview.engine.model.review;

import com.fasterxml.jackson.databind.JsonNode;

public record DiffRequest(
        JsonNode original,
        JsonNode enriched
) {}

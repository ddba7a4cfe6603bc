package com.enrichreview.engine.model.review;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

public record DocumentUpdateResponse(
        JsonNode enriched,      // new snapshot after the edit/removal
        JsonNode diff,          // recomputed against the original
        List<String> pendingFields,
        boolean exportReady
) {}

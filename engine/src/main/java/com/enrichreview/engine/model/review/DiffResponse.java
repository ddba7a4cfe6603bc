package com.enrichreview.engine.model.review;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

public record DiffResponse(
        JsonNode diff,
        List<String> pendingFields,
        boolean exportReady
) {}

package com.enrichreview.engine.model.review;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

public record GenerateResponse(
        JsonNode document,
        List<String> pendingFields,
        boolean exportReady
) {}

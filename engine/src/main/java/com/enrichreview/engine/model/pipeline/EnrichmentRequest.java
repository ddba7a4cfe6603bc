package com.enrichreview.engine.model.pipeline;

public record EnrichmentRequest(
        String url   // product page the pipeline scrapes and enriches
) {}

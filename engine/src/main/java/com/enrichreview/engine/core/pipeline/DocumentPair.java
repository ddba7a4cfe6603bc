package com.enrichreview.engine.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

public record DocumentPair(
        JsonNode originalDoc,   // as scraped from the page
        JsonNode enrichedDoc    // after LLM enrichment
) {}

package com.enrichreview.engine.model.pipeline;

import com.enrichreview.engine.core.pipeline.DocumentPair;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response body of the enrichment pipeline's /enrich-product-schema endpoint.
 * Anything besides the two documents (status, url, timings) is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnrichmentPairResponse(
        JsonNode originalProductSchema,
        JsonNode enrichedProductSchema
) {
    public DocumentPair toPair() {
        return new DocumentPair(originalProductSchema, enrichedProductSchema);
    }
}

package com.enrichreview.engine.core.pipeline;

import com.enrichreview.engine.model.pipeline.EnrichmentRequest;

/**
 * Where review sessions get their (original, enriched) documents from.
 * Implementations throw {@link UpstreamFetchException} on any failure.
 */
public interface DocumentPairSource {

    DocumentPair fetch(EnrichmentRequest request);

    String name();
}

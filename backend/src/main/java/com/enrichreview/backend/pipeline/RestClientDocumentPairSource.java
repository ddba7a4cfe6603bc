package com.enrichreview.backend.pipeline;

import com.enrichreview.engine.core.pipeline.DocumentPair;
import com.enrichreview.engine.core.pipeline.DocumentPairSource;
import com.enrichreview.engine.core.pipeline.UpstreamFetchException;
import com.enrichreview.engine.model.pipeline.EnrichmentPairResponse;
import com.enrichreview.engine.model.pipeline.EnrichmentRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Calls the enrichment pipeline's {@code POST /enrich-product-schema}.
 * The client is expected to carry the pipeline base url and timeouts.
 */
public class RestClientDocumentPairSource implements DocumentPairSource {

    private static final Logger log = LoggerFactory.getLogger(RestClientDocumentPairSource.class);

    static final String ENRICH_PATH = "/enrich-product-schema";

    private final RestClient rest;

    public RestClientDocumentPairSource(RestClient rest) {
        this.rest = rest;
    }

    @Override
    public DocumentPair fetch(EnrichmentRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }

        EnrichmentPairResponse out;
        try {
            out = rest.post()
                    .uri(ENRICH_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new EnrichmentRequest(request.url().trim()))
                    .retrieve()
                    .body(EnrichmentPairResponse.class);
        } catch (RestClientResponseException e) {
            int code = e.getStatusCode().value();
            throw new UpstreamFetchException(code, "enrichment pipeline returned " + code, e);
        } catch (RestClientException e) {
            throw new UpstreamFetchException(0, "enrichment pipeline request failed: " + e.getMessage(), e);
        }

        if (out == null || out.enrichedProductSchema() == null) {
            throw new UpstreamFetchException(200, "enrichment pipeline returned no enriched document", null);
        }
        log.debug("fetched document pair for {}", request.url());
        return out.toPair();
    }

    @Override
    public String name() {
        return "http";
    }
}

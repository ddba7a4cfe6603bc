package com.enrichreview.engine.core.pipeline;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.enrichreview.engine.model.pipeline.EnrichmentPairResponse;
import com.enrichreview.engine.model.pipeline.EnrichmentRequest;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class HttpDocumentPairSource implements DocumentPairSource {

    private static final Logger log = LoggerFactory.getLogger(HttpDocumentPairSource.class);

    static final String ENRICH_PATH = "/enrich-product-schema";

    private final HttpClient http;
    private final ObjectMapper om;
    private final String baseUrl;
    private final Duration timeout;

    public HttpDocumentPairSource(HttpClient http, ObjectMapper om, String baseUrl, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.om = Objects.requireNonNull(om, "om");
        this.baseUrl = (baseUrl == null) ? "" : baseUrl.trim();
        this.timeout = (timeout == null) ? Duration.ofSeconds(60) : timeout;
    }

    @Override
    public DocumentPair fetch(EnrichmentRequest request) {
        if (baseUrl.isBlank()) throw new UpstreamFetchException("ENRICHMENT_PIPELINE_URL is not set");
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }

        String url = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        url = url + ENRICH_PATH;

        try {
            String body = om.writeValueAsString(new EnrichmentRequest(request.url().trim()));
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("content-type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            int code = resp.statusCode();
            if (code / 100 != 2) {
                throw new UpstreamFetchException(code, "enrichment pipeline returned " + code, null);
            }

            EnrichmentPairResponse out = om.readValue(resp.body(), EnrichmentPairResponse.class);
            if (out == null || out.enrichedProductSchema() == null) {
                throw new UpstreamFetchException(code, "enrichment pipeline returned no enriched document", null);
            }
            log.debug("fetched document pair for {}", request.url());
            return out.toPair();
        } catch (UpstreamFetchException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException(0, "interrupted while calling enrichment pipeline", e);
        } catch (Exception e) {
            throw new UpstreamFetchException(0, "enrichment pipeline request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "http";
    }
}

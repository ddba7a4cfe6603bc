package com.enrichreview.engine.core.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

import com.enrichreview.engine.model.pipeline.EnrichmentPairResponse;
import com.enrichreview.engine.model.pipeline.EnrichmentRequest;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serves the bundled sample product pair regardless of the requested url.
 * Used when no pipeline is configured.
 */
public final class SampleDocumentPairSource implements DocumentPairSource {

    public static final String RESOURCE = "/samples/sample-products.json";

    private final ObjectMapper om;

    public SampleDocumentPairSource(ObjectMapper om) {
        this.om = Objects.requireNonNull(om, "om");
    }

    @Override
    public DocumentPair fetch(EnrichmentRequest request) {
        try (InputStream in = SampleDocumentPairSource.class.getResourceAsStream(RESOURCE)) {
            if (in == null) throw new UpstreamFetchException("sample pair not found on classpath: " + RESOURCE);
            return om.readValue(in, EnrichmentPairResponse.class).toPair();
        } catch (IOException e) {
            throw new UpstreamFetchException(0, "failed to read sample pair: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "sample";
    }
}

package com.enrichreview.backend.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.enrichreview.engine.core.pipeline.DocumentPair;
import com.enrichreview.engine.core.pipeline.UpstreamFetchException;
import com.enrichreview.engine.model.pipeline.EnrichmentRequest;

public class RestClientDocumentPairSourceTest {

    private static final String ENRICH_URL = "http://pipeline.test/enrich-product-schema";

    private MockRestServiceServer server;
    private RestClientDocumentPairSource source;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://pipeline.test");
        server = MockRestServiceServer.bindTo(builder).build();
        source = new RestClientDocumentPairSource(builder.build());
    }

    @Test
    void fetch_postsUrl_andReadsBothDocuments() {
        server.expect(requestTo(ENRICH_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.url").value("https://shop.example/p/1"))
                .andRespond(withSuccess("{\"status\":\"ok\",\"url\":\"https://shop.example/p/1\","
                        + "\"originalProductSchema\":{\"name\":\"A\",\"price\":10},"
                        + "\"enrichedProductSchema\":{\"name\":\"A\",\"price\":12,\"color\":\"red\"}}",
                        MediaType.APPLICATION_JSON));

        DocumentPair pair = source.fetch(new EnrichmentRequest(" https://shop.example/p/1 "));

        assertEquals(10, pair.originalDoc().get("price").intValue());
        assertEquals("red", pair.enrichedDoc().get("color").asText());
        server.verify();
    }

    @Test
    void fetch_serverError_isUpstreamFailureWithStatus() {
        server.expect(requestTo(ENRICH_URL)).andRespond(withServerError());

        UpstreamFetchException e = assertThrows(UpstreamFetchException.class,
                () -> source.fetch(new EnrichmentRequest("https://shop.example/p/1")));

        assertEquals(500, e.upstreamStatus());
        server.verify();
    }

    @Test
    void fetch_clientError_keepsUpstreamStatus() {
        server.expect(requestTo(ENRICH_URL)).andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

        UpstreamFetchException e = assertThrows(UpstreamFetchException.class,
                () -> source.fetch(new EnrichmentRequest("https://shop.example/p/1")));

        assertEquals(422, e.upstreamStatus());
    }

    @Test
    void fetch_withoutEnrichedDocument_isUpstreamFailure() {
        server.expect(requestTo(ENRICH_URL))
                .andRespond(withSuccess("{\"originalProductSchema\":{}}", MediaType.APPLICATION_JSON));

        assertThrows(UpstreamFetchException.class,
                () -> source.fetch(new EnrichmentRequest("https://shop.example/p/1")));
    }

    @Test
    void fetch_blankUrl_isRejectedBeforeAnyCall() {
        assertThrows(IllegalArgumentException.class, () -> source.fetch(new EnrichmentRequest(" ")));
        server.verify();
    }
}

package com.enrichreview.engine;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import com.amazonaws.services.lambda.runtime.ClientContext;
import com.amazonaws.services.lambda.runtime.CognitoIdentity;
import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.enrichreview.engine.handler.RouterHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class RouterHandlerLocalTest {

    static {
        // Works because Config.env() falls back to System.getProperty in tests.
        System.setProperty("REVIEW_INTERNAL_TOKEN", "test");
        System.setProperty("PAIR_SOURCE", "sample");
    }

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void healthz_ok_withoutToken() {
        RouterHandler h = new RouterHandler();

        var resp = h.handleRequest(newEvent("GET", "/healthz", null, null), new FakeContext());

        assertTrue(resp.getStatusCode() / 100 == 2);
    }

    @Test
    void missingToken_is401() {
        RouterHandler h = new RouterHandler();

        var resp = h.handleRequest(newEvent("POST", "/review/diff", "{}", null), new FakeContext());

        assertEquals(401, resp.getStatusCode());
    }

    @Test
    void unknownPath_is404_andWrongMethod_is405() {
        RouterHandler h = new RouterHandler();

        assertEquals(404, h.handleRequest(newEvent("POST", "/nope", "{}", "test"), new FakeContext()).getStatusCode());
        assertEquals(405, h.handleRequest(newEvent("GET", "/review/diff", null, "test"), new FakeContext()).getStatusCode());
    }

    @Test
    void emptyOrMalformedBody_is400() {
        RouterHandler h = new RouterHandler();

        assertEquals(400, h.handleRequest(newEvent("POST", "/review/diff", "", "test"), new FakeContext()).getStatusCode());
        assertEquals(400, h.handleRequest(newEvent("POST", "/review/diff", "{not json", "test"), new FakeContext()).getStatusCode());
        assertEquals(400, h.handleRequest(newEvent("POST", "/review/pending",
                "{\"original\":{},\"enriched\":{},\"decisions\":[{\"decisionType\":\"MAYBE\",\"fieldPath\":\"a\"}]}", "test"),
                new FakeContext()).getStatusCode());
    }

    @Test
    void diff_returnsTreeAndPendingFields() throws Exception {
        RouterHandler h = new RouterHandler();

        var resp = h.handleRequest(newEvent("POST", "/review/diff",
                "{\"original\":{\"name\":\"A\",\"price\":10},\"enriched\":{\"name\":\"A\",\"price\":12,\"color\":\"red\"}}",
                "test"), new FakeContext());

        assertEquals(200, resp.getStatusCode());
        JsonNode body = om.readTree(resp.getBody());
        assertEquals("NEW", body.at("/diff/color/kind").asText());
        assertEquals(2, body.get("pendingFields").size());
    }

    @Test
    void export_withPendingFields_is409_withDetails() throws Exception {
        RouterHandler h = new RouterHandler();

        var resp = h.handleRequest(newEvent("POST", "/review/export",
                "{\"original\":{\"price\":10},\"enriched\":{\"price\":12},\"decisions\":[]}", "test"), new FakeContext());

        assertEquals(409, resp.getStatusCode());
        JsonNode err = om.readTree(resp.getBody()).get("error");
        assertEquals("EXPORT_NOT_READY", err.get("code").asText());
        assertEquals("price", err.at("/details/0").asText());
    }

    @Test
    void export_afterDecisions_returnsDocument() throws Exception {
        RouterHandler h = new RouterHandler();

        var resp = h.handleRequest(newEvent("POST", "/review/export",
                "{\"original\":{\"price\":10},\"enriched\":{\"price\":12},"
                        + "\"decisions\":[{\"decisionType\":\"DECLINE\",\"fieldPath\":\"price\",\"originalValue\":10}]}",
                "test"), new FakeContext());

        assertEquals(200, resp.getStatusCode());
        assertEquals(10, om.readTree(resp.getBody()).at("/document/price").intValue());
    }

    @Test
    void fetchPair_servesSample() throws Exception {
        RouterHandler h = new RouterHandler();

        var resp = h.handleRequest(newEvent("POST", "/review/fetch-pair",
                "{\"url\":\"https://shop.example/p/1\"}", "test"), new FakeContext());

        assertEquals(200, resp.getStatusCode());
        assertEquals("sample", om.readTree(resp.getBody()).get("source").asText());
    }

    private static APIGatewayV2HTTPEvent newEvent(String method, String path, String body, String token) {
        APIGatewayV2HTTPEvent evt = new APIGatewayV2HTTPEvent();
        evt.setRawPath(path);
        evt.setBody(body);

        Map<String, String> headers = new HashMap<>();
        headers.put("content-type", "application/json");
        if (token != null) headers.put("x-internal-token", token);
        evt.setHeaders(headers);

        APIGatewayV2HTTPEvent.RequestContext rc = new APIGatewayV2HTTPEvent.RequestContext();
        APIGatewayV2HTTPEvent.RequestContext.Http http = new APIGatewayV2HTTPEvent.RequestContext.Http();
        http.setMethod(method);
        http.setPath(path);
        rc.setHttp(http);
        evt.setRequestContext(rc);

        return evt;
    }

    static final class FakeContext implements Context {
        private final LambdaLogger logger = new LambdaLogger() {
            @Override public void log(String message) { System.out.println(message); }
            @Override public void log(byte[] message) { System.out.println(new String(message)); }
        };

        @Override public String getAwsRequestId() { return "test"; }
        @Override public String getLogGroupName() { return "test"; }
        @Override public String getLogStreamName() { return "test"; }
        @Override public String getFunctionName() { return "test"; }
        @Override public String getFunctionVersion() { return "test"; }
        @Override public String getInvokedFunctionArn() { return "test"; }
        @Override public CognitoIdentity getIdentity() { return null; }
        @Override public ClientContext getClientContext() { return null; }
        @Override public int getRemainingTimeInMillis() { return 30_000; }
        @Override public int getMemoryLimitInMB() { return 512; }
        @Override public LambdaLogger getLogger() { return logger; }
    }
}

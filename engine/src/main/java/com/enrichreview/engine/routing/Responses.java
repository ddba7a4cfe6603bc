package com.enrichreview.engine.routing;

import java.util.Map;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class Responses {
    private Responses() {}

    public static APIGatewayV2HTTPResponse json(ObjectMapper om, int status, Object body) {
        try {
            String s = om.writeValueAsString(body);
            return APIGatewayV2HTTPResponse.builder()
                    .withStatusCode(status)
                    .withHeaders(Map.of("content-type", "application/json"))
                    .withBody(s)
                    .build();
        } catch (Exception e) {
            return APIGatewayV2HTTPResponse.builder()
                    .withStatusCode(500)
                    .withHeaders(Map.of("content-type", "application/json"))
                    .withBody("{\"error\":{\"code\":\"SERIALIZE_ERROR\",\"message\":\"failed to serialize response\"}}")
                    .build();
        }
    }

    public static APIGatewayV2HTTPResponse error(ObjectMapper om, int status, ApiError err) {
        return json(om, status, Map.of("error", err));
    }

    /** Error code for an HTTP status, as used in the error envelope. */
    public static String codeFor(int status) {
        return switch (status) {
            case 400 -> "BAD_REQUEST";
            case 401 -> "UNAUTHORIZED";
            case 403 -> "FORBIDDEN";
            case 404 -> "NOT_FOUND";
            case 405 -> "METHOD_NOT_ALLOWED";
            case 409 -> "CONFLICT";
            case 502 -> "BAD_GATEWAY";
            default -> "ERROR";
        };
    }
}

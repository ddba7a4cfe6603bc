package com.enrichreview.engine.routing;

import java.util.HashMap;
import java.util.Map;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;

public final class Router {
    private final Map<Key, Route> routes = new HashMap<>();

    public Router add(String method, String path, Route handler) {
        routes.put(new Key(method.toUpperCase(), path), handler);
        return this;
    }

    public Route match(APIGatewayV2HTTPEvent e) {
        String m = null;

        if (e.getRequestContext() != null && e.getRequestContext().getHttp() != null) {
            m = e.getRequestContext().getHttp().getMethod();
        }

        // Fallback for manual invokes: allow the method via header
        if (m == null && e.getHeaders() != null) {
            m = e.getHeaders().get("x-http-method");
        }

        String p = e.getRawPath();
        if (m == null || p == null) return null;

        return routes.get(new Key(m.toUpperCase(), p));
    }

    public boolean hasPath(String path) {
        return routes.keySet().stream().anyMatch(k -> k.path().equals(path));
    }

    private record Key(String method, String path) {}
}

package com.enrichreview.engine.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

public final class InternalAuth {
    private InternalAuth() {}

    public static final String HEADER = "X-Internal-Token";

    // Case-insensitive header lookup + constant-time compare
    public static boolean isAuthorized(Map<String, String> headers, String headerName, String expectedSecret) {
        if (expectedSecret == null || expectedSecret.isBlank()) return false;
        if (headers == null || headers.isEmpty()) return false;

        String got = header(headers, headerName);
        if (got == null || got.isBlank()) return false;

        return constantTimeEquals(got.trim(), expectedSecret.trim());
    }

    public static String header(Map<String, String> headers, String name) {
        if (headers == null || name == null) return null;

        // API Gateway usually lowercases keys
        String v = headers.get(name.toLowerCase());
        if (v != null) return v;

        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static boolean constantTimeEquals(String a, String b) {
        byte[] ab = a.getBytes(StandardCharsets.UTF_8);
        byte[] bb = b.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(ab, bb);
    }
}

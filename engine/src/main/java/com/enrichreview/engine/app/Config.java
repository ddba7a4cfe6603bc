package com.enrichreview.engine.app;

import java.time.Duration;

public record Config(
        // Auth (shared with the review backend)
        String internalToken,

        // Where document pairs come from: "http" or "sample"
        String pairSource,

        // Enrichment pipeline
        String pipelineBaseUrl,
        Duration pipelineTimeout
) {
    public static Config fromEnv() {
        return new Config(
                env("REVIEW_INTERNAL_TOKEN", ""),

                env("PAIR_SOURCE", "sample").toLowerCase(),

                env("ENRICHMENT_PIPELINE_URL", ""),
                Duration.ofSeconds(envLong("ENRICHMENT_PIPELINE_TIMEOUT_SECONDS", 60))
        );
    }

    public boolean useHttpSource() {
        return "http".equals(pairSource) && !pipelineBaseUrl.isBlank();
    }

    private static String env(String key, String def) {
        // Lambda uses env vars; unit tests can use System properties.
        String v = System.getenv(key);
        if (v == null) v = System.getProperty(key);
        if (v == null) return def;
        v = v.trim();
        return v.isEmpty() ? def : v;
    }

    private static long envLong(String key, long def) {
        String v = env(key, "");
        if (v.isEmpty()) return def;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a number of seconds, got: " + v, e);
        }
    }
}

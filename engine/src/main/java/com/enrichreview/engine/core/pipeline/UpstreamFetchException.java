package com.enrichreview.engine.core.pipeline;

/**
 * The enrichment pipeline could not deliver a document pair.
 */
public class UpstreamFetchException extends RuntimeException {

    private final int upstreamStatus;

    public UpstreamFetchException(String message) {
        this(0, message, null);
    }

    public UpstreamFetchException(int upstreamStatus, String message, Throwable cause) {
        super(message, cause);
        this.upstreamStatus = upstreamStatus;
    }

    /** HTTP status returned upstream, 0 when no response was received. */
    public int upstreamStatus() {
        return upstreamStatus;
    }
}

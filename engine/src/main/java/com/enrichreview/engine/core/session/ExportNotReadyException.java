package com.enrichreview.engine.core.session;

import java.util.List;

/**
 * Export was requested while fields still await a decision.
 */
public class ExportNotReadyException extends RuntimeException {

    private final List<String> pendingFields;

    public ExportNotReadyException(List<String> pendingFields) {
        super(message(pendingFields.size()));
        this.pendingFields = List.copyOf(pendingFields);
    }

    public List<String> pendingFields() {
        return pendingFields;
    }

    private static String message(int n) {
        return n + " field" + (n == 1 ? "" : "s") + " pending validation";
    }
}

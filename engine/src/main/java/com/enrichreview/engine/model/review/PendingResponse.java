package com.enrichreview.engine.model.review;

import java.util.List;

public record PendingResponse(
        List<String> pendingFields,
        int pendingCount,
        boolean exportReady
) {}

package com.enrichreview.backend.review;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.enrichreview.engine.core.diff.DiffKind;
import com.enrichreview.engine.core.validation.EffectiveState;
import com.enrichreview.engine.core.validation.ValidationState;
import com.fasterxml.jackson.databind.JsonNode;

public final class ReviewDtos {
    private ReviewDtos() {}

    // ---- requests ----

    public record CreateReviewRequest(
            String url,          // fetch from the pipeline...
            JsonNode original,   // ...or review an explicit pair
            JsonNode enriched
    ) {}

    public record ReloadRequest(String url) {}

    public record FieldRequest(String fieldPath) {}

    public record EditTextRequest(String text) {}

    // ---- responses ----

    public record ReviewSummary(
            UUID id,
            JsonNode original,
            JsonNode enriched,
            JsonNode diff,
            Map<String, ValidationState> decisions,
            List<String> pendingFields,
            boolean exportReady,
            EditingView editing   // null when no edit is active
    ) {}

    public record EditingView(String fieldPath, String text) {}

    public record FieldView(
            String fieldPath,
            JsonNode value,           // current enriched value, null when absent
            DiffKind diffKind,
            JsonNode originalValue,
            ValidationState validationState,
            EffectiveState effectiveState
    ) {}

    public record DocumentView(
            UUID id,
            JsonNode document,
            List<String> pendingFields,
            boolean exportReady
    ) {}

    public record ReviewUpdatedEvent(UUID reviewId, int pendingCount, boolean exportReady) {}
}

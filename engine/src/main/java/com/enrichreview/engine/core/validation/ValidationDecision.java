package com.enrichreview.engine.core.validation;

import com.fasterxml.jackson.databind.JsonNode;

public record ValidationDecision(
        DecisionType decisionType,  // APPROVE | DECLINE
        String fieldPath,           // dot-path e.g. "offers.price"
        JsonNode originalValue      // advisory only, never used as a key
) {

    public enum DecisionType { APPROVE, DECLINE }

    public static ValidationDecision approve(String fieldPath) {
        return new ValidationDecision(DecisionType.APPROVE, fieldPath, null);
    }

    public static ValidationDecision decline(String fieldPath) {
        return new ValidationDecision(DecisionType.DECLINE, fieldPath, null);
    }

    public ValidationState targetState() {
        return decisionType == DecisionType.APPROVE ? ValidationState.APPROVED : ValidationState.DECLINED;
    }
}

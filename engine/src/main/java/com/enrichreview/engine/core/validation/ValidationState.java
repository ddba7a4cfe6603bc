package com.enrichreview.engine.core.validation;

public enum ValidationState {
    PENDING,    // no decision stored
    APPROVED,   // keep the enriched value
    DECLINED    // revert to the original value, or drop a new key
}

package com.enrichreview.engine.core.diff;

public enum DiffKind {
    NEW,        // key only on the enriched side
    MODIFIED,   // present on both sides, value (or some descendant) differs
    UNCHANGED
}

package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightClassification {
    ACTIONABLE,
    INVESTIGATING,
    INCONCLUSIVE;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    public static InsightClassification classify(int causeCount, double confidence) {
        if (causeCount > 0 && confidence > 0.6) return ACTIONABLE;
        if (confidence < 0.4) return INCONCLUSIVE;
        return INVESTIGATING;
    }
}

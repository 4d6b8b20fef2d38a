package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowStatus {
    ACTIVE,
    ARCHIVED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static WorkflowStatus fromJson(String value) {
        return value == null ? null : WorkflowStatus.valueOf(value.toUpperCase());
    }
}

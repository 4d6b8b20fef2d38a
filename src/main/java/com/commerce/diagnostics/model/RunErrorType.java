package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunErrorType {
    WORKFLOW_VALIDATION_ERROR,
    EXECUTION_ERROR,
    DATA_FETCH_ERROR;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}

package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    SUCCESS,
    SUPPRESSED,
    DEFERRED,
    ERROR;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}

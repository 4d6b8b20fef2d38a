package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of workflow node kinds.
 * Used both as the validator's whitelist and as the engine's dispatch key.
 */
public enum NodeType {
    VALIDATION("validation"),
    METRIC_COMPARE("metric_compare"),
    BRANCH("branch"),
    RECURSIVE_DIMENSION_BREAKDOWN("recursive_dimension_breakdown"),
    DRILL_DOWN("drill_down"),
    COMPOSITE("composite"),
    CONFIDENCE("confidence"),
    INSIGHT("insight"),
    SUPPRESSION("suppression"),
    DEFER("defer");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == INSIGHT || this == SUPPRESSION || this == DEFER;
    }

    /**
     * Resolve a wire name to a node type, or null if the name is not whitelisted.
     */
    @JsonCreator
    public static NodeType fromWireName(String name) {
        if (name == null) return null;
        for (NodeType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        return null;
    }
}

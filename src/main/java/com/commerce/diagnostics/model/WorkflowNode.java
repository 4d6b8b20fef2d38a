package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A single step of a workflow graph. Common attributes are {@code id}, {@code type}
 * and {@code next}; the remaining fields are kind-specific and left null when unused.
 *
 * Older workflows nest the kind parameters under {@code params}. Those values are folded
 * into the typed fields on deserialization; a flat value always wins over a nested one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "A workflow step")
public class WorkflowNode {

    private static final ObjectMapper LEGACY_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Schema(description = "Unique node id within the workflow", example = "validate")
    private String id;

    @Schema(description = "Node kind", example = "branch")
    private String type;

    @Schema(description = "Successor node id", example = "compare")
    private String next;

    // branch
    private List<BranchRule> rules;
    private DefaultRoute defaultNext;
    @Schema(description = "Named route targets, label to node id. Validated and walked like rule targets.")
    private Map<String, String> routes;

    // metric_compare
    private List<String> metrics;

    // recursive_dimension_breakdown
    private List<String> dimensions;

    // drill_down
    private String dimension;

    // composite
    private List<String> steps;
    private String startNodeId;

    // validation
    private Double minDropPct;
    private List<Map<String, Object>> checks;

    // suppression / defer
    private String reason;

    // insight
    private String template;

    @Schema(description = "Legacy nested parameters")
    private Map<String, Object> params;

    @JsonIgnore
    public NodeType getNodeType() {
        return NodeType.fromWireName(type);
    }

    @JsonSetter("params")
    public void setParams(Map<String, Object> params) {
        this.params = params;
        if (params == null || params.isEmpty()) {
            return;
        }
        WorkflowNode legacy = LEGACY_MAPPER.convertValue(params, WorkflowNode.class);
        if (next == null) next = legacy.next;
        if (rules == null) rules = legacy.rules;
        if (defaultNext == null) defaultNext = legacy.defaultNext;
        if (routes == null) routes = legacy.routes;
        if (metrics == null) metrics = legacy.metrics;
        if (dimensions == null) dimensions = legacy.dimensions;
        if (dimension == null) dimension = legacy.dimension;
        if (steps == null) steps = legacy.steps;
        if (startNodeId == null) startNodeId = legacy.startNodeId;
        if (minDropPct == null) minDropPct = legacy.minDropPct;
        if (checks == null) checks = legacy.checks;
        if (reason == null) reason = legacy.reason;
        if (template == null) template = legacy.template;
    }
}

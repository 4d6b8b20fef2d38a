package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "A versioned diagnostic workflow graph")
public class Workflow {

    @Schema(description = "Workflow identifier, unique per brand", example = "cvr_drop_rca")
    @JsonAlias("workflow_id")
    private String id;

    @Schema(description = "Version, incremented on every save for the same brand and id", example = "3")
    private int version;

    @Schema(description = "Owning brand (tenant)", example = "42")
    private Long brandId;

    @Schema(description = "Free-form workflow category", example = "root_cause_analysis")
    private String workflowType;

    private String description;

    @Schema(description = "Trigger definition as authored, e.g. {type, metric, condition, window}")
    private Map<String, Object> trigger;

    @Schema(description = "Authoring-time context, e.g. {baseline_window}")
    private Map<String, Object> context;

    @Schema(description = "Explicit entry node id. Defaults to the single validation node.")
    private String startNode;

    @Builder.Default
    private List<WorkflowNode> nodes = new ArrayList<>();

    @Builder.Default
    private WorkflowStatus status = WorkflowStatus.ACTIVE;

    private String createdBy;

    @Schema(description = "Creation time in epoch milliseconds")
    private long createdAt;
}

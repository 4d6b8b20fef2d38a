package com.commerce.diagnostics.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Audit record of one stored-workflow run")
public class WorkflowExecutionRecord {

    private String executionId;
    private String workflowId;
    private int workflowVersion;
    private Long brandId;
    private Alert alertPayload;
    private RunResult result;
    private String executedBy;
    private long executedAt;
    private long executionTimeMs;
    private RunStatus status;
}

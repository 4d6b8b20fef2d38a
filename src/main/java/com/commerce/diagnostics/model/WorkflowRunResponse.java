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
public class WorkflowRunResponse {

    @Schema(description = "Request status; the run outcome itself is in analysis_result", example = "success")
    private String status;

    private String workflowId;

    private int version;

    @Schema(description = "Id of the stored execution record")
    private String executionId;

    private RunResult analysisResult;
}

package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Run the latest active version of a stored workflow")
public class WorkflowRunRequest {

    @Schema(example = "42")
    private Long brandId;

    @Schema(example = "cvr_drop_rca")
    private String workflowId;

    private Alert alertPayload;

    @Schema(description = "Caller identity recorded on the execution log", example = "alerting-service")
    private String runBy;
}

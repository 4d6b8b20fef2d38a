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
@Schema(description = "Identifiers of a single workflow run")
public class RunMetadata {

    @Schema(example = "cvr_drop_rca")
    private String workflowId;

    @Schema(example = "3")
    private int workflowVersion;

    @Schema(description = "Execution start as an ISO instant", example = "2026-01-10T15:02:11.204Z")
    private String executedAt;

    @Schema(description = "Generated trace identifier for this run")
    private String traceId;

    @Schema(description = "Whether the analysis ran on an incomplete window")
    private boolean partialData;
}

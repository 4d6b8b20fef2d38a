package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Terminal outcome of a workflow run")
public class RunResult {

    @Schema(description = "success, suppressed, deferred or error", example = "success")
    private RunStatus status;

    @Schema(description = "Error category, only for status=error", example = "execution_error")
    private RunErrorType type;

    @Schema(description = "Error message, only for status=error")
    private String message;

    @Schema(description = "Reason code, only for status=suppressed or deferred", example = "below_threshold")
    private String reason;

    private InsightClassification classification;

    private List<Finding> rootCauses;

    private Insight insight;

    @Schema(example = "42")
    private Long brandId;

    @Schema(example = "cvr")
    private String metric;

    private RunMetadata metadata;

    public static RunResult success(FinalInsight finalInsight, Long brandId, String metric, RunMetadata metadata) {
        return RunResult.builder()
                .status(RunStatus.SUCCESS)
                .classification(finalInsight.getClassification())
                .rootCauses(finalInsight.getRootCauses())
                .insight(finalInsight.getInsight())
                .brandId(brandId)
                .metric(metric)
                .metadata(metadata)
                .build();
    }

    public static RunResult suppressed(String reason) {
        return RunResult.builder().status(RunStatus.SUPPRESSED).reason(reason).build();
    }

    public static RunResult deferred(String reason) {
        return RunResult.builder().status(RunStatus.DEFERRED).reason(reason).build();
    }

    public static RunResult error(RunErrorType type, String message) {
        return RunResult.builder().status(RunStatus.ERROR).type(type).message(message).build();
    }

    @JsonIgnore
    public boolean isError() {
        return status == RunStatus.ERROR;
    }
}

package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "A metric regression alert that triggers a workflow run")
public class Alert {

    public static final String DEFAULT_BASELINE_WINDOW = "avg_prev_3_days_same_hour";

    @Schema(description = "Metric that regressed", example = "cvr")
    private String metric;

    @Schema(description = "Observed drop magnitude in percent", example = "22.5")
    private double dropPct;

    @Schema(description = "Current window token", example = "2026-01-10T14:00:00Z|2026-01-10T15:00:00Z")
    private String currentWindow;

    @Schema(description = "Baseline window token", example = "avg_prev_3_days_same_hour")
    private String baselineWindow;

    @Schema(description = "Alert time as an ISO instant, used when no current window is given")
    private String timestamp;

    public String getBaselineWindowOrDefault() {
        return baselineWindow != null && !baselineWindow.isBlank() ? baselineWindow : DEFAULT_BASELINE_WINDOW;
    }
}

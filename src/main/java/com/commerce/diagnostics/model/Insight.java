package com.commerce.diagnostics.model;

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
@Schema(description = "Narrative explanation of a regression")
public class Insight {

    @Schema(example = "CVR drop likely associated with payment_gateway (razorpay).")
    private String summary;

    private String conclusion;

    @Schema(description = "One line per ranked root cause")
    private List<String> details;

    @Schema(description = "Known limits of this analysis")
    private List<String> limitations;

    @Schema(example = "0.75")
    private double confidence;
}

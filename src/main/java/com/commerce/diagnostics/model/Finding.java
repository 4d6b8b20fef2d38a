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
@Schema(description = "A scored, dimension-value-level explanation candidate")
public class Finding {

    @Schema(description = "Dimension the finding belongs to", example = "payment_gateway")
    private String dimension;

    @Schema(description = "Dimension value", example = "razorpay")
    private String value;

    @Schema(description = "Human-readable change description", example = "Volume dropped -42.0% (120 -> 70)")
    private String change;

    @Schema(description = "Non-negative impact magnitude; higher is a stronger candidate", example = "42.0")
    private double impactScore;
}

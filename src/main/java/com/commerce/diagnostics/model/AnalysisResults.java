package com.commerce.diagnostics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable analysis state accumulated by breakdown, drill-down and confidence nodes.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResults {

    private List<Finding> rootCauses = new ArrayList<>();

    // null until a confidence node has run
    private Double confidence;

    private boolean mixedFactors;

    private List<String> drillDownPath;

    @JsonIgnore
    public Finding getTopCause() {
        return rootCauses.isEmpty() ? null : rootCauses.get(0);
    }
}

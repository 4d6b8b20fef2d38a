package com.commerce.diagnostics.engine;

import com.commerce.diagnostics.model.Alert;
import com.commerce.diagnostics.model.AnalysisResults;
import com.commerce.diagnostics.model.Brand;
import com.commerce.diagnostics.model.DerivedMetrics;
import com.commerce.diagnostics.model.FinalInsight;
import com.commerce.diagnostics.model.RunMetadata;
import com.commerce.diagnostics.model.Workflow;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Working state of a single workflow run. Created by the engine, mutated in place by node
 * executors, discarded once the run result is built. Never shared across runs.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionContext {

    private static final ObjectMapper PATH_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule());

    private final Alert alert;
    private final Brand brand;
    private final DerivedMetrics derived = new DerivedMetrics();
    private final AnalysisResults analysisResults = new AnalysisResults();
    private final RunMetadata metadata;

    private FinalInsight finalInsight;

    public ExecutionContext(Alert alert, Brand brand, RunMetadata metadata) {
        this.alert = alert != null ? alert.toBuilder().build() : new Alert();
        this.brand = brand != null ? brand : new Brand();
        this.metadata = metadata;
    }

    public static ExecutionContext create(Alert alert, Brand brand, Workflow workflow) {
        RunMetadata metadata = RunMetadata.builder()
                .workflowId(workflow.getId())
                .workflowVersion(workflow.getVersion())
                .executedAt(Instant.now().toString())
                .traceId(UUID.randomUUID().toString())
                .build();
        return new ExecutionContext(alert, brand, metadata);
    }

    /**
     * The final insight may be set exactly once per run.
     */
    public void setFinalInsight(FinalInsight finalInsight) {
        if (this.finalInsight != null) {
            throw new IllegalStateException("Final insight already set for run " + metadata.getTraceId());
        }
        this.finalInsight = finalInsight;
    }

    /**
     * Resolve a field reference the way branch conditions see it: the derived metrics by
     * their literal key first, then a dotted path from the context root
     * (e.g. {@code alert.drop_pct}, {@code analysis_results.root_causes.0.impact_score}).
     *
     * @return a Double, String or Boolean, or null if the path does not resolve to a scalar
     */
    public Object lookup(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        Double derivedValue = derived.lookup(path);
        if (derivedValue != null) {
            return derivedValue;
        }

        JsonNode current = PATH_MAPPER.valueToTree(this);
        for (String segment : path.split("\\.")) {
            if (current == null || current.isMissingNode() || current.isNull()) {
                return null;
            }
            if (current.isArray()) {
                if ("length".equals(segment)) {
                    return (double) current.size();
                }
                try {
                    current = current.get(Integer.parseInt(segment));
                } catch (NumberFormatException e) {
                    return null;
                }
            } else {
                current = current.get(segment);
            }
        }

        if (current == null || current.isNull() || current.isMissingNode()) {
            return null;
        }
        if (current.isNumber()) {
            return current.doubleValue();
        }
        if (current.isBoolean()) {
            return current.booleanValue();
        }
        if (current.isTextual()) {
            return current.textValue();
        }
        return null;
    }
}

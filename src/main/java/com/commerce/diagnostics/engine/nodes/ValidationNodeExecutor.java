package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.config.EngineConfig;
import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeExecutor;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.engine.WindowResolver;
import com.commerce.diagnostics.model.Alert;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.TimeWindow;
import com.commerce.diagnostics.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Gates a run on window completeness and drop magnitude.
 *
 * A current window that is still open and shorter than the configured minimum is deferred
 * ({@code window_too_short}); a still-open but long enough window marks the run as partial.
 * An alert whose drop is below the node's {@code min_drop_pct} is suppressed
 * ({@code below_threshold}).
 */
@Component
public class ValidationNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ValidationNodeExecutor.class);

    static final String WINDOW_TOO_SHORT = "window_too_short";
    static final String BELOW_THRESHOLD = "below_threshold";

    private final WindowResolver windowResolver;
    private final EngineConfig engineConfig;

    public ValidationNodeExecutor(WindowResolver windowResolver, EngineConfig engineConfig) {
        this.windowResolver = windowResolver;
        this.engineConfig = engineConfig;
    }

    @Override
    public NodeType getSupportedNodeType() {
        return NodeType.VALIDATION;
    }

    @Override
    public NodeOutcome execute(WorkflowNode node, ExecutionContext context) {
        Alert alert = context.getAlert();

        if (node.getChecks() != null) {
            for (Map<String, Object> check : node.getChecks()) {
                log.info("Running check: {} {}", check.get("metric"), check.get("condition"));
            }
        }

        TimeWindow current = windowResolver.resolveCurrent(alert);
        Instant now = Instant.now();
        if (current.getEnd().isAfter(now)) {
            long durationMinutes = current.getDuration().toMinutes();
            if (durationMinutes < engineConfig.getThresholds().getMinWindowMinutes()) {
                log.warn("Window too short for stable analysis: {} minutes, ends {}", durationMinutes, current.getEnd());
                return NodeOutcome.deferred(WINDOW_TOO_SHORT);
            }
            log.warn("Current window still open (ends {}), analysis runs on partial data", current.getEnd());
            context.getMetadata().setPartialData(true);
        }

        Double minDropPct = node.getMinDropPct();
        if (minDropPct != null && alert.getDropPct() < minDropPct) {
            log.info("Drop {}% is below threshold {}%", alert.getDropPct(), minDropPct);
            return NodeOutcome.suppressed(BELOW_THRESHOLD);
        }

        return NodeOutcome.success(node.getNext());
    }
}
